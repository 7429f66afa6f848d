////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.cxxhl.ast;

import java.util.Objects;
import java.util.Optional;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * {@link SourceManager} backed by the text of the primary file. Token ranges
 * are found by scanning the source line at the requested location, so
 * columns are in UTF-16 code units like every other LSP position.
 */
public class TextSourceManager implements SourceManager {
	private static final int MAX_MACRO_DEPTH = 64;

	private final String mainFileId;
	private final String[] sourceLines;

	public TextSourceManager(String mainFileId, String source) {
		this.mainFileId = Objects.requireNonNull(mainFileId);
		this.sourceLines = source != null ? source.split("\n", -1) : new String[0];
		for (int i = 0; i < sourceLines.length; i++) {
			String line = sourceLines[i];
			if (line.endsWith("\r")) {
				sourceLines[i] = line.substring(0, line.length() - 1);
			}
		}
	}

	/** Convenience factory for a location in the primary file. */
	public SourceLocation location(int line, int character) {
		return SourceLocation.of(mainFileId, line, character);
	}

	@Override
	public boolean isMacroArgExpansion(SourceLocation location) {
		return location != null && location.getKind() == SourceLocation.Kind.MACRO_ARGUMENT;
	}

	@Override
	public SourceLocation getSpellingLoc(SourceLocation location) {
		SourceLocation current = location;
		for (int depth = 0; depth < MAX_MACRO_DEPTH; depth++) {
			if (current == null || !current.isValid()) {
				return SourceLocation.invalid();
			}
			if (current.isFileID()) {
				return current;
			}
			current = current.getImmediateSpelling();
		}
		return SourceLocation.invalid();
	}

	@Override
	public boolean isInsideMainFile(SourceLocation location) {
		SourceLocation spelling = getSpellingLoc(location);
		return spelling.isFileID() && mainFileId.equals(spelling.getFileId());
	}

	@Override
	public Optional<Range> getTokenRange(SourceLocation location) {
		if (location == null || !location.isFileID() || !mainFileId.equals(location.getFileId())) {
			return Optional.empty();
		}
		int lineIndex = location.getLine();
		if (lineIndex < 0 || lineIndex >= sourceLines.length) {
			return Optional.empty();
		}
		String line = sourceLines[lineIndex];
		int start = location.getCharacter();
		int length = tokenLength(line, start);
		if (length <= 0) {
			return Optional.empty();
		}
		return Optional.of(new Range(new Position(lineIndex, start), new Position(lineIndex, start + length)));
	}

	/**
	 * Returns the length of the token starting at {@code start}, or 0 if the
	 * position is past the end of the line or on whitespace.
	 */
	private static int tokenLength(String line, int start) {
		if (start < 0 || start >= line.length()) {
			return 0;
		}
		int c = line.codePointAt(start);
		if (Character.isWhitespace(c)) {
			return 0;
		}
		if (Character.isJavaIdentifierPart(c)) {
			return identifierEnd(line, start) - start;
		}
		// destructor names are a single token for highlighting purposes
		if (c == '~' && start + 1 < line.length() && Character.isJavaIdentifierStart(line.codePointAt(start + 1))) {
			return identifierEnd(line, start + 1) - start;
		}
		if (line.startsWith("::", start) || line.startsWith("->", start)) {
			return 2;
		}
		return Character.charCount(c);
	}

	/** Index after the identifier starting at {@code from}, stepping over surrogate pairs whole. */
	private static int identifierEnd(String line, int from) {
		int end = from;
		while (end < line.length()) {
			int c = line.codePointAt(end);
			if (!Character.isJavaIdentifierPart(c)) {
				break;
			}
			end += Character.charCount(c);
		}
		return end;
	}
}

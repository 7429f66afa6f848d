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

/**
 * A location produced by the resolver. File locations point at a zero-based
 * line and character in a file; macro locations point at the location the
 * expanded token was spelled at.
 */
public final class SourceLocation {

	public enum Kind {
		INVALID,
		FILE,
		/** Token that came from a macro argument, e.g. {@code x} in {@code DEF_X(x)}. */
		MACRO_ARGUMENT,
		/** Token that came from the body of a macro definition. */
		MACRO_BODY
	}

	private static final SourceLocation INVALID = new SourceLocation(Kind.INVALID, null, -1, -1, null);

	private final Kind kind;
	private final String fileId;
	private final int line;
	private final int character;
	private final SourceLocation spelling;

	private SourceLocation(Kind kind, String fileId, int line, int character, SourceLocation spelling) {
		this.kind = kind;
		this.fileId = fileId;
		this.line = line;
		this.character = character;
		this.spelling = spelling;
	}

	public static SourceLocation invalid() {
		return INVALID;
	}

	public static SourceLocation of(String fileId, int line, int character) {
		if (fileId == null || line < 0 || character < 0) {
			return INVALID;
		}
		return new SourceLocation(Kind.FILE, fileId, line, character, null);
	}

	public static SourceLocation macroArgument(SourceLocation spelling) {
		return new SourceLocation(Kind.MACRO_ARGUMENT, null, -1, -1, Objects.requireNonNull(spelling));
	}

	public static SourceLocation macroBody(SourceLocation spelling) {
		return new SourceLocation(Kind.MACRO_BODY, null, -1, -1, Objects.requireNonNull(spelling));
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isValid() {
		return kind != Kind.INVALID;
	}

	public boolean isMacroID() {
		return kind == Kind.MACRO_ARGUMENT || kind == Kind.MACRO_BODY;
	}

	public boolean isFileID() {
		return kind == Kind.FILE;
	}

	/** File identity of a file location, {@code null} for macro and invalid locations. */
	public String getFileId() {
		return fileId;
	}

	public int getLine() {
		return line;
	}

	public int getCharacter() {
		return character;
	}

	/** The location one macro level closer to the spelling, {@code null} for file locations. */
	public SourceLocation getImmediateSpelling() {
		return spelling;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourceLocation)) return false;
		SourceLocation other = (SourceLocation) o;
		return kind == other.kind
				&& line == other.line
				&& character == other.character
				&& Objects.equals(fileId, other.fileId)
				&& Objects.equals(spelling, other.spelling);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, fileId, line, character, spelling);
	}

	@Override
	public String toString() {
		switch (kind) {
			case FILE:
				return fileId + ":" + line + ":" + character;
			case MACRO_ARGUMENT:
				return "<macro arg " + spelling + ">";
			case MACRO_BODY:
				return "<macro body " + spelling + ">";
			default:
				return "<invalid loc>";
		}
	}
}

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
package com.tomaszrup.cxxhl.highlighting;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-level diff between two canonical token lists.
 *
 * <p>Tokens are keyed by the line they start on. A token spanning several
 * lines only belongs to its first line, so a change on a later line that is
 * covered by such a token, with the rest of that line unchanged, is not
 * reported. Splitting multi-line tokens per line would fix this but needs
 * the line lengths of the document.</p>
 */
public final class HighlightingDiff {

	private HighlightingDiff() {
	}

	/**
	 * Returns the lines whose tokens differ between {@code newTokens} and
	 * {@code oldTokens}, each carrying its new tokens. A line that lost all
	 * its tokens is returned with an empty token list.
	 *
	 * @param newTokens canonical tokens of the current parse
	 * @param oldTokens canonical tokens of the previous parse, empty if none
	 * @throws IllegalArgumentException if either list is not sorted
	 */
	public static List<LineHighlightings> diff(List<HighlightingToken> newTokens, List<HighlightingToken> oldTokens) {
		checkSorted(newTokens, "newTokens");
		checkSorted(oldTokens, "oldTokens");

		List<LineHighlightings> diffedLines = new ArrayList<>();
		// end of the current line's slice on each side
		int newIndex = 0;
		int oldIndex = 0;
		int lineNumber = 0;
		while (newIndex < newTokens.size() || oldIndex < oldTokens.size()) {
			int newLineEnd = takeLine(newTokens, newIndex, lineNumber);
			int oldLineEnd = takeLine(oldTokens, oldIndex, lineNumber);
			List<HighlightingToken> newLine = newTokens.subList(newIndex, newLineEnd);
			List<HighlightingToken> oldLine = oldTokens.subList(oldIndex, oldLineEnd);
			if (!newLine.equals(oldLine)) {
				diffedLines.add(new LineHighlightings(lineNumber, newLine));
			}
			newIndex = newLineEnd;
			oldIndex = oldLineEnd;
			lineNumber = Math.min(nextLine(newTokens, newIndex), nextLine(oldTokens, oldIndex));
		}
		return diffedLines;
	}

	/**
	 * Returns the end of the run of tokens starting at {@code from} that start
	 * on {@code line}; {@code from} itself if there are none.
	 */
	private static int takeLine(List<HighlightingToken> tokens, int from, int line) {
		int end = from;
		while (end < tokens.size() && tokens.get(end).getStartLine() == line) {
			end++;
		}
		return end;
	}

	private static int nextLine(List<HighlightingToken> tokens, int index) {
		return index < tokens.size() ? tokens.get(index).getStartLine() : Integer.MAX_VALUE;
	}

	private static void checkSorted(List<HighlightingToken> tokens, String name) {
		for (int i = 1; i < tokens.size(); i++) {
			if (tokens.get(i - 1).compareTo(tokens.get(i)) > 0) {
				throw new IllegalArgumentException(name + " must be sorted, found " + tokens.get(i - 1)
						+ " before " + tokens.get(i));
			}
		}
	}
}

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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The tokens that start on one line, in canonical order.
 */
public final class LineHighlightings {
	private final int line;
	private final List<HighlightingToken> tokens;

	public LineHighlightings(int line, List<HighlightingToken> tokens) {
		this.line = line;
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
	}

	public int getLine() {
		return line;
	}

	public List<HighlightingToken> getTokens() {
		return tokens;
	}

	/**
	 * Groups a sorted token list by start line. Lines without tokens are
	 * not represented.
	 */
	public static List<LineHighlightings> group(List<HighlightingToken> sortedTokens) {
		List<LineHighlightings> lines = new ArrayList<>();
		int from = 0;
		while (from < sortedTokens.size()) {
			int line = sortedTokens.get(from).getStartLine();
			int to = from;
			while (to < sortedTokens.size() && sortedTokens.get(to).getStartLine() == line) {
				to++;
			}
			lines.add(new LineHighlightings(line, sortedTokens.subList(from, to)));
			from = to;
		}
		return lines;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof LineHighlightings)) return false;
		LineHighlightings other = (LineHighlightings) o;
		return line == other.line && tokens.equals(other.tokens);
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, tokens);
	}

	@Override
	public String toString() {
		return "Line " + line + ": " + tokens;
	}
}

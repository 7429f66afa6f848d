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

import java.util.Objects;

import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Ranges;

/**
 * A highlighted range of the primary file together with its kind. Tokens
 * are ordered by range (start, then end) and then by kind; this is the
 * order token lists are sorted, deduplicated and diffed in.
 */
public final class HighlightingToken implements Comparable<HighlightingToken> {
	private final HighlightingKind kind;
	private final Range range;

	public HighlightingToken(HighlightingKind kind, Range range) {
		this.kind = Objects.requireNonNull(kind);
		this.range = Ranges.copyOf(Objects.requireNonNull(range));
	}

	public HighlightingKind getKind() {
		return kind;
	}

	/** Returns a copy, the token itself is immutable. */
	public Range getRange() {
		return Ranges.copyOf(range);
	}

	public int getStartLine() {
		return range.getStart().getLine();
	}

	public int getStartCharacter() {
		return range.getStart().getCharacter();
	}

	public int getEndCharacter() {
		return range.getEnd().getCharacter();
	}

	boolean hasSameRange(HighlightingToken other) {
		return range.equals(other.range);
	}

	@Override
	public int compareTo(HighlightingToken other) {
		int byRange = Ranges.COMPARATOR.compare(range, other.range);
		if (byRange != 0) {
			return byRange;
		}
		return kind.compareTo(other.kind);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof HighlightingToken)) return false;
		HighlightingToken other = (HighlightingToken) o;
		return kind == other.kind && range.equals(other.range);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, range);
	}

	@Override
	public String toString() {
		return kind + "@" + range.getStart().getLine() + ":" + range.getStart().getCharacter()
				+ "-" + range.getEnd().getLine() + ":" + range.getEnd().getCharacter();
	}
}

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

/**
 * One token as it travels over the wire: start character, length and kind
 * index, all on the line the record was sent for.
 */
public final class HighlightingRecord {
	private final long character;
	private final int length;
	private final int kindIndex;

	public HighlightingRecord(long character, int length, int kindIndex) {
		this.character = character;
		this.length = length;
		this.kindIndex = kindIndex;
	}

	/** Unsigned 32-bit start character. */
	public long getCharacter() {
		return character;
	}

	/** Unsigned 16-bit length. */
	public int getLength() {
		return length;
	}

	/** Unsigned 16-bit {@link HighlightingKind} ordinal. */
	public int getKindIndex() {
		return kindIndex;
	}

	/** The kind, or {@code null} for an index this version does not know. */
	public HighlightingKind getKind() {
		return HighlightingKind.fromOrdinal(kindIndex);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof HighlightingRecord)) return false;
		HighlightingRecord other = (HighlightingRecord) o;
		return character == other.character && length == other.length && kindIndex == other.kindIndex;
	}

	@Override
	public int hashCode() {
		return Objects.hash(character, length, kindIndex);
	}

	@Override
	public String toString() {
		return "HighlightingRecord[character=" + character + ", length=" + length + ", kind=" + kindIndex + "]";
	}
}

////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import java.util.Comparator;

import org.eclipse.lsp4j.Range;

public class Ranges {
	private Ranges() {
	}

	/** Orders by start position, then by end position. */
	public static final Comparator<Range> COMPARATOR = (Range r1, Range r2) -> {
		int byStart = Positions.COMPARATOR.compare(r1.getStart(), r2.getStart());
		if (byStart != 0) {
			return byStart;
		}
		return Positions.COMPARATOR.compare(r1.getEnd(), r2.getEnd());
	};

	/**
	 * A range is valid when both ends are valid positions and the end does
	 * not come before the start.
	 */
	public static boolean valid(Range range) {
		return range != null
				&& Positions.valid(range.getStart())
				&& Positions.valid(range.getEnd())
				&& Positions.COMPARATOR.compare(range.getStart(), range.getEnd()) <= 0;
	}

	/** Deep copy, lsp4j ranges are mutable. */
	public static Range copyOf(Range range) {
		return new Range(Positions.copyOf(range.getStart()), Positions.copyOf(range.getEnd()));
	}
}

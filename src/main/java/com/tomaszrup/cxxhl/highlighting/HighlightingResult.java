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

/**
 * Canonical tokens of one parse, plus the problems found while producing
 * them.
 */
public final class HighlightingResult {
	private final List<HighlightingToken> tokens;
	private final List<String> problems;

	public HighlightingResult(List<HighlightingToken> tokens, List<String> problems) {
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		this.problems = problems != null ? Collections.unmodifiableList(new ArrayList<>(problems))
				: Collections.emptyList();
	}

	/** Sorted, duplicate-free, at most one token per range. */
	public List<HighlightingToken> getTokens() {
		return tokens;
	}

	public List<String> getProblems() {
		return problems;
	}
}

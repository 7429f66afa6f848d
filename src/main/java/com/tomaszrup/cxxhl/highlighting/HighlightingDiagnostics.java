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

import org.eclipse.lsp4j.Range;

import com.tomaszrup.cxxhl.ast.SourceLocation;

/**
 * Problems found while walking a tree. Nothing here stops the walk; the
 * affected token is dropped and the problem is kept for the caller to log.
 */
public class HighlightingDiagnostics {
	private final List<String> problems = new ArrayList<>();

	/**
	 * A location that passed every filter but has no token range. This means
	 * the tree and the source text disagree.
	 */
	public void invalidRange(SourceLocation location) {
		problems.add("Tried to add semantic token with an invalid range at " + location);
	}

	public void invalidMacroRange(Range range) {
		problems.add("Ignoring invalid macro expansion range " + range);
	}

	public boolean hasProblems() {
		return !problems.isEmpty();
	}

	public List<String> getProblems() {
		return Collections.unmodifiableList(problems);
	}
}

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

import org.eclipse.lsp4j.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.cxxhl.ast.ParsedUnit;
import com.tomaszrup.lsp.utils.Ranges;

/**
 * Produces the canonical highlighting tokens of a parsed document: walks the
 * tree, adds the macro expansions, sorts, and removes duplicates and
 * conflicting tokens.
 */
public class HighlightingTokenCollector {
	private static final Logger logger = LoggerFactory.getLogger(HighlightingTokenCollector.class);

	public HighlightingResult collect(ParsedUnit unit) {
		HighlightingDiagnostics diagnostics = new HighlightingDiagnostics();
		HighlightingTreeWalker walker = new HighlightingTreeWalker(unit.getSourceManager(), diagnostics);
		List<HighlightingToken> tokens = walker.walk(unit.getTranslationUnit());

		// macro expansions are not part of the tree
		for (Range macroRange : unit.getMacroRanges()) {
			if (!Ranges.valid(macroRange)) {
				diagnostics.invalidMacroRange(macroRange);
				continue;
			}
			tokens.add(new HighlightingToken(HighlightingKind.MACRO, macroRange));
		}

		List<HighlightingToken> canonical = canonicalize(tokens);
		for (String problem : diagnostics.getProblems()) {
			logger.error(problem);
		}
		logger.debug("Collected {} highlighting tokens ({} raw, {} problems)", canonical.size(), tokens.size(),
				diagnostics.getProblems().size());
		return new HighlightingResult(canonical, diagnostics.getProblems());
	}

	/**
	 * Sorts the raw tokens and removes exact duplicates. Tokens that share a
	 * range but disagree on the kind are all removed: there is no safe way to
	 * pick one of them.
	 */
	public static List<HighlightingToken> canonicalize(List<HighlightingToken> rawTokens) {
		List<HighlightingToken> sorted = new ArrayList<>(rawTokens);
		// List.sort is stable
		sorted.sort(null);

		// the same name can be visited twice, e.g. through initializer lists
		List<HighlightingToken> unique = new ArrayList<>(sorted.size());
		for (HighlightingToken token : sorted) {
			if (unique.isEmpty() || !unique.get(unique.size() - 1).equals(token)) {
				unique.add(token);
			}
		}

		List<HighlightingToken> nonConflicting = new ArrayList<>(unique.size());
		int runStart = 0;
		while (runStart < unique.size()) {
			HighlightingToken first = unique.get(runStart);
			int runEnd = runStart + 1;
			while (runEnd < unique.size() && unique.get(runEnd).hasSameRange(first)) {
				runEnd++;
			}
			if (runEnd - runStart == 1) {
				nonConflicting.add(first);
			}
			runStart = runEnd;
		}
		return nonConflicting;
	}
}

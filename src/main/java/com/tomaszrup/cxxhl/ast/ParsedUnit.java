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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.eclipse.lsp4j.Range;

/**
 * Everything the resolver hands over for one parse of a document: the tree,
 * location services for it, and the macro expansions of the primary file.
 */
public class ParsedUnit {
	private final TranslationUnit translationUnit;
	private final SourceManager sourceManager;
	private final List<Range> macroRanges;

	public ParsedUnit(TranslationUnit translationUnit, SourceManager sourceManager, List<Range> macroRanges) {
		this.translationUnit = Objects.requireNonNull(translationUnit);
		this.sourceManager = Objects.requireNonNull(sourceManager);
		this.macroRanges = macroRanges != null ? Collections.unmodifiableList(new ArrayList<>(macroRanges))
				: Collections.emptyList();
	}

	public ParsedUnit(TranslationUnit translationUnit, SourceManager sourceManager) {
		this(translationUnit, sourceManager, null);
	}

	public TranslationUnit getTranslationUnit() {
		return translationUnit;
	}

	public SourceManager getSourceManager() {
		return sourceManager;
	}

	/** Ranges of macro names at their expansion sites in the primary file. */
	public List<Range> getMacroRanges() {
		return macroRanges;
	}
}

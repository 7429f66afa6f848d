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

import java.util.Optional;

import org.eclipse.lsp4j.Range;

/**
 * Location services supplied by the resolver for one translation unit.
 */
public interface SourceManager {

	/**
	 * Returns {@code true} if the macro location was produced by expanding
	 * a macro argument rather than the macro body.
	 */
	boolean isMacroArgExpansion(SourceLocation location);

	/**
	 * Follows macro locations down to the file location the token was spelled
	 * at. File locations are returned unchanged. Returns an invalid location
	 * if no spelling can be found.
	 */
	SourceLocation getSpellingLoc(SourceLocation location);

	/**
	 * Returns {@code true} if the location is in the primary file of the
	 * translation unit, as opposed to an included file.
	 */
	boolean isInsideMainFile(SourceLocation location);

	/**
	 * Computes the range of the token that starts at the given file location.
	 *
	 * @return the token range, or empty if no token can be found there
	 */
	Optional<Range> getTokenRange(SourceLocation location);
}

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

/**
 * Semantic category of a highlighted name.
 *
 * <p>The ordinal is sent to clients as the token's kind index, so constants
 * must never be reordered or removed without bumping
 * {@link com.tomaszrup.cxxhl.Protocol#VERSION}. Add new kinds at the end.</p>
 */
public enum HighlightingKind {
	VARIABLE,            // 0
	LOCAL_VARIABLE,      // 1
	PARAMETER,           // 2
	FUNCTION,            // 3
	METHOD,              // 4
	STATIC_METHOD,       // 5
	FIELD,               // 6
	STATIC_FIELD,        // 7
	CLASS,               // 8
	ENUM,                // 9
	ENUM_CONSTANT,       // 10
	TYPEDEF,             // 11
	DEPENDENT_TYPE,      // 12
	DEPENDENT_NAME,      // 13
	NAMESPACE,           // 14
	TEMPLATE_PARAMETER,  // 15
	PRIMITIVE,           // 16
	MACRO;               // 17

	private static final HighlightingKind[] VALUES = values();

	/** Returns the kind with the given wire index, or {@code null} if there is none. */
	public static HighlightingKind fromOrdinal(int ordinal) {
		return ordinal >= 0 && ordinal < VALUES.length ? VALUES[ordinal] : null;
	}
}

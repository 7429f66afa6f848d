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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.cxxhl.highlighting;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HighlightingScopesTests {

	@Test
	void testLookupTableIsIndexedByKind() {
		List<List<String>> table = HighlightingScopes.getLookupTable();

		Assertions.assertEquals(HighlightingKind.values().length, table.size());
		for (HighlightingKind kind : HighlightingKind.values()) {
			List<String> scopes = table.get(kind.ordinal());
			Assertions.assertEquals(1, scopes.size(), kind.name());
			Assertions.assertEquals(HighlightingScopes.toTextMateScope(kind), scopes.get(0));
		}
	}

	@Test
	void testScopesAreDistinct() {
		Set<String> seen = new HashSet<>();
		for (HighlightingKind kind : HighlightingKind.values()) {
			Assertions.assertTrue(seen.add(HighlightingScopes.toTextMateScope(kind)), kind.name());
		}
	}

	@Test
	void testWellKnownScopes() {
		Assertions.assertEquals("entity.name.function.cpp", HighlightingScopes.toTextMateScope(HighlightingKind.FUNCTION));
		Assertions.assertEquals("entity.name.function.method.cpp",
				HighlightingScopes.toTextMateScope(HighlightingKind.METHOD));
		Assertions.assertEquals("entity.name.type.class.cpp", HighlightingScopes.toTextMateScope(HighlightingKind.CLASS));
		Assertions.assertEquals("entity.name.function.preprocessor.cpp",
				HighlightingScopes.toTextMateScope(HighlightingKind.MACRO));
		Assertions.assertEquals("storage.type.primitive.cpp",
				HighlightingScopes.toTextMateScope(HighlightingKind.PRIMITIVE));
	}

	@Test
	void testLookupTableIsReadOnly() {
		List<List<String>> table = HighlightingScopes.getLookupTable();
		Assertions.assertThrows(UnsupportedOperationException.class, () -> table.remove(0));
	}

	@Test
	void testKindOrdinalsAreStable() {
		Assertions.assertEquals(0, HighlightingKind.VARIABLE.ordinal());
		Assertions.assertEquals(3, HighlightingKind.FUNCTION.ordinal());
		Assertions.assertEquals(8, HighlightingKind.CLASS.ordinal());
		Assertions.assertEquals(17, HighlightingKind.MACRO.ordinal());
		Assertions.assertEquals(HighlightingKind.MACRO, HighlightingKind.fromOrdinal(17));
		Assertions.assertNull(HighlightingKind.fromOrdinal(18));
		Assertions.assertNull(HighlightingKind.fromOrdinal(-1));
	}
}

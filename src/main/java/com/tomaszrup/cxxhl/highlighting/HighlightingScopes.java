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
 * TextMate scopes for clients that color by scope name instead of by kind.
 */
public final class HighlightingScopes {
	private static final List<List<String>> LOOKUP_TABLE = buildLookupTable();

	private HighlightingScopes() {
	}

	public static String toTextMateScope(HighlightingKind kind) {
		switch (kind) {
			case FUNCTION:
				return "entity.name.function.cpp";
			case METHOD:
				return "entity.name.function.method.cpp";
			case STATIC_METHOD:
				return "entity.name.function.method.static.cpp";
			case VARIABLE:
				return "variable.other.cpp";
			case LOCAL_VARIABLE:
				return "variable.other.local.cpp";
			case PARAMETER:
				return "variable.parameter.cpp";
			case FIELD:
				return "variable.other.field.cpp";
			case STATIC_FIELD:
				return "variable.other.field.static.cpp";
			case CLASS:
				return "entity.name.type.class.cpp";
			case ENUM:
				return "entity.name.type.enum.cpp";
			case ENUM_CONSTANT:
				return "variable.other.enummember.cpp";
			case TYPEDEF:
				return "entity.name.type.typedef.cpp";
			case DEPENDENT_TYPE:
				return "entity.name.type.dependent.cpp";
			case DEPENDENT_NAME:
				return "entity.name.other.dependent.cpp";
			case NAMESPACE:
				return "entity.name.namespace.cpp";
			case TEMPLATE_PARAMETER:
				return "entity.name.type.template.cpp";
			case PRIMITIVE:
				return "storage.type.primitive.cpp";
			case MACRO:
				return "entity.name.function.preprocessor.cpp";
			default:
				throw new IllegalArgumentException("Unhandled highlighting kind " + kind);
		}
	}

	/**
	 * Scopes indexed by kind ordinal, one scope per kind. This is the table
	 * announced in the server capabilities.
	 */
	public static List<List<String>> getLookupTable() {
		return LOOKUP_TABLE;
	}

	private static List<List<String>> buildLookupTable() {
		List<List<String>> table = new ArrayList<>();
		for (HighlightingKind kind : HighlightingKind.values()) {
			table.add(Collections.singletonList(toTextMateScope(kind)));
		}
		return Collections.unmodifiableList(table);
	}
}

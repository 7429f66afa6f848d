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

import java.util.Objects;

/**
 * The name of a declaration or of a reference to one. Only identifiers carry
 * a spelling; the other kinds are names the language synthesizes
 * (constructors, operators, conversion functions, ...).
 */
public final class DeclarationName {

	public enum NameKind {
		IDENTIFIER,
		CONSTRUCTOR_NAME,
		DESTRUCTOR_NAME,
		CONVERSION_FUNCTION_NAME,
		OPERATOR_NAME,
		LITERAL_OPERATOR_NAME,
		DEDUCTION_GUIDE_NAME,
		USING_DIRECTIVE
	}

	private static final DeclarationName ANONYMOUS = new DeclarationName(NameKind.IDENTIFIER, "");
	private static final DeclarationName USING_DIRECTIVE_NAME = new DeclarationName(NameKind.USING_DIRECTIVE, null);

	private final NameKind nameKind;
	private final String identifier;

	private DeclarationName(NameKind nameKind, String identifier) {
		this.nameKind = nameKind;
		this.identifier = identifier;
	}

	public static DeclarationName identifier(String identifier) {
		return identifier == null || identifier.isEmpty() ? ANONYMOUS : new DeclarationName(NameKind.IDENTIFIER, identifier);
	}

	/** Name of an anonymous struct, union, namespace or lambda. */
	public static DeclarationName anonymous() {
		return ANONYMOUS;
	}

	public static DeclarationName constructor(String className) {
		return new DeclarationName(NameKind.CONSTRUCTOR_NAME, className);
	}

	public static DeclarationName destructor(String className) {
		return new DeclarationName(NameKind.DESTRUCTOR_NAME, className);
	}

	public static DeclarationName operator(String spelling) {
		return new DeclarationName(NameKind.OPERATOR_NAME, spelling);
	}

	public static DeclarationName conversionFunction(String typeSpelling) {
		return new DeclarationName(NameKind.CONVERSION_FUNCTION_NAME, typeSpelling);
	}

	public static DeclarationName usingDirective() {
		return USING_DIRECTIVE_NAME;
	}

	public static DeclarationName of(NameKind nameKind, String spelling) {
		if (nameKind == NameKind.IDENTIFIER) {
			return identifier(spelling);
		}
		return new DeclarationName(Objects.requireNonNull(nameKind), spelling);
	}

	public NameKind getNameKind() {
		return nameKind;
	}

	/**
	 * Returns the identifier spelling, or {@code null} if this is not an
	 * identifier name.
	 */
	public String getAsIdentifier() {
		return nameKind == NameKind.IDENTIFIER ? identifier : null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DeclarationName)) return false;
		DeclarationName other = (DeclarationName) o;
		return nameKind == other.nameKind && Objects.equals(identifier, other.identifier);
	}

	@Override
	public int hashCode() {
		return Objects.hash(nameKind, identifier);
	}

	@Override
	public String toString() {
		switch (nameKind) {
			case IDENTIFIER:
				return identifier;
			case DESTRUCTOR_NAME:
				return "~" + identifier;
			case OPERATOR_NAME:
				return "operator" + identifier;
			case USING_DIRECTIVE:
				return "<using-directive>";
			default:
				return identifier != null ? identifier : nameKind.name();
		}
	}
}

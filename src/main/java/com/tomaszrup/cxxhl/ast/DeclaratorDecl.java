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

/**
 * A declaration written with a declarator and a type specifier: variables,
 * fields, parameters and functions.
 */
public class DeclaratorDecl extends NamedDecl {
	private final Type type;
	private final SourceLocation typeSpecStartLoc;

	public DeclaratorDecl(DeclKind declKind, DeclarationName name, SourceLocation location,
			Type type, SourceLocation typeSpecStartLoc) {
		super(declKind, name, location);
		this.type = type;
		this.typeSpecStartLoc = typeSpecStartLoc != null ? typeSpecStartLoc : SourceLocation.invalid();
	}

	public DeclaratorDecl(DeclKind declKind, String identifier, SourceLocation location) {
		this(declKind, DeclarationName.identifier(identifier), location, null, null);
	}

	/** Declared type; for functions, the return type. May be {@code null}. */
	public Type getType() {
		return type;
	}

	/** Location where the type specifier starts, e.g. the {@code auto} keyword. */
	public SourceLocation getTypeSpecStartLoc() {
		return typeSpecStartLoc;
	}
}

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
 * {@code typedef} and {@code using X = ...} alias declarations.
 */
public class TypedefNameDecl extends NamedDecl {
	private final Type underlyingType;

	public TypedefNameDecl(DeclKind declKind, DeclarationName name, SourceLocation location, Type underlyingType) {
		super(declKind, name, location);
		if (!declKind.isTypedefName()) {
			throw new IllegalArgumentException("Not a typedef kind: " + declKind);
		}
		this.underlyingType = underlyingType;
	}

	public TypedefNameDecl(String identifier, SourceLocation location, Type underlyingType) {
		this(DeclKind.TYPEDEF, DeclarationName.identifier(identifier), location, underlyingType);
	}

	public Type getUnderlyingType() {
		return underlyingType;
	}
}

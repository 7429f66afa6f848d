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
 * Free functions, methods, constructors, destructors and conversion
 * functions.
 */
public class FunctionDecl extends DeclaratorDecl {
	private final boolean isStatic;

	public FunctionDecl(DeclKind declKind, DeclarationName name, SourceLocation location, Type returnType,
			SourceLocation typeSpecStartLoc, boolean isStatic) {
		super(checkKind(declKind), name, location, returnType, typeSpecStartLoc);
		this.isStatic = isStatic;
	}

	public FunctionDecl(DeclKind declKind, String identifier, SourceLocation location, boolean isStatic) {
		this(declKind, DeclarationName.identifier(identifier), location, null, null, isStatic);
	}

	/** {@code true} for static member functions. */
	public boolean isStatic() {
		return isStatic;
	}

	private static DeclKind checkKind(DeclKind declKind) {
		if (declKind == null || !declKind.isFunction()) {
			throw new IllegalArgumentException("Not a function kind: " + declKind);
		}
		return declKind;
	}
}

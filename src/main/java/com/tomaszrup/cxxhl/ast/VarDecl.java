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

public class VarDecl extends DeclaratorDecl {

	public enum StorageScope {
		/** {@code static} member of a class. */
		STATIC_DATA_MEMBER,
		/** Declared inside a function body. */
		LOCAL,
		/** Namespace scope, or anything else. */
		GLOBAL
	}

	private final StorageScope storageScope;

	public VarDecl(DeclarationName name, SourceLocation location, Type type, SourceLocation typeSpecStartLoc,
			StorageScope storageScope) {
		super(DeclKind.VAR, name, location, type, typeSpecStartLoc);
		this.storageScope = storageScope != null ? storageScope : StorageScope.GLOBAL;
	}

	public VarDecl(String identifier, SourceLocation location, StorageScope storageScope) {
		this(DeclarationName.identifier(identifier), location, null, null, storageScope);
	}

	public boolean isStaticDataMember() {
		return storageScope == StorageScope.STATIC_DATA_MEMBER;
	}

	public boolean isLocalVarDecl() {
		return storageScope == StorageScope.LOCAL;
	}
}

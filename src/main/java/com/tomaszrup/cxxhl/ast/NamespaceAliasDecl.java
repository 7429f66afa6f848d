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
 * {@code namespace alias = target;} declaration.
 */
public class NamespaceAliasDecl extends NamedDecl {
	private final NamedDecl aliasedNamespace;
	private final SourceLocation targetNameLoc;

	public NamespaceAliasDecl(DeclarationName name, SourceLocation location, NamedDecl aliasedNamespace,
			SourceLocation targetNameLoc) {
		super(DeclKind.NAMESPACE_ALIAS, name, location);
		this.aliasedNamespace = aliasedNamespace;
		this.targetNameLoc = targetNameLoc != null ? targetNameLoc : SourceLocation.invalid();
	}

	public NamespaceAliasDecl(String identifier, SourceLocation location, NamedDecl aliasedNamespace,
			SourceLocation targetNameLoc) {
		this(DeclarationName.identifier(identifier), location, aliasedNamespace, targetNameLoc);
	}

	/** The namespace (or namespace alias) this alias refers to. */
	public NamedDecl getAliasedNamespace() {
		return aliasedNamespace;
	}

	/** Location of the target namespace's name after the {@code =}. */
	public SourceLocation getTargetNameLoc() {
		return targetNameLoc;
	}
}

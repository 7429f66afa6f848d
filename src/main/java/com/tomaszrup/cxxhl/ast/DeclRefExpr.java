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
 * A reference to a declaration by name, e.g. {@code x} in {@code x + 1}.
 */
public class DeclRefExpr extends AstNode {
	private final DeclarationName name;
	private final SourceLocation location;
	private final NamedDecl decl;

	public DeclRefExpr(DeclarationName name, SourceLocation location, NamedDecl decl) {
		this.name = name != null ? name : DeclarationName.anonymous();
		this.location = location != null ? location : SourceLocation.invalid();
		this.decl = decl;
	}

	public DeclRefExpr(SourceLocation location, NamedDecl decl) {
		this(decl.getDeclName(), location, decl);
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.DECL_REF_EXPR;
	}

	public DeclarationName getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public NamedDecl getDecl() {
		return decl;
	}
}

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
 * A declaration that introduces a name. Declarations appear in the tree
 * where they are written and are referenced from expressions and types
 * wherever they are used.
 */
public class NamedDecl extends AstNode {
	private final DeclKind declKind;
	private final DeclarationName name;
	private final SourceLocation location;

	public NamedDecl(DeclKind declKind, DeclarationName name, SourceLocation location) {
		this.declKind = Objects.requireNonNull(declKind);
		this.name = name != null ? name : DeclarationName.anonymous();
		this.location = location != null ? location : SourceLocation.invalid();
	}

	public NamedDecl(DeclKind declKind, String identifier, SourceLocation location) {
		this(declKind, DeclarationName.identifier(identifier), location);
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.DECL;
	}

	public DeclKind getDeclKind() {
		return declKind;
	}

	public DeclarationName getDeclName() {
		return name;
	}

	/** Location of the name in the declaration. */
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String toString() {
		return declKind + " " + name + " @ " + location;
	}
}

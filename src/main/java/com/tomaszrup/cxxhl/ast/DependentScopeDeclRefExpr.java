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
 * {@code T::name} where {@code T} depends on a template parameter, so the
 * name cannot be looked up until instantiation.
 */
public class DependentScopeDeclRefExpr extends AstNode {
	private final DeclarationName declName;
	private final SourceLocation location;

	public DependentScopeDeclRefExpr(DeclarationName declName, SourceLocation location) {
		this.declName = declName != null ? declName : DeclarationName.anonymous();
		this.location = location != null ? location : SourceLocation.invalid();
	}

	public DependentScopeDeclRefExpr(String identifier, SourceLocation location) {
		this(DeclarationName.identifier(identifier), location);
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.DEPENDENT_SCOPE_DECL_REF_EXPR;
	}

	public DeclarationName getDeclName() {
		return declName;
	}

	public SourceLocation getLocation() {
		return location;
	}
}

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A name that lookup could not bind to a single declaration: an overload
 * set, or a name whose candidates depend on a template argument.
 */
public class OverloadExpr extends AstNode {
	private final DeclarationName name;
	private final SourceLocation nameLoc;
	private final List<NamedDecl> decls;

	public OverloadExpr(DeclarationName name, SourceLocation nameLoc, List<? extends NamedDecl> decls) {
		this.name = name != null ? name : DeclarationName.anonymous();
		this.nameLoc = nameLoc != null ? nameLoc : SourceLocation.invalid();
		this.decls = decls != null ? Collections.unmodifiableList(new ArrayList<>(decls)) : Collections.emptyList();
	}

	public OverloadExpr(String identifier, SourceLocation nameLoc, NamedDecl... decls) {
		this(DeclarationName.identifier(identifier), nameLoc, Arrays.asList(decls));
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.OVERLOAD_EXPR;
	}

	public DeclarationName getName() {
		return name;
	}

	public SourceLocation getNameLoc() {
		return nameLoc;
	}

	/** Candidate declarations found by lookup. */
	public List<NamedDecl> decls() {
		return decls;
	}
}

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
 * {@code t.name} where the type of {@code t} depends on a template
 * parameter.
 */
public class DependentScopeMemberExpr extends AstNode {
	private final DeclarationName member;
	private final SourceLocation memberLoc;

	public DependentScopeMemberExpr(DeclarationName member, SourceLocation memberLoc) {
		this.member = member != null ? member : DeclarationName.anonymous();
		this.memberLoc = memberLoc != null ? memberLoc : SourceLocation.invalid();
	}

	public DependentScopeMemberExpr(String identifier, SourceLocation memberLoc) {
		this(DeclarationName.identifier(identifier), memberLoc);
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.DEPENDENT_SCOPE_MEMBER_EXPR;
	}

	public DeclarationName getMember() {
		return member;
	}

	public SourceLocation getMemberLoc() {
		return memberLoc;
	}
}

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
 * Member access such as {@code obj.field} or {@code ptr->method()}. The
 * object expression is a child.
 */
public class MemberExpr extends AstNode {
	private final DeclarationName memberName;
	private final SourceLocation memberLoc;
	private final NamedDecl memberDecl;

	public MemberExpr(DeclarationName memberName, SourceLocation memberLoc, NamedDecl memberDecl) {
		this.memberName = memberName != null ? memberName : DeclarationName.anonymous();
		this.memberLoc = memberLoc != null ? memberLoc : SourceLocation.invalid();
		this.memberDecl = memberDecl;
	}

	public MemberExpr(SourceLocation memberLoc, NamedDecl memberDecl) {
		this(memberDecl.getDeclName(), memberLoc, memberDecl);
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.MEMBER_EXPR;
	}

	public DeclarationName getMemberName() {
		return memberName;
	}

	public SourceLocation getMemberLoc() {
		return memberLoc;
	}

	public NamedDecl getMemberDecl() {
		return memberDecl;
	}
}

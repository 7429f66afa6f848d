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
 * An entry of a constructor's member initializer list, e.g. {@code x(1)}.
 * The initializer expression is a child.
 */
public class ConstructorInitializer extends AstNode {
	private final NamedDecl member;
	private final SourceLocation sourceLocation;

	/**
	 * @param member the initialized field, {@code null} for base class and
	 *               delegating initializers
	 */
	public ConstructorInitializer(NamedDecl member, SourceLocation sourceLocation) {
		this.member = member;
		this.sourceLocation = sourceLocation != null ? sourceLocation : SourceLocation.invalid();
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.CONSTRUCTOR_INITIALIZER;
	}

	public NamedDecl getMember() {
		return member;
	}

	public SourceLocation getSourceLocation() {
		return sourceLocation;
	}
}

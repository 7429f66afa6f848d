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
 * One component of a qualifier such as {@code std::} in
 * {@code std::vector}. The qualifier before it, if any, is its only child.
 */
public class NestedNameSpecifierLoc extends AstNode {

	public enum SpecifierKind {
		IDENTIFIER,
		NAMESPACE,
		NAMESPACE_ALIAS,
		TYPE_SPEC,
		GLOBAL,
		SUPER
	}

	private final SpecifierKind specifierKind;
	private final SourceLocation localBeginLoc;

	public NestedNameSpecifierLoc(SpecifierKind specifierKind, SourceLocation localBeginLoc,
			NestedNameSpecifierLoc prefix) {
		this.specifierKind = specifierKind;
		this.localBeginLoc = localBeginLoc != null ? localBeginLoc : SourceLocation.invalid();
		addChild(prefix);
	}

	public NestedNameSpecifierLoc(SpecifierKind specifierKind, SourceLocation localBeginLoc) {
		this(specifierKind, localBeginLoc, null);
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.NESTED_NAME_SPECIFIER_LOC;
	}

	/** {@code null} for a specifier without a name, e.g. a bare {@code ::}. */
	public SpecifierKind getSpecifierKind() {
		return specifierKind;
	}

	/** Start of this component, not of the whole qualifier. */
	public SourceLocation getLocalBeginLoc() {
		return localBeginLoc;
	}
}

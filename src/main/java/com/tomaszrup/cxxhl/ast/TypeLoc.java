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
 * A type as written in the source. The node kind tells which shape of type
 * was written; {@link #getType()} is the resolved type.
 */
public class TypeLoc extends AstNode {
	private final NodeKind nodeKind;
	private final SourceLocation beginLoc;
	private final SourceLocation nameLoc;
	private final Type type;
	private final NamedDecl namedDecl;
	private final boolean definition;

	private TypeLoc(NodeKind nodeKind, SourceLocation beginLoc, SourceLocation nameLoc, Type type,
			NamedDecl namedDecl, boolean definition) {
		this.nodeKind = Objects.requireNonNull(nodeKind);
		this.beginLoc = beginLoc != null ? beginLoc : SourceLocation.invalid();
		this.nameLoc = nameLoc != null ? nameLoc : this.beginLoc;
		this.type = type;
		this.namedDecl = namedDecl;
		this.definition = definition;
	}

	public static TypeLoc typedef(SourceLocation beginLoc, TypedefNameDecl decl) {
		return new TypeLoc(NodeKind.TYPEDEF_TYPE_LOC, beginLoc, null, decl != null ? Type.typedef(decl) : null,
				decl, false);
	}

	/**
	 * {@code Foo<int>}; {@code template} is {@code null} when the template
	 * name does not resolve to a single template declaration.
	 */
	public static TypeLoc templateSpecialization(SourceLocation beginLoc, TemplateDecl template) {
		return new TypeLoc(NodeKind.TEMPLATE_SPECIALIZATION_TYPE_LOC, beginLoc, null, null, template, false);
	}

	/**
	 * A reference to a class, struct, union or enum.
	 *
	 * @param definition {@code true} when this is the type written by the
	 *                   defining declaration itself
	 */
	public static TypeLoc tag(SourceLocation beginLoc, Type type, boolean definition) {
		return new TypeLoc(NodeKind.TAG_TYPE_LOC, beginLoc, null, type, type != null ? type.getDecl() : null,
				definition);
	}

	public static TypeLoc tag(SourceLocation beginLoc, Type type) {
		return tag(beginLoc, type, false);
	}

	public static TypeLoc decltype(SourceLocation beginLoc, Type type) {
		return new TypeLoc(NodeKind.DECLTYPE_TYPE_LOC, beginLoc, null, type, null, false);
	}

	/** {@code typename T::name}; {@code nameLoc} points at {@code name}. */
	public static TypeLoc dependentName(SourceLocation beginLoc, SourceLocation nameLoc) {
		return new TypeLoc(NodeKind.DEPENDENT_NAME_TYPE_LOC, beginLoc, nameLoc, null, null, false);
	}

	public static TypeLoc templateTypeParm(SourceLocation beginLoc, NamedDecl parm) {
		return new TypeLoc(NodeKind.TEMPLATE_TYPE_PARM_TYPE_LOC, beginLoc, null,
				parm != null ? Type.templateTypeParm(parm) : null, parm, false);
	}

	public static TypeLoc other(SourceLocation beginLoc, Type type) {
		return new TypeLoc(NodeKind.OTHER_TYPE_LOC, beginLoc, null, type, null, false);
	}

	@Override
	public NodeKind getNodeKind() {
		return nodeKind;
	}

	public SourceLocation getBeginLoc() {
		return beginLoc;
	}

	public SourceLocation getNameLoc() {
		return nameLoc;
	}

	public Type getType() {
		return type;
	}

	/** Typedef, template or tag declaration the written type names, if any. */
	public NamedDecl getNamedDecl() {
		return namedDecl;
	}

	public boolean isDefinition() {
		return definition;
	}
}

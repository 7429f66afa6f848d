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
package com.tomaszrup.cxxhl.highlighting;

import java.util.Collection;
import java.util.Optional;

import com.tomaszrup.cxxhl.ast.FunctionDecl;
import com.tomaszrup.cxxhl.ast.NamedDecl;
import com.tomaszrup.cxxhl.ast.RecordDecl;
import com.tomaszrup.cxxhl.ast.TemplateDecl;
import com.tomaszrup.cxxhl.ast.Type;
import com.tomaszrup.cxxhl.ast.TypedefNameDecl;
import com.tomaszrup.cxxhl.ast.UsingShadowDecl;
import com.tomaszrup.cxxhl.ast.VarDecl;

/**
 * Maps resolved declarations and types to a {@link HighlightingKind}.
 * Stateless; an empty result means the entity is not highlighted.
 */
public final class KindClassifier {

	/**
	 * Bound on wrapper unwrapping and on typedef to type to declaration
	 * recursion. Well-formed trees never get close.
	 */
	static final int MAX_UNWRAP_DEPTH = 16;

	private KindClassifier() {
	}

	public static Optional<HighlightingKind> kindForDecl(NamedDecl decl) {
		return kindForDecl(decl, 0);
	}

	public static Optional<HighlightingKind> kindForType(Type type) {
		return kindForType(type, 0);
	}

	/**
	 * Returns the kind shared by all candidates, or empty if any candidate
	 * is unclassifiable, the candidates disagree, or there are none.
	 */
	public static Optional<HighlightingKind> kindForCandidateDecls(Collection<? extends NamedDecl> decls) {
		HighlightingKind result = null;
		for (NamedDecl decl : decls) {
			Optional<HighlightingKind> kind = kindForDecl(decl);
			if (!kind.isPresent() || (result != null && kind.get() != result)) {
				return Optional.empty();
			}
			result = kind.get();
		}
		return Optional.ofNullable(result);
	}

	private static Optional<HighlightingKind> kindForDecl(NamedDecl decl, int depth) {
		if (depth > MAX_UNWRAP_DEPTH) {
			return Optional.empty();
		}
		NamedDecl d = unwrap(decl);
		if (d == null) {
			return Optional.empty();
		}
		switch (d.getDeclKind()) {
			case TYPEDEF:
			case TYPE_ALIAS: {
				// typedefs are highlighted as what they name, Typedef is the fallback
				Type underlying = d instanceof TypedefNameDecl ? ((TypedefNameDecl) d).getUnderlyingType() : null;
				Optional<HighlightingKind> kind = kindForType(underlying, depth + 1);
				return kind.isPresent() ? kind : Optional.of(HighlightingKind.TYPEDEF);
			}
			case RECORD:
				// lambdas have a closure class but no name to highlight
				if (d instanceof RecordDecl && ((RecordDecl) d).isLambda()) {
					return Optional.empty();
				}
				return Optional.of(HighlightingKind.CLASS);
			case CLASS_TEMPLATE:
			case CONSTRUCTOR:
				return Optional.of(HighlightingKind.CLASS);
			case METHOD:
			case DESTRUCTOR:
			case CONVERSION:
				return Optional.of(d instanceof FunctionDecl && ((FunctionDecl) d).isStatic()
						? HighlightingKind.STATIC_METHOD
						: HighlightingKind.METHOD);
			case FIELD:
				return Optional.of(HighlightingKind.FIELD);
			case ENUM:
				return Optional.of(HighlightingKind.ENUM);
			case ENUM_CONSTANT:
				return Optional.of(HighlightingKind.ENUM_CONSTANT);
			case PARM_VAR:
				return Optional.of(HighlightingKind.PARAMETER);
			case VAR:
				return Optional.of(d instanceof VarDecl ? kindForVar((VarDecl) d) : HighlightingKind.VARIABLE);
			case BINDING:
				return Optional.of(HighlightingKind.VARIABLE);
			case FUNCTION:
				return Optional.of(HighlightingKind.FUNCTION);
			case NAMESPACE:
			case NAMESPACE_ALIAS:
			case USING_DIRECTIVE:
				return Optional.of(HighlightingKind.NAMESPACE);
			case TEMPLATE_TYPE_PARM:
			case NON_TYPE_TEMPLATE_PARM:
			case TEMPLATE_TEMPLATE_PARM:
				return Optional.of(HighlightingKind.TEMPLATE_PARAMETER);
			default:
				return Optional.empty();
		}
	}

	private static HighlightingKind kindForVar(VarDecl var) {
		if (var.isStaticDataMember()) {
			return HighlightingKind.STATIC_FIELD;
		}
		return var.isLocalVarDecl() ? HighlightingKind.LOCAL_VARIABLE : HighlightingKind.VARIABLE;
	}

	private static Optional<HighlightingKind> kindForType(Type type, int depth) {
		if (type == null || depth > MAX_UNWRAP_DEPTH) {
			return Optional.empty();
		}
		// builtins have no declaration
		if (type.isBuiltinType()) {
			return Optional.of(HighlightingKind.PRIMITIVE);
		}
		if (type.getTypeClass() == Type.TypeClass.TEMPLATE_TYPE_PARM) {
			return kindForDecl(type.getDecl(), depth + 1);
		}
		NamedDecl tag = type.getAsTagDecl();
		if (tag != null) {
			return kindForDecl(tag, depth + 1);
		}
		return Optional.empty();
	}

	/**
	 * Looks through using-shadows to their target and through templates to
	 * the templated entity. Returns {@code null} for a missing declaration or
	 * a wrapper chain that does not end.
	 */
	static NamedDecl unwrap(NamedDecl decl) {
		NamedDecl current = decl;
		for (int i = 0; i < MAX_UNWRAP_DEPTH && current != null; i++) {
			if (current instanceof UsingShadowDecl && ((UsingShadowDecl) current).getTargetDecl() != null) {
				current = ((UsingShadowDecl) current).getTargetDecl();
			} else if (current instanceof TemplateDecl && ((TemplateDecl) current).getTemplatedDecl() != null) {
				current = ((TemplateDecl) current).getTemplatedDecl();
			} else {
				return current;
			}
		}
		return null;
	}
}

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
 * A resolved type. Sugar types (typedefs, deduced {@code auto},
 * {@code decltype}, elaborated names) wrap the type they stand for;
 * {@link #getCanonicalType()} strips them.
 */
public final class Type {
	private static final int MAX_DESUGAR_DEPTH = 32;

	public enum TypeClass {
		BUILTIN,
		RECORD,
		ENUM,
		TEMPLATE_TYPE_PARM,
		TYPEDEF,
		AUTO,
		DECLTYPE,
		ELABORATED,
		POINTER,
		LVALUE_REFERENCE,
		RVALUE_REFERENCE,
		DEPENDENT_NAME,
		OTHER
	}

	private final TypeClass typeClass;
	private final String spelling;
	private final NamedDecl decl;
	private final Type inner;

	private Type(TypeClass typeClass, String spelling, NamedDecl decl, Type inner) {
		this.typeClass = typeClass;
		this.spelling = spelling;
		this.decl = decl;
		this.inner = inner;
	}

	public static Type builtin(String spelling) {
		return new Type(TypeClass.BUILTIN, spelling, null, null);
	}

	public static Type record(RecordDecl decl) {
		return new Type(TypeClass.RECORD, null, Objects.requireNonNull(decl), null);
	}

	public static Type enumType(NamedDecl decl) {
		return new Type(TypeClass.ENUM, null, Objects.requireNonNull(decl), null);
	}

	public static Type templateTypeParm(NamedDecl decl) {
		return new Type(TypeClass.TEMPLATE_TYPE_PARM, null, decl, null);
	}

	public static Type typedef(TypedefNameDecl decl) {
		return new Type(TypeClass.TYPEDEF, null, decl, decl.getUnderlyingType());
	}

	/**
	 * @param deduced the deduced type, or {@code null} while still undeduced
	 */
	public static Type auto(Type deduced) {
		return new Type(TypeClass.AUTO, "auto", null, deduced);
	}

	public static Type decltype(Type underlying) {
		return new Type(TypeClass.DECLTYPE, "decltype", null, underlying);
	}

	public static Type elaborated(Type named) {
		return new Type(TypeClass.ELABORATED, null, null, Objects.requireNonNull(named));
	}

	public static Type pointer(Type pointee) {
		return new Type(TypeClass.POINTER, null, null, Objects.requireNonNull(pointee));
	}

	public static Type lvalueReference(Type pointee) {
		return new Type(TypeClass.LVALUE_REFERENCE, null, null, Objects.requireNonNull(pointee));
	}

	public static Type rvalueReference(Type pointee) {
		return new Type(TypeClass.RVALUE_REFERENCE, null, null, Objects.requireNonNull(pointee));
	}

	public static Type dependentName(String spelling) {
		return new Type(TypeClass.DEPENDENT_NAME, spelling, null, null);
	}

	public static Type other(String spelling) {
		return new Type(TypeClass.OTHER, spelling, null, null);
	}

	public TypeClass getTypeClass() {
		return typeClass;
	}

	/** Declaration behind a tag, typedef or template type parameter type. */
	public NamedDecl getDecl() {
		return decl;
	}

	/** Deduced type of an {@code auto} type, {@code null} while undeduced. */
	public Type getDeducedType() {
		return typeClass == TypeClass.AUTO ? inner : null;
	}

	public Type getPointeeType() {
		switch (typeClass) {
			case POINTER:
			case LVALUE_REFERENCE:
			case RVALUE_REFERENCE:
				return inner;
			default:
				return null;
		}
	}

	public boolean isSugared() {
		switch (typeClass) {
			case TYPEDEF:
			case AUTO:
			case DECLTYPE:
			case ELABORATED:
				return inner != null;
			default:
				return false;
		}
	}

	/**
	 * Strips all sugar. An undeduced {@code auto} is its own canonical type.
	 * Returns {@code null} if the sugar chain does not end, which only
	 * happens for malformed input.
	 */
	public Type getCanonicalType() {
		Type current = this;
		for (int depth = 0; depth < MAX_DESUGAR_DEPTH; depth++) {
			if (!current.isSugared()) {
				return current;
			}
			current = current.inner;
		}
		return null;
	}

	public boolean isBuiltinType() {
		Type canonical = getCanonicalType();
		return canonical != null && canonical.typeClass == TypeClass.BUILTIN;
	}

	/** Record or enum declaration this type names once desugared, or {@code null}. */
	public NamedDecl getAsTagDecl() {
		Type canonical = getCanonicalType();
		if (canonical == null) {
			return null;
		}
		if (canonical.typeClass == TypeClass.RECORD || canonical.typeClass == TypeClass.ENUM) {
			return canonical.decl;
		}
		return null;
	}

	/**
	 * Finds an {@code auto} type written in this type, looking through
	 * pointers and references ({@code const auto &}, {@code auto *}).
	 */
	public Type getContainedAutoType() {
		Type current = this;
		for (int depth = 0; depth < MAX_DESUGAR_DEPTH && current != null; depth++) {
			if (current.typeClass == TypeClass.AUTO) {
				return current;
			}
			current = current.getPointeeType();
		}
		return null;
	}

	@Override
	public String toString() {
		if (spelling != null) {
			return spelling;
		}
		if (decl != null) {
			return typeClass + "(" + decl.getDeclName() + ")";
		}
		return typeClass + "(" + inner + ")";
	}
}

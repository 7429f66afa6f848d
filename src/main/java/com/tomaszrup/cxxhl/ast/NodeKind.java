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
 * Closed set of node shapes a resolved tree is made of. Highlighting
 * dispatches on this tag instead of on the node class.
 */
public enum NodeKind {
	TRANSLATION_UNIT,
	/** Any statement or expression that carries no name of its own. */
	STMT,
	DECL,
	DECL_REF_EXPR,
	MEMBER_EXPR,
	OVERLOAD_EXPR,
	DEPENDENT_SCOPE_DECL_REF_EXPR,
	DEPENDENT_SCOPE_MEMBER_EXPR,
	TYPEDEF_TYPE_LOC,
	TEMPLATE_SPECIALIZATION_TYPE_LOC,
	TAG_TYPE_LOC,
	DECLTYPE_TYPE_LOC,
	DEPENDENT_NAME_TYPE_LOC,
	TEMPLATE_TYPE_PARM_TYPE_LOC,
	/** Type location for every other type shape (builtins, pointers, ...). */
	OTHER_TYPE_LOC,
	NESTED_NAME_SPECIFIER_LOC,
	CONSTRUCTOR_INITIALIZER
}

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

public enum DeclKind {
	NAMESPACE,
	NAMESPACE_ALIAS,
	USING_DIRECTIVE,
	USING,
	USING_SHADOW,
	RECORD,
	ENUM,
	ENUM_CONSTANT,
	TYPEDEF,
	TYPE_ALIAS,
	CLASS_TEMPLATE,
	FUNCTION_TEMPLATE,
	VAR_TEMPLATE,
	ALIAS_TEMPLATE,
	FUNCTION,
	METHOD,
	CONSTRUCTOR,
	DESTRUCTOR,
	CONVERSION,
	FIELD,
	VAR,
	PARM_VAR,
	BINDING,
	TEMPLATE_TYPE_PARM,
	NON_TYPE_TEMPLATE_PARM,
	TEMPLATE_TEMPLATE_PARM,
	LABEL;

	public boolean isTemplate() {
		return this == CLASS_TEMPLATE || this == FUNCTION_TEMPLATE || this == VAR_TEMPLATE || this == ALIAS_TEMPLATE;
	}

	public boolean isTypedefName() {
		return this == TYPEDEF || this == TYPE_ALIAS;
	}

	public boolean isFunction() {
		return this == FUNCTION || this == METHOD || this == CONSTRUCTOR || this == DESTRUCTOR
				|| this == CONVERSION;
	}
}

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
 * A class, function, variable or alias template. The templated declaration
 * is traversed as a child of the template.
 */
public class TemplateDecl extends NamedDecl {
	private final NamedDecl templatedDecl;

	public TemplateDecl(DeclKind declKind, DeclarationName name, SourceLocation location, NamedDecl templatedDecl) {
		super(declKind, name, location);
		if (!declKind.isTemplate()) {
			throw new IllegalArgumentException("Not a template kind: " + declKind);
		}
		this.templatedDecl = templatedDecl;
		addChild(templatedDecl);
	}

	public TemplateDecl(DeclKind declKind, NamedDecl templatedDecl) {
		this(declKind, templatedDecl != null ? templatedDecl.getDeclName() : DeclarationName.anonymous(),
				templatedDecl != null ? templatedDecl.getLocation() : SourceLocation.invalid(), templatedDecl);
	}

	/** The entity being templated, may be {@code null} in broken code. */
	public NamedDecl getTemplatedDecl() {
		return templatedDecl;
	}
}

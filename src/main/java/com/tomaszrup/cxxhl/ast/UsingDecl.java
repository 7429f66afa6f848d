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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code using ns::name;} declaration. Every entity named by it is reachable
 * through one of its shadows.
 */
public class UsingDecl extends NamedDecl {
	private final List<UsingShadowDecl> shadows;

	public UsingDecl(DeclarationName name, SourceLocation location, List<UsingShadowDecl> shadows) {
		super(DeclKind.USING, name, location);
		this.shadows = shadows != null ? Collections.unmodifiableList(new ArrayList<>(shadows)) : Collections.emptyList();
	}

	public static UsingDecl of(String identifier, SourceLocation location, NamedDecl... targets) {
		List<UsingShadowDecl> shadows = new ArrayList<>();
		for (NamedDecl target : targets) {
			shadows.add(new UsingShadowDecl(target, location));
		}
		return new UsingDecl(DeclarationName.identifier(identifier), location, shadows);
	}

	public List<UsingShadowDecl> shadows() {
		return shadows;
	}
}

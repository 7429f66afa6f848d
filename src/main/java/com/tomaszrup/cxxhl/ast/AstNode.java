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
 * Base class of every node in a resolved tree. Children are added while the
 * resolver builds the tree and are read-only afterwards.
 */
public abstract class AstNode {
	private final List<AstNode> children = new ArrayList<>();

	public abstract NodeKind getNodeKind();

	public List<AstNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public AstNode addChild(AstNode child) {
		if (child != null) {
			children.add(child);
		}
		return this;
	}

	public AstNode addChildren(AstNode... nodes) {
		for (AstNode node : nodes) {
			addChild(node);
		}
		return this;
	}
}

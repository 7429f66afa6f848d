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
 * A statement or expression without a name of its own, e.g. a compound
 * statement or a call. Only its children are of interest.
 */
public class Stmt extends AstNode {
	private final String label;

	public Stmt(String label) {
		this.label = label;
	}

	@Override
	public NodeKind getNodeKind() {
		return NodeKind.STMT;
	}

	@Override
	public String toString() {
		return label;
	}
}

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
package com.tomaszrup.cxxhl;

/**
 * Custom protocol constants shared with the client extension.
 */
public final class Protocol {
	private Protocol() {
	}

	/**
	 * Version of the highlighting wire format. Bump it whenever
	 * {@link com.tomaszrup.cxxhl.highlighting.HighlightingKind} constants are
	 * reordered or the record layout changes.
	 */
	public static final String VERSION = "1";

	public static final String NOTIFICATION_SEMANTIC_HIGHLIGHTING = "textDocument/semanticHighlighting";
}

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

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import org.eclipse.lsp4j.services.LanguageClient;

import com.tomaszrup.cxxhl.protocol.SemanticHighlightingParams;

/**
 * Language client with the semantic highlighting notification.
 */
public interface CxxLanguageClient extends LanguageClient {

    /**
     * Push the highlighting of the lines that changed since the last
     * notification for the document.
     *
     * @param params the document version and its changed lines
     */
    @JsonNotification(Protocol.NOTIFICATION_SEMANTIC_HIGHLIGHTING)
    void semanticHighlighting(SemanticHighlightingParams params);
}

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
package com.tomaszrup.cxxhl.protocol;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;

/**
 * Parameters for the {@code textDocument/semanticHighlighting} notification.
 *
 * <p>Only lines whose highlighting changed since the previous notification
 * for the same document are included.</p>
 */
public class SemanticHighlightingParams {

    /** The document and the version the highlighting was computed for. */
    private VersionedTextDocumentIdentifier textDocument;

    private List<SemanticHighlightingInformation> lines = new ArrayList<>();

    public SemanticHighlightingParams() {
    }

    public SemanticHighlightingParams(VersionedTextDocumentIdentifier textDocument,
                                      List<SemanticHighlightingInformation> lines) {
        this.textDocument = textDocument;
        this.lines = lines;
    }

    public VersionedTextDocumentIdentifier getTextDocument() {
        return textDocument;
    }

    public void setTextDocument(VersionedTextDocumentIdentifier textDocument) {
        this.textDocument = textDocument;
    }

    public List<SemanticHighlightingInformation> getLines() {
        return lines;
    }

    public void setLines(List<SemanticHighlightingInformation> lines) {
        this.lines = lines;
    }
}

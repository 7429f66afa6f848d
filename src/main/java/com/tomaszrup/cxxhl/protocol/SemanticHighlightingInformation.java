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

import java.util.Objects;

/**
 * Highlighting of one line in a {@code textDocument/semanticHighlighting}
 * notification.
 */
public class SemanticHighlightingInformation {

    /** Zero-based line number. */
    private int line;

    /**
     * Base64 encoded token records of the line; empty when the line has no
     * tokens anymore.
     */
    private String tokens;

    public SemanticHighlightingInformation() {
    }

    public SemanticHighlightingInformation(int line, String tokens) {
        this.line = line;
        this.tokens = tokens;
    }

    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    public String getTokens() {
        return tokens;
    }

    public void setTokens(String tokens) {
        this.tokens = tokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticHighlightingInformation)) return false;
        SemanticHighlightingInformation other = (SemanticHighlightingInformation) o;
        return line == other.line && Objects.equals(tokens, other.tokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, tokens);
    }

    @Override
    public String toString() {
        return "SemanticHighlightingInformation[line=" + line + ", tokens=" + tokens + "]";
    }
}

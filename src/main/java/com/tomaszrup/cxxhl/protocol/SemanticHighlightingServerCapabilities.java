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

/**
 * Server capability announcing semantic highlighting. {@code scopes[i]}
 * holds the TextMate scopes of the kind with index {@code i}.
 */
public class SemanticHighlightingServerCapabilities {

    private List<List<String>> scopes = new ArrayList<>();

    public SemanticHighlightingServerCapabilities() {
    }

    public SemanticHighlightingServerCapabilities(List<List<String>> scopes) {
        this.scopes = scopes;
    }

    public List<List<String>> getScopes() {
        return scopes;
    }

    public void setScopes(List<List<String>> scopes) {
        this.scopes = scopes;
    }
}

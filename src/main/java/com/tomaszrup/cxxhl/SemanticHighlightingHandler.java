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

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.cxxhl.ast.ParsedUnit;
import com.tomaszrup.cxxhl.highlighting.HighlightingDiff;
import com.tomaszrup.cxxhl.highlighting.HighlightingEncoder;
import com.tomaszrup.cxxhl.highlighting.HighlightingResult;
import com.tomaszrup.cxxhl.highlighting.HighlightingScopes;
import com.tomaszrup.cxxhl.highlighting.HighlightingToken;
import com.tomaszrup.cxxhl.highlighting.HighlightingTokenCollector;
import com.tomaszrup.cxxhl.highlighting.LineHighlightings;
import com.tomaszrup.cxxhl.protocol.SemanticHighlightingInformation;
import com.tomaszrup.cxxhl.protocol.SemanticHighlightingParams;
import com.tomaszrup.cxxhl.protocol.SemanticHighlightingServerCapabilities;

/**
 * Pushes semantic highlighting to the client after each parse of a
 * document. Only the lines that changed since the previous parse are sent.
 *
 * <p>The document manager calls {@link #onDocumentParsed} in version order
 * for any one document; different documents may be handled concurrently.</p>
 */
public class SemanticHighlightingHandler {
	private static final Logger logger = LoggerFactory.getLogger(SemanticHighlightingHandler.class);

	private final HighlightingSnapshotStore snapshotStore;
	private final HighlightingTokenCollector collector;
	private volatile CxxLanguageClient client;
	private volatile HighlightingOptions options = HighlightingOptions.defaults();

	public SemanticHighlightingHandler(HighlightingSnapshotStore snapshotStore) {
		this(snapshotStore, new HighlightingTokenCollector());
	}

	SemanticHighlightingHandler(HighlightingSnapshotStore snapshotStore, HighlightingTokenCollector collector) {
		this.snapshotStore = snapshotStore;
		this.collector = collector;
	}

	public void connect(CxxLanguageClient client) {
		this.client = client;
	}

	/**
	 * Applies the client's {@code initializationOptions}.
	 */
	public void initialize(Object initializationOptions) {
		this.options = InitializationOptionsParser.parse(initializationOptions);
	}

	public boolean isSemanticHighlightingEnabled() {
		return options.isSemanticHighlightingEnabled();
	}

	/**
	 * Capability to announce in the {@code initialize} response.
	 */
	public static SemanticHighlightingServerCapabilities getCapabilities() {
		return new SemanticHighlightingServerCapabilities(HighlightingScopes.getLookupTable());
	}

	/**
	 * Computes the highlighting of a freshly parsed document version, diffs
	 * it against the previous version and notifies the client of the changed
	 * lines.
	 *
	 * @return the lines sent to the client, empty if nothing was sent
	 */
	public List<SemanticHighlightingInformation> onDocumentParsed(URI uri, int version, ParsedUnit unit) {
		if (!isSemanticHighlightingEnabled()) {
			return Collections.emptyList();
		}
		try {
			HighlightingResult result = collector.collect(unit);
			if (!result.getProblems().isEmpty()) {
				logger.debug("semanticHighlighting uri={} version={} problems={}", uri, version,
						result.getProblems().size());
			}
			Optional<List<HighlightingToken>> previous = snapshotStore.replace(uri, version, result.getTokens());
			if (!previous.isPresent()) {
				logger.debug("semanticHighlighting uri={} version={} stale=true", uri, version);
				return Collections.emptyList();
			}
			List<LineHighlightings> changedLines = HighlightingDiff.diff(result.getTokens(), previous.get());
			List<SemanticHighlightingInformation> lines = HighlightingEncoder.encode(changedLines);
			try {
				publish(uri, version, lines);
			} catch (RuntimeException e) {
				// the client never saw these tokens, diff the next version against what it has
				snapshotStore.restore(uri, version, previous.get());
				throw e;
			}
			return lines;
		} catch (RuntimeException e) {
			logger.warn("semanticHighlighting failed uri={} version={} error={}", uri, version, e.toString());
			logger.debug("semanticHighlighting failure details", e);
			return Collections.emptyList();
		}
	}

	/**
	 * Forgets the document. The next parse after reopening sends every line.
	 */
	public void onDocumentClosed(URI uri) {
		snapshotStore.remove(uri);
	}

	private void publish(URI uri, int version, List<SemanticHighlightingInformation> lines) {
		if (lines.isEmpty()) {
			logger.debug("semanticHighlighting uri={} version={} unchanged=true", uri, version);
			return;
		}
		CxxLanguageClient currentClient = client;
		if (currentClient == null) {
			logger.debug("semanticHighlighting uri={} version={} clientUnavailable=true", uri, version);
			return;
		}
		VersionedTextDocumentIdentifier textDocument = new VersionedTextDocumentIdentifier(uri.toString(), version);
		currentClient.semanticHighlighting(new SemanticHighlightingParams(textDocument, lines));
	}
}

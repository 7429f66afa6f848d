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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.tomaszrup.cxxhl.highlighting.HighlightingToken;

/**
 * Highlighting tokens last sent for each open document, keyed by URI.
 *
 * <p>Snapshots only move forward: a snapshot for a version older than the
 * stored one is rejected. Replacing a snapshot is atomic per document.</p>
 */
public class HighlightingSnapshotStore {

	private static final class Snapshot {
		final int version;
		final List<HighlightingToken> tokens;

		Snapshot(int version, List<HighlightingToken> tokens) {
			this.version = version;
			this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		}
	}

	private final Map<URI, Snapshot> snapshots = new ConcurrentHashMap<>();

	/**
	 * Stores the tokens of {@code version} of a document.
	 *
	 * @return the tokens this snapshot replaced (an empty list if there were
	 *         none), or empty if {@code version} is older than the stored
	 *         snapshot, in which case nothing changes
	 */
	public Optional<List<HighlightingToken>> replace(URI uri, int version, List<HighlightingToken> tokens) {
		Snapshot next = new Snapshot(version, tokens);
		Snapshot[] replaced = new Snapshot[1];
		boolean[] stale = new boolean[1];
		snapshots.compute(uri, (key, current) -> {
			if (current != null && current.version > version) {
				stale[0] = true;
				return current;
			}
			replaced[0] = current;
			return next;
		});
		if (stale[0]) {
			return Optional.empty();
		}
		return Optional.of(replaced[0] != null ? replaced[0].tokens : Collections.<HighlightingToken>emptyList());
	}

	/**
	 * Puts back the tokens a {@link #replace} of {@code version} displaced,
	 * keeping {@code version} so older parses are still rejected. Does
	 * nothing if another version has been stored since.
	 *
	 * @return {@code true} if the tokens were restored
	 */
	public boolean restore(URI uri, int version, List<HighlightingToken> tokens) {
		boolean[] restored = new boolean[1];
		snapshots.computeIfPresent(uri, (key, current) -> {
			if (current.version != version) {
				return current;
			}
			restored[0] = true;
			return new Snapshot(version, tokens);
		});
		return restored[0];
	}

	/** Tokens of the latest snapshot, empty if the document has none. */
	public List<HighlightingToken> getTokens(URI uri) {
		Snapshot snapshot = snapshots.get(uri);
		return snapshot != null ? snapshot.tokens : Collections.<HighlightingToken>emptyList();
	}

	public Optional<Integer> getVersion(URI uri) {
		Snapshot snapshot = snapshots.get(uri);
		return snapshot != null ? Optional.of(snapshot.version) : Optional.empty();
	}

	public void remove(URI uri) {
		snapshots.remove(uri);
	}

	public int size() {
		return snapshots.size();
	}
}

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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.cxxhl;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.cxxhl.highlighting.HighlightingKind;
import com.tomaszrup.cxxhl.highlighting.HighlightingToken;

class HighlightingSnapshotStoreTests {
	private static final URI FIRST = URI.create("file:///work/a.cpp");
	private static final URI SECOND = URI.create("file:///work/b.cpp");

	private HighlightingSnapshotStore store;

	@BeforeEach
	void setup() {
		store = new HighlightingSnapshotStore();
	}

	private static List<HighlightingToken> tokens(HighlightingKind kind) {
		return Collections.singletonList(
				new HighlightingToken(kind, new Range(new Position(0, 0), new Position(0, 3))));
	}

	@Test
	void testFirstSnapshotReplacesNothing() {
		Optional<List<HighlightingToken>> previous = store.replace(FIRST, 1, tokens(HighlightingKind.CLASS));

		Assertions.assertEquals(Optional.of(Collections.emptyList()), previous);
		Assertions.assertEquals(tokens(HighlightingKind.CLASS), store.getTokens(FIRST));
		Assertions.assertEquals(Optional.of(1), store.getVersion(FIRST));
	}

	@Test
	void testNewerSnapshotReturnsPrevious() {
		store.replace(FIRST, 1, tokens(HighlightingKind.CLASS));

		Optional<List<HighlightingToken>> previous = store.replace(FIRST, 2, tokens(HighlightingKind.ENUM));

		Assertions.assertEquals(Optional.of(tokens(HighlightingKind.CLASS)), previous);
		Assertions.assertEquals(tokens(HighlightingKind.ENUM), store.getTokens(FIRST));
	}

	@Test
	void testSameVersionIsAccepted() {
		store.replace(FIRST, 3, tokens(HighlightingKind.CLASS));

		Assertions.assertTrue(store.replace(FIRST, 3, tokens(HighlightingKind.ENUM)).isPresent());
		Assertions.assertEquals(tokens(HighlightingKind.ENUM), store.getTokens(FIRST));
	}

	@Test
	void testOlderSnapshotIsRejected() {
		store.replace(FIRST, 7, tokens(HighlightingKind.CLASS));

		Optional<List<HighlightingToken>> previous = store.replace(FIRST, 6, tokens(HighlightingKind.ENUM));

		Assertions.assertFalse(previous.isPresent());
		Assertions.assertEquals(tokens(HighlightingKind.CLASS), store.getTokens(FIRST));
		Assertions.assertEquals(Optional.of(7), store.getVersion(FIRST));
	}

	@Test
	void testDocumentsAreIndependent() {
		store.replace(FIRST, 9, tokens(HighlightingKind.CLASS));

		Assertions.assertEquals(Optional.of(Collections.emptyList()),
				store.replace(SECOND, 1, tokens(HighlightingKind.ENUM)));
		Assertions.assertEquals(2, store.size());
	}

	@Test
	void testRemove() {
		store.replace(FIRST, 4, tokens(HighlightingKind.CLASS));
		store.remove(FIRST);

		Assertions.assertEquals(Collections.emptyList(), store.getTokens(FIRST));
		Assertions.assertEquals(Optional.empty(), store.getVersion(FIRST));
		Assertions.assertEquals(0, store.size());
		// a reopened document starts over, even at a lower version
		Assertions.assertTrue(store.replace(FIRST, 1, tokens(HighlightingKind.ENUM)).isPresent());
	}

	@Test
	void testRestoreKeepsVersion() {
		store.replace(FIRST, 1, tokens(HighlightingKind.CLASS));
		List<HighlightingToken> previous = store.replace(FIRST, 2, tokens(HighlightingKind.ENUM)).get();

		Assertions.assertTrue(store.restore(FIRST, 2, previous));
		Assertions.assertEquals(tokens(HighlightingKind.CLASS), store.getTokens(FIRST));
		Assertions.assertEquals(Optional.of(2), store.getVersion(FIRST));
		Assertions.assertFalse(store.replace(FIRST, 1, tokens(HighlightingKind.FIELD)).isPresent());
	}

	@Test
	void testRestoreAfterNewerVersionDoesNothing() {
		store.replace(FIRST, 1, tokens(HighlightingKind.CLASS));
		List<HighlightingToken> previous = store.replace(FIRST, 2, tokens(HighlightingKind.ENUM)).get();
		store.replace(FIRST, 3, tokens(HighlightingKind.FIELD));

		Assertions.assertFalse(store.restore(FIRST, 2, previous));
		Assertions.assertFalse(store.restore(SECOND, 2, previous));
		Assertions.assertEquals(tokens(HighlightingKind.FIELD), store.getTokens(FIRST));
		Assertions.assertEquals(0, store.getTokens(SECOND).size());
	}

	@Test
	void testStoredTokensAreACopy() {
		List<HighlightingToken> mutable = new ArrayList<>(tokens(HighlightingKind.CLASS));
		store.replace(FIRST, 1, mutable);
		mutable.clear();

		Assertions.assertEquals(1, store.getTokens(FIRST).size());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> store.getTokens(FIRST).clear());
	}

	@Test
	void testConcurrentReplaceKeepsHighestVersion() throws Exception {
		int threads = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<?>> futures = new ArrayList<>();
		try {
			for (int t = 0; t < threads; t++) {
				int offset = t;
				futures.add(executor.submit(() -> {
					start.await();
					for (int version = offset; version < 400; version += threads) {
						store.replace(FIRST, version, tokens(HighlightingKind.CLASS));
					}
					return null;
				}));
			}
			start.countDown();
			for (Future<?> future : futures) {
				future.get(10, TimeUnit.SECONDS);
			}
		} finally {
			executor.shutdownNow();
		}

		Assertions.assertEquals(Optional.of(399), store.getVersion(FIRST));
	}
}

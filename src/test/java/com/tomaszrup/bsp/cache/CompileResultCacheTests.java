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
package com.tomaszrup.bsp.cache;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;

class CompileResultCacheTests {

	private static final Duration WAIT = Duration.ofSeconds(5);
	private static final BuildTargetIdentifier CORE = new BuildTargetIdentifier("file:///ws/core?id=core");
	private static final BuildTargetIdentifier APP = new BuildTargetIdentifier("file:///ws/app?id=app");
	private static final URI CORE_ANALYSIS = URI.create("file:///ws/analysis/core.analysis");
	private static final URI APP_ANALYSIS = URI.create("file:///ws/analysis/app.analysis");

	private StubDecoder decoder;
	private CompileResultCache cache;

	@BeforeEach
	void setup() {
		decoder = new StubDecoder();
		decoder.put(CORE_ANALYSIS, "core");
		decoder.put(APP_ANALYSIS, "app");
		cache = new CompileResultCache(decoder, Runnable::run, 8);
	}

	private void finishTarget(String originId, BuildTargetIdentifier target, CompileStatus status, URI analysis) {
		cache.markStarted(originId, target);
		Assertions.assertTrue(cache.publish(originId, target, status, analysis));
	}

	private static String text(Optional<AnalysisContents> contents) {
		return new String(contents.get().getData(), StandardCharsets.UTF_8);
	}

	// --- lookups ---

	@Test
	void testUnknownOriginIsNotFoundImmediately() {
		long start = System.nanoTime();
		CacheException error = Assertions.assertThrows(CacheException.class,
				() -> cache.await("never-sent", CORE, WAIT));
		Assertions.assertEquals(CacheException.Kind.NOT_FOUND, error.getKind());
		Assertions.assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(2), "must not wait");
	}

	@Test
	void testAwaitWaitsForPublication() throws Exception {
		Assertions.assertTrue(cache.expect("o1", Arrays.asList(CORE)));
		CompletableFuture<Optional<AnalysisContents>> pending = cache.awaitAsync("o1", CORE);
		Assertions.assertFalse(pending.isDone());

		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);

		Assertions.assertEquals("core", text(pending.get(5, TimeUnit.SECONDS)));
	}

	@Test
	void testAwaitTimesOut() {
		cache.expect("o1", Arrays.asList(CORE));
		CacheException error = Assertions.assertThrows(CacheException.class,
				() -> cache.await("o1", CORE, Duration.ofMillis(50)));
		Assertions.assertEquals(CacheException.Kind.TIMEOUT, error.getKind());
	}

	@Test
	void testOriginsAreIsolated() throws Exception {
		decoder.put(URI.create("file:///other/core.analysis"), "other core");
		cache.expect("o1", Arrays.asList(CORE));
		cache.expect("o2", Arrays.asList(CORE));
		finishTarget("o2", CORE, CompileStatus.OK, URI.create("file:///other/core.analysis"));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);

		Assertions.assertEquals("core", text(cache.await("o1", CORE, WAIT)));
		Assertions.assertEquals("other core", text(cache.await("o2", CORE, WAIT)));
	}

	@Test
	void testTargetsOfOneOriginAreAwaitedSeparately() throws Exception {
		cache.expect("o1", Arrays.asList(CORE, APP));
		cache.markStarted("o1", CORE);
		cache.markStarted("o1", APP);
		CompletableFuture<Optional<AnalysisContents>> app = cache.awaitAsync("o1", APP);
		cache.publish("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);

		Assertions.assertEquals("core", text(cache.await("o1", CORE, WAIT)));
		Assertions.assertFalse(app.isDone());
		cache.publish("o1", APP, CompileStatus.OK, APP_ANALYSIS);
		Assertions.assertEquals("app", text(app.get(5, TimeUnit.SECONDS)));
	}

	@Test
	void testFailedCompileYieldsNoAnalysis() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		finishTarget("o1", CORE, CompileStatus.FAILED, CORE_ANALYSIS);

		Assertions.assertFalse(cache.await("o1", CORE, WAIT).isPresent());
		Assertions.assertEquals(0, decoder.calls(CORE_ANALYSIS), "failed outcomes are not decoded");
		Assertions.assertEquals(CompileStatus.FAILED, cache.awaitOutcome("o1", CORE, WAIT).getStatus());
	}

	@Test
	void testMissingAnalysisFileYieldsNothing() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		finishTarget("o1", CORE, CompileStatus.OK, URI.create("file:///nowhere.analysis"));
		Assertions.assertFalse(cache.await("o1", CORE, WAIT).isPresent());
	}

	@Test
	void testDecodeFailureIsReported() {
		decoder.fail(CORE_ANALYSIS);
		cache.expect("o1", Arrays.asList(CORE));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);

		CacheException error = Assertions.assertThrows(CacheException.class,
				() -> cache.await("o1", CORE, WAIT));
		Assertions.assertEquals(CacheException.Kind.DECODE_FAILED, error.getKind());
	}

	@Test
	void testOutcomeCarriesDiagnostics() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		cache.markStarted("o1", CORE);
		Diagnostic diagnostic = new Diagnostic(new Range(new Position(1, 0), new Position(1, 4)), "type mismatch",
				DiagnosticSeverity.Error, "scalac");
		cache.addDiagnostics("o1", CORE, Arrays.asList(diagnostic), false);
		cache.publish("o1", CORE, CompileStatus.FAILED, null);

		CompileOutcome outcome = cache.awaitOutcome("o1", CORE, WAIT);
		Assertions.assertEquals(1, outcome.getDiagnostics().size());
		Assertions.assertEquals("type mismatch", outcome.getDiagnostics().get(0).getMessage());
	}

	// --- publication rules ---

	@Test
	void testFinishWithoutStartIsRejected() {
		cache.expect("o1", Arrays.asList(CORE));
		Assertions.assertFalse(cache.publish("o1", CORE, CompileStatus.OK, CORE_ANALYSIS));
		Assertions.assertTrue(cache.outcomes("o1").isEmpty());
	}

	@Test
	void testFinalResultSupersedesCancellation() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		finishTarget("o1", CORE, CompileStatus.CANCELLED, null);
		Assertions.assertTrue(cache.publish("o1", CORE, CompileStatus.OK, CORE_ANALYSIS));
		Assertions.assertEquals(CompileStatus.OK, cache.awaitOutcome("o1", CORE, WAIT).getStatus());
	}

	@Test
	void testCancellationDoesNotSupersedeFinalResult() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);
		Assertions.assertFalse(cache.publish("o1", CORE, CompileStatus.CANCELLED, null));
		Assertions.assertEquals("core", text(cache.await("o1", CORE, WAIT)));
	}

	@Test
	void testOutcomesSnapshotKeepsPublicationOrder() {
		cache.expect("o1", Arrays.asList(CORE, APP));
		finishTarget("o1", APP, CompileStatus.FAILED, null);
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);

		Map<BuildTargetIdentifier, CompileOutcome> outcomes = cache.outcomes("o1");
		Assertions.assertEquals(Arrays.asList(APP, CORE), Arrays.asList(outcomes.keySet().toArray()));
	}

	// --- origin id reuse ---

	@Test
	void testReuseIsRejectedWhileInFlight() {
		Assertions.assertTrue(cache.expect("o1", Arrays.asList(CORE)));
		Assertions.assertFalse(cache.expect("o1", Arrays.asList(CORE)));
		Assertions.assertTrue(cache.isInFlight("o1"));
	}

	@Test
	void testReuseAfterCompletionSupersedesOldEntries() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);
		cache.complete("o1");

		Assertions.assertTrue(cache.expect("o1", Arrays.asList(CORE)));
		Assertions.assertTrue(cache.outcomes("o1").isEmpty());
		CompletableFuture<Optional<AnalysisContents>> fresh = cache.awaitAsync("o1", CORE);
		Assertions.assertFalse(fresh.isDone(), "old outcome must not satisfy the new compile");
		finishTarget("o1", CORE, CompileStatus.FAILED, null);
		Assertions.assertFalse(fresh.get(5, TimeUnit.SECONDS).isPresent());
	}

	@Test
	void testCompleteEndsWaitsForUnreportedTargets() {
		cache.expect("o1", Arrays.asList(CORE, APP));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);
		CompletableFuture<Optional<AnalysisContents>> app = cache.awaitAsync("o1", APP);
		cache.complete("o1");

		ExecutionException error = Assertions.assertThrows(ExecutionException.class,
				() -> app.get(5, TimeUnit.SECONDS));
		Assertions.assertEquals(CacheException.Kind.NOT_FOUND, ((CacheException) error.getCause()).getKind());
		Assertions.assertFalse(cache.isInFlight("o1"));
	}

	// --- cancel, evict, connection loss ---

	@Test
	void testCancelFailsOnlyUnpublishedTargets() throws Exception {
		cache.expect("o1", Arrays.asList(CORE, APP));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);
		CompletableFuture<Optional<AnalysisContents>> app = cache.awaitAsync("o1", APP);

		cache.cancel("o1");

		ExecutionException error = Assertions.assertThrows(ExecutionException.class,
				() -> app.get(5, TimeUnit.SECONDS));
		Assertions.assertEquals(CacheException.Kind.CANCELLED, ((CacheException) error.getCause()).getKind());
		Assertions.assertEquals("core", text(cache.await("o1", CORE, WAIT)));
	}

	@Test
	void testLatePublishAfterCancelIsAccepted() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		cache.markStarted("o1", CORE);
		cache.cancel("o1");
		Assertions.assertTrue(cache.publish("o1", CORE, CompileStatus.OK, CORE_ANALYSIS));
		Assertions.assertEquals("core", text(cache.await("o1", CORE, WAIT)));
	}

	@Test
	void testEvictDropsEverything() {
		cache.expect("o1", Arrays.asList(CORE));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);
		CompletableFuture<Optional<AnalysisContents>> app = cache.awaitAsync("o1", APP);

		cache.evict("o1");

		Assertions.assertFalse(cache.contains("o1"));
		Assertions.assertEquals(0, cache.decodedCount());
		CacheException error = Assertions.assertThrows(CacheException.class,
				() -> cache.await("o1", CORE, WAIT));
		Assertions.assertEquals(CacheException.Kind.NOT_FOUND, error.getKind());
		Assertions.assertTrue(app.isCompletedExceptionally());
	}

	@Test
	void testConnectionLossFailsPendingAndLaterAwaits() {
		cache.expect("o1", Arrays.asList(CORE));
		CompletableFuture<Optional<AnalysisContents>> core = cache.awaitAsync("o1", CORE);

		cache.connectionLost(new IOException("peer went away"));

		ExecutionException pending = Assertions.assertThrows(ExecutionException.class,
				() -> core.get(5, TimeUnit.SECONDS));
		Assertions.assertEquals(CacheException.Kind.CONNECTION_LOST,
				((CacheException) pending.getCause()).getKind());
		CacheException later = Assertions.assertThrows(CacheException.class,
				() -> cache.await("o1", APP, WAIT));
		Assertions.assertEquals(CacheException.Kind.CONNECTION_LOST, later.getKind());
	}

	// --- decoded LRU ---

	@Test
	void testLeastRecentlyUsedAnalysisIsDecodedAgain() throws Exception {
		cache = new CompileResultCache(decoder, Runnable::run, 1);
		cache.expect("o1", Arrays.asList(CORE, APP));
		finishTarget("o1", CORE, CompileStatus.OK, CORE_ANALYSIS);
		finishTarget("o1", APP, CompileStatus.OK, APP_ANALYSIS);

		Assertions.assertEquals(1, cache.decodedCount());
		Assertions.assertFalse(cache.pendingAnalysis("o1", CORE).get().isDecoded());
		Assertions.assertTrue(cache.pendingAnalysis("o1", APP).get().isDecoded());

		Assertions.assertEquals("core", text(cache.await("o1", CORE, WAIT)));
		Assertions.assertEquals(2, decoder.calls(CORE_ANALYSIS));
		Assertions.assertEquals(1, cache.decodedCount());
	}

	@Test
	void testRejectsNonPositiveLimit() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new CompileResultCache(decoder, Runnable::run, 0));
	}

	@Test
	void testUnknownOriginHasNoOutcomes() {
		Assertions.assertEquals(Collections.emptyMap(), cache.outcomes("nope"));
	}

	private static final class StubDecoder implements AnalysisDecoder {
		private final Map<URI, String> contents = new ConcurrentHashMap<>();
		private final Map<URI, Integer> calls = new ConcurrentHashMap<>();
		private final Map<URI, Boolean> failing = new ConcurrentHashMap<>();

		void put(URI location, String text) {
			contents.put(location, text);
		}

		void fail(URI location) {
			failing.put(location, Boolean.TRUE);
		}

		int calls(URI location) {
			return calls.getOrDefault(location, 0);
		}

		@Override
		public Optional<AnalysisContents> decode(URI location) throws IOException {
			calls.merge(location, 1, Integer::sum);
			if (failing.containsKey(location)) {
				throw new IOException("corrupt analysis " + location);
			}
			String text = contents.get(location);
			return text == null
					? Optional.empty()
					: Optional.of(new AnalysisContents(location, text.getBytes(StandardCharsets.UTF_8)));
		}
	}
}

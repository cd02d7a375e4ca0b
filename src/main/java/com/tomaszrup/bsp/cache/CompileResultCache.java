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
package com.tomaszrup.bsp.cache;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.eclipse.lsp4j.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;

/**
 * Correlates the asynchronous outcome of compile requests with the
 * callers waiting for them, keyed by origin id and target.
 *
 * <p>Notifications for one origin may arrive interleaved across targets;
 * for a single target they arrive in order (start, diagnostics, finish).
 * An outcome is only accepted after its target's start was seen. Every
 * (origin, target) pair can be awaited on its own.</p>
 *
 * <p>Origin ids follow a supersede policy: {@link #expect} rejects an id
 * whose compile is still in flight, and replaces the entries of an id whose
 * compile already completed.</p>
 *
 * <p>Decoded analyses are kept in a bounded LRU. When it overflows, the
 * least recently used contents nobody is waiting for are released; their
 * location is kept so a later {@link #await} decodes them again.</p>
 *
 * <p>All operations are safe to call from any thread.</p>
 */
public class CompileResultCache {

    private static final Logger logger = LoggerFactory.getLogger(CompileResultCache.class);

    private final AnalysisDecoder decoder;
    private final Executor decodePool;
    private final int maxDecodedAnalyses;

    private final ConcurrentHashMap<String, OriginEntry> origins = new ConcurrentHashMap<>();

    /** Decoded analyses in access order; guarded by itself. */
    private final LinkedHashMap<PendingAnalysis, Boolean> decoded = new LinkedHashMap<>(16, 0.75f, true);

    private volatile Throwable connectionLoss;

    public CompileResultCache(AnalysisDecoder decoder, Executor decodePool, int maxDecodedAnalyses) {
        if (maxDecodedAnalyses < 1) {
            throw new IllegalArgumentException("maxDecodedAnalyses must be at least 1");
        }
        this.decoder = decoder;
        this.decodePool = decodePool;
        this.maxDecodedAnalyses = maxDecodedAnalyses;
    }

    // -----------------------------------------------------------------------
    // Producer side: the session's notification handling
    // -----------------------------------------------------------------------

    /**
     * Registers a compile request before it is sent.
     *
     * @param targets targets the request asks for; others may still be
     *                reported (dependencies compiled along the way)
     * @return {@code false} if a compile with this origin id is still in flight
     */
    public boolean expect(String originId, Collection<BuildTargetIdentifier> targets) {
        OriginEntry fresh = new OriginEntry(originId, true);
        for (BuildTargetIdentifier target : targets) {
            fresh.targets.put(target, new TargetEntry(target));
        }
        OriginEntry[] replaced = new OriginEntry[1];
        boolean[] rejected = new boolean[1];
        origins.compute(originId, (id, existing) -> {
            if (existing != null && existing.isInFlight()) {
                rejected[0] = true;
                return existing;
            }
            replaced[0] = existing;
            return fresh;
        });
        if (rejected[0]) {
            logger.warn("Rejecting compile with origin id {}: a compile with that id is still running", originId);
            return false;
        }
        if (replaced[0] != null) {
            logger.debug("Origin id {} reused, dropping the previous entries", originId);
            release(replaced[0], CacheException.Kind.NOT_FOUND, "Superseded by a new compile with origin id " + originId);
        }
        return true;
    }

    /** Records that compilation of {@code target} started under {@code originId}. */
    public void markStarted(String originId, BuildTargetIdentifier target) {
        OriginEntry origin = originFor(originId);
        synchronized (origin) {
            origin.entryFor(target).started = true;
        }
    }

    /** Appends diagnostics reported for {@code target}; {@code reset} clears earlier ones first. */
    public void addDiagnostics(String originId, BuildTargetIdentifier target, List<Diagnostic> diagnostics,
            boolean reset) {
        OriginEntry origin = originFor(originId);
        synchronized (origin) {
            TargetEntry entry = origin.entryFor(target);
            if (reset) {
                entry.diagnostics.clear();
            }
            if (diagnostics != null) {
                entry.diagnostics.addAll(diagnostics);
            }
        }
    }

    /**
     * Publishes the outcome of one target and schedules decoding of its
     * analysis on the decode pool.
     *
     * @return {@code false} if the outcome was rejected: its start was never
     *         seen, or an earlier outcome supersedes it
     */
    public boolean publish(String originId, BuildTargetIdentifier target, CompileStatus status,
            URI analysisLocation) {
        OriginEntry origin = originFor(originId);
        CompileOutcome outcome;
        PendingAnalysis previous;
        CompletableFuture<CompileOutcome> toComplete;
        synchronized (origin) {
            TargetEntry entry = origin.entryFor(target);
            if (!entry.started) {
                logger.warn("Ignoring outcome {} for {} under origin {}: the target was never started",
                        status, target, originId);
                return false;
            }
            if (entry.outcome != null && !status.supersedes(entry.outcome.getStatus())) {
                logger.info("Keeping outcome {} for {} under origin {}, rejecting later {}",
                        entry.outcome.getStatus(), target, originId, status);
                return false;
            }
            outcome = new CompileOutcome(originId, target, status, entry.diagnostics,
                    status == CompileStatus.OK ? analysisLocation : null);
            previous = entry.analysis;
            entry.outcome = outcome;
            entry.sequence = origin.publications++;
            entry.analysis = new PendingAnalysis(outcome.getAnalysisLocation(), decoder, decodePool,
                    this::registerDecoded);
            if (entry.published.isDone()) {
                entry.published = new CompletableFuture<>();
            }
            toComplete = entry.published;
            if (outcome.getAnalysisLocation() != null) {
                entry.analysis.contents();
            }
        }
        if (previous != null) {
            forget(previous);
        }
        logger.debug("Published {}", outcome);
        toComplete.complete(outcome);
        return true;
    }

    /**
     * Marks the compile of {@code originId} as finished. Targets it never
     * reported stop being awaitable.
     */
    public void complete(String originId) {
        OriginEntry origin = origins.get(originId);
        if (origin == null) {
            return;
        }
        finish(origin, CacheException.Kind.NOT_FOUND, "Compile " + originId + " finished without reporting ");
    }

    /**
     * Stops awaiting outcomes of {@code originId} that were not published
     * yet. Published outcomes stay available.
     */
    public void cancel(String originId) {
        OriginEntry origin = origins.get(originId);
        if (origin == null) {
            return;
        }
        finish(origin, CacheException.Kind.CANCELLED, "Compile " + originId + " was cancelled before reporting ");
    }

    /**
     * Drops every entry of {@code originId}. Decodes still running complete
     * but their results are not kept.
     */
    public void evict(String originId) {
        OriginEntry origin = origins.remove(originId);
        if (origin != null) {
            release(origin, CacheException.Kind.NOT_FOUND, "Origin " + originId + " was evicted");
            logger.debug("Evicted origin {}", originId);
        }
    }

    /**
     * Fails every unpublished entry, and any later await of one, with
     * {@link CacheException.Kind#CONNECTION_LOST}.
     */
    public void connectionLost(Throwable cause) {
        connectionLoss = cause;
        for (OriginEntry origin : origins.values()) {
            finish(origin, CacheException.Kind.CONNECTION_LOST, "Connection lost before reporting ");
        }
    }

    // -----------------------------------------------------------------------
    // Consumer side
    // -----------------------------------------------------------------------

    /**
     * The decoded analysis of {@code target} under {@code originId}, once
     * published. Empty for failed or cancelled compiles and for analyses the
     * decoder finds nothing in. Fails with {@link CacheException}.
     */
    public CompletableFuture<Optional<AnalysisContents>> awaitAsync(String originId, BuildTargetIdentifier target) {
        OriginEntry origin = origins.get(originId);
        if (origin == null) {
            return failed(CacheException.Kind.NOT_FOUND, "Unknown origin id " + originId);
        }
        CompletableFuture<CompileOutcome> published = publishedFuture(origin, target);
        CompletableFuture<Optional<AnalysisContents>> result = new CompletableFuture<>();
        published.whenComplete((outcome, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            PendingAnalysis analysis;
            synchronized (origin) {
                TargetEntry entry = origin.targets.get(target);
                analysis = entry != null ? entry.analysis : null;
            }
            if (analysis == null) {
                result.completeExceptionally(new CacheException(CacheException.Kind.NOT_FOUND,
                        "Origin " + originId + " was evicted"));
                return;
            }
            analysis.acquire();
            analysis.contents().whenComplete((contents, decodeError) -> {
                analysis.release();
                touch(analysis);
                if (decodeError != null) {
                    result.completeExceptionally(unwrap(decodeError));
                } else if (analysis.isDiscarded() && analysis.getLocation() != null) {
                    result.completeExceptionally(new CacheException(CacheException.Kind.NOT_FOUND,
                            "Origin " + originId + " was evicted"));
                } else {
                    result.complete(contents);
                }
            });
        });
        return result;
    }

    /**
     * Blocking form of {@link #awaitAsync}.
     *
     * @throws CacheException {@code NOT_FOUND} immediately for an unknown
     *                        origin id, {@code TIMEOUT} if nothing is
     *                        published within {@code timeout}, or the
     *                        failure of the entry
     */
    public Optional<AnalysisContents> await(String originId, BuildTargetIdentifier target, Duration timeout)
            throws CacheException {
        return get(awaitAsync(originId, target), originId, target, timeout);
    }

    /** The outcome of {@code target} under {@code originId}, without decoding its analysis. */
    public CompletableFuture<CompileOutcome> awaitOutcomeAsync(String originId, BuildTargetIdentifier target) {
        OriginEntry origin = origins.get(originId);
        if (origin == null) {
            return failed(CacheException.Kind.NOT_FOUND, "Unknown origin id " + originId);
        }
        CompletableFuture<CompileOutcome> result = new CompletableFuture<>();
        publishedFuture(origin, target).whenComplete((outcome, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(outcome);
            }
        });
        return result;
    }

    public CompileOutcome awaitOutcome(String originId, BuildTargetIdentifier target, Duration timeout)
            throws CacheException {
        return get(awaitOutcomeAsync(originId, target), originId, target, timeout);
    }

    /** Outcomes published so far under {@code originId}, in publication order. */
    public Map<BuildTargetIdentifier, CompileOutcome> outcomes(String originId) {
        OriginEntry origin = origins.get(originId);
        if (origin == null) {
            return Collections.emptyMap();
        }
        List<TargetEntry> published = new ArrayList<>();
        synchronized (origin) {
            for (TargetEntry entry : origin.targets.values()) {
                if (entry.outcome != null) {
                    published.add(entry);
                }
            }
            published.sort((a, b) -> Long.compare(a.sequence, b.sequence));
        }
        Map<BuildTargetIdentifier, CompileOutcome> result = new LinkedHashMap<>();
        for (TargetEntry entry : published) {
            result.put(entry.target, entry.outcome);
        }
        return Collections.unmodifiableMap(result);
    }

    /** Whether {@code originId} is known to the cache. */
    public boolean contains(String originId) {
        return origins.containsKey(originId);
    }

    /** Whether a compile registered with {@link #expect} is still running under {@code originId}. */
    public boolean isInFlight(String originId) {
        OriginEntry origin = origins.get(originId);
        return origin != null && origin.isInFlight();
    }

    /** Number of analyses whose decoded contents are currently held. */
    public int decodedCount() {
        synchronized (decoded) {
            return decoded.size();
        }
    }

    /** The analysis handle of a published target, or empty if there is none. */
    public Optional<PendingAnalysis> pendingAnalysis(String originId, BuildTargetIdentifier target) {
        OriginEntry origin = origins.get(originId);
        if (origin == null) {
            return Optional.empty();
        }
        synchronized (origin) {
            TargetEntry entry = origin.targets.get(target);
            return Optional.ofNullable(entry != null ? entry.analysis : null);
        }
    }

    // -----------------------------------------------------------------------

    private OriginEntry originFor(String originId) {
        return origins.computeIfAbsent(originId, id -> new OriginEntry(id, false));
    }

    private CompletableFuture<CompileOutcome> publishedFuture(OriginEntry origin, BuildTargetIdentifier target) {
        synchronized (origin) {
            TargetEntry entry = origin.entryFor(target);
            if (entry.outcome == null && !entry.published.isDone()) {
                if (origin.terminalKind != null) {
                    entry.published.completeExceptionally(new CacheException(origin.terminalKind,
                            origin.terminalMessage + target));
                } else if (connectionLoss != null) {
                    entry.published.completeExceptionally(new CacheException(CacheException.Kind.CONNECTION_LOST,
                            "Connection lost before reporting " + target, connectionLoss));
                }
            }
            return entry.published;
        }
    }

    private void finish(OriginEntry origin, CacheException.Kind kind, String messagePrefix) {
        List<CompletableFuture<CompileOutcome>> unpublished = new ArrayList<>();
        List<BuildTargetIdentifier> targets = new ArrayList<>();
        synchronized (origin) {
            origin.inFlight = false;
            if (origin.terminalKind == null) {
                origin.terminalKind = kind;
                origin.terminalMessage = messagePrefix;
            }
            for (TargetEntry entry : origin.targets.values()) {
                if (entry.outcome == null && !entry.published.isDone()) {
                    unpublished.add(entry.published);
                    targets.add(entry.target);
                }
            }
        }
        Throwable cause = kind == CacheException.Kind.CONNECTION_LOST ? connectionLoss : null;
        for (int i = 0; i < unpublished.size(); i++) {
            unpublished.get(i).completeExceptionally(new CacheException(kind, messagePrefix + targets.get(i), cause));
        }
    }

    private void release(OriginEntry origin, CacheException.Kind kind, String message) {
        List<TargetEntry> entries;
        synchronized (origin) {
            origin.inFlight = false;
            origin.terminalKind = kind;
            origin.terminalMessage = message + ", no outcome for ";
            entries = new ArrayList<>(origin.targets.values());
        }
        for (TargetEntry entry : entries) {
            entry.published.completeExceptionally(new CacheException(kind, message));
            PendingAnalysis analysis;
            synchronized (origin) {
                analysis = entry.analysis;
            }
            if (analysis != null) {
                forget(analysis);
            }
        }
    }

    private void forget(PendingAnalysis analysis) {
        analysis.discard();
        synchronized (decoded) {
            decoded.remove(analysis);
        }
    }

    private void touch(PendingAnalysis analysis) {
        synchronized (decoded) {
            decoded.get(analysis);
        }
    }

    private void registerDecoded(PendingAnalysis analysis) {
        List<PendingAnalysis> dropped = new ArrayList<>();
        synchronized (decoded) {
            if (analysis.isDiscarded()) {
                return;
            }
            decoded.put(analysis, Boolean.TRUE);
            Iterator<PendingAnalysis> eldest = decoded.keySet().iterator();
            while (decoded.size() > maxDecodedAnalyses && eldest.hasNext()) {
                PendingAnalysis candidate = eldest.next();
                if (candidate != analysis && candidate.drop()) {
                    eldest.remove();
                    dropped.add(candidate);
                }
            }
        }
        if (!dropped.isEmpty()) {
            logger.debug("Released {} decoded analyses (limit {})", dropped.size(), maxDecodedAnalyses);
        }
    }

    private static <T> T get(CompletableFuture<T> future, String originId, BuildTargetIdentifier target,
            Duration timeout) throws CacheException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new CacheException(CacheException.Kind.TIMEOUT,
                    "Timed out after " + timeout.toMillis() + " ms waiting for " + target + " under " + originId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new CacheException(CacheException.Kind.CANCELLED,
                    "Interrupted while waiting for " + target + " under " + originId, e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof CacheException) {
                throw (CacheException) cause;
            }
            throw new CacheException(CacheException.Kind.DECODE_FAILED,
                    "Unexpected failure for " + target + " under " + originId + ": " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new CacheException(CacheException.Kind.CANCELLED,
                    "Wait for " + target + " under " + originId + " was cancelled", e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T> CompletableFuture<T> failed(CacheException.Kind kind, String message) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(new CacheException(kind, message));
        return future;
    }

    // -----------------------------------------------------------------------

    private static final class OriginEntry {
        final String originId;
        /** Guarded by this entry. */
        final Map<BuildTargetIdentifier, TargetEntry> targets = new LinkedHashMap<>();
        long publications;
        volatile boolean inFlight;
        CacheException.Kind terminalKind;
        String terminalMessage;

        OriginEntry(String originId, boolean inFlight) {
            this.originId = originId;
            this.inFlight = inFlight;
        }

        boolean isInFlight() {
            return inFlight;
        }

        TargetEntry entryFor(BuildTargetIdentifier target) {
            return targets.computeIfAbsent(target, TargetEntry::new);
        }

        @Override
        public String toString() {
            return "Origin[" + originId + "]";
        }
    }

    private static final class TargetEntry {
        final BuildTargetIdentifier target;
        boolean started;
        final List<Diagnostic> diagnostics = new ArrayList<>();
        CompileOutcome outcome;
        long sequence;
        PendingAnalysis analysis;
        CompletableFuture<CompileOutcome> published = new CompletableFuture<>();

        TargetEntry(BuildTargetIdentifier target) {
            this.target = target;
        }
    }
}

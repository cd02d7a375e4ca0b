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

import java.io.IOException;
import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The lazily decoded analysis of one published target.
 *
 * <p>Decoding runs on the cache's decode pool. The location is kept after
 * decoding so {@link #drop()} can release the decoded contents and a later
 * {@link #contents()} decodes them again.</p>
 */
public final class PendingAnalysis {

    private static final Logger logger = LoggerFactory.getLogger(PendingAnalysis.class);

    private static final CompletableFuture<Optional<AnalysisContents>> NOTHING =
            CompletableFuture.completedFuture(Optional.empty());

    private final URI location;
    private final AnalysisDecoder decoder;
    private final Executor decodePool;
    private final Consumer<PendingAnalysis> onDecoded;

    private CompletableFuture<Optional<AnalysisContents>> decoding;
    private boolean discarded;
    private int decodeCount;
    private final AtomicInteger awaiters = new AtomicInteger();

    /**
     * @param location  analysis location, or {@code null} when there is nothing to decode
     * @param onDecoded called on the decode thread after a successful decode
     */
    PendingAnalysis(URI location, AnalysisDecoder decoder, Executor decodePool,
            Consumer<PendingAnalysis> onDecoded) {
        this.location = location;
        this.decoder = decoder;
        this.decodePool = decodePool;
        this.onDecoded = onDecoded;
    }

    public URI getLocation() {
        return location;
    }

    /**
     * The decoded contents, starting a decode if none is running and no
     * decoded result is held.
     */
    public CompletableFuture<Optional<AnalysisContents>> contents() {
        if (location == null) {
            return NOTHING;
        }
        synchronized (this) {
            if (discarded) {
                return NOTHING;
            }
            if (decoding == null) {
                decoding = startDecode();
            }
            return decoding;
        }
    }

    private CompletableFuture<Optional<AnalysisContents>> startDecode() {
        decodeCount++;
        CompletableFuture<Optional<AnalysisContents>> result = new CompletableFuture<>();
        try {
            decodePool.execute(() -> decode(result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new CacheException(CacheException.Kind.DECODE_FAILED,
                    "Decode pool rejected analysis " + location, e));
        }
        return result;
    }

    private void decode(CompletableFuture<Optional<AnalysisContents>> result) {
        Optional<AnalysisContents> decoded;
        try {
            decoded = decoder.decode(location);
            if (decoded == null) {
                decoded = Optional.empty();
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to decode analysis {}: {}", location, e.getMessage());
            result.completeExceptionally(new CacheException(CacheException.Kind.DECODE_FAILED,
                    "Failed to decode analysis " + location + ": " + e.getMessage(), e));
            return;
        }
        boolean keep;
        synchronized (this) {
            keep = !discarded;
            if (!keep && decoding == result) {
                decoding = null;
            }
        }
        result.complete(decoded);
        if (keep) {
            onDecoded.accept(this);
        }
    }

    /** Marks a caller as waiting on this analysis; {@link #drop()} leaves it alone meanwhile. */
    void acquire() {
        awaiters.incrementAndGet();
    }

    void release() {
        awaiters.decrementAndGet();
    }

    /**
     * Releases successfully decoded contents nobody is waiting for.
     *
     * @return {@code true} if contents were released
     */
    synchronized boolean drop() {
        if (awaiters.get() > 0 || decoding == null || !decoding.isDone()
                || decoding.isCompletedExceptionally()) {
            return false;
        }
        decoding = null;
        return true;
    }

    /**
     * Forgets this analysis for good. A decode still running completes, but
     * its result is not retained.
     */
    synchronized void discard() {
        discarded = true;
        if (decoding != null && decoding.isDone()) {
            decoding = null;
        }
    }

    synchronized boolean isDiscarded() {
        return discarded;
    }

    /** Whether decoded contents are currently held. */
    public synchronized boolean isDecoded() {
        return decoding != null && decoding.isDone() && !decoding.isCompletedExceptionally();
    }

    /** How many times this analysis has been decoded. */
    public synchronized int getDecodeCount() {
        return decodeCount;
    }

    @Override
    public String toString() {
        return "PendingAnalysis[" + location + "]";
    }
}

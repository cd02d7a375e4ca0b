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
package com.tomaszrup.bsp.session;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.tomaszrup.bsp.cache.AnalysisContents;
import com.tomaszrup.bsp.cache.CacheException;
import com.tomaszrup.bsp.cache.CompileOutcome;
import com.tomaszrup.bsp.cache.CompileResultCache;
import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;
import com.tomaszrup.bsp.protocol.CompileResult;

/**
 * A compile request in flight: its origin id, the server's
 * acknowledgement and access to the per-target outcomes as they are
 * published.
 */
public class CompileHandle {

    private final String originId;
    private final CompletableFuture<CompileResult> acknowledgement;
    private final CompileResultCache cache;

    CompileHandle(String originId, CompletableFuture<CompileResult> acknowledgement, CompileResultCache cache) {
        this.originId = originId;
        this.acknowledgement = acknowledgement;
        this.cache = cache;
    }

    public String getOriginId() {
        return originId;
    }

    /**
     * Completes with the server's {@code CompileResult} once every target
     * of the request has finished.
     */
    public CompletableFuture<CompileResult> getAcknowledgement() {
        return acknowledgement;
    }

    public Optional<AnalysisContents> await(BuildTargetIdentifier target, Duration timeout) throws CacheException {
        return cache.await(originId, target, timeout);
    }

    public CompileOutcome awaitOutcome(BuildTargetIdentifier target, Duration timeout) throws CacheException {
        return cache.awaitOutcome(originId, target, timeout);
    }

    /**
     * Cancels the request on the server ({@code $/cancelRequest}) and fails
     * awaits on targets that have not published an outcome yet.
     *
     * @return {@code false} if the request had already finished
     */
    public boolean cancel() {
        return acknowledgement.cancel(true);
    }

    @Override
    public String toString() {
        return "CompileHandle[" + originId + "]";
    }
}

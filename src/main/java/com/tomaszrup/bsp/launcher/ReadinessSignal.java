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
package com.tomaszrup.bsp.launcher;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot signal that a spawned server is ready. The first
 * {@link #ready()} or {@link #fail(LauncherException)} wins; waiting is
 * always bounded.
 */
public final class ReadinessSignal {

    private final CompletableFuture<Void> future = new CompletableFuture<>();

    public boolean ready() {
        return future.complete(null);
    }

    public boolean fail(LauncherException failure) {
        return future.completeExceptionally(failure);
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * @throws LauncherException the failure passed to {@link #fail}, or
     *                           {@code READINESS_TIMEOUT}
     */
    public void await(Duration timeout) throws LauncherException {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new LauncherException(LauncherException.Kind.READINESS_TIMEOUT,
                    "Build server not ready after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LauncherException(LauncherException.Kind.READINESS_TIMEOUT,
                    "Interrupted while waiting for the build server", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof LauncherException) {
                throw (LauncherException) e.getCause();
            }
            throw new LauncherException(LauncherException.Kind.SPAWN_FAILED,
                    "Build server failed to start: " + e.getCause().getMessage(), e.getCause());
        }
    }
}

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
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.tomaszrup.bsp.BspException;
import com.tomaszrup.bsp.ErrorCode;

/**
 * Helpers for callers that block on session futures and want the
 * {@link BspException} that failed them rather than the executor's
 * wrapper.
 */
public final class RequestGuard {

    private RequestGuard() {
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException}
     * wrappers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** Waits for {@code future} without a bound of its own; session futures carry their own timeout. */
    public static <T> T join(CompletableFuture<T> future) throws BspException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestException(ErrorCode.CANCELLED, null, "Interrupted while waiting for a response", e);
        } catch (ExecutionException e) {
            throw rethrow(e);
        } catch (CancellationException e) {
            throw new RequestException(ErrorCode.CANCELLED, null, "Request was cancelled", e);
        }
    }

    public static <T> T join(CompletableFuture<T> future, Duration timeout) throws BspException {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new RequestException(ErrorCode.TIMEOUT, null,
                    "No response within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestException(ErrorCode.CANCELLED, null, "Interrupted while waiting for a response", e);
        } catch (ExecutionException e) {
            throw rethrow(e);
        } catch (CancellationException e) {
            throw new RequestException(ErrorCode.CANCELLED, null, "Request was cancelled", e);
        }
    }

    private static BspException rethrow(ExecutionException e) {
        Throwable cause = unwrap(e);
        if (cause instanceof BspException) {
            return (BspException) cause;
        }
        if (cause instanceof CancellationException) {
            return new RequestException(ErrorCode.CANCELLED, null, "Request was cancelled", cause);
        }
        return new RequestException(ErrorCode.PROTOCOL_ERROR, null, summarize(cause), cause);
    }

    /**
     * One-line description of a throwable for log messages: its simple
     * class name and message.
     */
    public static String summarize(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        Throwable root = unwrap(throwable);
        String message = root.getMessage();
        return message == null || message.isEmpty()
                ? root.getClass().getSimpleName()
                : root.getClass().getSimpleName() + ": " + message;
    }
}

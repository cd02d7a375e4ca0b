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
package com.tomaszrup.bsp.util;

import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

import com.tomaszrup.bsp.transport.TransportEndpoint;

/**
 * Manages the SLF4J MDC key {@code "session"} so that every log line
 * carries the label of the build-server session it belongs to
 * (for example {@code 127.0.0.1:5101} or {@code bsp.sock}).
 *
 * <pre>{@code
 * MdcSessionContext.setSession(endpoint);
 * try {
 *     // ... log calls inside here include [bsp.sock]
 * } finally {
 *     MdcSessionContext.clear();
 * }
 * }</pre>
 *
 * <p>Use {@link #wrap(Runnable)} to carry the caller's context onto a pool
 * thread.</p>
 */
public final class MdcSessionContext {

    /** MDC key used in the logback pattern via {@code %X{session}}. */
    public static final String MDC_KEY = "session";

    private MdcSessionContext() {
        // utility class
    }

    public static void setSession(TransportEndpoint endpoint) {
        MDC.put(MDC_KEY, endpoint != null ? endpoint.label() : "default");
    }

    public static void setSession(String label) {
        MDC.put(MDC_KEY, label != null && !label.isEmpty() ? label : "default");
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Returns a snapshot of the current thread's MDC context map.
     *
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the caller's MDC context is restored
     * in the executing thread, and the executing thread's own context is put
     * back afterwards.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }

    /** {@link #wrap(Runnable)} for tasks that return a value. */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                return task.call();
            } finally {
                restore(previousContext);
            }
        };
    }
}

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

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.BspException;
import com.tomaszrup.bsp.ExecutorPools;
import com.tomaszrup.bsp.config.ClientOptions;
import com.tomaszrup.bsp.session.BuildClientSession;
import com.tomaszrup.bsp.session.BuildEventSink;
import com.tomaszrup.bsp.session.ClientInfo;
import com.tomaszrup.bsp.session.ConnectionLostException;
import com.tomaszrup.bsp.session.LoggingBuildEventSink;
import com.tomaszrup.bsp.session.RequestGuard;
import com.tomaszrup.bsp.transport.TransportEndpoint;

/**
 * Keeps one initialized {@link BuildClientSession} per endpoint.
 *
 * <p>Each endpoint has its own lock, so a slow spawn on one endpoint does
 * not hold up callers of another. Callers that queue behind an in-flight
 * launch get its session instead of launching again, even when they asked
 * for a restart.</p>
 */
public class BuildServerRegistry implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(BuildServerRegistry.class);

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final BuildServerLauncher launcher;
    private final ClientOptions options;
    private final ExecutorPools pools;
    private final ClientInfo clientInfo;
    private final BuildEventSink sink;

    private final Map<TransportEndpoint, Slot> slots = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /** A registry whose sessions log server messages through {@link LoggingBuildEventSink}. */
    public BuildServerRegistry(BuildServerLauncher launcher, ClientOptions options, ExecutorPools pools,
            ClientInfo clientInfo) {
        this(launcher, options, pools, clientInfo, new LoggingBuildEventSink());
    }

    public BuildServerRegistry(BuildServerLauncher launcher, ClientOptions options, ExecutorPools pools,
            ClientInfo clientInfo, BuildEventSink sink) {
        this.launcher = launcher;
        this.options = options;
        this.pools = pools;
        this.clientInfo = clientInfo;
        this.sink = sink;
    }

    /**
     * Returns a live, initialized session for {@code endpoint}.
     *
     * @param restart discard the cached session and spawn a new server,
     *                unless another caller replaced it while this one waited
     */
    public BuildClientSession acquire(TransportEndpoint endpoint, boolean restart) throws BspException {
        Slot slot = slots.computeIfAbsent(endpoint, key -> new Slot());
        long seenGeneration = slot.generation;
        slot.lock.lock();
        try {
            if (closed) {
                throw new ConnectionLostException("Build server registry is closed");
            }
            BuildClientSession cached = slot.session;
            if (cached != null && cached.isActive() && (!restart || slot.generation != seenGeneration)) {
                return cached;
            }
            slot.release();

            LaunchedServer launched = restart ? launcher.restart(endpoint) : launcher.connect(endpoint);
            BuildClientSession session = BuildClientSession.start(launched.getConnection(), options, pools, sink);
            try {
                RequestGuard.join(session.initialize(clientInfo));
            } catch (BspException e) {
                logger.warn("Build server at {} failed to initialize: {}", endpoint, e.getMessage());
                session.close();
                launched.terminate();
                throw e;
            }
            slot.launched = launched;
            slot.session = session;
            slot.generation++;
            return session;
        } finally {
            slot.lock.unlock();
        }
    }

    /** The cached session for {@code endpoint}, if one is live. */
    public BuildClientSession find(TransportEndpoint endpoint) {
        Slot slot = slots.get(endpoint);
        BuildClientSession session = slot == null ? null : slot.session;
        return session != null && session.isActive() ? session : null;
    }

    /** Shuts down every session and destroys the servers this registry spawned. */
    @Override
    public void close() {
        closed = true;
        List<Slot> all = new ArrayList<>(slots.values());
        slots.clear();
        for (Slot slot : all) {
            slot.lock.lock();
            try {
                slot.release();
            } finally {
                slot.lock.unlock();
            }
        }
    }

    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        volatile long generation;
        volatile BuildClientSession session;
        LaunchedServer launched;

        /** Shuts down the current session, if any. Called with the lock held. */
        void release() {
            if (session != null) {
                try {
                    RequestGuard.join(session.shutdown(), SHUTDOWN_TIMEOUT);
                } catch (BspException e) {
                    logger.debug("Shutdown of {} did not complete: {}",
                            session.getConnection().getEndpoint(), e.getMessage());
                }
                session.close();
                session = null;
            }
            if (launched != null) {
                launched.terminate();
                launched = null;
            }
        }
    }
}

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.ErrorCode;
import com.tomaszrup.bsp.config.ClientOptions;
import com.tomaszrup.bsp.transport.Connection;
import com.tomaszrup.bsp.transport.TransportEndpoint;
import com.tomaszrup.bsp.transport.TransportException;
import com.tomaszrup.bsp.transport.Transports;

/**
 * Connect-or-spawn: reaches a build server at an endpoint, starting one
 * through the {@link ServerSpawner} when nothing is listening there.
 *
 * <p>A spawned process is destroyed on every path that does not hand it
 * back inside a {@link LaunchedServer}.</p>
 */
public class BuildServerLauncher {

    private static final Logger logger = LoggerFactory.getLogger(BuildServerLauncher.class);
    private static final Logger serverOutput = LoggerFactory.getLogger("bsp.server.stdout");

    /** First words of the line a server prints on stdout once it accepts connections. */
    public static final String SENTINEL_PREFIX = "bsp-server listening";

    private static final Pattern SENTINEL_VERSION = Pattern.compile("\\bversion=(\\S+)");

    static final long POLL_BASE_MILLIS = 50;
    static final long POLL_CAP_MILLIS = 1000;

    private final ClientOptions options;
    private final ServerSpawner spawner;
    private final Executor ioPool;

    public BuildServerLauncher(ClientOptions options, ServerSpawner spawner, Executor ioPool) {
        this.options = options;
        this.spawner = spawner;
        this.ioPool = ioPool;
    }

    /**
     * Launcher spawning {@link ClientOptions#getServerCommand()}. Without a
     * configured command it can still reach servers that are already
     * running.
     */
    public static BuildServerLauncher forOptions(ClientOptions options, Executor ioPool) {
        ServerSpawner spawner;
        if (options.getServerCommand().isEmpty()) {
            spawner = (endpoint, versionToken) -> {
                throw new IOException("No server command configured");
            };
        } else {
            spawner = new ProcessServerSpawner(options.getServerCommand(), null);
        }
        return new BuildServerLauncher(options, spawner, ioPool);
    }

    /**
     * Connects to a server already listening on {@code endpoint}, or spawns
     * one and connects once it is ready.
     */
    public LaunchedServer connect(TransportEndpoint endpoint) throws TransportException, LauncherException {
        try {
            Connection connection = Transports.open(endpoint, options.getConnectTimeout());
            logger.info("Connected to running build server at {}", endpoint);
            return new LaunchedServer(connection, null);
        } catch (TransportException e) {
            if (e.getKind() == TransportException.Kind.MALFORMED_ADDRESS) {
                throw e;
            }
            logger.debug("No build server at {} ({}); starting one", endpoint, e.getMessage());
        }
        return spawnAndConnect(endpoint);
    }

    /** Spawns a fresh server without trying the endpoint first. */
    public LaunchedServer restart(TransportEndpoint endpoint) throws LauncherException {
        return spawnAndConnect(endpoint);
    }

    private LaunchedServer spawnAndConnect(TransportEndpoint endpoint) throws LauncherException {
        String version = options.getServerVersion();
        ServerProcess process;
        try {
            process = spawner.spawn(endpoint, version);
        } catch (IOException | RuntimeException e) {
            throw new LauncherException(LauncherException.Kind.SPAWN_FAILED,
                    "Could not start build server for " + endpoint + ": " + e.getMessage(), e);
        }
        boolean handedOver = false;
        try {
            Connection connection = options.getReadinessStrategy() == ReadinessStrategy.POLL
                    ? poll(endpoint, process)
                    : awaitSentinel(endpoint, process, version);
            handedOver = true;
            logger.info("Build server {} ready on {}", process.describe(), endpoint);
            return new LaunchedServer(connection, process);
        } finally {
            if (!handedOver) {
                process.destroy();
            }
        }
    }

    private Connection awaitSentinel(TransportEndpoint endpoint, ServerProcess process, String version)
            throws LauncherException {
        ReadinessSignal signal = new ReadinessSignal();
        process.onExit().thenAccept(code -> signal.fail(new LauncherException(LauncherException.Kind.SPAWN_FAILED,
                "Build server " + process.describe() + " exited with code " + code + " before it was ready")));
        ioPool.execute(() -> readStdout(process, version, signal));
        signal.await(options.getReadinessTimeout());
        try {
            return Transports.open(endpoint, options.getConnectTimeout());
        } catch (TransportException e) {
            throw new LauncherException(LauncherException.Kind.SPAWN_FAILED,
                    "Build server announced " + endpoint + " but cannot be reached: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the server's stdout until it closes. The sentinel line resolves
     * {@code signal}; the rest is logged.
     */
    void readStdout(ServerProcess process, String expectedVersion, ReadinessSignal signal) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getStdout(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!signal.isDone() && line.startsWith(SENTINEL_PREFIX)) {
                    String announced = announcedVersion(line);
                    if (announced != null && !announced.equals(expectedVersion)) {
                        signal.fail(new LauncherException(LauncherException.Kind.VERSION_MISMATCH,
                                "Build server announced version " + announced + ", expected " + expectedVersion));
                    } else {
                        signal.ready();
                    }
                } else {
                    serverOutput.debug("{}", line);
                }
            }
        } catch (IOException e) {
            logger.debug("Stopped reading output of {}: {}", process.describe(), e.getMessage());
        }
        signal.fail(new LauncherException(LauncherException.Kind.SPAWN_FAILED,
                "Build server " + process.describe() + " closed its output before it was ready"));
    }

    static String announcedVersion(String sentinelLine) {
        Matcher matcher = SENTINEL_VERSION.matcher(sentinelLine);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Tries the endpoint with exponential backoff until it answers, the
     * process dies or the readiness timeout runs out.
     */
    private Connection poll(TransportEndpoint endpoint, ServerProcess process) throws LauncherException {
        long deadline = System.nanoTime() + options.getReadinessTimeout().toNanos();
        long backoff = POLL_BASE_MILLIS;
        TransportException last = null;
        while (true) {
            if (process.onExit().isDone()) {
                throw new LauncherException(LauncherException.Kind.SPAWN_FAILED,
                        "Build server " + process.describe() + " exited with code "
                                + process.onExit().getNow(-1) + " before it was ready", last);
            }
            try {
                return Transports.open(endpoint, options.getConnectTimeout());
            } catch (TransportException e) {
                if (e.getCode() == ErrorCode.MALFORMED_ADDRESS) {
                    throw new LauncherException(LauncherException.Kind.SPAWN_FAILED, e.getMessage(), e);
                }
                last = e;
            }
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                throw new LauncherException(LauncherException.Kind.READINESS_TIMEOUT,
                        "Build server not reachable on " + endpoint + " after "
                                + options.getReadinessTimeout().toMillis() + " ms", last);
            }
            waitForExit(process, Math.min(backoff, remainingMillis));
            backoff = nextBackoff(backoff);
        }
    }

    static long nextBackoff(long backoffMillis) {
        return Math.min(backoffMillis * 2, POLL_CAP_MILLIS);
    }

    /** Sleeps up to {@code millis}, waking early if the process exits. */
    private static void waitForExit(ServerProcess process, long millis) throws LauncherException {
        try {
            process.onExit().get(millis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.trace("Build server {} still starting", process.describe());
        } catch (ExecutionException e) {
            logger.debug("Exit status of {} unavailable: {}", process.describe(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LauncherException(LauncherException.Kind.READINESS_TIMEOUT,
                    "Interrupted while waiting for the build server", e);
        }
    }

    Duration getReadinessTimeout() {
        return options.getReadinessTimeout();
    }
}

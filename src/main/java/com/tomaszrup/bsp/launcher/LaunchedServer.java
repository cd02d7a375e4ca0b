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
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.transport.Connection;

/** An open connection to a build server, plus the process if this client spawned it. */
public final class LaunchedServer {

    private static final Logger logger = LoggerFactory.getLogger(LaunchedServer.class);

    /** How long {@link #terminate()} waits for a killed server to exit. */
    static final Duration EXIT_TIMEOUT = Duration.ofSeconds(10);

    private final Connection connection;
    private final ServerProcess process;

    LaunchedServer(Connection connection, ServerProcess process) {
        this.connection = connection;
        this.process = process;
    }

    public Connection getConnection() {
        return connection;
    }

    /** The spawned process, or empty if an already running server was reached. */
    public Optional<ServerProcess> getProcess() {
        return Optional.ofNullable(process);
    }

    public boolean isSpawned() {
        return process != null;
    }

    /**
     * Closes the connection and kills the process if it was spawned here.
     * Returns once the process has exited, so its endpoint is free for a
     * replacement, or after {@link #EXIT_TIMEOUT}.
     */
    public void terminate() {
        connection.close();
        if (process != null) {
            process.destroy();
            awaitExit(process, EXIT_TIMEOUT);
        }
    }

    static void awaitExit(ServerProcess process, Duration timeout) {
        try {
            Integer code = process.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("Build server {} exited with code {}", process.describe(), code);
        } catch (TimeoutException e) {
            logger.warn("Build server {} still running {} ms after it was killed", process.describe(),
                    timeout.toMillis());
        } catch (ExecutionException e) {
            logger.debug("Exit status of {} unavailable: {}", process.describe(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for build server {} to exit", process.describe());
        }
    }
}

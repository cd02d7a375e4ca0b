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
package com.tomaszrup.bsp.server;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.logging.Level;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.ExecutorPools;
import com.tomaszrup.bsp.launcher.BuildServerLauncher;
import com.tomaszrup.bsp.transport.Connection;
import com.tomaszrup.bsp.transport.TransportEndpoint;
import com.tomaszrup.bsp.transport.TransportException;
import com.tomaszrup.bsp.transport.TransportListener;
import com.tomaszrup.bsp.transport.Transports;

/**
 * Build server process entry point.
 *
 * <pre>
 * bsp-server (--tcp &lt;host&gt; &lt;port&gt; | --socket &lt;path&gt; | --pipe &lt;read&gt; &lt;write&gt;)
 *            [--config &lt;dir&gt;] [--version &lt;token&gt;]
 * </pre>
 *
 * Once the endpoint is bound a single {@value #SENTINEL_PREFIX} line goes
 * to stdout; everything else is logged to stderr. Socket endpoints serve
 * clients until the process is killed; a pipe pair serves one client.
 */
public final class BuildServerMain {

    private static final Logger logger = LoggerFactory.getLogger(BuildServerMain.class);

    public static final String SENTINEL_PREFIX = BuildServerLauncher.SENTINEL_PREFIX;
    static final String DEFAULT_CONFIG_DIR = ".bsp-engine";
    private static final Duration PIPE_ACCEPT_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration ACCEPT_POLL = Duration.ofSeconds(30);

    private BuildServerMain() {
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}", thread.getName(), throwable.getMessage(),
                        throwable));

        // lsp4j reports unmatched $/cancelRequest notifications at WARNING
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint").setLevel(Level.SEVERE);

        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(Arguments.USAGE);
            System.exit(2);
            return;
        }

        PrintStream stdout = System.out;
        System.setOut(new PrintStream(System.err));
        ExecutorPools pools = new ExecutorPools();
        try {
            serve(arguments, pools, stdout);
        } catch (TransportException e) {
            logger.error("Cannot serve on {}: {}", arguments.endpoint, e.getMessage());
            System.exit(1);
        } finally {
            pools.shutdownAll();
        }
    }

    static void serve(Arguments arguments, ExecutorPools pools, PrintStream stdout) throws TransportException {
        GraphSource graphSource = GraphSource.fromConfigDirectory(arguments.configDir);
        CompilationEngine engine = new AnalysisWritingEngine();
        try (TransportListener listener = Transports.listen(arguments.endpoint)) {
            stdout.println(sentinel(listener.getEndpoint(), arguments.version));
            stdout.flush();
            if (arguments.endpoint instanceof TransportEndpoint.Pipe) {
                Connection connection = listener.accept(PIPE_ACCEPT_TIMEOUT);
                BuildServerSession session = new BuildServerSession(connection, graphSource, engine, pools,
                        arguments.version).start();
                session.getTermination().join();
                return;
            }
            while (!Thread.currentThread().isInterrupted()) {
                Connection connection;
                try {
                    connection = listener.accept(ACCEPT_POLL);
                } catch (TransportException e) {
                    if (e.getKind() == TransportException.Kind.TIMEOUT) {
                        continue;
                    }
                    throw e;
                }
                logger.info("Client connected on {}", listener.getEndpoint());
                new BuildServerSession(connection, graphSource, engine, pools, arguments.version).start();
            }
        }
    }

    static String sentinel(TransportEndpoint endpoint, String version) {
        return SENTINEL_PREFIX + " on " + endpoint + " version=" + version;
    }

    /** Parsed command line. */
    static final class Arguments {
        static final String USAGE = "usage: bsp-server (--tcp <host> <port> | --socket <path> | "
                + "--pipe <read> <write>) [--config <dir>] [--version <token>]";

        TransportEndpoint endpoint;
        Path configDir = Paths.get(DEFAULT_CONFIG_DIR);
        String version = "dev";

        static Arguments parse(String[] args) {
            Arguments parsed = new Arguments();
            int i = 0;
            while (i < args.length) {
                String flag = args[i];
                switch (flag) {
                    case "--tcp":
                        requireValues(args, i, 2);
                        try {
                            parsed.endpoint = TransportEndpoint.tcp(args[i + 1], Integer.parseInt(args[i + 2]));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid port number: " + args[i + 2], e);
                        }
                        i += 3;
                        break;
                    case "--socket":
                        requireValues(args, i, 1);
                        parsed.endpoint = TransportEndpoint.localSocket(Paths.get(args[i + 1]));
                        i += 2;
                        break;
                    case "--pipe":
                        requireValues(args, i, 2);
                        // held from the client's side: the client reads what we write
                        parsed.endpoint = TransportEndpoint.pipe(args[i + 2], args[i + 1]);
                        i += 3;
                        break;
                    case "--config":
                        requireValues(args, i, 1);
                        parsed.configDir = Paths.get(args[i + 1]);
                        i += 2;
                        break;
                    case "--version":
                        requireValues(args, i, 1);
                        parsed.version = args[i + 1];
                        i += 2;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            }
            if (parsed.endpoint == null) {
                throw new IllegalArgumentException("No endpoint given");
            }
            if (!Files.isDirectory(parsed.configDir)) {
                logger.warn("Config directory {} does not exist; serving an empty workspace", parsed.configDir);
            }
            return parsed;
        }

        private static void requireValues(String[] args, int flagIndex, int count) {
            if (flagIndex + count >= args.length) {
                throw new IllegalArgumentException(args[flagIndex] + " needs " + count + " value(s)");
            }
        }
    }
}

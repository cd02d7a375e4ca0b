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
package com.tomaszrup.bsp.transport;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable address of a build server: a TCP host/port, a local (Unix
 * domain) socket path, or a pair of named pipes.
 *
 * <p>Endpoints are value objects so they can key the per-endpoint spawn
 * locks in {@link com.tomaszrup.bsp.launcher.BuildServerRegistry}. The
 * string form produced by {@link #toString()} is accepted back by
 * {@link #parse(String)}:</p>
 * <ul>
 *   <li>{@code tcp://127.0.0.1:5101}</li>
 *   <li>{@code local:/tmp/bsp.sock}</li>
 *   <li>{@code pipe:/tmp/bsp-in|/tmp/bsp-out}</li>
 * </ul>
 */
public abstract class TransportEndpoint {

    private static final String TCP_PREFIX = "tcp://";
    private static final String LOCAL_PREFIX = "local:";
    private static final String PIPE_PREFIX = "pipe:";

    TransportEndpoint() {
    }

    public static Tcp tcp(String host, int port) {
        return new Tcp(host, port);
    }

    public static LocalSocket localSocket(Path path) {
        return new LocalSocket(path);
    }

    /**
     * @param readPipe  pipe this side reads from (the server's write pipe)
     * @param writePipe pipe this side writes to (the server's read pipe)
     */
    public static Pipe pipe(String readPipe, String writePipe) {
        return new Pipe(readPipe, writePipe);
    }

    /**
     * Parses the string form of an endpoint.
     *
     * @throws TransportException with {@link TransportException.Kind#MALFORMED_ADDRESS}
     *                            if the string is not a valid endpoint
     */
    public static TransportEndpoint parse(String text) throws TransportException {
        if (text == null || text.isBlank()) {
            throw malformed(text, "empty endpoint");
        }
        try {
            if (text.startsWith(TCP_PREFIX)) {
                String hostPort = text.substring(TCP_PREFIX.length());
                int colon = hostPort.lastIndexOf(':');
                if (colon <= 0 || colon == hostPort.length() - 1) {
                    throw malformed(text, "expected tcp://host:port");
                }
                int port = Integer.parseInt(hostPort.substring(colon + 1));
                return tcp(hostPort.substring(0, colon), port);
            }
            if (text.startsWith(LOCAL_PREFIX)) {
                return localSocket(Paths.get(text.substring(LOCAL_PREFIX.length())));
            }
            if (text.startsWith(PIPE_PREFIX)) {
                String[] names = text.substring(PIPE_PREFIX.length()).split("\\|", -1);
                if (names.length != 2) {
                    throw malformed(text, "expected pipe:read|write");
                }
                return pipe(names[0], names[1]);
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException, InvalidPathException and constructor checks
            throw new TransportException(TransportException.Kind.MALFORMED_ADDRESS, null,
                    "Malformed endpoint '" + text + "': " + e.getMessage(), e);
        }
        throw malformed(text, "unknown scheme");
    }

    private static TransportException malformed(String text, String detail) {
        return new TransportException(TransportException.Kind.MALFORMED_ADDRESS, null,
                "Malformed endpoint '" + text + "': " + detail);
    }

    /**
     * Command-line arguments that tell a spawned server to listen on this
     * endpoint, in the form understood by
     * {@link com.tomaszrup.bsp.server.BuildServerMain}.
     */
    public abstract List<String> toServerArguments();

    /** Short label used for thread names and the logging MDC. */
    public abstract String label();

    // -----------------------------------------------------------------------

    /** TCP host and port. */
    public static final class Tcp extends TransportEndpoint {
        private final String host;
        private final int port;

        Tcp(String host, int port) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must not be empty");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.host = host;
            this.port = port;
        }

        public String getHost() {
            return host;
        }

        public int getPort() {
            return port;
        }

        @Override
        public List<String> toServerArguments() {
            return Arrays.asList("--tcp", host, Integer.toString(port));
        }

        @Override
        public String label() {
            return host + ":" + port;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Tcp)) {
                return false;
            }
            Tcp other = (Tcp) o;
            return port == other.port && host.equals(other.host);
        }

        @Override
        public int hashCode() {
            return Objects.hash(host, port);
        }

        @Override
        public String toString() {
            return TCP_PREFIX + host + ":" + port;
        }
    }

    /** Unix domain socket bound to a filesystem path. */
    public static final class LocalSocket extends TransportEndpoint {
        private final Path path;

        LocalSocket(Path path) {
            this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        }

        public Path getPath() {
            return path;
        }

        @Override
        public List<String> toServerArguments() {
            return Arrays.asList("--socket", path.toString());
        }

        @Override
        public String label() {
            Path name = path.getFileName();
            return name != null ? name.toString() : path.toString();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof LocalSocket && path.equals(((LocalSocket) o).path);
        }

        @Override
        public int hashCode() {
            return path.hashCode();
        }

        @Override
        public String toString() {
            return LOCAL_PREFIX + path;
        }
    }

    /**
     * Two named pipes assembled into one duplex stream. Names are from the
     * point of view of the side that opens the endpoint; the accepting side
     * swaps them.
     */
    public static final class Pipe extends TransportEndpoint {
        private final String readPipe;
        private final String writePipe;

        Pipe(String readPipe, String writePipe) {
            if (readPipe == null || readPipe.isEmpty() || writePipe == null || writePipe.isEmpty()) {
                throw new IllegalArgumentException("pipe names must not be empty");
            }
            if (readPipe.equals(writePipe)) {
                throw new IllegalArgumentException("read and write pipes must differ");
            }
            this.readPipe = readPipe;
            this.writePipe = writePipe;
        }

        public String getReadPipe() {
            return readPipe;
        }

        public String getWritePipe() {
            return writePipe;
        }

        /** The same pipe pair seen from the other end. */
        public Pipe reversed() {
            return new Pipe(writePipe, readPipe);
        }

        @Override
        public List<String> toServerArguments() {
            // the server reads what we write
            return Collections.unmodifiableList(Arrays.asList("--pipe", writePipe, readPipe));
        }

        @Override
        public String label() {
            int slash = Math.max(readPipe.lastIndexOf('/'), readPipe.lastIndexOf('\\'));
            return "pipe:" + readPipe.substring(slash + 1);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Pipe)) {
                return false;
            }
            Pipe other = (Pipe) o;
            return readPipe.equals(other.readPipe) && writePipe.equals(other.writePipe);
        }

        @Override
        public int hashCode() {
            return Objects.hash(readPipe, writePipe);
        }

        @Override
        public String toString() {
            return PIPE_PREFIX + readPipe + "|" + writePipe;
        }
    }
}

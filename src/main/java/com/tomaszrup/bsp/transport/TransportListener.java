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

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server half of a transport: a bound endpoint that accepts clients.
 *
 * <p>{@link #getEndpoint()} reports the endpoint actually bound, so a TCP
 * listener created for port {@code 0} tells its caller the ephemeral
 * port.</p>
 */
public abstract class TransportListener implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(TransportListener.class);

    TransportListener() {
    }

    static TransportListener bind(TransportEndpoint endpoint) throws TransportException {
        if (endpoint instanceof TransportEndpoint.Tcp) {
            return TcpListener.bind((TransportEndpoint.Tcp) endpoint);
        }
        if (endpoint instanceof TransportEndpoint.LocalSocket) {
            return LocalSocketListener.bind((TransportEndpoint.LocalSocket) endpoint);
        }
        if (endpoint instanceof TransportEndpoint.Pipe) {
            return new PipeListener((TransportEndpoint.Pipe) endpoint);
        }
        throw new TransportException(TransportException.Kind.MALFORMED_ADDRESS, endpoint,
                "Unsupported endpoint type: " + endpoint);
    }

    /** The endpoint clients should connect to. */
    public abstract TransportEndpoint getEndpoint();

    /**
     * Waits for one client.
     *
     * @throws TransportException with {@link TransportException.Kind#TIMEOUT}
     *                            if no client arrives in time
     */
    public abstract Connection accept(Duration timeout) throws TransportException;

    @Override
    public abstract void close();

    // -----------------------------------------------------------------------

    private static final class TcpListener extends TransportListener {
        private final ServerSocket serverSocket;
        private final TransportEndpoint.Tcp endpoint;

        private TcpListener(ServerSocket serverSocket, TransportEndpoint.Tcp endpoint) {
            this.serverSocket = serverSocket;
            this.endpoint = endpoint;
        }

        static TcpListener bind(TransportEndpoint.Tcp requested) throws TransportException {
            ServerSocket serverSocket = null;
            try {
                serverSocket = new ServerSocket();
                serverSocket.setReuseAddress(true);
                serverSocket.bind(new InetSocketAddress(InetAddress.getByName(requested.getHost()),
                        requested.getPort()));
                TransportEndpoint.Tcp bound = TransportEndpoint.tcp(requested.getHost(),
                        serverSocket.getLocalPort());
                logger.info("Listening on {}", bound);
                return new TcpListener(serverSocket, bound);
            } catch (IOException | IllegalArgumentException | SecurityException e) {
                Transports.closeQuietly(serverSocket);
                throw Transports.classify(requested, e);
            }
        }

        @Override
        public TransportEndpoint getEndpoint() {
            return endpoint;
        }

        @Override
        public Connection accept(Duration timeout) throws TransportException {
            try {
                serverSocket.setSoTimeout(Transports.toMillis(timeout));
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                logger.debug("Accepted client {} on {}", socket.getRemoteSocketAddress(), endpoint);
                return new Connection(endpoint,
                        Transports.buffered(socket.getInputStream()),
                        new BufferedOutputStream(socket.getOutputStream()),
                        Collections.singletonList(socket));
            } catch (SocketTimeoutException e) {
                throw new TransportException(TransportException.Kind.TIMEOUT, endpoint,
                        "No client connected to " + endpoint + " within " + timeout.toMillis() + " ms", e);
            } catch (IOException e) {
                throw Transports.classify(endpoint, e);
            }
        }

        @Override
        public void close() {
            Transports.closeQuietly(serverSocket);
        }
    }

    private static final class LocalSocketListener extends TransportListener {
        private final ServerSocketChannel channel;
        private final Selector selector;
        private final TransportEndpoint.LocalSocket endpoint;

        private LocalSocketListener(ServerSocketChannel channel, Selector selector,
                TransportEndpoint.LocalSocket endpoint) {
            this.channel = channel;
            this.selector = selector;
            this.endpoint = endpoint;
        }

        static LocalSocketListener bind(TransportEndpoint.LocalSocket endpoint) throws TransportException {
            Path path = endpoint.getPath();
            ServerSocketChannel channel = null;
            Selector selector = null;
            try {
                // a socket file left behind by a dead server blocks bind
                Files.deleteIfExists(path);
                channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
                channel.bind(UnixDomainSocketAddress.of(path));
                channel.configureBlocking(false);
                selector = Selector.open();
                channel.register(selector, SelectionKey.OP_ACCEPT);
                logger.info("Listening on {}", endpoint);
                return new LocalSocketListener(channel, selector, endpoint);
            } catch (IOException | IllegalArgumentException | SecurityException
                    | UnsupportedOperationException e) {
                Transports.closeQuietly(selector);
                Transports.closeQuietly(channel);
                throw Transports.classify(endpoint, e);
            }
        }

        @Override
        public TransportEndpoint getEndpoint() {
            return endpoint;
        }

        @Override
        public Connection accept(Duration timeout) throws TransportException {
            try {
                long deadline = System.nanoTime() + timeout.toNanos();
                SocketChannel client = channel.accept();
                while (client == null) {
                    long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                    if (remainingMillis <= 0) {
                        throw new TransportException(TransportException.Kind.TIMEOUT, endpoint,
                                "No client connected to " + endpoint + " within " + timeout.toMillis() + " ms");
                    }
                    selector.select(remainingMillis);
                    selector.selectedKeys().clear();
                    client = channel.accept();
                }
                client.configureBlocking(true);
                logger.debug("Accepted client on {}", endpoint);
                return new Connection(endpoint,
                        Transports.buffered(ChannelStreams.input(client)),
                        ChannelStreams.output(client),
                        Collections.singletonList(client));
            } catch (IOException e) {
                throw Transports.classify(endpoint, e);
            }
        }

        @Override
        public void close() {
            Transports.closeQuietly(selector);
            Transports.closeQuietly(channel);
            try {
                Files.deleteIfExists(endpoint.getPath());
            } catch (IOException e) {
                logger.debug("Could not delete socket file {}: {}", endpoint.getPath(), e.getMessage());
            }
        }
    }

    /**
     * Named pipes need no bind step. The endpoint is held from the opening
     * side's point of view, so accepting opens it reversed.
     */
    private static final class PipeListener extends TransportListener {
        private final TransportEndpoint.Pipe endpoint;

        PipeListener(TransportEndpoint.Pipe endpoint) {
            this.endpoint = endpoint;
        }

        @Override
        public TransportEndpoint getEndpoint() {
            return endpoint;
        }

        @Override
        public Connection accept(Duration timeout) throws TransportException {
            return Transports.openPipes(endpoint.reversed(), timeout, false);
        }

        @Override
        public void close() {
            // nothing bound
        }
    }
}

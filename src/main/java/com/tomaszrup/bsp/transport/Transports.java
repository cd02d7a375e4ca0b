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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.net.UnknownHostException;
import java.nio.channels.FileChannel;
import java.nio.channels.Pipe;
import java.nio.channels.SocketChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link Connection}s to {@link TransportEndpoint}s.
 *
 * <p>The client side is {@link #open}; the server side is
 * {@link #listen} followed by {@link TransportListener#accept}.
 * {@link #pipePair()} wires two in-process connections back to back.</p>
 */
public final class Transports {

    private static final Logger logger = LoggerFactory.getLogger(Transports.class);

    private static final int BUFFER_SIZE = 8192;

    private Transports() {
    }

    /**
     * Opens a connection to an already listening endpoint.
     *
     * @param timeout bound on the time spent connecting
     * @throws TransportException if the endpoint cannot be reached
     */
    public static Connection open(TransportEndpoint endpoint, Duration timeout) throws TransportException {
        if (endpoint instanceof TransportEndpoint.Tcp) {
            return openTcp((TransportEndpoint.Tcp) endpoint, timeout);
        }
        if (endpoint instanceof TransportEndpoint.LocalSocket) {
            return openLocal((TransportEndpoint.LocalSocket) endpoint);
        }
        if (endpoint instanceof TransportEndpoint.Pipe) {
            return openPipes((TransportEndpoint.Pipe) endpoint, timeout, true);
        }
        throw new TransportException(TransportException.Kind.MALFORMED_ADDRESS, endpoint,
                "Unsupported endpoint type: " + endpoint);
    }

    /**
     * Binds the server side of an endpoint. For pipes nothing is bound; the
     * pipes are opened on {@link TransportListener#accept}.
     */
    public static TransportListener listen(TransportEndpoint endpoint) throws TransportException {
        return TransportListener.bind(endpoint);
    }

    /**
     * Binds the endpoint, waits for a single client and releases the
     * listener again.
     */
    public static Connection accept(TransportEndpoint endpoint, Duration timeout) throws TransportException {
        try (TransportListener listener = listen(endpoint)) {
            return listener.accept(timeout);
        }
    }

    /**
     * Two connected in-process connections built from a pair of
     * {@link Pipe}s: what one writes the other reads.
     */
    public static Connection[] pipePair() throws IOException {
        Pipe forward = Pipe.open();
        Pipe backward = Pipe.open();
        TransportEndpoint.Pipe endpoint = TransportEndpoint.pipe("in-process/backward", "in-process/forward");
        Connection first = new Connection(endpoint,
                buffered(ChannelStreams.input(backward.source())),
                ChannelStreams.output(forward.sink()),
                Arrays.asList(forward.sink(), backward.source()));
        Connection second = new Connection(endpoint.reversed(),
                buffered(ChannelStreams.input(forward.source())),
                ChannelStreams.output(backward.sink()),
                Arrays.asList(backward.sink(), forward.source()));
        return new Connection[] {first, second};
    }

    // -----------------------------------------------------------------------

    private static Connection openTcp(TransportEndpoint.Tcp endpoint, Duration timeout) throws TransportException {
        Socket socket = new Socket();
        try {
            InetSocketAddress address = new InetSocketAddress(endpoint.getHost(), endpoint.getPort());
            if (address.isUnresolved()) {
                throw new UnknownHostException(endpoint.getHost());
            }
            socket.connect(address, toMillis(timeout));
            socket.setTcpNoDelay(true);
            logger.debug("Connected to {}", endpoint);
            return new Connection(endpoint,
                    buffered(socket.getInputStream()),
                    new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE),
                    Collections.singletonList(socket));
        } catch (IOException | IllegalArgumentException | SecurityException e) {
            closeQuietly(socket);
            throw classify(endpoint, e);
        }
    }

    private static Connection openLocal(TransportEndpoint.LocalSocket endpoint) throws TransportException {
        Path path = endpoint.getPath();
        if (!Files.exists(path)) {
            throw new TransportException(TransportException.Kind.REFUSED, endpoint,
                    "No server socket at " + path);
        }
        SocketChannel channel = null;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
            channel.connect(UnixDomainSocketAddress.of(path));
            logger.debug("Connected to {}", endpoint);
            return new Connection(endpoint,
                    buffered(ChannelStreams.input(channel)),
                    ChannelStreams.output(channel),
                    Collections.singletonList(channel));
        } catch (IOException | IllegalArgumentException | SecurityException e) {
            closeQuietly(channel);
            throw classify(endpoint, e);
        }
    }

    /**
     * Opens both named pipes of a pipe endpoint.
     *
     * <p>Opening a FIFO blocks until the other end opens it too. The opening
     * side opens its write pipe first and the accepting side its read pipe
     * first, so the two sides pair up without deadlocking.</p>
     */
    static Connection openPipes(TransportEndpoint.Pipe endpoint, Duration timeout, boolean writeFirst)
            throws TransportException {
        Path readPath;
        Path writePath;
        try {
            readPath = Paths.get(endpoint.getReadPipe());
            writePath = Paths.get(endpoint.getWritePipe());
        } catch (InvalidPathException e) {
            throw new TransportException(TransportException.Kind.MALFORMED_ADDRESS, endpoint,
                    "Invalid pipe name: " + e.getMessage(), e);
        }
        for (Path path : Arrays.asList(readPath, writePath)) {
            if (!Files.exists(path)) {
                throw new TransportException(TransportException.Kind.REFUSED, endpoint, "No pipe at " + path);
            }
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        FileChannel first = null;
        try {
            FileChannel readChannel;
            FileChannel writeChannel;
            if (writeFirst) {
                first = openFifo(endpoint, writePath, StandardOpenOption.WRITE, deadline);
                writeChannel = first;
                readChannel = openFifo(endpoint, readPath, StandardOpenOption.READ, deadline);
            } else {
                first = openFifo(endpoint, readPath, StandardOpenOption.READ, deadline);
                readChannel = first;
                writeChannel = openFifo(endpoint, writePath, StandardOpenOption.WRITE, deadline);
            }
            logger.debug("Opened pipes {}", endpoint);
            return new Connection(endpoint,
                    buffered(ChannelStreams.input(readChannel)),
                    ChannelStreams.output(writeChannel),
                    Arrays.asList(readChannel, writeChannel));
        } catch (TransportException e) {
            closeQuietly(first);
            throw e;
        }
    }

    private static FileChannel openFifo(TransportEndpoint endpoint, Path path, StandardOpenOption mode,
            long deadlineNanos) throws TransportException {
        CompletableFuture<FileChannel> opening = new CompletableFuture<>();
        Thread opener = new Thread(() -> {
            try {
                opening.complete(FileChannel.open(path, mode));
            } catch (IOException | RuntimeException e) {
                opening.completeExceptionally(e);
            }
        }, "bsp-pipe-open-" + path.getFileName());
        opener.setDaemon(true);
        opener.start();
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return opening.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            releaseBlockedOpen(path, mode, opening);
            throw new TransportException(TransportException.Kind.TIMEOUT, endpoint,
                    "Timed out waiting for the peer to open " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseBlockedOpen(path, mode, opening);
            throw new TransportException(TransportException.Kind.TIMEOUT, endpoint,
                    "Interrupted while opening " + path, e);
        } catch (ExecutionException e) {
            throw classify(endpoint, e.getCause());
        }
    }

    /**
     * A FIFO open blocks in the kernel until the peer shows up. Opening the
     * complementary end ourselves completes the blocked open, after which
     * both handles are closed.
     */
    private static void releaseBlockedOpen(Path path, StandardOpenOption mode, CompletableFuture<FileChannel> opening) {
        StandardOpenOption opposite = mode == StandardOpenOption.READ
                ? StandardOpenOption.WRITE : StandardOpenOption.READ;
        Thread releaser = new Thread(() -> {
            try (FileChannel ignored = FileChannel.open(path, opposite)) {
                logger.debug("Released blocked open of {}", path);
            } catch (IOException e) {
                logger.debug("Could not release blocked open of {}: {}", path, e.getMessage());
            }
        }, "bsp-pipe-release");
        releaser.setDaemon(true);
        releaser.start();
        opening.thenAccept(Transports::closeQuietly);
    }

    static TransportException classify(TransportEndpoint endpoint, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);
        TransportException.Kind kind;
        if (error instanceof UnknownHostException
                || error instanceof IllegalArgumentException
                || error instanceof InvalidPathException) {
            kind = TransportException.Kind.MALFORMED_ADDRESS;
        } else if (error instanceof SocketTimeoutException) {
            kind = TransportException.Kind.TIMEOUT;
        } else if (error instanceof AccessDeniedException
                || error instanceof SecurityException
                || lower.contains("permission denied")) {
            kind = TransportException.Kind.PERMISSION_DENIED;
        } else {
            // ConnectException, NoSuchFileException and other I/O errors
            kind = TransportException.Kind.REFUSED;
        }
        return new TransportException(kind, endpoint, "Cannot connect to " + endpoint + ": " + message, error);
    }

    static InputStream buffered(InputStream in) {
        return new BufferedInputStream(in, BUFFER_SIZE);
    }

    static int toMillis(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis <= 0) {
            return 1;
        }
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }

    static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            logger.debug("Error closing {}: {}", closeable, e.getMessage());
        }
    }
}

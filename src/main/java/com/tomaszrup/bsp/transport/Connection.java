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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A duplex, ordered byte stream to one peer, plus the lifecycle state of
 * the protocol running over it.
 *
 * <p>A connection is owned by exactly one session. The read half has a
 * single owner (the session's listener thread); the write half may be used
 * from several threads and serializes writers itself.</p>
 *
 * <p>{@link #close()} and {@link #fail(String, Throwable)} release the
 * underlying OS handles exactly once, may be called from any thread, and
 * make reads or writes in progress fail immediately.</p>
 */
public class Connection implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(Connection.class);

    private final TransportEndpoint endpoint;
    private final InputStream input;
    private final OutputStream output;
    private final List<Closeable> resources;

    private final Object stateLock = new Object();
    private ConnectionState state = ConnectionState.CONNECTING;
    private String failureReason;
    private Throwable failureCause;

    private final AtomicBoolean released = new AtomicBoolean();
    private final List<Consumer<Connection>> terminationListeners = new CopyOnWriteArrayList<>();
    private volatile long lastActivityMillis = System.currentTimeMillis();

    Connection(TransportEndpoint endpoint, InputStream input, OutputStream output, List<Closeable> resources) {
        this.endpoint = endpoint;
        this.input = new ActivityInputStream(input);
        this.output = new ActivityOutputStream(output);
        this.resources = new ArrayList<>(resources);
    }

    public TransportEndpoint getEndpoint() {
        return endpoint;
    }

    public InputStream getInput() {
        return input;
    }

    public OutputStream getOutput() {
        return output;
    }

    public ConnectionState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    /** Reason recorded by {@link #fail}, or {@code null} if the connection has not failed. */
    public String getFailureReason() {
        synchronized (stateLock) {
            return failureReason;
        }
    }

    public Throwable getFailureCause() {
        synchronized (stateLock) {
            return failureCause;
        }
    }

    public boolean isOpen() {
        return !getState().isTerminal();
    }

    /** Wall-clock time of the last byte read or written. */
    public long getLastActivityMillis() {
        return lastActivityMillis;
    }

    /**
     * Registers a callback run once when the connection reaches
     * {@link ConnectionState#CLOSED} or {@link ConnectionState#FAILED}.
     * Runs immediately if it already has.
     */
    public void onTermination(Consumer<Connection> listener) {
        terminationListeners.add(listener);
        if (!isOpen() && terminationListeners.remove(listener)) {
            listener.accept(this);
        }
    }

    /** {@code CONNECTING → HANDSHAKING}. */
    public boolean beginHandshake() {
        return moveTo(ConnectionState.HANDSHAKING);
    }

    /** {@code HANDSHAKING → READY}. */
    public boolean markReady() {
        return moveTo(ConnectionState.READY);
    }

    /**
     * Moves the connection to {@link ConnectionState#FAILED} and releases it.
     * Has no effect if the connection already reached a terminal state.
     *
     * @return {@code true} if this call performed the transition
     */
    public boolean fail(String reason, Throwable cause) {
        synchronized (stateLock) {
            if (state.isTerminal()) {
                return false;
            }
            state = ConnectionState.FAILED;
            failureReason = reason;
            failureCause = cause;
        }
        logger.warn("Connection to {} failed: {}", endpoint, reason);
        release();
        fireTermination();
        return true;
    }

    @Override
    public void close() {
        boolean transitioned;
        synchronized (stateLock) {
            transitioned = !state.isTerminal();
            if (transitioned) {
                state = ConnectionState.CLOSED;
            }
        }
        release();
        if (transitioned) {
            logger.debug("Connection to {} closed", endpoint);
            fireTermination();
        }
    }

    private boolean moveTo(ConnectionState next) {
        synchronized (stateLock) {
            if (!state.canMoveTo(next)) {
                logger.debug("Ignoring transition {} -> {} on {}", state, next, endpoint);
                return false;
            }
            state = next;
            return true;
        }
    }

    private void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        for (Closeable resource : resources) {
            try {
                resource.close();
            } catch (IOException e) {
                logger.debug("Error releasing transport resource of {}: {}", endpoint, e.getMessage());
            }
        }
    }

    private void fireTermination() {
        for (Consumer<Connection> listener : terminationListeners) {
            if (terminationListeners.remove(listener)) {
                try {
                    listener.accept(this);
                } catch (RuntimeException e) {
                    logger.error("Connection termination listener failed for {}", endpoint, e);
                }
            }
        }
    }

    private void touch() {
        lastActivityMillis = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return "Connection[" + endpoint + ", " + getState() + "]";
    }

    private final class ActivityInputStream extends InputStream {
        private final InputStream delegate;

        ActivityInputStream(InputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public int read() throws IOException {
            int b = delegate.read();
            touch();
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = delegate.read(b, off, len);
            touch();
            return n;
        }

        @Override
        public int available() throws IOException {
            return delegate.available();
        }

        @Override
        public void close() {
            Connection.this.close();
        }
    }

    private final class ActivityOutputStream extends OutputStream {
        private final OutputStream delegate;

        ActivityOutputStream(OutputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public synchronized void write(int b) throws IOException {
            delegate.write(b);
            touch();
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) throws IOException {
            delegate.write(b, off, len);
            touch();
        }

        @Override
        public synchronized void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() {
            Connection.this.close();
        }
    }
}

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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.Objects;

/**
 * Stream views over NIO channels.
 *
 * <p>{@link java.nio.channels.Channels#newInputStream} and
 * {@link java.nio.channels.Channels#newOutputStream} synchronize on the
 * channel's blocking lock, so on a socket channel a reader blocked in
 * {@code read} stalls every writer. These adapters call the channel
 * directly: socket channels keep separate read and write locks, and
 * closing the channel wakes a blocked reader with an
 * {@link java.nio.channels.AsynchronousCloseException}.</p>
 */
final class ChannelStreams {

    private ChannelStreams() {
    }

    static InputStream input(ReadableByteChannel channel) {
        return new ChannelInput(channel);
    }

    static OutputStream output(WritableByteChannel channel) {
        return new ChannelOutput(channel);
    }

    private static final class ChannelInput extends InputStream {
        private final ReadableByteChannel channel;
        private final byte[] single = new byte[1];

        ChannelInput(ReadableByteChannel channel) {
            this.channel = Objects.requireNonNull(channel);
        }

        @Override
        public int read() throws IOException {
            int n = read(single, 0, 1);
            return n <= 0 ? -1 : single[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) {
                return 0;
            }
            ByteBuffer buffer = ByteBuffer.wrap(b, off, len);
            int n;
            do {
                n = channel.read(buffer);
            } while (n == 0);
            return n;
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }

    private static final class ChannelOutput extends OutputStream {
        private final WritableByteChannel channel;

        ChannelOutput(WritableByteChannel channel) {
            this.channel = Objects.requireNonNull(channel);
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            ByteBuffer buffer = ByteBuffer.wrap(b, off, len);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}

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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.bsp.transport;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConnectionTests {

	private final List<Connection> opened = new ArrayList<>();

	@AfterEach
	void tearDown() {
		opened.forEach(Connection::close);
	}

	private Connection newConnection(Closeable resource) {
		Connection connection = new Connection(TransportEndpoint.tcp("localhost", 1),
				new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream(),
				Arrays.asList(resource));
		opened.add(connection);
		return connection;
	}

	@Test
	void testCloseIsIdempotent() {
		AtomicInteger closes = new AtomicInteger();
		Connection connection = newConnection(closes::incrementAndGet);
		AtomicInteger terminations = new AtomicInteger();
		connection.onTermination(c -> terminations.incrementAndGet());

		connection.close();
		connection.close();

		Assertions.assertEquals(1, closes.get(), "resources released exactly once");
		Assertions.assertEquals(1, terminations.get(), "termination listeners run exactly once");
		Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
	}

	@Test
	void testStatesOnlyMoveForward() {
		Connection connection = newConnection(() -> { });
		Assertions.assertEquals(ConnectionState.CONNECTING, connection.getState());
		Assertions.assertFalse(connection.markReady(), "cannot skip the handshake");
		Assertions.assertTrue(connection.beginHandshake());
		Assertions.assertFalse(connection.beginHandshake());
		Assertions.assertTrue(connection.markReady());
		Assertions.assertEquals(ConnectionState.READY, connection.getState());
	}

	@Test
	void testFailedConnectionIsNeverResurrected() {
		Connection connection = newConnection(() -> { });
		Assertions.assertTrue(connection.fail("boom", null));
		Assertions.assertFalse(connection.fail("again", null));
		Assertions.assertFalse(connection.beginHandshake());
		connection.close();

		Assertions.assertEquals(ConnectionState.FAILED, connection.getState());
		Assertions.assertEquals("boom", connection.getFailureReason());
		Assertions.assertFalse(connection.isOpen());
	}

	@Test
	void testListenerAddedAfterTerminationRunsImmediately() {
		Connection connection = newConnection(() -> { });
		connection.close();
		AtomicInteger calls = new AtomicInteger();
		connection.onTermination(c -> calls.incrementAndGet());
		Assertions.assertEquals(1, calls.get());
	}

	@Test
	void testCloseFromAnotherThreadUnblocksReader() throws Exception {
		Connection[] pair = Transports.pipePair();
		opened.addAll(Arrays.asList(pair));
		InputStream in = pair[0].getInput();
		CompletableFuture<Object> reader = CompletableFuture.supplyAsync(() -> {
			try {
				return in.read();
			} catch (IOException e) {
				return e;
			}
		});

		Thread.sleep(100);
		Assertions.assertFalse(reader.isDone(), "reader should be blocked");
		pair[0].close();

		Object result = reader.get(5, TimeUnit.SECONDS);
		Assertions.assertTrue(result instanceof IOException || Integer.valueOf(-1).equals(result),
				"blocked read should end once the connection closes, got " + result);
	}

	@Test
	void testActivityIsTracked() throws Exception {
		Connection[] pair = Transports.pipePair();
		opened.addAll(Arrays.asList(pair));
		long before = pair[0].getLastActivityMillis();
		Thread.sleep(20);
		pair[0].getOutput().write(42);
		pair[0].getOutput().flush();
		Assertions.assertTrue(pair[0].getLastActivityMillis() > before);
	}
}

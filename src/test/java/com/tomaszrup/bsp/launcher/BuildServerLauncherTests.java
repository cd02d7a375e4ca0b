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
package com.tomaszrup.bsp.launcher;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.bsp.ErrorCode;
import com.tomaszrup.bsp.config.ClientOptions;
import com.tomaszrup.bsp.transport.TransportEndpoint;
import com.tomaszrup.bsp.transport.TransportException;
import com.tomaszrup.bsp.transport.TransportListener;
import com.tomaszrup.bsp.transport.Transports;

class BuildServerLauncherTests {

	private ExecutorService ioPool;
	private final List<TransportListener> listeners = Collections.synchronizedList(new ArrayList<TransportListener>());
	private final List<ScriptedProcess> spawned = new ArrayList<>();
	private TransportEndpoint endpoint;

	@BeforeEach
	void setup() throws Exception {
		ioPool = Executors.newCachedThreadPool();
		endpoint = TransportEndpoint.tcp("127.0.0.1", freePort());
	}

	@AfterEach
	void tearDown() {
		synchronized (listeners) {
			for (TransportListener listener : listeners) {
				listener.close();
			}
		}
		ioPool.shutdownNow();
	}

	private static int freePort() throws IOException {
		try (ServerSocket socket = new ServerSocket(0)) {
			return socket.getLocalPort();
		}
	}

	private ClientOptions sentinelOptions() {
		return ClientOptions.builder()
				.connectTimeout(Duration.ofMillis(500))
				.readinessTimeout(Duration.ofSeconds(5))
				.serverVersion("1.0.0")
				.build();
	}

	private TransportListener listen() throws TransportException {
		TransportListener listener = Transports.listen(endpoint);
		listeners.add(listener);
		return listener;
	}

	/** Spawner whose processes are driven by {@code script}. */
	private ServerSpawner spawner(ProcessScript script) {
		return (target, versionToken) -> {
			ScriptedProcess process = new ScriptedProcess();
			spawned.add(process);
			try {
				script.run(process, target, versionToken);
			} catch (IOException e) {
				throw e;
			} catch (Exception e) {
				throw new IOException(e);
			}
			return process;
		};
	}

	@Test
	void testConnectsToRunningServerWithoutSpawning() throws Exception {
		listen();
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((p, t, v) -> {
			throw new IOException("must not spawn");
		}), ioPool);

		LaunchedServer launched = launcher.connect(endpoint);

		Assertions.assertFalse(launched.isSpawned());
		Assertions.assertTrue(launched.getConnection().isOpen());
		Assertions.assertTrue(spawned.isEmpty());
		launched.terminate();
	}

	@Test
	void testSpawnsAndWaitsForSentinel() throws Exception {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((process, target, version) -> {
			Assertions.assertEquals(endpoint, target);
			listen();
			process.print("starting up");
			process.print(BuildServerLauncher.SENTINEL_PREFIX + " on " + target.label() + " version=" + version);
		}), ioPool);

		LaunchedServer launched = launcher.connect(endpoint);

		Assertions.assertTrue(launched.isSpawned());
		Assertions.assertTrue(launched.getConnection().isOpen());
		Assertions.assertFalse(spawned.get(0).destroyed);

		launched.terminate();
		Assertions.assertTrue(spawned.get(0).destroyed);
		Assertions.assertFalse(launched.getConnection().isOpen());
	}

	@Test
	void testTerminateWaitsForProcessExit() throws Exception {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((process, target, version) -> {
			TransportListener listener = listen();
			process.exitsLater();
			process.onDestroy(() -> ioPool.execute(() -> {
				try {
					Thread.sleep(300);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				listener.close();
				process.exit(143);
			}));
			process.print(BuildServerLauncher.SENTINEL_PREFIX + " on " + target.label() + " version=" + version);
		}), ioPool);
		LaunchedServer launched = launcher.connect(endpoint);

		launched.terminate();

		Assertions.assertTrue(spawned.get(0).onExit().isDone());
		Assertions.assertEquals(143, spawned.get(0).onExit().get().intValue());
		try (TransportListener replacement = Transports.listen(endpoint)) {
			Assertions.assertEquals(endpoint, replacement.getEndpoint());
		}
	}

	@Test
	void testTerminateGivesUpOnProcessThatNeverExits() throws Exception {
		ScriptedProcess process = new ScriptedProcess();
		process.exitsLater();

		long started = System.nanoTime();
		LaunchedServer.awaitExit(process, Duration.ofMillis(200));

		Assertions.assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) >= 200);
		Assertions.assertTrue(process.isAlive());
	}

	@Test
	void testSentinelWithoutVersionIsAccepted() throws Exception {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((process, target, version) -> {
			listen();
			process.print(BuildServerLauncher.SENTINEL_PREFIX);
		}), ioPool);

		LaunchedServer launched = launcher.restart(endpoint);

		Assertions.assertTrue(launched.isSpawned());
		launched.terminate();
	}

	@Test
	void testVersionMismatchDestroysProcess() throws Exception {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((process, target, version) -> {
			listen();
			process.print(BuildServerLauncher.SENTINEL_PREFIX + " on " + target.label() + " version=9.9.9");
		}), ioPool);

		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.connect(endpoint));

		Assertions.assertEquals(LauncherException.Kind.VERSION_MISMATCH, e.getKind());
		Assertions.assertEquals(ErrorCode.VERSION_INCOMPATIBLE, e.getCode());
		Assertions.assertTrue(spawned.get(0).destroyed);
	}

	@Test
	void testExitBeforeReadyIsSpawnFailure() throws Exception {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(),
				spawner((process, target, version) -> process.exit(3)), ioPool);

		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.connect(endpoint));

		Assertions.assertEquals(LauncherException.Kind.SPAWN_FAILED, e.getKind());
		Assertions.assertTrue(spawned.get(0).destroyed);
	}

	@Test
	void testClosedOutputBeforeSentinelIsSpawnFailure() throws Exception {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((process, target, version) -> {
			process.print("something went wrong");
			process.closeOutput();
		}), ioPool);

		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.connect(endpoint));

		Assertions.assertEquals(LauncherException.Kind.SPAWN_FAILED, e.getKind());
	}

	@Test
	void testSilentServerTimesOut() throws Exception {
		ClientOptions options = sentinelOptions().toBuilder().readinessTimeout(Duration.ofMillis(200)).build();
		BuildServerLauncher launcher = new BuildServerLauncher(options,
				spawner((process, target, version) -> process.print("still booting")), ioPool);

		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.connect(endpoint));

		Assertions.assertEquals(LauncherException.Kind.READINESS_TIMEOUT, e.getKind());
		Assertions.assertTrue(spawned.get(0).destroyed);
	}

	@Test
	void testSpawnerFailureIsReported() {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((p, t, v) -> {
			throw new IOException("no such file");
		}), ioPool);

		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.connect(endpoint));

		Assertions.assertEquals(LauncherException.Kind.SPAWN_FAILED, e.getKind());
		Assertions.assertTrue(e.getMessage().contains("no such file"));
	}

	@Test
	void testPollingFindsLateListener() throws Exception {
		ClientOptions options = sentinelOptions().toBuilder().readinessStrategy(ReadinessStrategy.POLL).build();
		CompletableFuture<Void> listening = new CompletableFuture<>();
		BuildServerLauncher launcher = new BuildServerLauncher(options, spawner((process, target, version) ->
				CompletableFuture.runAsync(() -> {
					try {
						Thread.sleep(200);
						listen();
						listening.complete(null);
					} catch (Exception e) {
						listening.completeExceptionally(e);
					}
				})), ioPool);

		LaunchedServer launched = launcher.connect(endpoint);

		listening.get(5, TimeUnit.SECONDS);
		Assertions.assertTrue(launched.isSpawned());
		launched.terminate();
	}

	@Test
	void testPollingStopsWhenProcessExits() throws Exception {
		ClientOptions options = sentinelOptions().toBuilder().readinessStrategy(ReadinessStrategy.POLL).build();
		BuildServerLauncher launcher = new BuildServerLauncher(options,
				spawner((process, target, version) -> process.exit(1)), ioPool);

		long started = System.nanoTime();
		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.connect(endpoint));

		Assertions.assertEquals(LauncherException.Kind.SPAWN_FAILED, e.getKind());
		Assertions.assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 5);
	}

	@Test
	void testPollingTimesOut() throws Exception {
		ClientOptions options = sentinelOptions().toBuilder()
				.readinessStrategy(ReadinessStrategy.POLL)
				.readinessTimeout(Duration.ofMillis(300))
				.build();
		BuildServerLauncher launcher = new BuildServerLauncher(options, spawner((p, t, v) -> {
		}), ioPool);

		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.connect(endpoint));

		Assertions.assertEquals(LauncherException.Kind.READINESS_TIMEOUT, e.getKind());
		Assertions.assertTrue(spawned.get(0).destroyed);
	}

	@Test
	void testMalformedAddressIsNotSpawnedFor() {
		BuildServerLauncher launcher = new BuildServerLauncher(sentinelOptions(), spawner((p, t, v) -> {
			throw new IOException("must not spawn");
		}), ioPool);

		TransportException e = Assertions.assertThrows(TransportException.class,
				() -> launcher.connect(TransportEndpoint.tcp("no-such-host.invalid", 4000)));

		Assertions.assertEquals(TransportException.Kind.MALFORMED_ADDRESS, e.getKind());
		Assertions.assertTrue(spawned.isEmpty());
	}

	@Test
	void testLauncherWithoutCommandCannotSpawn() {
		BuildServerLauncher launcher = BuildServerLauncher.forOptions(sentinelOptions(), ioPool);

		LauncherException e = Assertions.assertThrows(LauncherException.class, () -> launcher.restart(endpoint));

		Assertions.assertEquals(LauncherException.Kind.SPAWN_FAILED, e.getKind());
		Assertions.assertTrue(e.getMessage().contains("No server command configured"));
	}

	@Test
	void testBackoffDoublesUpToCap() {
		Assertions.assertEquals(100, BuildServerLauncher.nextBackoff(BuildServerLauncher.POLL_BASE_MILLIS));
		Assertions.assertEquals(BuildServerLauncher.POLL_CAP_MILLIS, BuildServerLauncher.nextBackoff(800));
		Assertions.assertEquals(BuildServerLauncher.POLL_CAP_MILLIS,
				BuildServerLauncher.nextBackoff(BuildServerLauncher.POLL_CAP_MILLIS));
	}

	@Test
	void testAnnouncedVersion() {
		Assertions.assertEquals("2.0.1",
				BuildServerLauncher.announcedVersion("bsp-server listening on tcp:127.0.0.1:4000 version=2.0.1"));
		Assertions.assertNull(BuildServerLauncher.announcedVersion("bsp-server listening on tcp:127.0.0.1:4000"));
	}

	@Test
	void testProcessSpawnerAppendsEndpointAndVersion() {
		ProcessServerSpawner processSpawner = new ProcessServerSpawner(
				Arrays.asList("bsp-engine", "--verbose"), null);

		List<String> command = processSpawner.command(TransportEndpoint.tcp("127.0.0.1", 4000), "1.0.0");

		Assertions.assertEquals("bsp-engine", command.get(0));
		Assertions.assertEquals("--verbose", command.get(1));
		Assertions.assertEquals("--version", command.get(command.size() - 2));
		Assertions.assertEquals("1.0.0", command.get(command.size() - 1));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new ProcessServerSpawner(Collections.<String>emptyList(), null));
	}

	@FunctionalInterface
	private interface ProcessScript {
		void run(ScriptedProcess process, TransportEndpoint target, String versionToken) throws Exception;
	}
}

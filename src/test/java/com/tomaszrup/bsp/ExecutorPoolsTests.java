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
package com.tomaszrup.bsp;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import com.tomaszrup.bsp.util.MdcSessionContext;

/**
 * Tests for {@link ExecutorPools}: pool creation, session MDC propagation
 * across thread boundaries, the compilation semaphore, and shutdown.
 */
class ExecutorPoolsTests {

	private ExecutorPools pools;

	@BeforeEach
	void setup() {
		pools = new ExecutorPools(3);
		MDC.clear();
	}

	@AfterEach
	void tearDown() {
		pools.shutdownAll();
		MDC.clear();
	}

	@Test
	void testPoolsAreNotNull() {
		Assertions.assertNotNull(pools.getSchedulingPool());
		Assertions.assertNotNull(pools.getIoPool());
		Assertions.assertNotNull(pools.getDecodePool());
		Assertions.assertNotNull(pools.getRequestPool());
		Assertions.assertTrue(pools.getCompilationPermits().availablePermits() > 0,
				"Should have at least 1 compilation permit");
	}

	// ------------------------------------------------------------------
	// MDC propagation
	// ------------------------------------------------------------------

	@Test
	void testIoPoolPropagatesMdcViaExecute() throws Exception {
		MdcSessionContext.setSession("tcp-127.0.0.1-5010");
		AtomicReference<String> captured = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);

		pools.getIoPool().execute(() -> {
			captured.set(MDC.get(MdcSessionContext.MDC_KEY));
			latch.countDown();
		});

		Assertions.assertTrue(latch.await(5, TimeUnit.SECONDS), "Task should complete");
		Assertions.assertEquals("tcp-127.0.0.1-5010", captured.get());
	}

	@Test
	void testDecodePoolPropagatesMdcViaSubmitCallable() throws Exception {
		MdcSessionContext.setSession("decode-session");

		Future<String> future = pools.getDecodePool().submit(() -> MDC.get(MdcSessionContext.MDC_KEY));

		Assertions.assertEquals("decode-session", future.get(5, TimeUnit.SECONDS));
	}

	@Test
	void testRequestPoolPropagatesMdcViaSubmitRunnable() throws Exception {
		MdcSessionContext.setSession("request-session");
		AtomicReference<String> captured = new AtomicReference<>();

		Future<?> future = pools.getRequestPool().submit(() -> {
			captured.set(MDC.get(MdcSessionContext.MDC_KEY));
		});

		future.get(5, TimeUnit.SECONDS);
		Assertions.assertEquals("request-session", captured.get());
	}

	@Test
	void testSchedulingPoolPropagatesMdcViaScheduleCallable() throws Exception {
		MdcSessionContext.setSession("scheduled-session");

		ScheduledFuture<String> future = pools.getSchedulingPool().schedule(
				() -> MDC.get(MdcSessionContext.MDC_KEY), 10, TimeUnit.MILLISECONDS);

		Assertions.assertEquals("scheduled-session", future.get(5, TimeUnit.SECONDS));
	}

	@Test
	void testSchedulingPoolPropagatesMdcViaScheduleAtFixedRate() throws Exception {
		MdcSessionContext.setSession("watchdog-session");
		AtomicReference<String> captured = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);

		ScheduledFuture<?> future = pools.getSchedulingPool().scheduleAtFixedRate(() -> {
			captured.set(MDC.get(MdcSessionContext.MDC_KEY));
			latch.countDown();
		}, 10, 1000, TimeUnit.MILLISECONDS);

		Assertions.assertTrue(latch.await(5, TimeUnit.SECONDS), "Fixed-rate task should execute");
		future.cancel(true);
		Assertions.assertEquals("watchdog-session", captured.get());
	}

	@Test
	void testMdcIsRestoredInWorkerThreadAfterTask() throws Exception {
		MdcSessionContext.setSession("first-session");
		pools.getDecodePool().submit(() -> { }).get(5, TimeUnit.SECONDS);

		MdcSessionContext.setSession("second-session");
		Future<String> second = pools.getDecodePool().submit(() -> MDC.get(MdcSessionContext.MDC_KEY));

		Assertions.assertEquals("second-session", second.get(5, TimeUnit.SECONDS),
				"Second task should see its own MDC context, not the first task's");
	}

	@Test
	void testNoMdcContextPropagatesAsNull() throws Exception {
		Future<String> future = pools.getIoPool().submit(() -> MDC.get(MdcSessionContext.MDC_KEY));

		Assertions.assertNull(future.get(5, TimeUnit.SECONDS), "Task should see null when caller has no MDC");
	}

	// ------------------------------------------------------------------
	// Compilation semaphore
	// ------------------------------------------------------------------

	@Test
	void testCompilationPermitsAcquireAndRelease() throws Exception {
		Semaphore permits = pools.getCompilationPermits();
		int initial = permits.availablePermits();

		permits.acquire();
		Assertions.assertEquals(initial - 1, permits.availablePermits());

		permits.release();
		Assertions.assertEquals(initial, permits.availablePermits());
	}

	// ------------------------------------------------------------------
	// Shutdown
	// ------------------------------------------------------------------

	@Test
	void testShutdownAllTerminatesPools() {
		ExecutorService ioPool = pools.getIoPool();
		ScheduledExecutorService schedulingPool = pools.getSchedulingPool();
		ExecutorService decodePool = pools.getDecodePool();
		ExecutorService requestPool = pools.getRequestPool();

		pools.shutdownAll();

		Assertions.assertTrue(ioPool.isShutdown());
		Assertions.assertTrue(schedulingPool.isShutdown());
		Assertions.assertTrue(decodePool.isShutdown());
		Assertions.assertTrue(requestPool.isShutdown());
	}

	@Test
	void testShutdownAllRejectsNewTasks() {
		pools.shutdownAll();

		Assertions.assertThrows(RejectedExecutionException.class, () -> pools.getDecodePool().submit(() -> { }),
				"Decode pool should reject tasks after shutdown");
	}

	@Test
	void testShutdownAllIsIdempotent() {
		pools.shutdownAll();
		Assertions.assertDoesNotThrow(() -> pools.shutdownAll());
	}

	@Test
	void testPoolThreadsAreDaemons() throws Exception {
		Future<Boolean> io = pools.getIoPool().submit(() -> Thread.currentThread().isDaemon());
		ScheduledFuture<Boolean> scheduled = pools.getSchedulingPool().schedule(
				() -> Thread.currentThread().isDaemon(), 1, TimeUnit.MILLISECONDS);

		Assertions.assertTrue(io.get(5, TimeUnit.SECONDS), "I/O pool threads should be daemon threads");
		Assertions.assertTrue(scheduled.get(5, TimeUnit.SECONDS), "Scheduling threads should be daemon threads");
	}
}

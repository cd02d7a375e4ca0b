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
package com.tomaszrup.bsp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.util.MdcSessionContext;

/**
 * Thread pools shared by the client and server sides of the engine.
 *
 * <ul>
 *   <li><b>Scheduling pool</b>: request timeouts, idle watchdogs and
 *       readiness polling. Tasks are short and hand real work to the other
 *       pools.</li>
 *   <li><b>I/O pool</b>: unbounded, one long-lived thread per connection
 *       listener and per spawned process output pump.</li>
 *   <li><b>Decode pool</b>: fixed-size pool for analysis decoding, so a
 *       slow decode never runs on a connection's listener thread.</li>
 *   <li><b>Request pool</b>: server-side request handlers and compile
 *       runs.</li>
 * </ul>
 *
 * <p>Every pool propagates the caller's SLF4J MDC. Create one instance per
 * client or server, pass it to all components, and call
 * {@link #shutdownAll()} when done.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    public static final int DEFAULT_DECODE_THREADS = 2;

    private final ScheduledExecutorService schedulingPool;
    private final ExecutorService ioPool;
    private final ExecutorService decodePool;
    private final ExecutorService requestPool;

    /**
     * Caps the number of compile runs executing at once on the server,
     * independently of how many requests are in flight.
     */
    private final Semaphore compilationPermits;

    public ExecutorPools() {
        this(DEFAULT_DECODE_THREADS);
    }

    public ExecutorPools(int decodeThreads) {
        this.schedulingPool = new MdcScheduledExecutorService(
                Executors.newScheduledThreadPool(2, daemonThreads("bsp-scheduler")));
        this.ioPool = new MdcExecutorService(Executors.newCachedThreadPool(daemonThreads("bsp-io")));
        this.decodePool = new MdcExecutorService(
                Executors.newFixedThreadPool(Math.max(1, decodeThreads), daemonThreads("bsp-decode")));
        this.requestPool = new MdcExecutorService(Executors.newFixedThreadPool(
                Math.max(2, Math.min(4, Runtime.getRuntime().availableProcessors())),
                daemonThreads("bsp-request")));

        int permits = Math.max(1, Math.min(2, Runtime.getRuntime().availableProcessors()));
        this.compilationPermits = new Semaphore(permits);
        logger.debug("Executor pools created (decodeThreads={}, compilationPermits={})",
                Math.max(1, decodeThreads), permits);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public ScheduledExecutorService getSchedulingPool() {
        return schedulingPool;
    }

    /** Unbounded pool for threads that block on a stream for their whole life. */
    public ExecutorService getIoPool() {
        return ioPool;
    }

    public ExecutorService getDecodePool() {
        return decodePool;
    }

    public ExecutorService getRequestPool() {
        return requestPool;
    }

    /**
     * Callers {@code acquire()} before compiling and {@code release()} in a
     * {@code finally} block afterwards.
     */
    public Semaphore getCompilationPermits() {
        return compilationPermits;
    }

    /**
     * Shut down all pools, waiting up to 5 seconds for each.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        schedulingPool.shutdownNow();
        ioPool.shutdownNow();
        decodePool.shutdownNow();
        requestPool.shutdownNow();
        try {
            schedulingPool.awaitTermination(5, TimeUnit.SECONDS);
            ioPool.awaitTermination(5, TimeUnit.SECONDS);
            decodePool.awaitTermination(5, TimeUnit.SECONDS);
            requestPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -----------------------------------------------------------------------
    // MDC-propagating executor wrappers
    // -----------------------------------------------------------------------

    private static class MdcExecutorService implements ExecutorService {
        protected final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcSessionContext.wrap(command));
        }

        @Override public Future<?> submit(Runnable task) {
            return delegate.submit(MdcSessionContext.wrap(task));
        }

        @Override public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(MdcSessionContext.wrap(task), result);
        }

        @Override public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(MdcSessionContext.wrap(task));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks)
                throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks), timeout, unit);
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapAll(tasks));
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapAll(tasks), timeout, unit);
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }

        private static <T> Collection<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
            List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                wrapped.add(MdcSessionContext.wrap(task));
            }
            return wrapped;
        }
    }

    private static class MdcScheduledExecutorService extends MdcExecutorService
            implements ScheduledExecutorService {
        private final ScheduledExecutorService scheduledDelegate;

        MdcScheduledExecutorService(ScheduledExecutorService delegate) {
            super(delegate);
            this.scheduledDelegate = delegate;
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcSessionContext.wrap(command), delay, unit);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcSessionContext.wrap(callable), delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay,
                long period, TimeUnit unit) {
            return scheduledDelegate.scheduleAtFixedRate(
                    MdcSessionContext.wrap(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay,
                long delay, TimeUnit unit) {
            return scheduledDelegate.scheduleWithFixedDelay(
                    MdcSessionContext.wrap(command), initialDelay, delay, unit);
        }
    }
}

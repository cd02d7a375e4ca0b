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
package com.tomaszrup.bsp.session;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.MessageConsumer;
import org.eclipse.lsp4j.jsonrpc.MessageIssueException;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.Message;
import org.eclipse.lsp4j.jsonrpc.messages.NotificationMessage;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.BspException;
import com.tomaszrup.bsp.ErrorCode;
import com.tomaszrup.bsp.ExecutorPools;
import com.tomaszrup.bsp.cache.CompileResultCache;
import com.tomaszrup.bsp.cache.FileAnalysisDecoder;
import com.tomaszrup.bsp.config.ClientOptions;
import com.tomaszrup.bsp.protocol.BspMethods;
import com.tomaszrup.bsp.protocol.BuildClientCapabilities;
import com.tomaszrup.bsp.protocol.BuildServer;
import com.tomaszrup.bsp.protocol.BuildServerCapabilities;
import com.tomaszrup.bsp.protocol.BuildTarget;
import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;
import com.tomaszrup.bsp.protocol.CompileParams;
import com.tomaszrup.bsp.protocol.CompileResult;
import com.tomaszrup.bsp.protocol.DependencySourcesItem;
import com.tomaszrup.bsp.protocol.DependencySourcesResult;
import com.tomaszrup.bsp.protocol.InitializeBuildParams;
import com.tomaszrup.bsp.protocol.InitializeBuildResult;
import com.tomaszrup.bsp.protocol.OptionsItem;
import com.tomaszrup.bsp.protocol.OptionsResult;
import com.tomaszrup.bsp.protocol.SourcesItem;
import com.tomaszrup.bsp.protocol.SourcesResult;
import com.tomaszrup.bsp.protocol.TargetsParams;
import com.tomaszrup.bsp.protocol.WorkspaceBuildTargetsResult;
import com.tomaszrup.bsp.transport.Connection;
import com.tomaszrup.bsp.util.MdcSessionContext;

/**
 * Client side of one BSP connection.
 *
 * <p>Runs lsp4j's JSON-RPC machinery over a {@link Connection}, tracks the
 * session lifecycle ({@link SessionState}) and turns server notifications
 * into {@link BuildNotification}s for the {@link CompileResultCache} and
 * the {@link BuildEventSink}.</p>
 *
 * <p>Requests issued before {@link #initialize} has completed are queued
 * and sent in arrival order once the handshake succeeds. Queries are
 * bounded by {@link ClientOptions#getRequestTimeout()} or by the timeout
 * the caller passes, and cancelling the future a query returns cancels the
 * request on the server. The compile acknowledgement is bounded only by
 * {@link ClientOptions#getCompileTimeout()}. When the connection
 * goes away, for whatever reason, every pending or queued request and
 * every cache await fails with {@link ConnectionLostException}.</p>
 */
public class BuildClientSession implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(BuildClientSession.class);

    private static final Set<String> OUTGOING_NOTIFICATIONS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList(BspMethods.BUILD_INITIALIZED, BspMethods.BUILD_EXIT)));

    private static final String UNKNOWN_TARGET_MESSAGE = "Unknown build target";

    private final Connection connection;
    private final ClientOptions options;
    private final ExecutorPools pools;
    private final CompileResultCache cache;
    private final NotificationDispatcher dispatcher;

    private final Object lock = new Object();
    private SessionState state = SessionState.UNINITIALIZED;
    private final Deque<Runnable> queued = new ArrayDeque<>();
    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile BuildServer server;
    private volatile InitializeBuildResult serverInfo;
    private volatile ScheduledFuture<?> idleWatchdog;

    BuildClientSession(Connection connection, ClientOptions options, ExecutorPools pools,
            CompileResultCache cache, BuildEventSink sink) {
        this.connection = connection;
        this.options = options;
        this.pools = pools;
        this.cache = cache;
        this.dispatcher = new NotificationDispatcher(cache, sink != null ? sink : new LoggingBuildEventSink());
    }

    /**
     * Starts a session that logs server messages through
     * {@link LoggingBuildEventSink}.
     */
    public static BuildClientSession start(Connection connection, ClientOptions options, ExecutorPools pools) {
        return start(connection, options, pools, new LoggingBuildEventSink());
    }

    /**
     * Starts a session on {@code connection} with a file-backed compile
     * result cache.
     */
    public static BuildClientSession start(Connection connection, ClientOptions options, ExecutorPools pools,
            BuildEventSink sink) {
        CompileResultCache cache = new CompileResultCache(new FileAnalysisDecoder(), pools.getDecodePool(),
                options.getMaxDecodedAnalyses());
        return start(connection, options, pools, cache, sink);
    }

    public static BuildClientSession start(Connection connection, ClientOptions options, ExecutorPools pools,
            CompileResultCache cache, BuildEventSink sink) {
        BuildClientSession session = new BuildClientSession(connection, options, pools, cache, sink);
        session.listen();
        return session;
    }

    private void listen() {
        Map<String, String> previous = MdcSessionContext.snapshot();
        MdcSessionContext.setSession(connection.getEndpoint());
        try {
            Launcher<BuildServer> launcher = new Launcher.Builder<BuildServer>()
                    .setLocalService(new SessionBuildClient(dispatcher))
                    .setRemoteInterface(BuildServer.class)
                    .setInput(connection.getInput())
                    .setOutput(connection.getOutput())
                    .setExecutorService(pools.getIoPool())
                    .validateMessages(true)
                    .wrapMessages(this::guardMessages)
                    .create();
            server = launcher.getRemoteProxy();
            startIdleWatchdog();
            connection.onTermination(this::onConnectionTerminated);
            Future<Void> listening = launcher.startListening();
            pools.getIoPool().execute(() -> watchListener(listening));
        } finally {
            MdcSessionContext.restore(previous);
        }
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    /**
     * Performs the {@code build/initialize} / {@code build/initialized}
     * handshake. A failed or incompatible handshake fails the connection.
     *
     * @return completes with the server's answer, or fails with
     *         {@link ProtocolException}, {@link RequestException} or
     *         {@link ConnectionLostException}
     */
    public CompletableFuture<InitializeBuildResult> initialize(ClientInfo clientInfo) {
        synchronized (lock) {
            if (state == SessionState.CLOSED) {
                return failed(connectionLost(BspMethods.BUILD_INITIALIZE + " issued after the session closed",
                        null));
            }
            if (state != SessionState.UNINITIALIZED) {
                return failed(new RequestException(ErrorCode.BAD_ARGUMENTS, BspMethods.BUILD_INITIALIZE,
                        "Session is already " + state));
            }
            state = SessionState.INITIALIZING;
        }
        connection.beginHandshake();
        InitializeBuildParams params = new InitializeBuildParams(clientInfo.getDisplayName(),
                clientInfo.getVersion(), BspMethods.BSP_VERSION, clientInfo.getRootUri(),
                new BuildClientCapabilities(clientInfo.getLanguageIds()));

        CompletableFuture<InitializeBuildResult> response = track(BspMethods.BUILD_INITIALIZE,
                options.getRequestTimeout());
        send(response, BspMethods.BUILD_INITIALIZE, s -> s.buildInitialize(params));

        CompletableFuture<InitializeBuildResult> result = new CompletableFuture<>();
        response.whenComplete((initializeResult, error) -> {
            if (error != null) {
                Throwable failure = RequestGuard.unwrap(error);
                connection.fail("Handshake failed: " + RequestGuard.summarize(failure), failure);
                result.completeExceptionally(failure);
                return;
            }
            try {
                validateHandshake(initializeResult);
            } catch (ProtocolException e) {
                connection.fail(e.getMessage(), e);
                result.completeExceptionally(e);
                return;
            }
            serverInfo = initializeResult;
            try {
                server.onBuildInitialized();
            } catch (RuntimeException e) {
                ConnectionLostException lost = new ConnectionLostException(
                        "Could not send " + BspMethods.BUILD_INITIALIZED, e);
                connection.fail(lost.getMessage(), e);
                result.completeExceptionally(lost);
                return;
            }
            connection.markReady();
            activate();
            logger.info("Connected to {} {} (BSP {})", initializeResult.getDisplayName(),
                    initializeResult.getVersion(), initializeResult.getBspVersion());
            result.complete(initializeResult);
        });
        return result;
    }

    static void validateHandshake(InitializeBuildResult result) throws ProtocolException {
        if (result == null) {
            throw new ProtocolException(ProtocolException.Kind.MALFORMED_HANDSHAKE,
                    "Empty " + BspMethods.BUILD_INITIALIZE + " result");
        }
        if (result.getBspVersion() == null || result.getVersion() == null || result.getCapabilities() == null) {
            throw new ProtocolException(ProtocolException.Kind.MALFORMED_HANDSHAKE,
                    "Handshake result lacks version or capabilities");
        }
        int serverMajor = BspMethods.majorVersion(result.getBspVersion());
        int clientMajor = BspMethods.majorVersion(BspMethods.BSP_VERSION);
        if (serverMajor != clientMajor) {
            throw new ProtocolException(ProtocolException.Kind.VERSION_INCOMPATIBLE,
                    "Server speaks BSP " + result.getBspVersion() + ", client speaks " + BspMethods.BSP_VERSION);
        }
    }

    private void activate() {
        synchronized (lock) {
            if (state != SessionState.INITIALIZING) {
                return;
            }
            state = SessionState.ACTIVE;
            // drained under the lock so later requests cannot overtake queued ones
            Runnable next;
            while ((next = queued.poll()) != null) {
                next.run();
            }
        }
    }

    /**
     * Sends {@code build/shutdown} and {@code build/exit}, then closes the
     * connection. A session that never became active is just closed.
     *
     * @return completes once the connection is closed
     */
    public CompletableFuture<Void> shutdown() {
        boolean active;
        synchronized (lock) {
            if (state == SessionState.SHUTTING_DOWN || state == SessionState.CLOSED) {
                return terminated;
            }
            active = state == SessionState.ACTIVE;
            state = SessionState.SHUTTING_DOWN;
        }
        if (!active) {
            close();
            return terminated;
        }
        CompletableFuture<Object> response = track(BspMethods.BUILD_SHUTDOWN, options.getRequestTimeout());
        send(response, BspMethods.BUILD_SHUTDOWN, BuildServer::buildShutdown);
        response.whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("{} failed: {}", BspMethods.BUILD_SHUTDOWN, RequestGuard.summarize(error));
            } else {
                try {
                    server.onBuildExit();
                } catch (RuntimeException e) {
                    logger.debug("Could not send {}: {}", BspMethods.BUILD_EXIT, e.getMessage());
                }
            }
            close();
        });
        return terminated;
    }

    /** Closes the connection without the shutdown handshake. */
    @Override
    public void close() {
        connection.close();
    }

    // -----------------------------------------------------------------------
    // Operations
    // -----------------------------------------------------------------------

    public CompletableFuture<List<BuildTarget>> listBuildTargets() {
        return listBuildTargets(options.getRequestTimeout());
    }

    public CompletableFuture<List<BuildTarget>> listBuildTargets(Duration timeout) {
        CompletableFuture<WorkspaceBuildTargetsResult> request = request(BspMethods.WORKSPACE_BUILD_TARGETS,
                timeout, BuildServer::workspaceBuildTargets);
        return cancelling(request.thenApply(result -> result != null && result.getTargets() != null
                ? result.getTargets()
                : Collections.<BuildTarget>emptyList()), request);
    }

    /** {@code buildTarget/scalacOptions} for one target. */
    public CompletableFuture<OptionsItem> getCompilerOptions(BuildTargetIdentifier target) {
        return getCompilerOptions(target, options.getRequestTimeout());
    }

    public CompletableFuture<OptionsItem> getCompilerOptions(BuildTargetIdentifier target, Duration timeout) {
        String method = BspMethods.BUILD_TARGET_SCALAC_OPTIONS;
        CompletableFuture<OptionsResult> request = request(method, timeout,
                s -> s.buildTargetScalacOptions(targets(target)));
        return cancelling(request.thenCompose(
                result -> single(method, target, result.getItems(), OptionsItem::getTarget)), request);
    }

    /** {@code buildTarget/javacOptions} for one target. */
    public CompletableFuture<OptionsItem> getJavacOptions(BuildTargetIdentifier target) {
        return getJavacOptions(target, options.getRequestTimeout());
    }

    public CompletableFuture<OptionsItem> getJavacOptions(BuildTargetIdentifier target, Duration timeout) {
        String method = BspMethods.BUILD_TARGET_JAVAC_OPTIONS;
        CompletableFuture<OptionsResult> request = request(method, timeout,
                s -> s.buildTargetJavacOptions(targets(target)));
        return cancelling(request.thenCompose(
                result -> single(method, target, result.getItems(), OptionsItem::getTarget)), request);
    }

    public CompletableFuture<SourcesItem> getSources(BuildTargetIdentifier target) {
        return getSources(target, options.getRequestTimeout());
    }

    public CompletableFuture<SourcesItem> getSources(BuildTargetIdentifier target, Duration timeout) {
        String method = BspMethods.BUILD_TARGET_SOURCES;
        CompletableFuture<SourcesResult> request = request(method, timeout,
                s -> s.buildTargetSources(targets(target)));
        return cancelling(request.thenCompose(
                result -> single(method, target, result.getItems(), SourcesItem::getTarget)), request);
    }

    public CompletableFuture<DependencySourcesItem> getDependencySources(BuildTargetIdentifier target) {
        return getDependencySources(target, options.getRequestTimeout());
    }

    public CompletableFuture<DependencySourcesItem> getDependencySources(BuildTargetIdentifier target,
            Duration timeout) {
        String method = BspMethods.BUILD_TARGET_DEPENDENCY_SOURCES;
        CompletableFuture<DependencySourcesResult> request = request(method, timeout,
                s -> s.buildTargetDependencySources(targets(target)));
        return cancelling(request.thenCompose(
                result -> single(method, target, result.getItems(), DependencySourcesItem::getTarget)), request);
    }

    public CompletableFuture<Void> reload() {
        return reload(options.getRequestTimeout());
    }

    public CompletableFuture<Void> reload(Duration timeout) {
        CompletableFuture<Object> request = request(BspMethods.WORKSPACE_RELOAD, timeout,
                BuildServer::workspaceReload);
        return cancelling(request.<Void>thenApply(ignored -> null), request);
    }

    /**
     * Starts a compile of {@code targets}. Outcomes are published into the
     * session's cache under the handle's origin id as the server reports
     * them. The acknowledgement is bounded only by
     * {@link ClientOptions#getCompileTimeout()}; callers wait on outcomes
     * with their own timeouts.
     *
     * @param originId correlation id, or {@code null} to generate one. A
     *                 compile whose id is still in flight is rejected with
     *                 {@link ErrorCode#BAD_ARGUMENTS}.
     */
    public CompileHandle compile(List<BuildTargetIdentifier> targets, String originId) {
        String origin = originId != null ? originId : UUID.randomUUID().toString();
        if (!cache.expect(origin, targets)) {
            return new CompileHandle(origin,
                    failed(new RequestException(ErrorCode.BAD_ARGUMENTS, BspMethods.BUILD_TARGET_COMPILE,
                            "A compile with origin id " + origin + " is still in flight")),
                    cache);
        }
        CompileParams params = new CompileParams(new ArrayList<>(targets), origin);
        CompletableFuture<CompileResult> acknowledgement = request(BspMethods.BUILD_TARGET_COMPILE,
                options.getCompileTimeout(), s -> s.buildTargetCompile(params));
        acknowledgement.whenComplete((result, error) -> {
            Throwable failure = error != null ? RequestGuard.unwrap(error) : null;
            if (failure instanceof ConnectionLostException) {
                return;
            }
            if (failure instanceof CancellationException || (failure instanceof RequestException
                    && (((RequestException) failure).getCode() == ErrorCode.CANCELLED
                            || ((RequestException) failure).getCode() == ErrorCode.TIMEOUT))) {
                cache.cancel(origin);
            } else {
                cache.complete(origin);
            }
        });
        return new CompileHandle(origin, acknowledgement, cache);
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public SessionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isActive() {
        return getState() == SessionState.ACTIVE && connection.isOpen();
    }

    public Connection getConnection() {
        return connection;
    }

    public CompileResultCache getCache() {
        return cache;
    }

    /** The server's handshake answer, or {@code null} before initialization. */
    public InitializeBuildResult getServerInfo() {
        return serverInfo;
    }

    public BuildServerCapabilities getServerCapabilities() {
        InitializeBuildResult info = serverInfo;
        return info != null ? info.getCapabilities() : null;
    }

    /** Completes once the connection has closed or failed. */
    public CompletableFuture<Void> getTermination() {
        return terminated;
    }

    // -----------------------------------------------------------------------
    // Request plumbing
    // -----------------------------------------------------------------------

    private <T> CompletableFuture<T> request(String method, Duration timeout,
            Function<BuildServer, CompletableFuture<T>> call) {
        CompletableFuture<T> result = track(method, timeout);
        boolean sendNow;
        synchronized (lock) {
            if (state == SessionState.SHUTTING_DOWN || state == SessionState.CLOSED) {
                result.completeExceptionally(connectionLost(method + " issued after the session " +
                        (state == SessionState.CLOSED ? "closed" : "started shutting down"), null));
                return result;
            }
            sendNow = state == SessionState.ACTIVE;
            if (!sendNow) {
                queued.add(() -> send(result, method, call));
            }
        }
        if (sendNow) {
            send(result, method, call);
        }
        return result;
    }

    /**
     * A future registered as pending and bounded by {@code timeout}. A zero
     * timeout leaves it unbounded.
     */
    private <T> CompletableFuture<T> track(String method, Duration timeout) {
        CompletableFuture<T> result = new CompletableFuture<>();
        pending.add(result);
        long timeoutMillis = timeout.toMillis();
        ScheduledFuture<?> timer = null;
        if (timeoutMillis > 0) {
            timer = pools.getSchedulingPool().schedule(
                    () -> result.completeExceptionally(new RequestException(ErrorCode.TIMEOUT, method,
                            method + " got no response within " + timeoutMillis + " ms")),
                    timeoutMillis, TimeUnit.MILLISECONDS);
        }
        ScheduledFuture<?> scheduled = timer;
        result.whenComplete((value, error) -> {
            pending.remove(result);
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        });
        return result;
    }

    /** Makes cancelling {@code derived} cancel the request it was derived from. */
    private static <T> CompletableFuture<T> cancelling(CompletableFuture<T> derived, CompletableFuture<?> request) {
        derived.whenComplete((value, error) -> {
            if (derived.isCancelled()) {
                request.cancel(false);
            }
        });
        return derived;
    }

    private <T> void send(CompletableFuture<T> result, String method,
            Function<BuildServer, CompletableFuture<T>> call) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<T> remote;
        try {
            remote = call.apply(server);
        } catch (RuntimeException e) {
            result.completeExceptionally(mapFailure(method, e));
            return;
        }
        result.whenComplete((value, error) -> {
            if (error != null && !remote.isDone() && connection.isOpen()) {
                cancelRemote(method, remote);
            }
        });
        remote.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(mapFailure(method, error));
            }
        });
    }

    private static void cancelRemote(String method, CompletableFuture<?> remote) {
        try {
            // lsp4j sends $/cancelRequest
            remote.cancel(true);
        } catch (RuntimeException e) {
            logger.debug("Could not cancel {}: {}", method, e.getMessage());
        }
    }

    BspException mapFailure(String method, Throwable error) {
        Throwable cause = RequestGuard.unwrap(error);
        if (cause instanceof BspException) {
            return (BspException) cause;
        }
        if (cause instanceof ResponseErrorException) {
            return fromResponseError(method, ((ResponseErrorException) cause).getResponseError(), cause);
        }
        if (cause instanceof CancellationException) {
            return new RequestException(ErrorCode.CANCELLED, method, method + " was cancelled", cause);
        }
        if (!connection.isOpen()) {
            return connectionLost(method + " failed: connection is gone", cause);
        }
        return new RequestException(ErrorCode.PROTOCOL_ERROR, method,
                method + " failed: " + RequestGuard.summarize(cause), cause);
    }

    static RequestException fromResponseError(String method, ResponseError error, Throwable cause) {
        String message = error.getMessage() != null ? error.getMessage() : method + " failed";
        int code = error.getCode();
        if (code == ResponseErrorCode.InvalidParams.getValue()) {
            ErrorCode errorCode = message.contains(UNKNOWN_TARGET_MESSAGE)
                    ? ErrorCode.UNKNOWN_TARGET : ErrorCode.BAD_ARGUMENTS;
            return new RequestException(errorCode, method, message, cause);
        }
        if (code == ResponseErrorCode.RequestCancelled.getValue()) {
            return new RequestException(ErrorCode.CANCELLED, method, message, cause);
        }
        if (code == ResponseErrorCode.MethodNotFound.getValue()) {
            return new RequestException(ErrorCode.PROTOCOL_ERROR, method,
                    "Server does not support " + method, cause);
        }
        return new RequestException(ErrorCode.PROTOCOL_ERROR, method, message + " (code " + code + ")", cause);
    }

    private <T> CompletableFuture<T> single(String method, BuildTargetIdentifier target, List<T> items,
            Function<T, BuildTargetIdentifier> targetOf) {
        if (items != null) {
            for (T item : items) {
                if (target.equals(targetOf.apply(item))) {
                    return CompletableFuture.completedFuture(item);
                }
            }
        }
        return failed(new RequestException(ErrorCode.UNKNOWN_TARGET, method,
                "Server returned no " + method + " item for " + target));
    }

    private static TargetsParams targets(BuildTargetIdentifier target) {
        return new TargetsParams(Collections.singletonList(target));
    }

    private ConnectionLostException connectionLost(String message, Throwable cause) {
        String reason = connection.getFailureReason();
        return new ConnectionLostException(reason != null ? message + " (" + reason + ")" : message, cause);
    }

    private static <T> CompletableFuture<T> failed(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    // -----------------------------------------------------------------------
    // Connection supervision
    // -----------------------------------------------------------------------

    /**
     * Intercepts messages in both directions: drops inbound notifications
     * with unknown methods after reporting them as
     * {@link BuildNotification.Unrecognized}, and fails the connection on
     * inbound messages that do not validate.
     */
    private MessageConsumer guardMessages(MessageConsumer next) {
        return message -> {
            if (message instanceof NotificationMessage) {
                NotificationMessage notification = (NotificationMessage) message;
                if (isUnknownInbound(notification.getMethod())) {
                    dispatcher.dispatch(new BuildNotification.Unrecognized(notification.getMethod(),
                            notification.getParams()));
                    return;
                }
            }
            try {
                next.consume(message);
            } catch (MessageIssueException e) {
                if (isInbound(message)) {
                    connection.fail("Invalid message from build server: " + e.getMessage(),
                            new ProtocolException(ProtocolException.Kind.MALFORMED_MESSAGE, e.getMessage(), e));
                }
                throw e;
            }
        };
    }

    private static boolean isUnknownInbound(String method) {
        return method != null
                && !BspMethods.CLIENT_NOTIFICATIONS.contains(method)
                && !OUTGOING_NOTIFICATIONS.contains(method)
                && !method.startsWith("$/");
    }

    private static boolean isInbound(Message message) {
        if (message instanceof ResponseMessage) {
            return true;
        }
        return message instanceof NotificationMessage
                && BspMethods.CLIENT_NOTIFICATIONS.contains(((NotificationMessage) message).getMethod());
    }

    private void watchListener(Future<Void> listening) {
        Throwable failure = null;
        try {
            listening.get();
        } catch (ExecutionException e) {
            failure = e.getCause();
        } catch (CancellationException e) {
            failure = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        }
        if (!connection.isOpen()) {
            return;
        }
        if (getState() == SessionState.SHUTTING_DOWN) {
            connection.close();
        } else if (failure != null) {
            connection.fail("Listener stopped: " + RequestGuard.summarize(failure), failure);
        } else {
            connection.fail("Build server closed the connection", null);
        }
    }

    private void startIdleWatchdog() {
        long idleMillis = options.getIdleTimeout().toMillis();
        if (idleMillis <= 0) {
            return;
        }
        long period = Math.max(50L, Math.min(1000L, idleMillis / 4));
        idleWatchdog = pools.getSchedulingPool().scheduleAtFixedRate(() -> {
            long silentMillis = System.currentTimeMillis() - connection.getLastActivityMillis();
            if (silentMillis >= idleMillis && connection.isOpen()) {
                connection.fail("No traffic for " + silentMillis + " ms (idle timeout " + idleMillis + " ms)",
                        null);
            }
        }, period, period, TimeUnit.MILLISECONDS);
    }

    private void onConnectionTerminated(Connection terminatedConnection) {
        synchronized (lock) {
            state = SessionState.CLOSED;
            queued.clear();
        }
        ScheduledFuture<?> watchdog = idleWatchdog;
        if (watchdog != null) {
            watchdog.cancel(false);
        }
        String reason = terminatedConnection.getFailureReason();
        ConnectionLostException lost = new ConnectionLostException(
                reason != null ? reason : "Connection to " + terminatedConnection.getEndpoint() + " closed",
                terminatedConnection.getFailureCause());
        // the cache first, so acknowledgements failing below find their origins already lost
        cache.connectionLost(lost);
        dispatcher.connectionLost();
        for (CompletableFuture<?> future : new ArrayList<>(pending)) {
            future.completeExceptionally(lost);
        }
        if (reason != null) {
            logger.warn("Session on {} lost: {}", terminatedConnection.getEndpoint(), reason);
        } else {
            logger.debug("Session on {} closed", terminatedConnection.getEndpoint());
        }
        terminated.complete(null);
    }
}

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
package com.tomaszrup.bsp.server;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.eclipse.lsp4j.jsonrpc.CompletableFutures;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.ExecutorPools;
import com.tomaszrup.bsp.protocol.BspMethods;
import com.tomaszrup.bsp.protocol.BuildClient;
import com.tomaszrup.bsp.protocol.BuildServer;
import com.tomaszrup.bsp.protocol.BuildServerCapabilities;
import com.tomaszrup.bsp.protocol.BuildTargetEvent;
import com.tomaszrup.bsp.protocol.BuildTargetEventKind;
import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;
import com.tomaszrup.bsp.protocol.CompileParams;
import com.tomaszrup.bsp.protocol.CompileProvider;
import com.tomaszrup.bsp.protocol.CompileReport;
import com.tomaszrup.bsp.protocol.CompileResult;
import com.tomaszrup.bsp.protocol.CompileTask;
import com.tomaszrup.bsp.protocol.DependencySourcesItem;
import com.tomaszrup.bsp.protocol.DependencySourcesResult;
import com.tomaszrup.bsp.protocol.DidChangeBuildTarget;
import com.tomaszrup.bsp.protocol.InitializeBuildParams;
import com.tomaszrup.bsp.protocol.InitializeBuildResult;
import com.tomaszrup.bsp.protocol.LogMessageParams;
import com.tomaszrup.bsp.protocol.OptionsItem;
import com.tomaszrup.bsp.protocol.OptionsResult;
import com.tomaszrup.bsp.protocol.ProtocolJson;
import com.tomaszrup.bsp.protocol.PublishDiagnosticsParams;
import com.tomaszrup.bsp.protocol.SourceItem;
import com.tomaszrup.bsp.protocol.SourcesItem;
import com.tomaszrup.bsp.protocol.SourcesResult;
import com.tomaszrup.bsp.protocol.StatusCode;
import com.tomaszrup.bsp.protocol.TargetsParams;
import com.tomaszrup.bsp.protocol.TaskDataKind;
import com.tomaszrup.bsp.protocol.TaskFinishParams;
import com.tomaszrup.bsp.protocol.TaskId;
import com.tomaszrup.bsp.protocol.TaskStartParams;
import com.tomaszrup.bsp.protocol.WorkspaceBuildTargetsResult;
import com.tomaszrup.bsp.transport.Connection;
import com.tomaszrup.bsp.util.MdcSessionContext;

/**
 * Server side of one BSP connection: answers requests from the current
 * {@link BuildTargetGraph} and drives the {@link CompilationEngine}.
 *
 * <p>Handlers run on the request pool so the connection's listener thread
 * is never blocked. Concurrent compiles, across all sessions sharing the
 * {@link ExecutorPools}, are limited by its compilation permits.</p>
 */
public class BuildServerSession implements BuildServer {

    private static final Logger logger = LoggerFactory.getLogger(BuildServerSession.class);

    public static final String SERVER_NAME = "bsp-engine";
    static final String UNKNOWN_TARGET_MESSAGE = "Unknown build target: ";
    private static final List<String> LANGUAGE_IDS = Arrays.asList("scala", "java");
    private static final long PERMIT_POLL_MILLIS = 100;

    private final Connection connection;
    private final GraphSource graphSource;
    private final CompilationEngine engine;
    private final ExecutorPools pools;
    private final String version;

    private final AtomicReference<BuildTargetGraph> graph = new AtomicReference<>(BuildTargetGraph.empty());
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile BuildClient client;

    public BuildServerSession(Connection connection, GraphSource graphSource, CompilationEngine engine,
            ExecutorPools pools, String version) {
        this.connection = connection;
        this.graphSource = graphSource;
        this.engine = engine;
        this.pools = pools;
        this.version = version;
    }

    /** Loads the graph and starts answering requests. */
    public BuildServerSession start() {
        Map<String, String> previous = MdcSessionContext.snapshot();
        MdcSessionContext.setSession(connection.getEndpoint());
        try {
            graph.set(loadGraph());
            Launcher<BuildClient> launcher = new Launcher.Builder<BuildClient>()
                    .setLocalService(this)
                    .setRemoteInterface(BuildClient.class)
                    .setInput(connection.getInput())
                    .setOutput(connection.getOutput())
                    .setExecutorService(pools.getIoPool())
                    .validateMessages(true)
                    .create();
            client = launcher.getRemoteProxy();
            connection.onTermination(c -> terminated.complete(null));
            Future<Void> listening = launcher.startListening();
            pools.getIoPool().execute(() -> watchListener(listening));
            return this;
        } finally {
            MdcSessionContext.restore(previous);
        }
    }

    private void watchListener(Future<Void> listening) {
        try {
            listening.get();
        } catch (ExecutionException e) {
            logger.warn("Listener on {} stopped: {}", connection.getEndpoint(), e.getCause().getMessage());
        } catch (CancellationException e) {
            logger.debug("Listener on {} cancelled", connection.getEndpoint());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        connection.close();
    }

    /** Completes when the connection has closed. */
    public CompletableFuture<Void> getTermination() {
        return terminated;
    }

    public BuildTargetGraph getGraph() {
        return graph.get();
    }

    private BuildTargetGraph loadGraph() {
        try {
            return graphSource.load();
        } catch (IOException e) {
            logger.error("Could not load the build target graph: {}", e.getMessage());
            return BuildTargetGraph.empty();
        }
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    @Override
    public CompletableFuture<InitializeBuildResult> buildInitialize(InitializeBuildParams params) {
        logger.info("Client {} {} connected (BSP {})", params.getDisplayName(), params.getVersion(),
                params.getBspVersion());
        connection.beginHandshake();
        BuildServerCapabilities capabilities = new BuildServerCapabilities();
        capabilities.setCompileProvider(new CompileProvider(new ArrayList<>(LANGUAGE_IDS)));
        capabilities.setDependencySourcesProvider(true);
        capabilities.setCanReload(true);
        capabilities.setBuildTargetChangedProvider(true);
        initialized.set(true);
        return CompletableFuture.completedFuture(
                new InitializeBuildResult(SERVER_NAME, version, BspMethods.BSP_VERSION, capabilities));
    }

    @Override
    public void onBuildInitialized() {
        connection.markReady();
        logger.debug("Handshake complete");
    }

    @Override
    public CompletableFuture<Object> buildShutdown() {
        shutdownRequested.set(true);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onBuildExit() {
        if (!shutdownRequested.get()) {
            logger.warn("{} received without {}", BspMethods.BUILD_EXIT, BspMethods.BUILD_SHUTDOWN);
        }
        connection.close();
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    @Override
    public CompletableFuture<WorkspaceBuildTargetsResult> workspaceBuildTargets() {
        return handle(BspMethods.WORKSPACE_BUILD_TARGETS,
                current -> new WorkspaceBuildTargetsResult(current.getTargets()));
    }

    @Override
    public CompletableFuture<SourcesResult> buildTargetSources(TargetsParams params) {
        return handle(BspMethods.BUILD_TARGET_SOURCES, current -> {
            List<SourcesItem> items = new ArrayList<>();
            for (BuildTargetGraph.Node node : resolve(current, params.getTargets())) {
                List<SourceItem> sources = current.sources(node);
                items.add(new SourcesItem(node.getId(), sources));
            }
            return new SourcesResult(items);
        });
    }

    @Override
    public CompletableFuture<DependencySourcesResult> buildTargetDependencySources(TargetsParams params) {
        return handle(BspMethods.BUILD_TARGET_DEPENDENCY_SOURCES, current -> {
            List<DependencySourcesItem> items = new ArrayList<>();
            for (BuildTargetGraph.Node node : resolve(current, params.getTargets())) {
                items.add(new DependencySourcesItem(node.getId(), current.dependencySources(node)));
            }
            return new DependencySourcesResult(items);
        });
    }

    @Override
    public CompletableFuture<OptionsResult> buildTargetScalacOptions(TargetsParams params) {
        return handle(BspMethods.BUILD_TARGET_SCALAC_OPTIONS,
                current -> options(current, params, BuildTargetGraph.Node::getScalacOptions));
    }

    @Override
    public CompletableFuture<OptionsResult> buildTargetJavacOptions(TargetsParams params) {
        return handle(BspMethods.BUILD_TARGET_JAVAC_OPTIONS,
                current -> options(current, params, BuildTargetGraph.Node::getJavacOptions));
    }

    private static OptionsResult options(BuildTargetGraph current, TargetsParams params,
            Function<BuildTargetGraph.Node, List<String>> optionsOf) {
        List<OptionsItem> items = new ArrayList<>();
        for (BuildTargetGraph.Node node : resolve(current, params.getTargets())) {
            items.add(new OptionsItem(node.getId(), new ArrayList<>(optionsOf.apply(node)),
                    current.classpath(node), node.getClassDirectory()));
        }
        return new OptionsResult(items);
    }

    @Override
    public CompletableFuture<Object> workspaceReload() {
        return handle(BspMethods.WORKSPACE_RELOAD, current -> {
            BuildTargetGraph reloaded;
            try {
                reloaded = graphSource.load();
            } catch (IOException e) {
                throw new ResponseErrorException(new ResponseError(ResponseErrorCode.InternalError,
                        "Reload failed: " + e.getMessage(), null));
            }
            BuildTargetGraph previous = graph.getAndSet(reloaded);
            List<BuildTargetEvent> changes = changes(previous, reloaded);
            logger.info("Reloaded build targets: {} -> {} target(s)", previous.size(), reloaded.size());
            if (!changes.isEmpty()) {
                client.onBuildTargetDidChange(new DidChangeBuildTarget(changes));
            }
            return null;
        });
    }

    static List<BuildTargetEvent> changes(BuildTargetGraph previous, BuildTargetGraph next) {
        List<BuildTargetEvent> changes = new ArrayList<>();
        for (BuildTargetGraph.Node node : next.getNodes()) {
            BuildTargetEventKind kind = previous.find(node.getId()).isPresent()
                    ? BuildTargetEventKind.CHANGED : BuildTargetEventKind.CREATED;
            changes.add(new BuildTargetEvent(node.getId(), kind));
        }
        for (BuildTargetGraph.Node node : previous.getNodes()) {
            if (!next.find(node.getId()).isPresent()) {
                changes.add(new BuildTargetEvent(node.getId(), BuildTargetEventKind.DELETED));
            }
        }
        return changes;
    }

    // -----------------------------------------------------------------------
    // Compile
    // -----------------------------------------------------------------------

    @Override
    public CompletableFuture<CompileResult> buildTargetCompile(CompileParams params) {
        if (!initialized.get()) {
            return notInitialized(BspMethods.BUILD_TARGET_COMPILE);
        }
        BuildTargetGraph current = graph.get();
        return CompletableFutures.computeAsync(pools.getRequestPool(),
                cancelChecker -> compile(current, params.getTargets(), params.getOriginId(), cancelChecker));
    }

    private CompileResult compile(BuildTargetGraph current, List<BuildTargetIdentifier> targets,
            String originId, CancelChecker cancelChecker) {
        List<BuildTargetIdentifier> requested = new ArrayList<>();
        for (BuildTargetGraph.Node node : resolve(current, targets)) {
            requested.add(node.getId());
        }
        Semaphore permits = pools.getCompilationPermits();
        acquire(permits, cancelChecker);
        try {
            Set<BuildTargetIdentifier> broken = new HashSet<>();
            for (BuildTargetGraph.Node node : current.compileOrder(requested)) {
                cancelChecker.checkCanceled();
                boolean upstreamBroken = false;
                for (BuildTargetIdentifier dependency : node.getDependencies()) {
                    upstreamBroken |= broken.contains(dependency);
                }
                StatusCode status = upstreamBroken
                        ? skip(node, originId)
                        : compileTarget(current, node, originId, cancelChecker);
                if (status != StatusCode.OK) {
                    broken.add(node.getId());
                }
            }
            return new CompileResult(originId, broken.isEmpty() ? StatusCode.OK : StatusCode.ERROR);
        } finally {
            permits.release();
        }
    }

    private static void acquire(Semaphore permits, CancelChecker cancelChecker) {
        try {
            while (!permits.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                cancelChecker.checkCanceled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a compilation slot");
        }
    }

    private StatusCode compileTarget(BuildTargetGraph current, BuildTargetGraph.Node node, String originId,
            CancelChecker cancelChecker) {
        TaskId taskId = startTask(node, originId);
        long started = System.currentTimeMillis();
        Path classDirectory = Paths.get(URI.create(node.getClassDirectory()));
        Path analysisOut = classDirectory.getParent() != null
                ? classDirectory.getParent().resolve("analysis").resolve(node.getName() + ".analysis")
                : classDirectory.resolveSibling(node.getName() + ".analysis");
        List<Path> sources = new ArrayList<>();
        for (SourceItem source : current.sources(node)) {
            sources.add(Paths.get(URI.create(source.getUri())));
        }
        List<String> options = new ArrayList<>(node.getScalacOptions());
        options.addAll(node.getJavacOptions());
        CompileInputs inputs = new CompileInputs(node.getId(), node.getName(), sources, current.classpath(node),
                classDirectory, options, analysisOut, cancelChecker::isCanceled);

        EngineResult result;
        try {
            result = engine.compile(inputs);
        } catch (IOException e) {
            logger.warn("Compiling {} failed: {}", node.getName(), e.getMessage());
            client.onBuildLogMessage(logMessage(MessageType.Error,
                    "Compiling " + node.getName() + " failed: " + e.getMessage(), originId));
            result = EngineResult.failed(Collections.<String, List<Diagnostic>>emptyMap());
        }

        for (Map.Entry<String, List<Diagnostic>> entry : result.getDiagnostics().entrySet()) {
            PublishDiagnosticsParams diagnostics = new PublishDiagnosticsParams(
                    new TextDocumentIdentifier(entry.getKey()), node.getId(), new ArrayList<>(entry.getValue()),
                    true);
            diagnostics.setOriginId(originId);
            client.onBuildPublishDiagnostics(diagnostics);
        }

        StatusCode status = result.isSuccess() ? StatusCode.OK : StatusCode.ERROR;
        CompileReport report = new CompileReport(node.getId(), result.countErrors(), result.countWarnings());
        report.setOriginId(originId);
        report.setTime(System.currentTimeMillis() - started);
        if (result.getAnalysisFile() != null) {
            report.setAnalysisOut(result.getAnalysisFile().toUri().toString());
        }
        finishTask(taskId, node, originId, status, report);
        logger.debug("Compiled {}: {} ({} error(s), {} warning(s))", node.getName(), status,
                report.getErrors(), report.getWarnings());
        return status;
    }

    /** A target downstream of a failed one: reported, never compiled. */
    private StatusCode skip(BuildTargetGraph.Node node, String originId) {
        TaskId taskId = startTask(node, originId);
        CompileReport report = new CompileReport(node.getId(), 0, 0);
        report.setOriginId(originId);
        report.setTime(0L);
        finishTask(taskId, node, originId, StatusCode.CANCELLED, report);
        logger.debug("Skipped {}: a dependency failed", node.getName());
        return StatusCode.CANCELLED;
    }

    private TaskId startTask(BuildTargetGraph.Node node, String originId) {
        TaskId taskId = new TaskId(UUID.randomUUID().toString());
        TaskStartParams start = new TaskStartParams(taskId);
        start.setOriginId(originId);
        start.setEventTime(System.currentTimeMillis());
        start.setMessage("Compiling " + node.getName());
        start.setDataKind(TaskDataKind.COMPILE_TASK);
        start.setData(ProtocolJson.toJson(new CompileTask(node.getId())));
        client.onBuildTaskStart(start);
        return taskId;
    }

    private void finishTask(TaskId taskId, BuildTargetGraph.Node node, String originId, StatusCode status,
            CompileReport report) {
        TaskFinishParams finish = new TaskFinishParams(taskId, status);
        finish.setOriginId(originId);
        finish.setEventTime(System.currentTimeMillis());
        finish.setMessage("Compiled " + node.getName());
        finish.setDataKind(TaskDataKind.COMPILE_REPORT);
        finish.setData(ProtocolJson.toJson(report));
        client.onBuildTaskFinish(finish);
    }

    private static LogMessageParams logMessage(MessageType type, String message, String originId) {
        LogMessageParams params = new LogMessageParams(type, message);
        params.setOriginId(originId);
        return params;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    /** Runs {@code body} against the current graph on the request pool. */
    private <T> CompletableFuture<T> handle(String method, Function<BuildTargetGraph, T> body) {
        if (!initialized.get()) {
            return notInitialized(method);
        }
        BuildTargetGraph current = graph.get();
        return CompletableFuture.supplyAsync(() -> body.apply(current), pools.getRequestPool());
    }

    private static <T> CompletableFuture<T> notInitialized(String method) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(new ResponseErrorException(new ResponseError(
                ResponseErrorCode.ServerNotInitialized, method + " before " + BspMethods.BUILD_INITIALIZE, null)));
        return future;
    }

    /**
     * Looks up every requested target.
     *
     * @throws ResponseErrorException {@code InvalidParams} naming the first
     *                                unknown target
     */
    static List<BuildTargetGraph.Node> resolve(BuildTargetGraph current, List<BuildTargetIdentifier> targets) {
        List<BuildTargetGraph.Node> nodes = new ArrayList<>();
        if (targets == null) {
            return nodes;
        }
        for (BuildTargetIdentifier target : targets) {
            BuildTargetGraph.Node node = current.find(target).orElse(null);
            if (node == null) {
                throw new ResponseErrorException(new ResponseError(ResponseErrorCode.InvalidParams,
                        UNKNOWN_TARGET_MESSAGE + (target != null ? target.getUri() : null), null));
            }
            nodes.add(node);
        }
        return nodes;
    }
}

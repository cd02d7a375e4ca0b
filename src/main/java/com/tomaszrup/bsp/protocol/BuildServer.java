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
package com.tomaszrup.bsp.protocol;

import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;

/**
 * Requests and notifications a build server accepts. The client uses this
 * interface as its remote proxy; the server implements it.
 */
public interface BuildServer {

    @JsonRequest(BspMethods.BUILD_INITIALIZE)
    CompletableFuture<InitializeBuildResult> buildInitialize(InitializeBuildParams params);

    @JsonNotification(BspMethods.BUILD_INITIALIZED)
    void onBuildInitialized();

    @JsonRequest(BspMethods.BUILD_SHUTDOWN)
    CompletableFuture<Object> buildShutdown();

    @JsonNotification(BspMethods.BUILD_EXIT)
    void onBuildExit();

    @JsonRequest(BspMethods.WORKSPACE_BUILD_TARGETS)
    CompletableFuture<WorkspaceBuildTargetsResult> workspaceBuildTargets();

    @JsonRequest(BspMethods.WORKSPACE_RELOAD)
    CompletableFuture<Object> workspaceReload();

    @JsonRequest(BspMethods.BUILD_TARGET_SOURCES)
    CompletableFuture<SourcesResult> buildTargetSources(TargetsParams params);

    @JsonRequest(BspMethods.BUILD_TARGET_DEPENDENCY_SOURCES)
    CompletableFuture<DependencySourcesResult> buildTargetDependencySources(TargetsParams params);

    @JsonRequest(BspMethods.BUILD_TARGET_SCALAC_OPTIONS)
    CompletableFuture<OptionsResult> buildTargetScalacOptions(TargetsParams params);

    @JsonRequest(BspMethods.BUILD_TARGET_JAVAC_OPTIONS)
    CompletableFuture<OptionsResult> buildTargetJavacOptions(TargetsParams params);

    @JsonRequest(BspMethods.BUILD_TARGET_COMPILE)
    CompletableFuture<CompileResult> buildTargetCompile(CompileParams params);
}

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

import org.eclipse.lsp4j.jsonrpc.services.JsonNotification;

/** Notifications a build server sends to its client. */
public interface BuildClient {

    @JsonNotification(BspMethods.BUILD_SHOW_MESSAGE)
    void onBuildShowMessage(ShowMessageParams params);

    @JsonNotification(BspMethods.BUILD_LOG_MESSAGE)
    void onBuildLogMessage(LogMessageParams params);

    @JsonNotification(BspMethods.BUILD_PUBLISH_DIAGNOSTICS)
    void onBuildPublishDiagnostics(PublishDiagnosticsParams params);

    @JsonNotification(BspMethods.BUILD_TASK_START)
    void onBuildTaskStart(TaskStartParams params);

    @JsonNotification(BspMethods.BUILD_TASK_PROGRESS)
    void onBuildTaskProgress(TaskProgressParams params);

    @JsonNotification(BspMethods.BUILD_TASK_FINISH)
    void onBuildTaskFinish(TaskFinishParams params);

    @JsonNotification(BspMethods.BUILD_TARGET_DID_CHANGE)
    void onBuildTargetDidChange(DidChangeBuildTarget params);
}

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

import com.tomaszrup.bsp.protocol.BuildClient;
import com.tomaszrup.bsp.protocol.DidChangeBuildTarget;
import com.tomaszrup.bsp.protocol.LogMessageParams;
import com.tomaszrup.bsp.protocol.PublishDiagnosticsParams;
import com.tomaszrup.bsp.protocol.ShowMessageParams;
import com.tomaszrup.bsp.protocol.TaskFinishParams;
import com.tomaszrup.bsp.protocol.TaskProgressParams;
import com.tomaszrup.bsp.protocol.TaskStartParams;

/** The client endpoint lsp4j calls for inbound notifications. */
class SessionBuildClient implements BuildClient {

    private final NotificationDispatcher dispatcher;

    SessionBuildClient(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void onBuildShowMessage(ShowMessageParams params) {
        dispatcher.dispatch(new BuildNotification.ShowMessage(params));
    }

    @Override
    public void onBuildLogMessage(LogMessageParams params) {
        dispatcher.dispatch(new BuildNotification.LogMessage(params));
    }

    @Override
    public void onBuildPublishDiagnostics(PublishDiagnosticsParams params) {
        dispatcher.dispatch(new BuildNotification.PublishDiagnostics(params));
    }

    @Override
    public void onBuildTaskStart(TaskStartParams params) {
        dispatcher.dispatch(new BuildNotification.TaskStart(params));
    }

    @Override
    public void onBuildTaskProgress(TaskProgressParams params) {
        dispatcher.dispatch(new BuildNotification.TaskProgress(params));
    }

    @Override
    public void onBuildTaskFinish(TaskFinishParams params) {
        dispatcher.dispatch(new BuildNotification.TaskFinish(params));
    }

    @Override
    public void onBuildTargetDidChange(DidChangeBuildTarget params) {
        dispatcher.dispatch(new BuildNotification.TargetDidChange(params));
    }
}

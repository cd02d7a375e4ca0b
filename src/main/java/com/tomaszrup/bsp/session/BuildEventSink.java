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

import com.tomaszrup.bsp.protocol.DidChangeBuildTarget;
import com.tomaszrup.bsp.protocol.LogMessageParams;
import com.tomaszrup.bsp.protocol.PublishDiagnosticsParams;
import com.tomaszrup.bsp.protocol.ShowMessageParams;

/**
 * Receives the notifications a session does not consume itself. Callbacks
 * run on the session's listener thread and must not block.
 */
public interface BuildEventSink {

    /** Ignores everything. */
    BuildEventSink NONE = new BuildEventSink() {
    };

    default void onShowMessage(ShowMessageParams params) {
    }

    default void onLogMessage(LogMessageParams params) {
    }

    default void onDiagnostics(PublishDiagnosticsParams params) {
    }

    default void onTargetsChanged(DidChangeBuildTarget params) {
    }

    /** Task start, progress and finish notifications, after the cache has seen them. */
    default void onTaskEvent(BuildNotification notification) {
    }
}

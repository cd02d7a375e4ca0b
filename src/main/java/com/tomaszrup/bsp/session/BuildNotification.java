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
import com.tomaszrup.bsp.protocol.TaskData;
import com.tomaszrup.bsp.protocol.TaskFinishParams;
import com.tomaszrup.bsp.protocol.TaskProgressParams;
import com.tomaszrup.bsp.protocol.TaskStartParams;

/**
 * A server-to-client notification, converted from its wire form into one
 * of a closed set of variants. {@link #getKind()} tells which one.
 */
public abstract class BuildNotification {

    public enum Kind {
        SHOW_MESSAGE,
        LOG_MESSAGE,
        PUBLISH_DIAGNOSTICS,
        TASK_START,
        TASK_PROGRESS,
        TASK_FINISH,
        TARGET_DID_CHANGE,
        UNRECOGNIZED
    }

    BuildNotification() {
    }

    public abstract Kind getKind();

    public static final class ShowMessage extends BuildNotification {
        private final ShowMessageParams params;

        public ShowMessage(ShowMessageParams params) {
            this.params = params;
        }

        public ShowMessageParams getParams() {
            return params;
        }

        @Override
        public Kind getKind() {
            return Kind.SHOW_MESSAGE;
        }
    }

    public static final class LogMessage extends BuildNotification {
        private final LogMessageParams params;

        public LogMessage(LogMessageParams params) {
            this.params = params;
        }

        public LogMessageParams getParams() {
            return params;
        }

        @Override
        public Kind getKind() {
            return Kind.LOG_MESSAGE;
        }
    }

    public static final class PublishDiagnostics extends BuildNotification {
        private final PublishDiagnosticsParams params;

        public PublishDiagnostics(PublishDiagnosticsParams params) {
            this.params = params;
        }

        public PublishDiagnosticsParams getParams() {
            return params;
        }

        @Override
        public Kind getKind() {
            return Kind.PUBLISH_DIAGNOSTICS;
        }
    }

    /** {@code build/taskStart} with its data already decoded. */
    public static final class TaskStart extends BuildNotification {
        private final TaskStartParams params;
        private final TaskData data;

        public TaskStart(TaskStartParams params) {
            this.params = params;
            this.data = TaskData.decode(params.getDataKind(), params.getData());
        }

        public TaskStartParams getParams() {
            return params;
        }

        public TaskData getData() {
            return data;
        }

        @Override
        public Kind getKind() {
            return Kind.TASK_START;
        }
    }

    public static final class TaskProgress extends BuildNotification {
        private final TaskProgressParams params;
        private final TaskData data;

        public TaskProgress(TaskProgressParams params) {
            this.params = params;
            this.data = TaskData.decode(params.getDataKind(), params.getData());
        }

        public TaskProgressParams getParams() {
            return params;
        }

        public TaskData getData() {
            return data;
        }

        @Override
        public Kind getKind() {
            return Kind.TASK_PROGRESS;
        }
    }

    /** {@code build/taskFinish} with its data already decoded. */
    public static final class TaskFinish extends BuildNotification {
        private final TaskFinishParams params;
        private final TaskData data;

        public TaskFinish(TaskFinishParams params) {
            this.params = params;
            this.data = TaskData.decode(params.getDataKind(), params.getData());
        }

        public TaskFinishParams getParams() {
            return params;
        }

        public TaskData getData() {
            return data;
        }

        @Override
        public Kind getKind() {
            return Kind.TASK_FINISH;
        }
    }

    public static final class TargetDidChange extends BuildNotification {
        private final DidChangeBuildTarget params;

        public TargetDidChange(DidChangeBuildTarget params) {
            this.params = params;
        }

        public DidChangeBuildTarget getParams() {
            return params;
        }

        @Override
        public Kind getKind() {
            return Kind.TARGET_DID_CHANGE;
        }
    }

    /** A notification whose method this client does not know. Ignored. */
    public static final class Unrecognized extends BuildNotification {
        private final String method;
        private final Object params;

        public Unrecognized(String method, Object params) {
            this.method = method;
            this.params = params;
        }

        public String getMethod() {
            return method;
        }

        public Object getParams() {
            return params;
        }

        @Override
        public Kind getKind() {
            return Kind.UNRECOGNIZED;
        }
    }
}

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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.cache.CompileResultCache;
import com.tomaszrup.bsp.cache.CompileStatus;
import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;
import com.tomaszrup.bsp.protocol.CompileReport;
import com.tomaszrup.bsp.protocol.PublishDiagnosticsParams;
import com.tomaszrup.bsp.protocol.TaskData;
import com.tomaszrup.bsp.protocol.TaskId;

/**
 * Routes {@link BuildNotification}s: compile task events and diagnostics
 * into the {@link CompileResultCache}, everything user-facing to the
 * {@link BuildEventSink}.
 *
 * <p>Servers that omit {@code originId} on {@code build/taskStart} are
 * handled by remembering which task ids started a compile; the origin is
 * then taken from the compile report when the task finishes.</p>
 */
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final CompileResultCache cache;
    private final BuildEventSink sink;
    private final Map<String, BuildTargetIdentifier> startedTasks = new ConcurrentHashMap<>();

    public NotificationDispatcher(CompileResultCache cache, BuildEventSink sink) {
        this.cache = cache;
        this.sink = sink;
    }

    public void dispatch(BuildNotification notification) {
        switch (notification.getKind()) {
            case SHOW_MESSAGE:
                sink.onShowMessage(((BuildNotification.ShowMessage) notification).getParams());
                break;
            case LOG_MESSAGE:
                sink.onLogMessage(((BuildNotification.LogMessage) notification).getParams());
                break;
            case PUBLISH_DIAGNOSTICS:
                onDiagnostics(((BuildNotification.PublishDiagnostics) notification).getParams());
                break;
            case TASK_START:
                onTaskStart((BuildNotification.TaskStart) notification);
                sink.onTaskEvent(notification);
                break;
            case TASK_PROGRESS:
                sink.onTaskEvent(notification);
                break;
            case TASK_FINISH:
                onTaskFinish((BuildNotification.TaskFinish) notification);
                sink.onTaskEvent(notification);
                break;
            case TARGET_DID_CHANGE:
                sink.onTargetsChanged(((BuildNotification.TargetDidChange) notification).getParams());
                break;
            default:
                BuildNotification.Unrecognized unknown = (BuildNotification.Unrecognized) notification;
                logger.debug("Ignoring unrecognized notification {}", unknown.getMethod());
                break;
        }
    }

    /** Forgets tasks that started on a connection which is now gone. */
    public void connectionLost() {
        if (!startedTasks.isEmpty()) {
            logger.debug("Dropping {} unfinished task(s)", startedTasks.size());
            startedTasks.clear();
        }
    }

    int unfinishedTasks() {
        return startedTasks.size();
    }

    private void onDiagnostics(PublishDiagnosticsParams params) {
        if (params.getOriginId() != null) {
            cache.addDiagnostics(params.getOriginId(), params.getBuildTarget(), params.getDiagnostics(),
                    Boolean.TRUE.equals(params.getReset()));
        }
        sink.onDiagnostics(params);
    }

    private void onTaskStart(BuildNotification.TaskStart start) {
        TaskData data = start.getData();
        if (data.getKind() != TaskData.Kind.COMPILE_TASK) {
            logUnrecognized(data);
            return;
        }
        BuildTargetIdentifier target = ((TaskData.OfCompileTask) data).getTarget();
        String taskId = taskId(start.getParams().getTaskId());
        if (taskId != null) {
            startedTasks.put(taskId, target);
        }
        String originId = start.getParams().getOriginId();
        if (originId != null) {
            cache.markStarted(originId, target);
        }
    }

    private void onTaskFinish(BuildNotification.TaskFinish finish) {
        TaskData data = finish.getData();
        String taskId = taskId(finish.getParams().getTaskId());
        BuildTargetIdentifier startedTarget = taskId != null ? startedTasks.remove(taskId) : null;
        if (data.getKind() != TaskData.Kind.COMPILE_REPORT) {
            logUnrecognized(data);
            return;
        }
        CompileReport report = ((TaskData.OfCompileReport) data).getReport();
        String originId = report.getOriginId() != null ? report.getOriginId() : finish.getParams().getOriginId();
        if (originId == null) {
            logger.debug("Compile report for {} carries no origin id; not cached", report.getTarget());
            return;
        }
        if (report.getTarget().equals(startedTarget)) {
            cache.markStarted(originId, report.getTarget());
        }
        CompileStatus status = CompileStatus.fromStatusCode(finish.getParams().getStatus());
        cache.publish(originId, report.getTarget(), status, analysisLocation(report));
    }

    private static URI analysisLocation(CompileReport report) {
        String analysisOut = report.getAnalysisOut();
        if (analysisOut == null || analysisOut.isEmpty()) {
            return null;
        }
        try {
            return new URI(analysisOut);
        } catch (URISyntaxException e) {
            logger.warn("Ignoring malformed analysis location {} for {}: {}", analysisOut, report.getTarget(),
                    e.getMessage());
            return null;
        }
    }

    private static String taskId(TaskId taskId) {
        return taskId != null ? taskId.getId() : null;
    }

    private static void logUnrecognized(TaskData data) {
        if (data instanceof TaskData.Unrecognized) {
            TaskData.Unrecognized unknown = (TaskData.Unrecognized) data;
            if (unknown.getProblem() != null) {
                logger.warn("Undecodable {} task data: {}", unknown.getDataKind(), unknown.getProblem());
            } else {
                logger.trace("Task data of kind {} not handled", unknown.getDataKind());
            }
        }
    }
}

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
package com.tomaszrup.bsp.session;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.bsp.cache.AnalysisContents;
import com.tomaszrup.bsp.cache.CompileOutcome;
import com.tomaszrup.bsp.cache.CompileResultCache;
import com.tomaszrup.bsp.cache.CompileStatus;
import com.tomaszrup.bsp.protocol.BuildTargetEvent;
import com.tomaszrup.bsp.protocol.BuildTargetEventKind;
import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;
import com.tomaszrup.bsp.protocol.CompileReport;
import com.tomaszrup.bsp.protocol.CompileTask;
import com.tomaszrup.bsp.protocol.DidChangeBuildTarget;
import com.tomaszrup.bsp.protocol.LogMessageParams;
import com.tomaszrup.bsp.protocol.ProtocolJson;
import com.tomaszrup.bsp.protocol.PublishDiagnosticsParams;
import com.tomaszrup.bsp.protocol.ShowMessageParams;
import com.tomaszrup.bsp.protocol.StatusCode;
import com.tomaszrup.bsp.protocol.TaskDataKind;
import com.tomaszrup.bsp.protocol.TaskFinishParams;
import com.tomaszrup.bsp.protocol.TaskId;
import com.tomaszrup.bsp.protocol.TaskStartParams;

class NotificationDispatcherTests {

	private static final Duration WAIT = Duration.ofSeconds(5);
	private static final BuildTargetIdentifier CORE = new BuildTargetIdentifier("file:///ws/core?id=core");
	private static final URI ANALYSIS = URI.create("file:///ws/analysis/core.analysis");

	private CompileResultCache cache;
	private RecordingSink sink;
	private NotificationDispatcher dispatcher;

	@BeforeEach
	void setup() {
		cache = new CompileResultCache(location -> Optional.of(
				new AnalysisContents(location, "decoded".getBytes(StandardCharsets.UTF_8))), Runnable::run, 4);
		sink = new RecordingSink();
		dispatcher = new NotificationDispatcher(cache, sink);
	}

	private static BuildNotification.TaskStart compileStarted(String taskId, String originId) {
		TaskStartParams params = new TaskStartParams(new TaskId(taskId));
		params.setOriginId(originId);
		params.setDataKind(TaskDataKind.COMPILE_TASK);
		params.setData(ProtocolJson.toJson(new CompileTask(CORE)));
		return new BuildNotification.TaskStart(params);
	}

	private static BuildNotification.TaskFinish compileFinished(String taskId, String originId, StatusCode status) {
		CompileReport report = new CompileReport(CORE, status == StatusCode.OK ? 0 : 1, 0);
		report.setOriginId(originId);
		report.setAnalysisOut(ANALYSIS.toString());
		TaskFinishParams params = new TaskFinishParams(new TaskId(taskId), status);
		params.setDataKind(TaskDataKind.COMPILE_REPORT);
		params.setData(ProtocolJson.toJson(report));
		return new BuildNotification.TaskFinish(params);
	}

	@Test
	void testCompileTaskEventsPublishIntoCache() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));

		dispatcher.dispatch(compileStarted("t1", "o1"));
		dispatcher.dispatch(compileFinished("t1", "o1", StatusCode.OK));

		Optional<AnalysisContents> contents = cache.await("o1", CORE, WAIT);
		Assertions.assertEquals(ANALYSIS, contents.get().getLocation());
		Assertions.assertEquals(2, sink.taskEvents.size());
	}

	@Test
	void testStartWithoutOriginIsMatchedByTaskId() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));

		dispatcher.dispatch(compileStarted("t1", null));
		dispatcher.dispatch(compileFinished("t1", "o1", StatusCode.ERROR));

		CompileOutcome outcome = cache.awaitOutcome("o1", CORE, WAIT);
		Assertions.assertEquals(CompileStatus.FAILED, outcome.getStatus());
		Assertions.assertNull(outcome.getAnalysisLocation());
	}

	@Test
	void testConnectionLossForgetsUnfinishedTasks() {
		cache.expect("o1", Arrays.asList(CORE));
		dispatcher.dispatch(compileStarted("t1", null));
		Assertions.assertEquals(1, dispatcher.unfinishedTasks());

		dispatcher.connectionLost();
		dispatcher.dispatch(compileFinished("t1", "o1", StatusCode.OK));

		Assertions.assertEquals(0, dispatcher.unfinishedTasks());
		Assertions.assertTrue(cache.outcomes("o1").isEmpty());
	}

	@Test
	void testFinishWithoutStartIsNotPublished() {
		cache.expect("o1", Arrays.asList(CORE));

		dispatcher.dispatch(compileFinished("t9", "o1", StatusCode.OK));

		Assertions.assertTrue(cache.outcomes("o1").isEmpty());
	}

	@Test
	void testDiagnosticsReachCacheAndSink() throws Exception {
		cache.expect("o1", Arrays.asList(CORE));
		dispatcher.dispatch(compileStarted("t1", "o1"));
		Diagnostic diagnostic = new Diagnostic(new Range(new Position(3, 2), new Position(3, 9)),
				"not found: value foo", DiagnosticSeverity.Error, "scalac");
		PublishDiagnosticsParams params = new PublishDiagnosticsParams(
				new TextDocumentIdentifier("file:///ws/core/src/A.scala"), CORE, Arrays.asList(diagnostic), true);
		params.setOriginId("o1");

		dispatcher.dispatch(new BuildNotification.PublishDiagnostics(params));
		dispatcher.dispatch(compileFinished("t1", "o1", StatusCode.ERROR));

		Assertions.assertEquals(1, sink.diagnostics.size());
		Assertions.assertEquals("not found: value foo",
				cache.awaitOutcome("o1", CORE, WAIT).getDiagnostics().get(0).getMessage());
	}

	@Test
	void testUserFacingNotificationsGoToSink() {
		dispatcher.dispatch(new BuildNotification.ShowMessage(new ShowMessageParams(MessageType.Warning, "slow")));
		dispatcher.dispatch(new BuildNotification.LogMessage(new LogMessageParams(MessageType.Log, "compiling")));
		dispatcher.dispatch(new BuildNotification.TargetDidChange(new DidChangeBuildTarget(
				Arrays.asList(new BuildTargetEvent(CORE, BuildTargetEventKind.CHANGED)))));

		Assertions.assertEquals(Arrays.asList("show:slow", "log:compiling"), sink.messages);
		Assertions.assertEquals(1, sink.changes.size());
	}

	@Test
	void testUnrecognizedNotificationIsIgnored() {
		dispatcher.dispatch(new BuildNotification.Unrecognized("build/somethingNew", null));

		Assertions.assertTrue(sink.messages.isEmpty());
		Assertions.assertTrue(sink.taskEvents.isEmpty());
	}

	@Test
	void testUnrecognizedTaskDataIsForwardedButNotCached() {
		cache.expect("o1", Arrays.asList(CORE));
		TaskStartParams params = new TaskStartParams(new TaskId("t1"));
		params.setOriginId("o1");
		params.setDataKind("test-task");

		dispatcher.dispatch(new BuildNotification.TaskStart(params));

		Assertions.assertEquals(1, sink.taskEvents.size());
		Assertions.assertTrue(cache.outcomes("o1").isEmpty());
	}

	private static final class RecordingSink implements BuildEventSink {
		final List<String> messages = new ArrayList<>();
		final List<PublishDiagnosticsParams> diagnostics = new ArrayList<>();
		final List<DidChangeBuildTarget> changes = new ArrayList<>();
		final List<BuildNotification> taskEvents = new ArrayList<>();

		@Override
		public void onShowMessage(ShowMessageParams params) {
			messages.add("show:" + params.getMessage());
		}

		@Override
		public void onLogMessage(LogMessageParams params) {
			messages.add("log:" + params.getMessage());
		}

		@Override
		public void onDiagnostics(PublishDiagnosticsParams params) {
			diagnostics.add(params);
		}

		@Override
		public void onTargetsChanged(DidChangeBuildTarget params) {
			changes.add(params);
		}

		@Override
		public void onTaskEvent(BuildNotification notification) {
			taskEvents.add(notification);
		}
	}
}

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

import java.util.Arrays;
import java.util.Collections;

import org.eclipse.lsp4j.MessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.tomaszrup.bsp.protocol.BuildTargetEvent;
import com.tomaszrup.bsp.protocol.BuildTargetEventKind;
import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;
import com.tomaszrup.bsp.protocol.DidChangeBuildTarget;
import com.tomaszrup.bsp.protocol.LogMessageParams;
import com.tomaszrup.bsp.protocol.ShowMessageParams;

class LoggingBuildEventSinkTests {

	private final LoggingBuildEventSink sink = new LoggingBuildEventSink();
	private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
	private Logger serverLog;
	private Level previousLevel;

	@BeforeEach
	void setup() {
		serverLog = (Logger) LoggerFactory.getLogger("bsp.server");
		previousLevel = serverLog.getLevel();
		serverLog.setLevel(Level.DEBUG);
		appender.start();
		serverLog.addAppender(appender);
	}

	@AfterEach
	void tearDown() {
		serverLog.detachAppender(appender);
		serverLog.setLevel(previousLevel);
	}

	private Level levelOf(int index) {
		return appender.list.get(index).getLevel();
	}

	@Test
	void testMessageTypesMapOntoLogLevels() {
		sink.onLogMessage(new LogMessageParams(MessageType.Error, "broken"));
		sink.onLogMessage(new LogMessageParams(MessageType.Warning, "deprecated"));
		sink.onShowMessage(new ShowMessageParams(MessageType.Info, "compiling"));
		sink.onLogMessage(new LogMessageParams(MessageType.Log, "detail"));
		sink.onLogMessage(new LogMessageParams(null, "untyped"));

		Assertions.assertEquals(5, appender.list.size());
		Assertions.assertEquals(Level.ERROR, levelOf(0));
		Assertions.assertEquals(Level.WARN, levelOf(1));
		Assertions.assertEquals(Level.INFO, levelOf(2));
		Assertions.assertEquals(Level.DEBUG, levelOf(3));
		Assertions.assertEquals(Level.INFO, levelOf(4));
		Assertions.assertEquals("broken", appender.list.get(0).getFormattedMessage());
	}

	@Test
	void testTargetChangesAreCounted() {
		BuildTargetIdentifier core = new BuildTargetIdentifier("file:///ws/core?id=core");
		sink.onTargetsChanged(new DidChangeBuildTarget(Arrays.asList(
				new BuildTargetEvent(core, BuildTargetEventKind.CHANGED))));
		sink.onTargetsChanged(new DidChangeBuildTarget(Collections.<BuildTargetEvent>emptyList()));

		Assertions.assertEquals("Build targets changed: 1", appender.list.get(0).getFormattedMessage());
		Assertions.assertEquals("Build targets changed: 0", appender.list.get(1).getFormattedMessage());
	}
}

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
package com.tomaszrup.bsp.protocol;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

class TaskDataTests {

	@Test
	void testDecodesCompileTask() {
		JsonObject data = JsonParser.parseString("{\"target\":{\"uri\":\"file:///ws/core?id=core\"}}")
				.getAsJsonObject();

		TaskData decoded = TaskData.decode(TaskDataKind.COMPILE_TASK, data);

		Assertions.assertEquals(TaskData.Kind.COMPILE_TASK, decoded.getKind());
		Assertions.assertEquals(new BuildTargetIdentifier("file:///ws/core?id=core"),
				((TaskData.OfCompileTask) decoded).getTarget());
	}

	@Test
	void testDecodesCompileReport() {
		CompileReport report = new CompileReport(new BuildTargetIdentifier("file:///ws/core?id=core"), 2, 1);
		report.setOriginId("o1");
		report.setAnalysisOut("file:///ws/analysis/core.analysis");

		TaskData decoded = TaskData.decode(TaskDataKind.COMPILE_REPORT, ProtocolJson.toJson(report));

		Assertions.assertEquals(TaskData.Kind.COMPILE_REPORT, decoded.getKind());
		CompileReport read = ((TaskData.OfCompileReport) decoded).getReport();
		Assertions.assertEquals("o1", read.getOriginId());
		Assertions.assertEquals(Integer.valueOf(2), read.getErrors());
		Assertions.assertEquals("file:///ws/analysis/core.analysis", read.getAnalysisOut());
	}

	@Test
	void testUnknownKindIsUnrecognizedWithoutProblem() {
		TaskData decoded = TaskData.decode("test-task", new JsonObject());

		Assertions.assertEquals(TaskData.Kind.UNRECOGNIZED, decoded.getKind());
		Assertions.assertEquals("test-task", ((TaskData.Unrecognized) decoded).getDataKind());
		Assertions.assertNull(((TaskData.Unrecognized) decoded).getProblem());
	}

	@Test
	void testMissingKindIsUnrecognized() {
		Assertions.assertEquals(TaskData.Kind.UNRECOGNIZED, TaskData.decode(null, null).getKind());
	}

	@Test
	void testKnownKindWithoutTargetReportsProblem() {
		TaskData decoded = TaskData.decode(TaskDataKind.COMPILE_REPORT, JsonParser.parseString("{\"errors\":0}"));

		Assertions.assertEquals(TaskData.Kind.UNRECOGNIZED, decoded.getKind());
		Assertions.assertNotNull(((TaskData.Unrecognized) decoded).getProblem());
	}
}

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
package com.tomaszrup.bsp.server;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;

class AnalysisWritingEngineTests {

	@TempDir
	Path workspace;

	private final AnalysisWritingEngine engine = new AnalysisWritingEngine();

	private CompileInputs inputs(Path... sources) {
		return new CompileInputs(new BuildTargetIdentifier("file:///ws/core?id=core"), "core", Arrays.asList(sources),
				Arrays.asList("file:///libs/scala-library.jar"), workspace.resolve("out/classes"),
				Collections.singletonList("-deprecation"), workspace.resolve("out/analysis/core.analysis"),
				() -> false);
	}

	@Test
	void testWritesAnalysisForExistingSources() throws Exception {
		Path sources = Files.createDirectories(workspace.resolve("src"));

		EngineResult result = engine.compile(inputs(sources));

		Assertions.assertTrue(result.isSuccess());
		Assertions.assertTrue(Files.isDirectory(workspace.resolve("out/classes")));
		String analysis = new String(Files.readAllBytes(result.getAnalysisFile()), StandardCharsets.UTF_8);
		Assertions.assertTrue(analysis.contains("classpath file:///libs/scala-library.jar"));
		Assertions.assertTrue(analysis.contains("option -deprecation"));
		Assertions.assertEquals(0, result.countErrors());
	}

	@Test
	void testMissingSourceFails() throws Exception {
		EngineResult result = engine.compile(inputs(workspace.resolve("nope")));

		Assertions.assertFalse(result.isSuccess());
		Assertions.assertEquals(1, result.countErrors());
		Assertions.assertEquals(AnalysisWritingEngine.DIAGNOSTIC_SOURCE, result.allDiagnostics().get(0).getSource());
		Assertions.assertFalse(Files.exists(workspace.resolve("out/analysis/core.analysis")));
	}
}

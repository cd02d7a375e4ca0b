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
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceConfigLoaderTests {

	@TempDir
	Path configDir;

	private final WorkspaceConfigLoader loader = new WorkspaceConfigLoader();

	private void write(String fileName, String json) throws Exception {
		Files.write(configDir.resolve(fileName), json.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void testLoadsProjectsInFileNameOrder() throws Exception {
		write("b-app.json", "{\"version\":\"1.0.0\",\"project\":{\"name\":\"app\",\"directory\":\"/ws/app\","
				+ "\"dependencies\":[\"core\"],\"scala\":{\"version\":\"2.13.12\",\"options\":[\"-Xfatal-warnings\"]}}}");
		write("a-core.json", "{\"version\":\"1.0.0\",\"project\":{\"name\":\"core\",\"directory\":\"/ws/core\"}}");

		List<ProjectConfig.Project> projects = loader.load(configDir);

		Assertions.assertEquals(2, projects.size());
		Assertions.assertEquals("core", projects.get(0).getName());
		Assertions.assertTrue(projects.get(0).getDependencies().isEmpty(), "absent lists read as empty");
		Assertions.assertEquals("-Xfatal-warnings", projects.get(1).getScala().getOptions().get(0));
	}

	@Test
	void testSkipsBrokenAndIncompleteFiles() throws Exception {
		write("broken.json", "{\"project\": {");
		write("nameless.json", "{\"project\":{\"directory\":\"/ws/x\"}}");
		write("empty.json", "{}");
		write("ok.json", "{\"project\":{\"name\":\"ok\",\"directory\":\"/ws/ok\"}}");
		write("notes.txt", "not a project");

		List<ProjectConfig.Project> projects = loader.load(configDir);

		Assertions.assertEquals(1, projects.size());
		Assertions.assertEquals("ok", projects.get(0).getName());
	}

	@Test
	void testMissingDirectoryIsEmptyWorkspace() throws Exception {
		Assertions.assertTrue(loader.load(configDir.resolve("absent")).isEmpty());
	}

	@Test
	void testGraphSourceRereadsDirectory() throws Exception {
		GraphSource source = GraphSource.fromConfigDirectory(configDir);
		Assertions.assertTrue(source.load().isEmpty());

		write("core.json", "{\"project\":{\"name\":\"core\",\"directory\":\"/ws/core\"}}");

		Assertions.assertEquals(1, source.load().size());
	}
}

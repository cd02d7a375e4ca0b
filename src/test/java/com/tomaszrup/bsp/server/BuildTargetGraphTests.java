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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.bsp.protocol.BuildTarget;
import com.tomaszrup.bsp.protocol.ScalaBuildTarget;
import com.tomaszrup.bsp.protocol.ProtocolJson;
import com.tomaszrup.bsp.protocol.SourceItem;
import com.tomaszrup.bsp.protocol.SourceItemKind;
import com.tomaszrup.bsp.protocol.TaskDataKind;

class BuildTargetGraphTests {

	@TempDir
	Path workspace;

	private ProjectConfig.Project project(String name, String... dependencies) {
		ProjectConfig.Project project = new ProjectConfig.Project(name, workspace.resolve(name).toString());
		project.setDependencies(Arrays.asList(dependencies));
		return project;
	}

	private static List<String> names(List<BuildTargetGraph.Node> nodes) {
		List<String> names = new ArrayList<>();
		for (BuildTargetGraph.Node node : nodes) {
			names.add(node.getName());
		}
		return names;
	}

	private BuildTargetGraph.Node node(BuildTargetGraph graph, ProjectConfig.Project project) {
		return graph.find(BuildTargetGraph.identifierOf(project)).get();
	}

	@Test
	void testTargetsKeepConfigurationOrder() {
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(project("core"), project("app", "core")));

		List<BuildTarget> targets = graph.getTargets();
		Assertions.assertEquals(2, targets.size());
		Assertions.assertEquals("core", targets.get(0).getDisplayName());
		Assertions.assertEquals(Collections.singletonList(targets.get(0).getId()), targets.get(1).getDependencies());
	}

	@Test
	void testIdentifierCarriesDirectoryAndName() {
		ProjectConfig.Project core = project("core-test");
		String uri = BuildTargetGraph.identifierOf(core).getUri();
		Assertions.assertTrue(uri.startsWith(workspace.resolve("core-test").toUri().toString()));
		Assertions.assertTrue(uri.endsWith("?id=core-test"));
	}

	@Test
	void testCycleYieldsEmptyGraph() {
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(
				project("a", "b"), project("b", "c"), project("c", "a")));
		Assertions.assertTrue(graph.isEmpty());
	}

	@Test
	void testSelfDependencyYieldsEmptyGraph() {
		Assertions.assertTrue(BuildTargetGraph.build(Arrays.asList(project("a", "a"))).isEmpty());
	}

	@Test
	void testUnknownDependencyYieldsEmptyGraph() {
		Assertions.assertTrue(BuildTargetGraph.build(Arrays.asList(project("app", "missing"))).isEmpty());
	}

	@Test
	void testDuplicateNameYieldsEmptyGraph() {
		Assertions.assertTrue(BuildTargetGraph.build(Arrays.asList(project("a"), project("a"))).isEmpty());
	}

	@Test
	void testDiamondIsNotACycle() {
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(
				project("base"), project("left", "base"), project("right", "base"), project("top", "left", "right")));
		Assertions.assertEquals(4, graph.size());
	}

	@Test
	void testTransitiveDependenciesAreBreadthFirst() {
		ProjectConfig.Project top = project("top", "left", "right");
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(
				project("base"), project("left", "base"), project("right", "base"), top));

		Assertions.assertEquals(Arrays.asList("left", "right", "base"),
				names(graph.transitiveDependencies(node(graph, top))));
	}

	@Test
	void testClasspathOrder() {
		ProjectConfig.Project base = project("base");
		base.setClasspath(Arrays.asList("/libs/scala-library.jar", "/libs/cats.jar"));
		ProjectConfig.Project app = project("app", "base");
		app.setClasspath(Arrays.asList("/libs/scala-library.jar"));
		app.setClassesDir(workspace.resolve("out/app").toString());
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(base, app));

		List<String> classpath = graph.classpath(node(graph, app));

		Assertions.assertEquals(Arrays.asList(
				workspace.resolve("out/app").toUri().toString(),
				workspace.resolve("base").resolve("target").resolve("classes").toUri().toString(),
				Path.of("/libs/scala-library.jar").toUri().toString(),
				Path.of("/libs/cats.jar").toUri().toString()), classpath);
	}

	@Test
	void testCompileOrderPutsDependenciesFirst() {
		ProjectConfig.Project app = project("app", "lib");
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(
				app, project("unrelated"), project("lib", "core"), project("core")));

		List<BuildTargetGraph.Node> order = graph.compileOrder(Arrays.asList(BuildTargetGraph.identifierOf(app)));

		Assertions.assertEquals(Arrays.asList("core", "lib", "app"), names(order));
	}

	@Test
	void testSourcesListAuthoredThenGenerated() throws Exception {
		Path srcDir = Files.createDirectories(workspace.resolve("core/src/main/scala"));
		Path file = Files.createFile(workspace.resolve("core/Build.scala"));
		Path generated = workspace.resolve("core/target/src_managed");
		ProjectConfig.Project core = project("core");
		core.setSources(Arrays.asList(srcDir.toString(), file.toString(), srcDir.toString()));
		core.setGeneratedSources(Arrays.asList(generated.toString()));
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(core));

		List<SourceItem> sources = graph.sources(node(graph, core));

		Assertions.assertEquals(3, sources.size());
		Assertions.assertEquals(SourceItemKind.DIRECTORY, sources.get(0).getKind());
		Assertions.assertFalse(sources.get(0).getGenerated());
		Assertions.assertEquals(SourceItemKind.FILE, sources.get(1).getKind());
		Assertions.assertEquals(generated.toUri().toString(), sources.get(2).getUri());
		Assertions.assertTrue(sources.get(2).getGenerated());
	}

	@Test
	void testDependencySourcesKeepOnlySourcesArtifacts() {
		ProjectConfig.Project core = project("core");
		core.setResolution(new ProjectConfig.Resolution(Arrays.asList(
				new ProjectConfig.Module("org.typelevel", "cats-core_2.13", "2.10.0", Arrays.asList(
						new ProjectConfig.Artifact("cats-core_2.13", null, "/cache/cats-core.jar"),
						new ProjectConfig.Artifact("cats-core_2.13", "sources", "/cache/cats-core-sources.jar"))),
				new ProjectConfig.Module("org.typelevel", "cats-core_2.13", "2.10.0", Arrays.asList(
						new ProjectConfig.Artifact("cats-core_2.13", "sources", "/cache/cats-core-sources.jar"))))));
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(core));

		Assertions.assertEquals(Arrays.asList(Path.of("/cache/cats-core-sources.jar").toUri().toString()),
				graph.dependencySources(node(graph, core)));
	}

	@Test
	void testScalaTargetData() {
		ProjectConfig.Project core = project("core");
		core.setScala(new ProjectConfig.Scala("org.scala-lang", "2.13.12", Arrays.asList("-deprecation"),
				Arrays.asList("/libs/scala-compiler.jar")));
		core.setTags(Arrays.asList(ProjectConfig.TAG_TEST));
		BuildTargetGraph graph = BuildTargetGraph.build(Arrays.asList(core));

		BuildTarget target = graph.getTargets().get(0);
		Assertions.assertEquals(TaskDataKind.SCALA_BUILD_TARGET, target.getDataKind());
		ScalaBuildTarget scala = ProtocolJson.fromJson(target.getData(), ScalaBuildTarget.class);
		Assertions.assertEquals("2.13", scala.getScalaBinaryVersion());
		Assertions.assertTrue(target.getCapabilities().getCanTest());
		Assertions.assertEquals(Arrays.asList("-deprecation"), node(graph, core).getScalacOptions());
	}

	@Test
	void testBinaryVersion() {
		Assertions.assertEquals("2.12", BuildTargetGraph.Node.binaryVersion("2.12.18"));
		Assertions.assertEquals("3", BuildTargetGraph.Node.binaryVersion("3.3.1"));
	}
}

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
package com.tomaszrup.bsp.server;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.bsp.protocol.BuildTarget;
import com.tomaszrup.bsp.protocol.BuildTargetCapabilities;
import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;
import com.tomaszrup.bsp.protocol.ProtocolJson;
import com.tomaszrup.bsp.protocol.ScalaBuildTarget;
import com.tomaszrup.bsp.protocol.ScalaPlatform;
import com.tomaszrup.bsp.protocol.SourceItem;
import com.tomaszrup.bsp.protocol.SourceItemKind;
import com.tomaszrup.bsp.protocol.TaskDataKind;

/**
 * Immutable index of the workspace's build targets, one per configured
 * project. A reload builds a new graph; nothing here is ever mutated.
 *
 * <p>A project set whose dependencies form a cycle or name a project that
 * does not exist resolves to the {@linkplain #empty() empty graph}.</p>
 */
public final class BuildTargetGraph {

    private static final Logger logger = LoggerFactory.getLogger(BuildTargetGraph.class);

    private static final List<String> DEFAULT_LANGUAGE_IDS = Collections.unmodifiableList(
            Arrays.asList("scala", "java"));

    private static final BuildTargetGraph EMPTY = new BuildTargetGraph(new LinkedHashMap<>());

    private final Map<BuildTargetIdentifier, Node> nodes;

    private BuildTargetGraph(LinkedHashMap<BuildTargetIdentifier, Node> nodes) {
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    public static BuildTargetGraph empty() {
        return EMPTY;
    }

    /**
     * Indexes {@code projects}, keeping their order.
     *
     * @return the graph, or the empty graph if the projects do not resolve
     */
    public static BuildTargetGraph build(List<ProjectConfig.Project> projects) {
        Map<String, ProjectConfig.Project> byName = new LinkedHashMap<>();
        for (ProjectConfig.Project project : projects) {
            if (byName.putIfAbsent(project.getName(), project) != null) {
                logger.warn("Project {} is defined twice; no build targets are available", project.getName());
                return EMPTY;
            }
        }
        for (ProjectConfig.Project project : projects) {
            for (String dependency : project.getDependencies()) {
                if (!byName.containsKey(dependency)) {
                    logger.warn("Project {} depends on unknown project {}; no build targets are available",
                            project.getName(), dependency);
                    return EMPTY;
                }
            }
        }
        List<String> cycle = findCycle(byName);
        if (!cycle.isEmpty()) {
            logger.warn("Recursive project dependencies {}; no build targets are available",
                    String.join(" -> ", cycle));
            return EMPTY;
        }

        Map<String, BuildTargetIdentifier> ids = new HashMap<>();
        for (ProjectConfig.Project project : projects) {
            ids.put(project.getName(), identifierOf(project));
        }
        LinkedHashMap<BuildTargetIdentifier, Node> nodes = new LinkedHashMap<>();
        for (ProjectConfig.Project project : projects) {
            List<BuildTargetIdentifier> dependencies = new ArrayList<>();
            for (String dependency : project.getDependencies()) {
                dependencies.add(ids.get(dependency));
            }
            BuildTargetIdentifier id = ids.get(project.getName());
            nodes.put(id, new Node(id, project, dependencies));
        }
        return new BuildTargetGraph(nodes);
    }

    /** Returns the first dependency cycle found, as project names, or an empty list. */
    private static List<String> findCycle(Map<String, ProjectConfig.Project> byName) {
        Set<String> done = new HashSet<>();
        for (String root : byName.keySet()) {
            if (done.contains(root)) {
                continue;
            }
            // iterative DFS; the path holds the projects currently being visited
            LinkedHashSet<String> path = new LinkedHashSet<>();
            Deque<Frame> stack = new ArrayDeque<>();
            path.add(root);
            stack.push(new Frame(root, byName.get(root).getDependencies()));
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.index < top.dependencies.size()) {
                    String next = top.dependencies.get(top.index++);
                    if (path.contains(next)) {
                        List<String> cycle = new ArrayList<>();
                        boolean inCycle = false;
                        for (String name : path) {
                            inCycle |= name.equals(next);
                            if (inCycle) {
                                cycle.add(name);
                            }
                        }
                        cycle.add(next);
                        return cycle;
                    }
                    if (!done.contains(next)) {
                        path.add(next);
                        stack.push(new Frame(next, byName.get(next).getDependencies()));
                    }
                } else {
                    stack.pop();
                    path.remove(top.name);
                    done.add(top.name);
                }
            }
        }
        return Collections.emptyList();
    }

    private static final class Frame {
        final String name;
        final List<String> dependencies;
        int index;

        Frame(String name, List<String> dependencies) {
            this.name = name;
            this.dependencies = dependencies;
        }
    }

    /** {@code <project directory uri>?id=<project name>}. */
    public static BuildTargetIdentifier identifierOf(ProjectConfig.Project project) {
        String directory = Paths.get(project.getDirectory()).toUri().toString();
        return new BuildTargetIdentifier(directory + "?id=" + URLEncoder.encode(project.getName(),
                StandardCharsets.UTF_8));
    }

    // -----------------------------------------------------------------------

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    public Optional<Node> find(BuildTargetIdentifier id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Collection<Node> getNodes() {
        return nodes.values();
    }

    public List<BuildTarget> getTargets() {
        List<BuildTarget> targets = new ArrayList<>(nodes.size());
        for (Node node : nodes.values()) {
            targets.add(node.toBuildTarget());
        }
        return targets;
    }

    /**
     * Transitive dependencies of {@code node}, breadth-first, each once and
     * without {@code node} itself.
     */
    public List<Node> transitiveDependencies(Node node) {
        Set<BuildTargetIdentifier> seen = new HashSet<>();
        seen.add(node.getId());
        List<Node> result = new ArrayList<>();
        Deque<Node> queue = new ArrayDeque<>();
        queue.add(node);
        while (!queue.isEmpty()) {
            Node current = queue.poll();
            for (BuildTargetIdentifier dependency : current.getDependencies()) {
                if (seen.add(dependency)) {
                    Node dependencyNode = nodes.get(dependency);
                    result.add(dependencyNode);
                    queue.add(dependencyNode);
                }
            }
        }
        return result;
    }

    /**
     * Class directory of {@code node}, then the class directories of its
     * transitive dependencies, then library entries. Every entry appears
     * once.
     */
    public List<String> classpath(Node node) {
        LinkedHashSet<String> entries = new LinkedHashSet<>();
        entries.add(node.getClassDirectory());
        List<Node> dependencies = transitiveDependencies(node);
        for (Node dependency : dependencies) {
            entries.add(dependency.getClassDirectory());
        }
        for (String library : node.getProject().getClasspath()) {
            entries.add(toUri(library));
        }
        for (Node dependency : dependencies) {
            for (String library : dependency.getProject().getClasspath()) {
                entries.add(toUri(library));
            }
        }
        return new ArrayList<>(entries);
    }

    /**
     * The requested targets and everything they depend on, dependencies
     * first. Ties keep configuration order.
     */
    public List<Node> compileOrder(Collection<BuildTargetIdentifier> requested) {
        Set<BuildTargetIdentifier> closure = new HashSet<>();
        for (BuildTargetIdentifier id : requested) {
            Node node = nodes.get(id);
            if (node != null && closure.add(id)) {
                for (Node dependency : transitiveDependencies(node)) {
                    closure.add(dependency.getId());
                }
            }
        }
        List<Node> ordered = new ArrayList<>(closure.size());
        Set<BuildTargetIdentifier> placed = new HashSet<>();
        for (Node node : nodes.values()) {
            place(node, closure, placed, ordered);
        }
        return ordered;
    }

    private void place(Node node, Set<BuildTargetIdentifier> closure, Set<BuildTargetIdentifier> placed,
            List<Node> ordered) {
        if (!closure.contains(node.getId()) || placed.contains(node.getId())) {
            return;
        }
        // the graph is acyclic, so recursion depth is bounded by the longest dependency chain
        for (BuildTargetIdentifier dependency : node.getDependencies()) {
            place(nodes.get(dependency), closure, placed, ordered);
        }
        placed.add(node.getId());
        ordered.add(node);
    }

    /** Authored sources ({@code generated=false}) followed by generated ones. */
    public List<SourceItem> sources(Node node) {
        List<SourceItem> items = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String source : node.getProject().getSources()) {
            addSource(items, seen, source, false);
        }
        for (String source : node.getProject().getGeneratedSources()) {
            addSource(items, seen, source, true);
        }
        return items;
    }

    private static void addSource(List<SourceItem> items, Set<String> seen, String source, boolean generated) {
        Path path = Paths.get(source);
        String uri = path.toUri().toString();
        if (seen.add(uri)) {
            SourceItemKind kind = Files.isRegularFile(path) ? SourceItemKind.FILE : SourceItemKind.DIRECTORY;
            items.add(new SourceItem(uri, kind, generated));
        }
    }

    /**
     * {@code sources}-classified artifacts of the target's resolved
     * modules, deduplicated.
     */
    public List<String> dependencySources(Node node) {
        LinkedHashSet<String> sources = new LinkedHashSet<>();
        ProjectConfig.Resolution resolution = node.getProject().getResolution();
        if (resolution != null) {
            for (ProjectConfig.Module module : resolution.getModules()) {
                for (ProjectConfig.Artifact artifact : module.getArtifacts()) {
                    if (artifact.isSources() && artifact.getPath() != null) {
                        sources.add(toUri(artifact.getPath()));
                    }
                }
            }
        }
        return new ArrayList<>(sources);
    }

    static String toUri(String path) {
        return Paths.get(path).toUri().toString();
    }

    /** One build target and the project it was built from. */
    public static final class Node {
        private final BuildTargetIdentifier id;
        private final ProjectConfig.Project project;
        private final List<BuildTargetIdentifier> dependencies;

        Node(BuildTargetIdentifier id, ProjectConfig.Project project, List<BuildTargetIdentifier> dependencies) {
            this.id = id;
            this.project = project;
            this.dependencies = Collections.unmodifiableList(dependencies);
        }

        public BuildTargetIdentifier getId() {
            return id;
        }

        public String getName() {
            return project.getName();
        }

        public ProjectConfig.Project getProject() {
            return project;
        }

        public List<BuildTargetIdentifier> getDependencies() {
            return dependencies;
        }

        /** URI of the class output directory; defaults to {@code <directory>/target/classes}. */
        public String getClassDirectory() {
            String classesDir = project.getClassesDir();
            Path path = classesDir != null
                    ? Paths.get(classesDir)
                    : Paths.get(project.getDirectory(), "target", "classes");
            return path.toUri().toString();
        }

        public List<String> getScalacOptions() {
            return project.getScala() != null ? project.getScala().getOptions() : Collections.emptyList();
        }

        public List<String> getJavacOptions() {
            return project.getJava() != null ? project.getJava().getOptions() : Collections.emptyList();
        }

        BuildTarget toBuildTarget() {
            boolean test = project.isTest();
            List<String> tags = project.getTags().isEmpty()
                    ? Collections.singletonList(test ? ProjectConfig.TAG_TEST : ProjectConfig.TAG_LIBRARY)
                    : project.getTags();
            List<String> languageIds = project.getLanguageIds().isEmpty()
                    ? DEFAULT_LANGUAGE_IDS : project.getLanguageIds();
            BuildTarget target = new BuildTarget(id, new ArrayList<>(tags), new ArrayList<>(languageIds),
                    new ArrayList<>(dependencies), new BuildTargetCapabilities(true, test, !test, false));
            target.setDisplayName(project.getName());
            target.setBaseDirectory(Paths.get(project.getDirectory()).toUri().toString());
            ProjectConfig.Scala scala = project.getScala();
            if (scala != null && scala.getVersion() != null) {
                target.setDataKind(TaskDataKind.SCALA_BUILD_TARGET);
                target.setData(ProtocolJson.toJson(new ScalaBuildTarget(
                        scala.getOrganization() != null ? scala.getOrganization() : "org.scala-lang",
                        scala.getVersion(), binaryVersion(scala.getVersion()), platform(),
                        new ArrayList<>(scala.getJars()))));
            }
            return target;
        }

        private ScalaPlatform platform() {
            ProjectConfig.Platform platform = project.getPlatform();
            String name = platform != null && platform.getName() != null
                    ? platform.getName().toLowerCase(Locale.ROOT) : "jvm";
            switch (name) {
                case "js":
                    return ScalaPlatform.JS;
                case "native":
                    return ScalaPlatform.NATIVE;
                default:
                    return ScalaPlatform.JVM;
            }
        }

        /** {@code 2.13.12 -> 2.13}, {@code 3.3.1 -> 3}. */
        static String binaryVersion(String version) {
            String[] parts = version.split("\\.");
            if (parts.length >= 1 && parts[0].equals("3")) {
                return "3";
            }
            return parts.length >= 2 ? parts[0] + "." + parts[1] : version;
        }

        @Override
        public String toString() {
            return project.getName();
        }
    }
}

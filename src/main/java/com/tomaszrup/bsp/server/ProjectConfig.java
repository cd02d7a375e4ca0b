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

import java.util.ArrayList;
import java.util.List;

/**
 * One project configuration file, as read by Gson.
 *
 * <pre>
 * {
 *   "version": "1.0.0",
 *   "project": {
 *     "name": "core",
 *     "directory": "/work/core",
 *     "dependencies": ["util"],
 *     "sources": ["/work/core/src/main/scala"],
 *     "generatedSources": ["/work/core/target/src_managed"],
 *     "classpath": ["/repo/scala-library.jar"],
 *     "classesDir": "/work/.bsp-out/core/classes",
 *     "scala": { "organization": "org.scala-lang", "version": "2.13.12",
 *                "options": ["-deprecation"], "jars": [] },
 *     "java": { "options": ["-source", "17"] },
 *     "platform": { "name": "jvm" },
 *     "tags": ["library"],
 *     "resolution": { "modules": [ { "organization": "org.typelevel",
 *         "name": "cats-core_2.13", "version": "2.10.0",
 *         "artifacts": [ { "name": "cats-core_2.13", "classifier": "sources",
 *                          "path": "/repo/cats-core_2.13-2.10.0-sources.jar" } ] } ] }
 *   }
 * }
 * </pre>
 *
 * Absent lists read as empty.
 */
public class ProjectConfig {

    public static final String TAG_TEST = "test";
    public static final String TAG_LIBRARY = "library";

    private String version;
    private Project project;

    public String getVersion() {
        return version;
    }

    public Project getProject() {
        return project;
    }

    public static class Project {
        private String name;
        private String directory;
        private List<String> dependencies;
        private List<String> sources;
        private List<String> generatedSources;
        private List<String> classpath;
        private String classesDir;
        private Scala scala;
        private Java java;
        private Platform platform;
        private List<String> tags;
        private List<String> languageIds;
        private Resolution resolution;

        public Project() {
        }

        public Project(String name, String directory) {
            this.name = name;
            this.directory = directory;
        }

        public String getName() {
            return name;
        }

        public String getDirectory() {
            return directory;
        }

        public List<String> getDependencies() {
            return orEmpty(dependencies);
        }

        public void setDependencies(List<String> dependencies) {
            this.dependencies = dependencies;
        }

        public List<String> getSources() {
            return orEmpty(sources);
        }

        public void setSources(List<String> sources) {
            this.sources = sources;
        }

        public List<String> getGeneratedSources() {
            return orEmpty(generatedSources);
        }

        public void setGeneratedSources(List<String> generatedSources) {
            this.generatedSources = generatedSources;
        }

        public List<String> getClasspath() {
            return orEmpty(classpath);
        }

        public void setClasspath(List<String> classpath) {
            this.classpath = classpath;
        }

        public String getClassesDir() {
            return classesDir;
        }

        public void setClassesDir(String classesDir) {
            this.classesDir = classesDir;
        }

        public Scala getScala() {
            return scala;
        }

        public void setScala(Scala scala) {
            this.scala = scala;
        }

        public Java getJava() {
            return java;
        }

        public void setJava(Java java) {
            this.java = java;
        }

        public Platform getPlatform() {
            return platform;
        }

        public void setPlatform(Platform platform) {
            this.platform = platform;
        }

        public List<String> getTags() {
            return orEmpty(tags);
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public List<String> getLanguageIds() {
            return orEmpty(languageIds);
        }

        public void setLanguageIds(List<String> languageIds) {
            this.languageIds = languageIds;
        }

        public Resolution getResolution() {
            return resolution;
        }

        public void setResolution(Resolution resolution) {
            this.resolution = resolution;
        }

        public boolean isTest() {
            return getTags().contains(TAG_TEST);
        }
    }

    public static class Scala {
        private String organization;
        private String version;
        private List<String> options;
        private List<String> jars;

        public Scala() {
        }

        public Scala(String organization, String version, List<String> options, List<String> jars) {
            this.organization = organization;
            this.version = version;
            this.options = options;
            this.jars = jars;
        }

        public String getOrganization() {
            return organization;
        }

        public String getVersion() {
            return version;
        }

        public List<String> getOptions() {
            return orEmpty(options);
        }

        public List<String> getJars() {
            return orEmpty(jars);
        }
    }

    public static class Java {
        private List<String> options;

        public Java() {
        }

        public Java(List<String> options) {
            this.options = options;
        }

        public List<String> getOptions() {
            return orEmpty(options);
        }
    }

    public static class Platform {
        private String name;

        public Platform() {
        }

        public Platform(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    public static class Resolution {
        private List<Module> modules;

        public Resolution() {
        }

        public Resolution(List<Module> modules) {
            this.modules = modules;
        }

        public List<Module> getModules() {
            return orEmpty(modules);
        }
    }

    public static class Module {
        private String organization;
        private String name;
        private String version;
        private List<Artifact> artifacts;

        public Module() {
        }

        public Module(String organization, String name, String version, List<Artifact> artifacts) {
            this.organization = organization;
            this.name = name;
            this.version = version;
            this.artifacts = artifacts;
        }

        public String getOrganization() {
            return organization;
        }

        public String getName() {
            return name;
        }

        public String getVersion() {
            return version;
        }

        public List<Artifact> getArtifacts() {
            return orEmpty(artifacts);
        }
    }

    public static class Artifact {
        public static final String CLASSIFIER_SOURCES = "sources";

        private String name;
        private String classifier;
        private String path;

        public Artifact() {
        }

        public Artifact(String name, String classifier, String path) {
            this.name = name;
            this.classifier = classifier;
            this.path = path;
        }

        public String getName() {
            return name;
        }

        public String getClassifier() {
            return classifier;
        }

        public String getPath() {
            return path;
        }

        public boolean isSources() {
            return CLASSIFIER_SOURCES.equals(classifier);
        }
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : new ArrayList<>();
    }
}

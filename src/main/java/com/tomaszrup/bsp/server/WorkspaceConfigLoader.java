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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Reads every {@code *.json} project file of a configuration directory,
 * in file-name order. Unreadable or incomplete files are skipped with a
 * warning so one broken project does not hide the rest of the workspace.
 */
public class WorkspaceConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceConfigLoader.class);

    private final Gson gson = new Gson();

    public List<ProjectConfig.Project> load(Path configDir) throws IOException {
        if (!Files.isDirectory(configDir)) {
            logger.warn("No configuration directory at {}", configDir);
            return new ArrayList<>();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(configDir, "*.json")) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(null);

        List<ProjectConfig.Project> projects = new ArrayList<>();
        for (Path file : files) {
            ProjectConfig.Project project = read(file);
            if (project != null) {
                projects.add(project);
            }
        }
        logger.info("Loaded {} project(s) from {}", projects.size(), configDir);
        return projects;
    }

    ProjectConfig.Project read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ProjectConfig config = gson.fromJson(reader, ProjectConfig.class);
            if (config == null || config.getProject() == null) {
                logger.warn("Skipping {}: no project definition", file);
                return null;
            }
            ProjectConfig.Project project = config.getProject();
            if (project.getName() == null || project.getDirectory() == null) {
                logger.warn("Skipping {}: project needs a name and a directory", file);
                return null;
            }
            return project;
        } catch (IOException | JsonParseException e) {
            logger.warn("Skipping {}: {}", file, e.getMessage());
            return null;
        }
    }
}

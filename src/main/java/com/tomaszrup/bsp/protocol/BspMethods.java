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
package com.tomaszrup.bsp.protocol;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JSON-RPC method names of the Build Server Protocol. These must match
 * deployed servers byte for byte.
 */
public final class BspMethods {

    /** Protocol version announced in {@code build/initialize}. */
    public static final String BSP_VERSION = "2.0.0";

    public static final String BUILD_INITIALIZE = "build/initialize";
    public static final String BUILD_INITIALIZED = "build/initialized";
    public static final String BUILD_SHUTDOWN = "build/shutdown";
    public static final String BUILD_EXIT = "build/exit";
    public static final String WORKSPACE_BUILD_TARGETS = "workspace/buildTargets";
    public static final String WORKSPACE_RELOAD = "workspace/reload";
    public static final String BUILD_TARGET_SOURCES = "buildTarget/sources";
    public static final String BUILD_TARGET_DEPENDENCY_SOURCES = "buildTarget/dependencySources";
    public static final String BUILD_TARGET_SCALAC_OPTIONS = "buildTarget/scalacOptions";
    public static final String BUILD_TARGET_JAVAC_OPTIONS = "buildTarget/javacOptions";
    public static final String BUILD_TARGET_COMPILE = "buildTarget/compile";

    public static final String BUILD_SHOW_MESSAGE = "build/showMessage";
    public static final String BUILD_LOG_MESSAGE = "build/logMessage";
    public static final String BUILD_PUBLISH_DIAGNOSTICS = "build/publishDiagnostics";
    public static final String BUILD_TASK_START = "build/taskStart";
    public static final String BUILD_TASK_PROGRESS = "build/taskProgress";
    public static final String BUILD_TASK_FINISH = "build/taskFinish";
    public static final String BUILD_TARGET_DID_CHANGE = "buildTarget/didChange";

    /** Notifications a build client understands. */
    public static final Set<String> CLIENT_NOTIFICATIONS = Collections.unmodifiableSet(new LinkedHashSet<>(
            Arrays.asList(BUILD_SHOW_MESSAGE, BUILD_LOG_MESSAGE, BUILD_PUBLISH_DIAGNOSTICS,
                    BUILD_TASK_START, BUILD_TASK_PROGRESS, BUILD_TASK_FINISH, BUILD_TARGET_DID_CHANGE)));

    private BspMethods() {
    }

    /**
     * Major component of a {@code major.minor.patch} version string.
     *
     * @return the major version, or {@code -1} if it cannot be parsed
     */
    public static int majorVersion(String version) {
        if (version == null) {
            return -1;
        }
        int dot = version.indexOf('.');
        String major = dot < 0 ? version : version.substring(0, dot);
        try {
            return Integer.parseInt(major.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}

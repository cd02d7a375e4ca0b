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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;

import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;

/** Everything a {@link CompilationEngine} needs to compile one target. */
public final class CompileInputs {

    private final BuildTargetIdentifier target;
    private final String name;
    private final List<Path> sources;
    private final List<String> classpath;
    private final Path classDirectory;
    private final List<String> options;
    private final Path analysisOut;
    private final BooleanSupplier cancelled;

    public CompileInputs(BuildTargetIdentifier target, String name, List<Path> sources, List<String> classpath,
            Path classDirectory, List<String> options, Path analysisOut, BooleanSupplier cancelled) {
        this.target = target;
        this.name = name;
        this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
        this.classpath = Collections.unmodifiableList(new ArrayList<>(classpath));
        this.classDirectory = classDirectory;
        this.options = Collections.unmodifiableList(new ArrayList<>(options));
        this.analysisOut = analysisOut;
        this.cancelled = cancelled;
    }

    public BuildTargetIdentifier getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    /** Source files and directories, authored and generated. */
    public List<Path> getSources() {
        return sources;
    }

    /** Classpath entries as URIs. */
    public List<String> getClasspath() {
        return classpath;
    }

    public Path getClassDirectory() {
        return classDirectory;
    }

    public List<String> getOptions() {
        return options;
    }

    /** Where the engine should write the target's analysis file. */
    public Path getAnalysisOut() {
        return analysisOut;
    }

    /** Engines poll this between units of work and stop early once it is true. */
    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }
}

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

import java.util.List;

import org.eclipse.lsp4j.jsonrpc.validation.NonNull;

/** Compiler options of one target, shared by {@code buildTarget/scalacOptions} and {@code buildTarget/javacOptions}. */
public class OptionsItem {

    @NonNull
    private BuildTargetIdentifier target;
    @NonNull
    private List<String> options;
    @NonNull
    private List<String> classpath;
    @NonNull
    private String classDirectory;

    public OptionsItem() {
    }

    public OptionsItem(BuildTargetIdentifier target, List<String> options, List<String> classpath, String classDirectory) {
        this.target = target;
        this.options = options;
        this.classpath = classpath;
        this.classDirectory = classDirectory;
    }

    public BuildTargetIdentifier getTarget() {
        return target;
    }

    public void setTarget(BuildTargetIdentifier target) {
        this.target = target;
    }

    public List<String> getOptions() {
        return options;
    }

    public void setOptions(List<String> options) {
        this.options = options;
    }

    public List<String> getClasspath() {
        return classpath;
    }

    public void setClasspath(List<String> classpath) {
        this.classpath = classpath;
    }

    public String getClassDirectory() {
        return classDirectory;
    }

    public void setClassDirectory(String classDirectory) {
        this.classDirectory = classDirectory;
    }
}

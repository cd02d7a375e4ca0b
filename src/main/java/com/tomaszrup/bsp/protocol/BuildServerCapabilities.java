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

public class BuildServerCapabilities {

    private CompileProvider compileProvider;
    private Boolean dependencySourcesProvider;
    private Boolean canReload;
    private Boolean buildTargetChangedProvider;

    public CompileProvider getCompileProvider() {
        return compileProvider;
    }

    public void setCompileProvider(CompileProvider compileProvider) {
        this.compileProvider = compileProvider;
    }

    public Boolean getDependencySourcesProvider() {
        return dependencySourcesProvider;
    }

    public void setDependencySourcesProvider(Boolean dependencySourcesProvider) {
        this.dependencySourcesProvider = dependencySourcesProvider;
    }

    public Boolean getCanReload() {
        return canReload;
    }

    public void setCanReload(Boolean canReload) {
        this.canReload = canReload;
    }

    public Boolean getBuildTargetChangedProvider() {
        return buildTargetChangedProvider;
    }

    public void setBuildTargetChangedProvider(Boolean buildTargetChangedProvider) {
        this.buildTargetChangedProvider = buildTargetChangedProvider;
    }
}

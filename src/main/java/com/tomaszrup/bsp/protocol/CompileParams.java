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

public class CompileParams {

    @NonNull
    private List<BuildTargetIdentifier> targets;
    private String originId;
    private List<String> arguments;

    public CompileParams() {
    }

    public CompileParams(List<BuildTargetIdentifier> targets, String originId) {
        this.targets = targets;
        this.originId = originId;
    }

    public List<BuildTargetIdentifier> getTargets() {
        return targets;
    }

    public void setTargets(List<BuildTargetIdentifier> targets) {
        this.targets = targets;
    }

    public String getOriginId() {
        return originId;
    }

    public void setOriginId(String originId) {
        this.originId = originId;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public void setArguments(List<String> arguments) {
        this.arguments = arguments;
    }
}

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

import org.eclipse.lsp4j.jsonrpc.validation.NonNull;

public class BuildTargetEvent {

    @NonNull
    private BuildTargetIdentifier target;
    private BuildTargetEventKind kind;

    public BuildTargetEvent() {
    }

    public BuildTargetEvent(BuildTargetIdentifier target, BuildTargetEventKind kind) {
        this.target = target;
        this.kind = kind;
    }

    public BuildTargetIdentifier getTarget() {
        return target;
    }

    public void setTarget(BuildTargetIdentifier target) {
        this.target = target;
    }

    public BuildTargetEventKind getKind() {
        return kind;
    }

    public void setKind(BuildTargetEventKind kind) {
        this.kind = kind;
    }
}

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
package com.tomaszrup.bsp.cache;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;

import com.tomaszrup.bsp.protocol.BuildTargetIdentifier;

/**
 * What one compile request produced for one target: its status, the
 * diagnostics reported before it finished (in arrival order) and where the
 * server wrote the target's analysis.
 */
public final class CompileOutcome {

    private final String originId;
    private final BuildTargetIdentifier target;
    private final CompileStatus status;
    private final List<Diagnostic> diagnostics;
    private final URI analysisLocation;

    public CompileOutcome(String originId, BuildTargetIdentifier target, CompileStatus status,
            List<Diagnostic> diagnostics, URI analysisLocation) {
        this.originId = originId;
        this.target = target;
        this.status = status;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.analysisLocation = analysisLocation;
    }

    public String getOriginId() {
        return originId;
    }

    public BuildTargetIdentifier getTarget() {
        return target;
    }

    public CompileStatus getStatus() {
        return status;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** {@code null} if the server reported no analysis file. */
    public URI getAnalysisLocation() {
        return analysisLocation;
    }

    @Override
    public String toString() {
        return "CompileOutcome[" + originId + ", " + target + ", " + status
                + ", diagnostics=" + diagnostics.size() + "]";
    }
}

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;

/**
 * What a {@link CompilationEngine} reports for one target: diagnostics per
 * document URI and, for a successful compile, the analysis file written.
 */
public final class EngineResult {

    private final boolean success;
    private final Map<String, List<Diagnostic>> diagnostics;
    private final Path analysisFile;

    private EngineResult(boolean success, Map<String, List<Diagnostic>> diagnostics, Path analysisFile) {
        this.success = success;
        this.diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
        this.analysisFile = analysisFile;
    }

    public static EngineResult succeeded(Map<String, List<Diagnostic>> diagnostics, Path analysisFile) {
        return new EngineResult(true, diagnostics, analysisFile);
    }

    public static EngineResult failed(Map<String, List<Diagnostic>> diagnostics) {
        return new EngineResult(false, diagnostics, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, List<Diagnostic>> getDiagnostics() {
        return diagnostics;
    }

    /** The analysis file, or {@code null} if none was written. */
    public Path getAnalysisFile() {
        return analysisFile;
    }

    public int countErrors() {
        return count(DiagnosticSeverity.Error);
    }

    public int countWarnings() {
        return count(DiagnosticSeverity.Warning);
    }

    private int count(DiagnosticSeverity severity) {
        int count = 0;
        for (List<Diagnostic> list : diagnostics.values()) {
            for (Diagnostic diagnostic : list) {
                if (diagnostic.getSeverity() == severity) {
                    count++;
                }
            }
        }
        return count;
    }

    /** Diagnostics in the order the engine reported them, flattened. */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>();
        for (List<Diagnostic> list : diagnostics.values()) {
            all.addAll(list);
        }
        return all;
    }
}

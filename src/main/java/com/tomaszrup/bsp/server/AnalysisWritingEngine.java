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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine that compiles nothing. It checks that every source path exists,
 * creates the class directory and records the target's inputs in the
 * analysis file, so a server built on it can be driven end to end.
 *
 * <p>A missing source path is reported as an error diagnostic and fails
 * the target.</p>
 */
public class AnalysisWritingEngine implements CompilationEngine {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisWritingEngine.class);

    static final String DIAGNOSTIC_SOURCE = "bsp-engine";

    @Override
    public EngineResult compile(CompileInputs inputs) throws IOException {
        Map<String, List<Diagnostic>> diagnostics = new LinkedHashMap<>();
        for (Path source : inputs.getSources()) {
            if (!Files.exists(source)) {
                Diagnostic diagnostic = new Diagnostic(new Range(new Position(0, 0), new Position(0, 0)),
                        "Source path does not exist: " + source, DiagnosticSeverity.Error, DIAGNOSTIC_SOURCE);
                diagnostics.put(source.toUri().toString(), Collections.singletonList(diagnostic));
            }
        }
        if (!diagnostics.isEmpty()) {
            logger.debug("{}: {} missing source path(s)", inputs.getName(), diagnostics.size());
            return EngineResult.failed(diagnostics);
        }

        Files.createDirectories(inputs.getClassDirectory());
        Path analysisOut = inputs.getAnalysisOut();
        Files.createDirectories(analysisOut.getParent());
        StringBuilder analysis = new StringBuilder();
        analysis.append("target ").append(inputs.getTarget().getUri()).append('\n');
        for (Path source : inputs.getSources()) {
            analysis.append("source ").append(source.toUri()).append('\n');
        }
        for (String entry : inputs.getClasspath()) {
            analysis.append("classpath ").append(entry).append('\n');
        }
        for (String option : inputs.getOptions()) {
            analysis.append("option ").append(option).append('\n');
        }
        Files.write(analysisOut, analysis.toString().getBytes(StandardCharsets.UTF_8));
        return EngineResult.succeeded(diagnostics, analysisOut);
    }
}

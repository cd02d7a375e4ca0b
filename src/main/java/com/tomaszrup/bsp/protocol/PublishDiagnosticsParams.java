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

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.validation.NonNull;

public class PublishDiagnosticsParams {

    @NonNull
    private TextDocumentIdentifier textDocument;
    @NonNull
    private BuildTargetIdentifier buildTarget;
    private String originId;
    @NonNull
    private List<Diagnostic> diagnostics;
    @NonNull
    private Boolean reset;

    public PublishDiagnosticsParams() {
    }

    public PublishDiagnosticsParams(TextDocumentIdentifier textDocument, BuildTargetIdentifier buildTarget, List<Diagnostic> diagnostics, Boolean reset) {
        this.textDocument = textDocument;
        this.buildTarget = buildTarget;
        this.diagnostics = diagnostics;
        this.reset = reset;
    }

    public TextDocumentIdentifier getTextDocument() {
        return textDocument;
    }

    public void setTextDocument(TextDocumentIdentifier textDocument) {
        this.textDocument = textDocument;
    }

    public BuildTargetIdentifier getBuildTarget() {
        return buildTarget;
    }

    public void setBuildTarget(BuildTargetIdentifier buildTarget) {
        this.buildTarget = buildTarget;
    }

    public String getOriginId() {
        return originId;
    }

    public void setOriginId(String originId) {
        this.originId = originId;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public void setDiagnostics(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Boolean getReset() {
        return reset;
    }

    public void setReset(Boolean reset) {
        this.reset = reset;
    }
}

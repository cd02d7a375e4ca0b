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

/**
 * Task data of kind {@code compile-report}.
 *
 * <p>{@code analysisOut} is the URI of the analysis file the server wrote
 * for the target, or absent if the compile produced none.</p>
 */
public class CompileReport {

    @NonNull
    private BuildTargetIdentifier target;
    private String originId;
    @NonNull
    private Integer errors;
    @NonNull
    private Integer warnings;
    private Long time;
    private Boolean noOp;
    private String analysisOut;

    public CompileReport() {
    }

    public CompileReport(BuildTargetIdentifier target, Integer errors, Integer warnings) {
        this.target = target;
        this.errors = errors;
        this.warnings = warnings;
    }

    public BuildTargetIdentifier getTarget() {
        return target;
    }

    public void setTarget(BuildTargetIdentifier target) {
        this.target = target;
    }

    public String getOriginId() {
        return originId;
    }

    public void setOriginId(String originId) {
        this.originId = originId;
    }

    public Integer getErrors() {
        return errors;
    }

    public void setErrors(Integer errors) {
        this.errors = errors;
    }

    public Integer getWarnings() {
        return warnings;
    }

    public void setWarnings(Integer warnings) {
        this.warnings = warnings;
    }

    public Long getTime() {
        return time;
    }

    public void setTime(Long time) {
        this.time = time;
    }

    public Boolean getNoOp() {
        return noOp;
    }

    public void setNoOp(Boolean noOp) {
        this.noOp = noOp;
    }

    public String getAnalysisOut() {
        return analysisOut;
    }

    public void setAnalysisOut(String analysisOut) {
        this.analysisOut = analysisOut;
    }
}

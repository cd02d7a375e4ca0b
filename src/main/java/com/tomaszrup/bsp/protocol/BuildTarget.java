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

import com.google.gson.JsonElement;

public class BuildTarget {

    @NonNull
    private BuildTargetIdentifier id;
    private String displayName;
    private String baseDirectory;
    @NonNull
    private List<String> tags;
    @NonNull
    private List<String> languageIds;
    @NonNull
    private List<BuildTargetIdentifier> dependencies;
    @NonNull
    private BuildTargetCapabilities capabilities;
    private String dataKind;
    private JsonElement data;

    public BuildTarget() {
    }

    public BuildTarget(BuildTargetIdentifier id, List<String> tags, List<String> languageIds, List<BuildTargetIdentifier> dependencies, BuildTargetCapabilities capabilities) {
        this.id = id;
        this.tags = tags;
        this.languageIds = languageIds;
        this.dependencies = dependencies;
        this.capabilities = capabilities;
    }

    public BuildTargetIdentifier getId() {
        return id;
    }

    public void setId(BuildTargetIdentifier id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getBaseDirectory() {
        return baseDirectory;
    }

    public void setBaseDirectory(String baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public List<String> getLanguageIds() {
        return languageIds;
    }

    public void setLanguageIds(List<String> languageIds) {
        this.languageIds = languageIds;
    }

    public List<BuildTargetIdentifier> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<BuildTargetIdentifier> dependencies) {
        this.dependencies = dependencies;
    }

    public BuildTargetCapabilities getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(BuildTargetCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    public String getDataKind() {
        return dataKind;
    }

    public void setDataKind(String dataKind) {
        this.dataKind = dataKind;
    }

    public JsonElement getData() {
        return data;
    }

    public void setData(JsonElement data) {
        this.data = data;
    }

    @Override
    public String toString() {
        return "BuildTarget[" + id + "]";
    }
}

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

import com.google.gson.JsonElement;

/**
 * Result of {@code build/initialize}. Fields are not marked required so a
 * server omitting them reaches the session's handshake check, which
 * reports a malformed handshake instead of a generic validation error.
 */
public class InitializeBuildResult {

    private String displayName;
    private String version;
    private String bspVersion;
    private BuildServerCapabilities capabilities;
    private JsonElement data;

    public InitializeBuildResult() {
    }

    public InitializeBuildResult(String displayName, String version, String bspVersion,
            BuildServerCapabilities capabilities) {
        this.displayName = displayName;
        this.version = version;
        this.bspVersion = bspVersion;
        this.capabilities = capabilities;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getBspVersion() {
        return bspVersion;
    }

    public void setBspVersion(String bspVersion) {
        this.bspVersion = bspVersion;
    }

    public BuildServerCapabilities getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(BuildServerCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    public JsonElement getData() {
        return data;
    }

    public void setData(JsonElement data) {
        this.data = data;
    }
}

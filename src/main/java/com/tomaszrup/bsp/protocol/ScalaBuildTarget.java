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

/** Data of a build target whose {@code dataKind} is {@code scala}. */
public class ScalaBuildTarget {

    @NonNull
    private String scalaOrganization;
    @NonNull
    private String scalaVersion;
    @NonNull
    private String scalaBinaryVersion;
    @NonNull
    private ScalaPlatform platform;
    @NonNull
    private List<String> jars;

    public ScalaBuildTarget() {
    }

    public ScalaBuildTarget(String scalaOrganization, String scalaVersion, String scalaBinaryVersion, ScalaPlatform platform, List<String> jars) {
        this.scalaOrganization = scalaOrganization;
        this.scalaVersion = scalaVersion;
        this.scalaBinaryVersion = scalaBinaryVersion;
        this.platform = platform;
        this.jars = jars;
    }

    public String getScalaOrganization() {
        return scalaOrganization;
    }

    public void setScalaOrganization(String scalaOrganization) {
        this.scalaOrganization = scalaOrganization;
    }

    public String getScalaVersion() {
        return scalaVersion;
    }

    public void setScalaVersion(String scalaVersion) {
        this.scalaVersion = scalaVersion;
    }

    public String getScalaBinaryVersion() {
        return scalaBinaryVersion;
    }

    public void setScalaBinaryVersion(String scalaBinaryVersion) {
        this.scalaBinaryVersion = scalaBinaryVersion;
    }

    public ScalaPlatform getPlatform() {
        return platform;
    }

    public void setPlatform(ScalaPlatform platform) {
        this.platform = platform;
    }

    public List<String> getJars() {
        return jars;
    }

    public void setJars(List<String> jars) {
        this.jars = jars;
    }
}

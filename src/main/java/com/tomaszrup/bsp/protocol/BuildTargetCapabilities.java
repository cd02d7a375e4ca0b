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

public class BuildTargetCapabilities {

    private Boolean canCompile;
    private Boolean canTest;
    private Boolean canRun;
    private Boolean canDebug;

    public BuildTargetCapabilities() {
    }

    public BuildTargetCapabilities(boolean canCompile, boolean canTest, boolean canRun, boolean canDebug) {
        this.canCompile = canCompile;
        this.canTest = canTest;
        this.canRun = canRun;
        this.canDebug = canDebug;
    }

    public Boolean getCanCompile() {
        return canCompile;
    }

    public void setCanCompile(Boolean canCompile) {
        this.canCompile = canCompile;
    }

    public Boolean getCanTest() {
        return canTest;
    }

    public void setCanTest(Boolean canTest) {
        this.canTest = canTest;
    }

    public Boolean getCanRun() {
        return canRun;
    }

    public void setCanRun(Boolean canRun) {
        this.canRun = canRun;
    }

    public Boolean getCanDebug() {
        return canDebug;
    }

    public void setCanDebug(Boolean canDebug) {
        this.canDebug = canDebug;
    }
}

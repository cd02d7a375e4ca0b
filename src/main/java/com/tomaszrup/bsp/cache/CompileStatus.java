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

import com.tomaszrup.bsp.protocol.StatusCode;

/** Final status of one target within one compile request. */
public enum CompileStatus {
    OK,
    FAILED,
    CANCELLED;

    public static CompileStatus fromStatusCode(StatusCode code) {
        if (code == null) {
            return FAILED;
        }
        switch (code) {
            case OK:
                return OK;
            case CANCELLED:
                return CANCELLED;
            default:
                return FAILED;
        }
    }

    /**
     * Whether an outcome with this status may replace one with
     * {@code previous}. A final result replaces anything; a cancellation
     * only replaces another cancellation.
     */
    public boolean supersedes(CompileStatus previous) {
        if (previous == null) {
            return true;
        }
        return this != CANCELLED || previous == CANCELLED;
    }
}

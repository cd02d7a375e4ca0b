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
package com.tomaszrup.bsp.launcher;

import com.tomaszrup.bsp.BspException;
import com.tomaszrup.bsp.ErrorCode;

/** A build server could neither be reached nor brought up. */
public class LauncherException extends BspException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        SPAWN_FAILED(ErrorCode.SPAWN_FAILED),
        READINESS_TIMEOUT(ErrorCode.READINESS_TIMEOUT),
        VERSION_MISMATCH(ErrorCode.VERSION_INCOMPATIBLE);

        private final ErrorCode code;

        Kind(ErrorCode code) {
            this.code = code;
        }

        public ErrorCode getCode() {
            return code;
        }
    }

    private final Kind kind;

    public LauncherException(Kind kind, String message) {
        this(kind, message, null);
    }

    public LauncherException(Kind kind, String message, Throwable cause) {
        super(kind.getCode(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

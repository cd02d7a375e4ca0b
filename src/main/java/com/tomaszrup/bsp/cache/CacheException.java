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

import com.tomaszrup.bsp.BspException;
import com.tomaszrup.bsp.ErrorCode;

/** Raised when a compile outcome or its analysis cannot be delivered. */
public class CacheException extends BspException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The origin id was never referenced, was evicted, or its compile ended without this target. */
        NOT_FOUND(ErrorCode.NOT_FOUND),
        TIMEOUT(ErrorCode.TIMEOUT),
        DECODE_FAILED(ErrorCode.DECODE_FAILED),
        /** The compile was cancelled before this target was published. */
        CANCELLED(ErrorCode.CANCELLED),
        /** The session died before this target was published. */
        CONNECTION_LOST(ErrorCode.CONNECTION_LOST);

        private final ErrorCode code;

        Kind(ErrorCode code) {
            this.code = code;
        }

        public ErrorCode getCode() {
            return code;
        }
    }

    private final Kind kind;

    public CacheException(Kind kind, String message) {
        this(kind, message, null);
    }

    public CacheException(Kind kind, String message, Throwable cause) {
        super(kind.getCode(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

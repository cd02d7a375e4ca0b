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
package com.tomaszrup.bsp.session;

import com.tomaszrup.bsp.BspException;
import com.tomaszrup.bsp.ErrorCode;

/**
 * The peer broke the protocol: an incompatible or malformed handshake, or
 * an invalid message on a live connection. Fatal to the connection.
 */
public class ProtocolException extends BspException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        VERSION_INCOMPATIBLE(ErrorCode.VERSION_INCOMPATIBLE),
        MALFORMED_HANDSHAKE(ErrorCode.PROTOCOL_ERROR),
        MALFORMED_MESSAGE(ErrorCode.PROTOCOL_ERROR);

        private final ErrorCode code;

        Kind(ErrorCode code) {
            this.code = code;
        }

        public ErrorCode getCode() {
            return code;
        }
    }

    private final Kind kind;

    public ProtocolException(Kind kind, String message) {
        this(kind, message, null);
    }

    public ProtocolException(Kind kind, String message, Throwable cause) {
        super(kind.getCode(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

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
package com.tomaszrup.bsp.transport;

import com.tomaszrup.bsp.BspException;
import com.tomaszrup.bsp.ErrorCode;

/**
 * Raised when a transport endpoint cannot be opened or accepted.
 */
public class TransportException extends BspException {

    private static final long serialVersionUID = 1L;

    /** Why the endpoint could not be reached. */
    public enum Kind {
        REFUSED(ErrorCode.CONNECTION_REFUSED),
        TIMEOUT(ErrorCode.TRANSPORT_TIMEOUT),
        PERMISSION_DENIED(ErrorCode.PERMISSION_DENIED),
        MALFORMED_ADDRESS(ErrorCode.MALFORMED_ADDRESS);

        private final ErrorCode code;

        Kind(ErrorCode code) {
            this.code = code;
        }

        public ErrorCode getCode() {
            return code;
        }
    }

    private final Kind kind;
    private final TransportEndpoint endpoint;

    public TransportException(Kind kind, TransportEndpoint endpoint, String message) {
        this(kind, endpoint, message, null);
    }

    public TransportException(Kind kind, TransportEndpoint endpoint, String message, Throwable cause) {
        super(kind.getCode(), message, cause);
        this.kind = kind;
        this.endpoint = endpoint;
    }

    public Kind getKind() {
        return kind;
    }

    /** The endpoint that failed, or {@code null} if the address itself could not be parsed. */
    public TransportEndpoint getEndpoint() {
        return endpoint;
    }
}

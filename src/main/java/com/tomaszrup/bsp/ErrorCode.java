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
package com.tomaszrup.bsp;

/**
 * Stable, user-facing failure codes. Every {@link BspException} carries one
 * so front ends can render actionable diagnostics without parsing messages.
 */
public enum ErrorCode {
    // transport
    CONNECTION_REFUSED("connection-refused"),
    PERMISSION_DENIED("permission-denied"),
    MALFORMED_ADDRESS("malformed-address"),
    TRANSPORT_TIMEOUT("transport-timeout"),

    // launcher
    SPAWN_FAILED("spawn-failed"),
    READINESS_TIMEOUT("readiness-timeout"),
    VERSION_INCOMPATIBLE("version-incompatible"),

    // session / request
    PROTOCOL_ERROR("protocol-error"),
    UNKNOWN_TARGET("unknown-target"),
    BAD_ARGUMENTS("bad-arguments"),
    TIMEOUT("timeout"),
    CANCELLED("cancelled"),
    CONNECTION_LOST("connection-lost"),

    // cache
    NOT_FOUND("not-found"),
    DECODE_FAILED("decode-failed");

    private final String id;

    ErrorCode(String id) {
        this.id = id;
    }

    /** The kebab-case identifier shown to users and written to logs. */
    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}

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

/** Whether a source item is a single file or a directory tree. Serialized as its integer value. */
public enum SourceItemKind {
    FILE(1),
    DIRECTORY(2);

    private final int value;

    SourceItemKind(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static SourceItemKind forValue(int value) {
        for (SourceItemKind candidate : values()) {
            if (candidate.value == value) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Illegal enum value: " + value);
    }
}

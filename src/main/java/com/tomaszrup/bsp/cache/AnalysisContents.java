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

import java.net.URI;
import java.util.Arrays;

/**
 * Decoded analysis of one target. The engine only ferries these bytes; it
 * never interprets them.
 */
public final class AnalysisContents {

    private final URI location;
    private final byte[] data;

    public AnalysisContents(URI location, byte[] data) {
        this.location = location;
        this.data = data.clone();
    }

    public URI getLocation() {
        return location;
    }

    public byte[] getData() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AnalysisContents)) {
            return false;
        }
        AnalysisContents other = (AnalysisContents) o;
        return location.equals(other.location) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * location.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "AnalysisContents[" + location + ", " + data.length + " bytes]";
    }
}

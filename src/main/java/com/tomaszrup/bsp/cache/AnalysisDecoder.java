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

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Turns an analysis location reported by the server into its contents.
 * Decoding is expensive; the cache runs it on a bounded pool and only
 * keeps a limited number of results.
 */
@FunctionalInterface
public interface AnalysisDecoder {

    /**
     * @return the contents, or empty if there is nothing to decode at
     *         {@code location}
     * @throws IOException if the analysis exists but cannot be read
     */
    Optional<AnalysisContents> decode(URI location) throws IOException;
}

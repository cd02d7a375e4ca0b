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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** How the client introduces itself in {@code build/initialize}. */
public final class ClientInfo {

    private final String displayName;
    private final String version;
    private final String rootUri;
    private final List<String> languageIds;

    public ClientInfo(String displayName, String version, String rootUri, List<String> languageIds) {
        this.displayName = displayName;
        this.version = version;
        this.rootUri = rootUri;
        this.languageIds = Collections.unmodifiableList(new ArrayList<>(languageIds));
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getVersion() {
        return version;
    }

    public String getRootUri() {
        return rootUri;
    }

    public List<String> getLanguageIds() {
        return languageIds;
    }
}

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

import org.eclipse.lsp4j.jsonrpc.json.adapters.EnumTypeAdapter;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

/**
 * Converts the free-form {@code data} payloads of protocol messages to and
 * from their typed form, using the same enum encoding as the JSON-RPC
 * layer.
 */
public final class ProtocolJson {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapterFactory(new EnumTypeAdapter.Factory())
            .create();

    private ProtocolJson() {
    }

    public static JsonElement toJson(Object value) {
        return GSON.toJsonTree(value);
    }

    /**
     * @throws JsonParseException if {@code json} does not have the shape of {@code type}
     */
    public static <T> T fromJson(JsonElement json, Class<T> type) {
        if (json == null || json.isJsonNull()) {
            throw new JsonParseException("Missing " + type.getSimpleName() + " payload");
        }
        if (!json.isJsonObject()) {
            throw new JsonParseException("Expected an object for " + type.getSimpleName() + " but got " + json);
        }
        return GSON.fromJson(json, type);
    }
}

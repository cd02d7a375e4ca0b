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
package com.tomaszrup.bsp.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import com.tomaszrup.bsp.launcher.ReadinessStrategy;

/**
 * Reads {@link ClientOptions} from a JSON object. Unknown keys are ignored;
 * a key with a value of the wrong shape is logged and keeps its default.
 */
public final class ClientOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(ClientOptionsParser.class);

    static final String LOG_LEVEL_OPTION = "logLevel";
    static final String CONNECT_TIMEOUT_OPTION = "connectTimeoutMillis";
    static final String REQUEST_TIMEOUT_OPTION = "requestTimeoutSeconds";
    static final String COMPILE_TIMEOUT_OPTION = "compileTimeoutSeconds";
    static final String IDLE_TIMEOUT_OPTION = "idleTimeoutSeconds";
    static final String READINESS_TIMEOUT_OPTION = "readinessTimeoutSeconds";
    static final String READINESS_STRATEGY_OPTION = "readinessStrategy";
    static final String SERVER_COMMAND_OPTION = "serverCommand";
    static final String SERVER_VERSION_OPTION = "serverVersion";
    static final String DECODE_THREADS_OPTION = "decodeThreads";
    static final String MAX_DECODED_ANALYSES_OPTION = "maxDecodedAnalyses";

    private ClientOptionsParser() {
        // utility class
    }

    /**
     * Parses options and applies the log level, if one is given.
     *
     * @return the parsed options; defaults if {@code options} is not a JSON object
     */
    public static ClientOptions parse(JsonElement options) {
        ClientOptions.Builder builder = ClientOptions.builder();
        if (options == null || !options.isJsonObject()) {
            return builder.build();
        }
        JsonObject opts = options.getAsJsonObject();

        String logLevel = string(opts, LOG_LEVEL_OPTION);
        if (logLevel != null) {
            builder.logLevel(logLevel);
            applyLogLevel(logLevel);
        }
        Long connectMillis = number(opts, CONNECT_TIMEOUT_OPTION);
        if (connectMillis != null) {
            apply(CONNECT_TIMEOUT_OPTION, connectMillis,
                    v -> builder.connectTimeout(Duration.ofMillis(v)));
        }
        Long requestSeconds = number(opts, REQUEST_TIMEOUT_OPTION);
        if (requestSeconds != null) {
            apply(REQUEST_TIMEOUT_OPTION, requestSeconds,
                    v -> builder.requestTimeout(Duration.ofSeconds(v)));
        }
        Long compileSeconds = number(opts, COMPILE_TIMEOUT_OPTION);
        if (compileSeconds != null) {
            apply(COMPILE_TIMEOUT_OPTION, compileSeconds, v -> builder.compileTimeout(Duration.ofSeconds(v)));
        }
        Long idleSeconds = number(opts, IDLE_TIMEOUT_OPTION);
        if (idleSeconds != null) {
            apply(IDLE_TIMEOUT_OPTION, idleSeconds, v -> builder.idleTimeout(Duration.ofSeconds(v)));
        }
        Long readinessSeconds = number(opts, READINESS_TIMEOUT_OPTION);
        if (readinessSeconds != null) {
            apply(READINESS_TIMEOUT_OPTION, readinessSeconds,
                    v -> builder.readinessTimeout(Duration.ofSeconds(v)));
        }
        String strategy = string(opts, READINESS_STRATEGY_OPTION);
        if (strategy != null) {
            try {
                builder.readinessStrategy(ReadinessStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                logger.warn("Unknown readiness strategy '{}', keeping {}", strategy, ReadinessStrategy.SENTINEL);
            }
        }
        if (opts.has(SERVER_COMMAND_OPTION) && opts.get(SERVER_COMMAND_OPTION).isJsonArray()) {
            JsonArray arr = opts.getAsJsonArray(SERVER_COMMAND_OPTION);
            List<String> command = new ArrayList<>();
            for (JsonElement el : arr) {
                if (el.isJsonPrimitive()) {
                    command.add(el.getAsString());
                }
            }
            builder.serverCommand(command);
        }
        String version = string(opts, SERVER_VERSION_OPTION);
        if (version != null) {
            apply(SERVER_VERSION_OPTION, version, builder::serverVersion);
        }
        Long decodeThreads = number(opts, DECODE_THREADS_OPTION);
        if (decodeThreads != null) {
            apply(DECODE_THREADS_OPTION, decodeThreads, v -> builder.decodeThreads(v.intValue()));
        }
        Long maxDecoded = number(opts, MAX_DECODED_ANALYSES_OPTION);
        if (maxDecoded != null) {
            apply(MAX_DECODED_ANALYSES_OPTION, maxDecoded, v -> builder.maxDecodedAnalyses(v.intValue()));
        }

        ClientOptions parsed = builder.build();
        logger.debug("Client options: {}", parsed);
        return parsed;
    }

    /**
     * Reads options from a JSON file.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public static ClientOptions parse(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new IOException("Invalid client options in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    public static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Logging backend is not Logback, cannot set log level to '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
        ch.qos.logback.classic.Level previous = logbackRoot.getLevel();
        logbackRoot.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private static <T> void apply(String key, T value, Consumer<T> setter) {
        try {
            setter.accept(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring option {}={}: {}", key, value, e.getMessage());
        }
    }

    private static String string(JsonObject opts, String key) {
        if (opts.has(key) && opts.get(key).isJsonPrimitive()) {
            return opts.get(key).getAsString();
        }
        return null;
    }

    private static Long number(JsonObject opts, String key) {
        if (!opts.has(key) || !opts.get(key).isJsonPrimitive()) {
            return null;
        }
        if (!opts.get(key).getAsJsonPrimitive().isNumber()) {
            logger.warn("Ignoring option {}: expected a number but got {}", key, opts.get(key));
            return null;
        }
        return opts.get(key).getAsLong();
    }
}

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.bsp.launcher.ReadinessStrategy;

/**
 * Immutable client-side settings: timeouts, the server command used when
 * nothing is listening yet, and the sizes of the analysis decoding pool
 * and decoded-analysis cache.
 */
public final class ClientOptions {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(2000);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_READINESS_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_SERVER_VERSION = "1.0.0";
    public static final int DEFAULT_MAX_DECODED_ANALYSES = 64;

    private final String logLevel;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final Duration compileTimeout;
    private final Duration idleTimeout;
    private final Duration readinessTimeout;
    private final ReadinessStrategy readinessStrategy;
    private final List<String> serverCommand;
    private final String serverVersion;
    private final int decodeThreads;
    private final int maxDecodedAnalyses;

    private ClientOptions(Builder builder) {
        this.logLevel = builder.logLevel;
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.compileTimeout = builder.compileTimeout;
        this.idleTimeout = builder.idleTimeout;
        this.readinessTimeout = builder.readinessTimeout;
        this.readinessStrategy = builder.readinessStrategy;
        this.serverCommand = Collections.unmodifiableList(new ArrayList<>(builder.serverCommand));
        this.serverVersion = builder.serverVersion;
        this.decodeThreads = builder.decodeThreads;
        this.maxDecodedAnalyses = builder.maxDecodedAnalyses;
    }

    public static ClientOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .logLevel(logLevel)
                .connectTimeout(connectTimeout)
                .requestTimeout(requestTimeout)
                .compileTimeout(compileTimeout)
                .idleTimeout(idleTimeout)
                .readinessTimeout(readinessTimeout)
                .readinessStrategy(readinessStrategy)
                .serverCommand(serverCommand)
                .serverVersion(serverVersion)
                .decodeThreads(decodeThreads)
                .maxDecodedAnalyses(maxDecodedAnalyses);
    }

    /** Root logger level to apply, or {@code null} to leave logging alone. */
    public String getLogLevel() {
        return logLevel;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Bound on the {@code buildTarget/compile} acknowledgement, which only
     * arrives once every target is compiled. {@link Duration#ZERO}, the
     * default, leaves compiles unbounded.
     */
    public Duration getCompileTimeout() {
        return compileTimeout;
    }

    /** {@link Duration#ZERO} disables the idle watchdog. */
    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getReadinessTimeout() {
        return readinessTimeout;
    }

    public ReadinessStrategy getReadinessStrategy() {
        return readinessStrategy;
    }

    /** Command line of the build server; the endpoint arguments are appended when spawning. */
    public List<String> getServerCommand() {
        return serverCommand;
    }

    public String getServerVersion() {
        return serverVersion;
    }

    public int getDecodeThreads() {
        return decodeThreads;
    }

    public int getMaxDecodedAnalyses() {
        return maxDecodedAnalyses;
    }

    @Override
    public String toString() {
        return "ClientOptions{connectTimeout=" + connectTimeout
                + ", requestTimeout=" + requestTimeout
                + ", compileTimeout=" + compileTimeout
                + ", idleTimeout=" + idleTimeout
                + ", readinessTimeout=" + readinessTimeout
                + ", readinessStrategy=" + readinessStrategy
                + ", serverCommand=" + serverCommand
                + ", serverVersion=" + serverVersion
                + ", decodeThreads=" + decodeThreads
                + ", maxDecodedAnalyses=" + maxDecodedAnalyses + "}";
    }

    public static final class Builder {
        private String logLevel;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration compileTimeout = Duration.ZERO;
        private Duration idleTimeout = Duration.ZERO;
        private Duration readinessTimeout = DEFAULT_READINESS_TIMEOUT;
        private ReadinessStrategy readinessStrategy = ReadinessStrategy.SENTINEL;
        private List<String> serverCommand = Collections.emptyList();
        private String serverVersion = DEFAULT_SERVER_VERSION;
        private int decodeThreads = 2;
        private int maxDecodedAnalyses = DEFAULT_MAX_DECODED_ANALYSES;

        private Builder() {
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = positive(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder compileTimeout(Duration compileTimeout) {
            this.compileTimeout = notNegative(compileTimeout, "compileTimeout");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = notNegative(idleTimeout, "idleTimeout");
            return this;
        }

        public Builder readinessTimeout(Duration readinessTimeout) {
            this.readinessTimeout = positive(readinessTimeout, "readinessTimeout");
            return this;
        }

        public Builder readinessStrategy(ReadinessStrategy readinessStrategy) {
            if (readinessStrategy == null) {
                throw new IllegalArgumentException("readinessStrategy must not be null");
            }
            this.readinessStrategy = readinessStrategy;
            return this;
        }

        public Builder serverCommand(List<String> serverCommand) {
            this.serverCommand = serverCommand != null ? serverCommand : Collections.<String>emptyList();
            return this;
        }

        public Builder serverVersion(String serverVersion) {
            if (serverVersion == null || serverVersion.isBlank()) {
                throw new IllegalArgumentException("serverVersion must not be empty");
            }
            this.serverVersion = serverVersion;
            return this;
        }

        public Builder decodeThreads(int decodeThreads) {
            if (decodeThreads < 1) {
                throw new IllegalArgumentException("decodeThreads must be at least 1");
            }
            this.decodeThreads = decodeThreads;
            return this;
        }

        public Builder maxDecodedAnalyses(int maxDecodedAnalyses) {
            if (maxDecodedAnalyses < 1) {
                throw new IllegalArgumentException("maxDecodedAnalyses must be at least 1");
            }
            this.maxDecodedAnalyses = maxDecodedAnalyses;
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static Duration notNegative(Duration value, String name) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be zero or positive");
            }
            return value;
        }
    }
}

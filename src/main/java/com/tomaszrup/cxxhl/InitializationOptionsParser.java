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
package com.tomaszrup.cxxhl;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request.
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    private static final String PROTOCOL_VERSION_OPTION = "protocolVersion";
    private static final String LOG_LEVEL_OPTION = "logLevel";
    private static final String SEMANTIC_HIGHLIGHTING_OPTION = "semanticHighlighting";

    /**
     * Parse initialization options and apply side-effects that are
     * self-contained (protocol version warning, log level change).
     *
     * @return parsed options, or the defaults if the input is not a
     *         {@link JsonObject}
     */
    static HighlightingOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return HighlightingOptions.defaults();
        }
        JsonObject opts = (JsonObject) initOptions;
        applyProtocolVersionOption(opts);
        applyLogLevelOption(opts);
        return new HighlightingOptions(parseSemanticHighlightingOption(opts));
    }

    private static void applyProtocolVersionOption(JsonObject opts) {
        if (!isPrimitive(opts, PROTOCOL_VERSION_OPTION)) {
            return;
        }
        String clientProtocolVersion = opts.get(PROTOCOL_VERSION_OPTION).getAsString();
        if (!Protocol.VERSION.equals(clientProtocolVersion)) {
            logger.warn("Protocol version mismatch: extension={}, server={}. "
                            + "Highlighting kinds may be shown with the wrong colors.",
                    clientProtocolVersion, Protocol.VERSION);
        }
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (isPrimitive(opts, LOG_LEVEL_OPTION)) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (Exception e) {
            logger.warn("Failed to set log level to '{}': {}", levelName, e.getMessage());
        }
    }

    private static boolean parseSemanticHighlightingOption(JsonObject opts) {
        if (!isPrimitive(opts, SEMANTIC_HIGHLIGHTING_OPTION)) {
            return HighlightingOptions.defaults().isSemanticHighlightingEnabled();
        }
        JsonElement value = opts.get(SEMANTIC_HIGHLIGHTING_OPTION);
        if (!value.getAsJsonPrimitive().isBoolean()) {
            logger.warn("Ignoring non-boolean '{}' option: {}", SEMANTIC_HIGHLIGHTING_OPTION, value);
            return HighlightingOptions.defaults().isSemanticHighlightingEnabled();
        }
        boolean enabled = value.getAsBoolean();
        logger.info("Semantic highlighting {}", enabled ? "enabled" : "disabled");
        return enabled;
    }

    private static boolean isPrimitive(JsonObject opts, String name) {
        return opts.has(name) && opts.get(name).isJsonPrimitive();
    }

    private InitializationOptionsParser() {
        // utility class
    }
}

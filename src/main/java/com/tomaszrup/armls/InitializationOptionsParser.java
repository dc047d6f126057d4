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
package com.tomaszrup.armls;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code initializationOptions} JSON object sent by the client
 * during the LSP {@code initialize} request, and the {@code armTemplate}
 * section of {@code workspace/didChangeConfiguration} settings.
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    static final String SETTINGS_SECTION = "armTemplate";

    private static final String PROTOCOL_VERSION_OPTION = "protocolVersion";
    private static final String LOG_LEVEL_OPTION = "logLevel";
    private static final String FUNCTION_METADATA_PATH_OPTION = "functionMetadataPath";

    /** Immutable container for parsed initialization options. */
    static final class ParsedOptions {
        final Path functionMetadataPath;

        ParsedOptions(Path functionMetadataPath) {
            this.functionMetadataPath = functionMetadataPath;
        }
    }

    /**
     * Parse initialization options and apply side-effects that are
     * self-contained (protocol version warning, log level change).
     *
     * @return parsed options, or {@code null} if the input is not a
     *         {@link JsonObject}
     */
    static ParsedOptions parse(Object initOptions) {
        if (!(initOptions instanceof JsonObject)) {
            return null;
        }
        JsonObject opts = (JsonObject) initOptions;
        applyLogLevelOption(opts);
        applyProtocolVersionOption(opts);
        return new ParsedOptions(parseFunctionMetadataPathOption(opts));
    }

    /**
     * Applies a {@code didChangeConfiguration} settings object of the form
     * {@code {"armTemplate": {"logLevel": "DEBUG"}}}. Other sections are
     * ignored.
     */
    static void applySettings(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            return;
        }
        JsonElement section = ((JsonObject) rawSettings).get(SETTINGS_SECTION);
        if (section != null && section.isJsonObject()) {
            applyLogLevelOption(section.getAsJsonObject());
        }
    }

    private static void applyProtocolVersionOption(JsonObject opts) {
        if (!opts.has(PROTOCOL_VERSION_OPTION) || !opts.get(PROTOCOL_VERSION_OPTION).isJsonPrimitive()) {
            return;
        }
        String clientProtocolVersion = opts.get(PROTOCOL_VERSION_OPTION).getAsString();
        if (!Protocol.VERSION.equals(clientProtocolVersion)) {
            logger.warn("Protocol version mismatch: extension={}, server={}. "
                            + "Some custom features may not work as expected.",
                    clientProtocolVersion, Protocol.VERSION);
        }
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
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
    }

    private static Path parseFunctionMetadataPathOption(JsonObject opts) {
        if (!opts.has(FUNCTION_METADATA_PATH_OPTION) || !opts.get(FUNCTION_METADATA_PATH_OPTION).isJsonPrimitive()) {
            return null;
        }
        String value = opts.get(FUNCTION_METADATA_PATH_OPTION).getAsString().trim();
        if (value.isEmpty()) {
            return null;
        }
        logger.info("Function metadata path: {}", value);
        return Paths.get(value);
    }

    private InitializationOptionsParser() {
        // utility class
    }
}

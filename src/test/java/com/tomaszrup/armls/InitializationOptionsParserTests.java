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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.armls;

import java.nio.file.Paths;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

class InitializationOptionsParserTests {

    private Logger rootLogger;
    private Level originalLevel;

    @BeforeEach
    void setup() {
        rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        originalLevel = rootLogger.getLevel();
    }

    @AfterEach
    void tearDown() {
        rootLogger.setLevel(originalLevel);
    }

    // ------------------------------------------------------------------
    // parse()
    // ------------------------------------------------------------------

    @Test
    void testParseReturnsNullForNonObject() {
        Assertions.assertNull(InitializationOptionsParser.parse(null));
        Assertions.assertNull(InitializationOptionsParser.parse("options"));
        Assertions.assertNull(InitializationOptionsParser.parse(new JsonArray()));
    }

    @Test
    void testParseEmptyObject() {
        InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(new JsonObject());
        Assertions.assertNotNull(options);
        Assertions.assertNull(options.functionMetadataPath);
    }

    @Test
    void testParseFunctionMetadataPathIsTrimmed() {
        JsonObject opts = new JsonObject();
        opts.addProperty("functionMetadataPath", "  /opt/arm/ExpressionMetadata.json ");
        InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(opts);
        Assertions.assertEquals(Paths.get("/opt/arm/ExpressionMetadata.json"), options.functionMetadataPath);
    }

    @Test
    void testParseIgnoresBlankOrNonPrimitivePath() {
        JsonObject blank = new JsonObject();
        blank.addProperty("functionMetadataPath", "   ");
        Assertions.assertNull(InitializationOptionsParser.parse(blank).functionMetadataPath);

        JsonObject nested = new JsonObject();
        nested.add("functionMetadataPath", new JsonObject());
        Assertions.assertNull(InitializationOptionsParser.parse(nested).functionMetadataPath);
    }

    @Test
    void testParseAppliesLogLevel() {
        JsonObject opts = new JsonObject();
        opts.addProperty("logLevel", "debug");
        InitializationOptionsParser.parse(opts);
        Assertions.assertEquals(Level.DEBUG, rootLogger.getLevel());
    }

    @Test
    void testParseWithMismatchedProtocolVersionDoesNotThrow() {
        JsonObject opts = new JsonObject();
        opts.addProperty("protocolVersion", "0");
        Assertions.assertNotNull(InitializationOptionsParser.parse(opts));
    }

    // ------------------------------------------------------------------
    // applyLogLevel() / applySettings()
    // ------------------------------------------------------------------

    @Test
    void testUnknownLogLevelKeepsCurrentLevel() {
        rootLogger.setLevel(Level.WARN);
        InitializationOptionsParser.applyLogLevel("LOUD");
        Assertions.assertEquals(Level.WARN, rootLogger.getLevel());
    }

    @Test
    void testApplySettingsReadsArmTemplateSection() {
        JsonObject section = new JsonObject();
        section.addProperty("logLevel", "TRACE");
        JsonObject settings = new JsonObject();
        settings.add(InitializationOptionsParser.SETTINGS_SECTION, section);

        InitializationOptionsParser.applySettings(settings);
        Assertions.assertEquals(Level.TRACE, rootLogger.getLevel());
    }

    @Test
    void testApplySettingsIgnoresOtherSections() {
        rootLogger.setLevel(Level.INFO);
        JsonObject section = new JsonObject();
        section.addProperty("logLevel", "TRACE");
        JsonObject settings = new JsonObject();
        settings.add("editor", section);

        InitializationOptionsParser.applySettings(settings);
        InitializationOptionsParser.applySettings(null);
        Assertions.assertEquals(Level.INFO, rootLogger.getLevel());
    }
}

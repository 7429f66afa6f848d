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
package com.tomaszrup.cxxhl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

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

	@Test
	void testNonObjectOptionsGiveDefaults() {
		Assertions.assertTrue(InitializationOptionsParser.parse(null).isSemanticHighlightingEnabled());
		Assertions.assertTrue(InitializationOptionsParser.parse("semanticHighlighting=false")
				.isSemanticHighlightingEnabled());
	}

	@Test
	void testEmptyObjectGivesDefaults() {
		Assertions.assertTrue(InitializationOptionsParser.parse(new JsonObject()).isSemanticHighlightingEnabled());
	}

	@Test
	void testSemanticHighlightingCanBeDisabled() {
		JsonObject opts = new JsonObject();
		opts.addProperty("semanticHighlighting", false);

		Assertions.assertFalse(InitializationOptionsParser.parse(opts).isSemanticHighlightingEnabled());
	}

	@Test
	void testNonBooleanSemanticHighlightingIsIgnored() {
		JsonObject opts = new JsonObject();
		opts.addProperty("semanticHighlighting", "off");
		JsonObject nested = new JsonObject();
		nested.add("semanticHighlighting", new JsonObject());

		Assertions.assertTrue(InitializationOptionsParser.parse(opts).isSemanticHighlightingEnabled());
		Assertions.assertTrue(InitializationOptionsParser.parse(nested).isSemanticHighlightingEnabled());
	}

	@Test
	void testProtocolVersionMismatchDoesNotFail() {
		JsonObject opts = new JsonObject();
		opts.addProperty("protocolVersion", "0");
		opts.addProperty("semanticHighlighting", true);

		Assertions.assertTrue(InitializationOptionsParser.parse(opts).isSemanticHighlightingEnabled());
	}

	@Test
	void testLogLevelOptionChangesRootLevel() {
		JsonObject opts = new JsonObject();
		opts.addProperty("logLevel", "debug");

		InitializationOptionsParser.parse(opts);

		Assertions.assertEquals(Level.DEBUG, rootLogger.getLevel());
	}

	@Test
	void testUnknownLogLevelKeepsCurrentLevel() {
		rootLogger.setLevel(Level.WARN);

		InitializationOptionsParser.applyLogLevel("verbose");

		Assertions.assertEquals(Level.WARN, rootLogger.getLevel());
	}
}

/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.resonantlab.summary.mongodb;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for ConfigValueResolver.
 */
@Tag("unit")
public class ConfigValueResolverTest {

  private static final String PROPERTY = "summary.test.host";

  @AfterEach void tearDown() {
    System.clearProperty(PROPERTY);
  }

  @Test void testPlainValues() {
    assertEquals("", ConfigValueResolver.resolve(""));
    assertEquals("mongodb://localhost", ConfigValueResolver.resolve("mongodb://localhost"));
  }

  @Test void testLookup() {
    Map<String, String> vars = ImmutableMap.of("HOST", "db1", "PORT", "27018");
    assertEquals("mongodb://db1:27018",
        ConfigValueResolver.resolve("mongodb://${HOST}:${PORT}", vars::get));
  }

  @Test void testDefaults() {
    Map<String, String> vars = ImmutableMap.of("EMPTY", "");
    assertEquals("localhost", ConfigValueResolver.resolve("${HOST:-localhost}", vars::get));
    assertEquals("localhost", ConfigValueResolver.resolve("${EMPTY:-localhost}", vars::get));
    assertEquals("", ConfigValueResolver.resolve("${HOST:-}", vars::get));
  }

  @Test void testUnresolvedReferenceIsKept() {
    Map<String, String> vars = ImmutableMap.of();
    assertEquals("mongodb://${HOST}", ConfigValueResolver.resolve("mongodb://${HOST}", vars::get));
  }

  @Test void testReplacementIsLiteral() {
    Map<String, String> vars = ImmutableMap.of("NAME", "a$1\\b");
    assertEquals("app-a$1\\b", ConfigValueResolver.resolve("app-${NAME}", vars::get));
  }

  @Test void testSystemProperty() {
    System.setProperty(PROPERTY, "db3");
    assertEquals("mongodb://db3", ConfigValueResolver.resolve("mongodb://${" + PROPERTY + "}"));
  }

  @Test void testEnvironmentVariable() {
    // set by the surefire configuration
    assertEquals("summary-test", ConfigValueResolver.resolve("${SUMMARY_TEST_APP:-none}"));
  }
}

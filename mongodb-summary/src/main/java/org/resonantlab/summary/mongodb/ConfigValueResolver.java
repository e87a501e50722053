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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${NAME}} and {@code ${NAME:-default}} in configuration
 * operand values, looking {@code NAME} up as an environment variable and
 * then as a system property.
 *
 * <p>Only {@link DataSummaryConfig} values go through here. A reference
 * with no value and no default is left as written.
 */
final class ConfigValueResolver {

  private static final Pattern REFERENCE =
      Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_.]*)(?::-([^}]*))?\\}");

  private ConfigValueResolver() {
  }

  static String resolve(String value) {
    return resolve(value, ConfigValueResolver::lookup);
  }

  static String resolve(String value, Function<String, @Nullable String> lookup) {
    Matcher matcher = REFERENCE.matcher(value);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String replacement = lookup.apply(matcher.group(1));
      if (replacement == null || replacement.isEmpty()) {
        replacement = matcher.group(2) != null ? matcher.group(2) : matcher.group();
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static @Nullable String lookup(String name) {
    String value = System.getenv(name);
    return value == null || value.isEmpty() ? System.getProperty(name) : value;
  }
}

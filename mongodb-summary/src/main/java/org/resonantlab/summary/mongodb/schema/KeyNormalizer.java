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
package org.resonantlab.summary.mongodb.schema;

import java.util.regex.Pattern;

/**
 * Collapses keys that differ only in embedded numbers.
 *
 * <p>Every maximal run of decimal digits is replaced by {@link #PLACEHOLDER}:
 * <ul>
 *   <li>"items.0.name" → "items.XX.name"</li>
 *   <li>"sample12b3" → "sampleXXbXX"</li>
 * </ul>
 * The placeholder holds no digits, so normalizing twice changes nothing.
 */
public final class KeyNormalizer {

  public static final String PLACEHOLDER = "XX";

  private static final Pattern DIGITS = Pattern.compile("[0-9]+");

  private KeyNormalizer() {
    // Utility class
  }

  public static String normalize(String key) {
    return DIGITS.matcher(key).replaceAll(PLACEHOLDER);
  }
}

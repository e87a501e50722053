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

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Identifies one collection in one database at one connection target.
 *
 * <p>Two metadata objects with the same connection URL, database and
 * collection are equal, and resolve to equivalent handles.
 */
public final class DatasetMetadata {

  /** Key of the database description inside a data item. */
  public static final String ITEM_KEY = "databaseMetadata";

  private static final Pattern USER_INFO = Pattern.compile("//[^/@]*@");

  private final String url;
  private final String database;
  private final String collection;

  public DatasetMetadata(String url, String database, String collection) {
    this.url = requireNonNull(url, "url");
    this.database = requireNonNull(database, "database");
    this.collection = requireNonNull(collection, "collection");
    if (database.isEmpty() || collection.isEmpty()) {
      throw new IllegalArgumentException("database and collection must not be empty");
    }
  }

  /**
   * Returns whether a data item describes a database-backed dataset.
   * Items without a {@code databaseMetadata} entry are flat files.
   */
  public static boolean isDatabaseBacked(Map<String, ?> item) {
    return item.get(ITEM_KEY) instanceof Map;
  }

  /**
   * Reads the {@code databaseMetadata} entry of a data item.
   *
   * <p>The {@code url} is taken as stored; {@code ${...}} sequences in it
   * are not expanded.
   *
   * @throws IllegalArgumentException if the item is not database-backed or
   *     the entry lacks {@code url}, {@code database} or {@code collection}
   */
  public static DatasetMetadata fromItem(Map<String, ?> item) {
    Object entry = item.get(ITEM_KEY);
    if (!(entry instanceof Map)) {
      throw new IllegalArgumentException("Item is not database-backed: no " + ITEM_KEY);
    }
    Map<?, ?> map = (Map<?, ?>) entry;
    return new DatasetMetadata(stringValue(map, "url"),
        stringValue(map, "database"), stringValue(map, "collection"));
  }

  private static String stringValue(Map<?, ?> map, String key) {
    @Nullable Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException(ITEM_KEY + "." + key + " is required");
    }
    return value.toString();
  }

  public String getUrl() {
    return url;
  }

  public String getDatabase() {
    return database;
  }

  public String getCollection() {
    return collection;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatasetMetadata)) {
      return false;
    }
    DatasetMetadata that = (DatasetMetadata) o;
    return url.equals(that.url)
        && database.equals(that.database)
        && collection.equals(that.collection);
  }

  @Override public int hashCode() {
    return Objects.hash(url, database, collection);
  }

  /** Renders the target without any credentials embedded in the URL. */
  @Override public String toString() {
    return database + "." + collection + " at " + USER_INFO.matcher(url).replaceFirst("//***@");
  }
}

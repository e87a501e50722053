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

import com.google.common.collect.ImmutableMap;

import org.bson.BsonType;
import org.bson.BsonValue;

/**
 * Coarse runtime type of a document value, as reported in an inferred schema.
 */
public enum ValueType {
  STRING("string"),
  NUMBER("number"),
  BOOLEAN("boolean"),
  OBJECT("object"),
  ARRAY("array"),
  NULL("null");

  /** Type aliases returned by the aggregation {@code $type} operator. */
  private static final ImmutableMap<String, BsonType> ALIASES =
      ImmutableMap.<String, BsonType>builder()
          .put("double", BsonType.DOUBLE)
          .put("string", BsonType.STRING)
          .put("object", BsonType.DOCUMENT)
          .put("array", BsonType.ARRAY)
          .put("binData", BsonType.BINARY)
          .put("undefined", BsonType.UNDEFINED)
          .put("objectId", BsonType.OBJECT_ID)
          .put("bool", BsonType.BOOLEAN)
          .put("date", BsonType.DATE_TIME)
          .put("null", BsonType.NULL)
          .put("regex", BsonType.REGULAR_EXPRESSION)
          .put("dbPointer", BsonType.DB_POINTER)
          .put("javascript", BsonType.JAVASCRIPT)
          .put("symbol", BsonType.SYMBOL)
          .put("javascriptWithScope", BsonType.JAVASCRIPT_WITH_SCOPE)
          .put("int", BsonType.INT32)
          .put("timestamp", BsonType.TIMESTAMP)
          .put("long", BsonType.INT64)
          .put("decimal", BsonType.DECIMAL128)
          .put("minKey", BsonType.MIN_KEY)
          .put("maxKey", BsonType.MAX_KEY)
          .build();

  private final String typeName;

  ValueType(String typeName) {
    this.typeName = typeName;
  }

  /** Returns the name used for this type in schema results. */
  public String getTypeName() {
    return typeName;
  }

  public static ValueType of(BsonValue value) {
    return of(value.getBsonType());
  }

  /**
   * Maps a BSON type. Identifiers, dates, binaries and the other
   * non-primitive BSON types all count as {@link #OBJECT}.
   */
  public static ValueType of(BsonType type) {
    switch (type) {
    case STRING:
    case SYMBOL:
      return STRING;
    case INT32:
    case INT64:
    case DOUBLE:
    case DECIMAL128:
      return NUMBER;
    case BOOLEAN:
      return BOOLEAN;
    case ARRAY:
      return ARRAY;
    case NULL:
    case UNDEFINED:
      return NULL;
    default:
      return OBJECT;
    }
  }

  /**
   * Maps a type alias as returned by the aggregation {@code $type}
   * operator, e.g. "int" or "objectId". Unknown aliases map to
   * {@link #OBJECT}.
   */
  public static ValueType fromAlias(String alias) {
    BsonType type = ALIASES.get(alias);
    return type == null ? OBJECT : of(type);
  }

  /** Looks a type up by its {@link #getTypeName() name}. */
  public static ValueType fromTypeName(String typeName) {
    for (ValueType valueType : values()) {
      if (valueType.typeName.equals(typeName)) {
        return valueType;
      }
    }
    throw new IllegalArgumentException("Unknown type name: " + typeName);
  }
}

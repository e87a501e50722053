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
package org.resonantlab.summary.mongodb.filter;

import com.google.common.collect.ImmutableSet;

import org.bson.BSONException;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A boolean condition over documents, in MongoDB's query language.
 *
 * <p>Predicates are validated when they are created, so an instance is
 * always well-formed. The underlying document is never handed out; callers
 * get a copy, so one predicate can be prepended to any number of pipelines.
 *
 * <p>The empty predicate ({@code {}}) matches every document and adds no
 * stage to a pipeline.
 */
public final class FilterPredicate {

  private static final FilterPredicate NONE = new FilterPredicate(new BsonDocument());

  /** Operators allowed in place of a field name. */
  private static final ImmutableSet<String> TOP_LEVEL_OPERATORS =
      ImmutableSet.of("$and", "$or", "$nor", "$expr", "$text", "$where",
          "$comment", "$jsonSchema");

  /** Operators allowed inside a field's condition document. */
  private static final ImmutableSet<String> FIELD_OPERATORS =
      ImmutableSet.of("$eq", "$ne", "$gt", "$gte", "$lt", "$lte", "$in", "$nin",
          "$exists", "$type", "$regex", "$options", "$not", "$elemMatch", "$size",
          "$all", "$mod", "$bitsAllSet", "$bitsAnySet", "$bitsAllClear",
          "$bitsAnyClear", "$geoWithin", "$geoIntersects", "$near", "$nearSphere",
          "$maxDistance", "$minDistance");

  private final BsonDocument document;

  private FilterPredicate(BsonDocument document) {
    this.document = document;
  }

  /** Returns the predicate that matches every document. */
  public static FilterPredicate none() {
    return NONE;
  }

  /**
   * Parses a predicate from MongoDB Extended JSON, e.g.
   * {@code {"$or": [{"sex": "f"}, {"age": {"$gte": 40}}]}}.
   *
   * @param json Predicate text; null or blank means no filter
   * @throws MalformedFilterException if the text is not a well-formed
   *     query document
   */
  public static FilterPredicate parse(@Nullable String json) {
    if (json == null || json.trim().isEmpty()) {
      return NONE;
    }
    BsonDocument document;
    try {
      document = BsonDocument.parse(json);
    } catch (JsonParseException | BSONException e) {
      throw new MalformedFilterException("Filter is not a JSON document: " + e.getMessage(), e);
    }
    return of(document);
  }

  /**
   * Creates a predicate from a query document. The document is copied.
   *
   * @throws MalformedFilterException if the document is not a well-formed
   *     query
   */
  public static FilterPredicate of(BsonDocument document) {
    requireNonNull(document, "document");
    if (document.isEmpty()) {
      return NONE;
    }
    validateQuery(document, "");
    return new FilterPredicate(document.clone());
  }

  /**
   * Returns a predicate requiring {@code attribute} to hold a numeric value
   * (int, long, double or decimal). Missing values do not match.
   */
  public static FilterPredicate numeric(String attribute) {
    requireNonNull(attribute, "attribute");
    return new FilterPredicate(
        new BsonDocument(attribute, new BsonDocument("$type", new BsonString("number"))));
  }

  public boolean isEmpty() {
    return document.isEmpty();
  }

  /** Returns a copy of the query document. */
  public BsonDocument toBsonDocument() {
    return document.clone();
  }

  public String toJson() {
    return document.toJson();
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o
        || o instanceof FilterPredicate && document.equals(((FilterPredicate) o).document);
  }

  @Override public int hashCode() {
    return document.hashCode();
  }

  @Override public String toString() {
    return "FilterPredicate" + toJson();
  }

  private static void validateQuery(BsonDocument query, String path) {
    for (Map.Entry<String, BsonValue> entry : query.entrySet()) {
      String key = entry.getKey();
      BsonValue value = entry.getValue();
      if (key.isEmpty()) {
        throw malformed(path, "empty field name");
      }
      if (key.startsWith("$")) {
        validateTopLevelOperator(key, value, path);
      } else {
        validateFieldCondition(key, value, path);
      }
    }
  }

  private static void validateTopLevelOperator(String operator, BsonValue value, String path) {
    if (!TOP_LEVEL_OPERATORS.contains(operator)) {
      throw malformed(path, "unknown top-level operator " + operator);
    }
    switch (operator) {
    case "$and":
    case "$or":
    case "$nor":
      if (!value.isArray() || value.asArray().isEmpty()) {
        throw malformed(path, operator + " requires a non-empty array");
      }
      BsonArray clauses = value.asArray();
      for (int i = 0; i < clauses.size(); i++) {
        BsonValue clause = clauses.get(i);
        String clausePath = path + operator + "[" + i + "]";
        if (!clause.isDocument()) {
          throw malformed(clausePath, "clause must be a document");
        }
        validateQuery(clause.asDocument(), clausePath + ".");
      }
      break;
    case "$text":
    case "$jsonSchema":
      if (!value.isDocument()) {
        throw malformed(path, operator + " requires a document");
      }
      break;
    case "$where":
      if (!value.isString() && !value.isJavaScript()) {
        throw malformed(path, "$where requires a string or JavaScript code");
      }
      break;
    default:
      // $expr and $comment accept any value
      break;
    }
  }

  private static void validateFieldCondition(String field, BsonValue value, String path) {
    if (!isOperatorDocument(value)) {
      // Equality match
      return;
    }
    validateOperatorDocument(value.asDocument(), path + field);
  }

  private static boolean isOperatorDocument(BsonValue value) {
    return value.isDocument()
        && !value.asDocument().isEmpty()
        && value.asDocument().getFirstKey().startsWith("$");
  }

  private static void validateOperatorDocument(BsonDocument operators, String fieldPath) {
    for (Map.Entry<String, BsonValue> entry : operators.entrySet()) {
      String operator = entry.getKey();
      BsonValue operand = entry.getValue();
      if (!operator.startsWith("$")) {
        throw malformed(fieldPath, "mixes operators and field names ('" + operator + "')");
      }
      if (!FIELD_OPERATORS.contains(operator)) {
        throw malformed(fieldPath, "unknown operator " + operator);
      }
      switch (operator) {
      case "$in":
      case "$nin":
      case "$all":
        if (!operand.isArray()) {
          throw malformed(fieldPath, operator + " requires an array");
        }
        break;
      case "$not":
        if (operand.isRegularExpression()) {
          break;
        }
        if (!isOperatorDocument(operand)) {
          throw malformed(fieldPath, "$not requires an operator document or a regex");
        }
        validateOperatorDocument(operand.asDocument(), fieldPath);
        break;
      case "$elemMatch":
        if (!operand.isDocument()) {
          throw malformed(fieldPath, "$elemMatch requires a document");
        }
        break;
      case "$size":
        if (!operand.isNumber()) {
          throw malformed(fieldPath, "$size requires a number");
        }
        break;
      case "$mod":
        if (!operand.isArray() || operand.asArray().size() != 2) {
          throw malformed(fieldPath, "$mod requires [divisor, remainder]");
        }
        break;
      case "$options":
        if (!operators.containsKey("$regex")) {
          throw malformed(fieldPath, "$options requires $regex");
        }
        break;
      default:
        break;
      }
    }
  }

  private static MalformedFilterException malformed(String path, String message) {
    String location = path.isEmpty() ? "filter" : "filter at '" + path + "'";
    return new MalformedFilterException("Malformed " + location + ": " + message);
  }
}

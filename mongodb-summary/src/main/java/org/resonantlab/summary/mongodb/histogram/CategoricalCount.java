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
package org.resonantlab.summary.mongodb.histogram;

import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.BsonNull;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Number of matching documents holding one distinct value of a categorical
 * attribute. Documents where the attribute is null or missing share the
 * null bucket.
 */
public final class CategoricalCount {

  private static final DocumentCodec CODEC = new DocumentCodec();

  private final BsonValue value;
  private final long count;

  public CategoricalCount(@Nullable BsonValue value, long count) {
    this.value = value == null ? BsonNull.VALUE : value;
    this.count = count;
  }

  public BsonValue getValue() {
    return value;
  }

  public boolean isNull() {
    return value.isNull();
  }

  public long getCount() {
    return count;
  }

  /** Returns the value as a plain Java object (String, Integer, Document, ...). */
  public @Nullable Object getJavaValue() {
    return toJava(value);
  }

  /** Renders {@code {_id: value, count: n}}. */
  public Document toDocument() {
    return new Document("_id", getJavaValue()).append("count", count);
  }

  static @Nullable Object toJava(BsonValue value) {
    BsonDocument wrapper = new BsonDocument("v", value);
    Document decoded = CODEC.decode(new BsonDocumentReader(wrapper),
        DecoderContext.builder().build());
    return decoded.get("v");
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CategoricalCount)) {
      return false;
    }
    CategoricalCount that = (CategoricalCount) o;
    return count == that.count && value.equals(that.value);
  }

  @Override public int hashCode() {
    return Objects.hash(value, count);
  }

  @Override public String toString() {
    return value + "=" + count;
  }
}

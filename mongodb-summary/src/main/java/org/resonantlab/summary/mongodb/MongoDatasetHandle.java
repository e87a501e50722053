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

import org.resonantlab.summary.mongodb.pipeline.BsonStageTranslator;
import org.resonantlab.summary.mongodb.pipeline.Pipeline;

import com.mongodb.MongoException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;

import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Handle on a MongoDB collection. Owns its client; closing the handle
 * closes the client and its connection pool.
 */
public class MongoDatasetHandle implements DatasetHandle {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoDatasetHandle.class);

  private final DatasetMetadata metadata;
  private final MongoClient client;
  private final MongoCollection<BsonDocument> collection;
  private final DataSummaryConfig config;

  MongoDatasetHandle(DatasetMetadata metadata, MongoClient client, DataSummaryConfig config) {
    this.metadata = requireNonNull(metadata, "metadata");
    this.client = requireNonNull(client, "client");
    this.config = requireNonNull(config, "config");
    this.collection = client.getDatabase(metadata.getDatabase())
        .getCollection(metadata.getCollection(), BsonDocument.class);
  }

  @Override public DatasetMetadata getMetadata() {
    return metadata;
  }

  @Override public List<BsonDocument> aggregate(Pipeline pipeline) {
    List<Bson> stages = BsonStageTranslator.INSTANCE.translate(pipeline);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Aggregating {}: {}", metadata, BsonStageTranslator.INSTANCE.toJson(pipeline));
    }
    AggregateIterable<BsonDocument> iterable = collection.aggregate(stages)
        .allowDiskUse(config.isAllowDiskUse());
    if (config.getMaxTimeMs() > 0) {
      iterable.maxTime(config.getMaxTimeMs(), TimeUnit.MILLISECONDS);
    }
    if (config.getBatchSize() > 0) {
      iterable.batchSize(config.getBatchSize());
    }
    try {
      return iterable.into(new ArrayList<>());
    } catch (MongoException e) {
      throw translate(e);
    }
  }

  @Override public Iterable<BsonDocument> scan() {
    LOGGER.debug("Scanning {}", metadata);
    FindIterable<BsonDocument> iterable = collection.find();
    if (config.getBatchSize() > 0) {
      iterable.batchSize(config.getBatchSize());
    }
    return () -> new GuardedIterator(iterable);
  }

  @Override public void close() {
    client.close();
  }

  /**
   * Converts connectivity failures into {@link ConnectionException}; every
   * other driver error is returned unchanged.
   */
  RuntimeException translate(MongoException e) {
    if (isConnectivityFailure(e)) {
      return new ConnectionException(metadata, e);
    }
    return e;
  }

  static boolean isConnectivityFailure(MongoException e) {
    return e instanceof MongoTimeoutException
        || e instanceof MongoSocketException
        || e instanceof MongoSecurityException;
  }

  @Override public String toString() {
    return "MongoDatasetHandle{" + metadata + "}";
  }

  /**
   * Cursor wrapper that opens lazily and translates driver errors.
   * The cursor closes itself once exhausted.
   */
  private class GuardedIterator implements Iterator<BsonDocument> {
    private final FindIterable<BsonDocument> iterable;
    private MongoCursor<BsonDocument> cursor;

    GuardedIterator(FindIterable<BsonDocument> iterable) {
      this.iterable = iterable;
    }

    @Override public boolean hasNext() {
      try {
        if (cursor == null) {
          cursor = iterable.iterator();
        }
        return cursor.hasNext();
      } catch (MongoException e) {
        throw translate(e);
      }
    }

    @Override public BsonDocument next() {
      try {
        if (cursor == null) {
          cursor = iterable.iterator();
        }
        return cursor.next();
      } catch (MongoException e) {
        throw translate(e);
      }
    }
  }
}

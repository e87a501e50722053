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

import com.mongodb.ConnectionString;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Resolves datasets to collections on a MongoDB deployment.
 *
 * <p>Every call creates its own client; nothing is cached between calls.
 * When {@link DataSummaryConfig#isVerifyConnection()} is set, the server is
 * pinged before the handle is returned, so an unreachable target or
 * rejected credentials fail here rather than on the first query.
 */
public class MongoCollectionAccessor implements CollectionAccessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoCollectionAccessor.class);

  private static final BsonDocument PING = new BsonDocument("ping", new BsonInt32(1));

  private final DataSummaryConfig config;

  public MongoCollectionAccessor() {
    this(DataSummaryConfig.defaults());
  }

  public MongoCollectionAccessor(DataSummaryConfig config) {
    this.config = requireNonNull(config, "config");
  }

  @Override public DatasetHandle resolve(DatasetMetadata metadata) {
    requireNonNull(metadata, "metadata");
    ConnectionString connectionString;
    try {
      connectionString = new ConnectionString(metadata.getUrl());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid connection URL for " + metadata, e);
    }

    MongoClient client = MongoClients.create(config.toClientSettings(connectionString));
    try {
      if (config.isVerifyConnection()) {
        client.getDatabase(metadata.getDatabase()).runCommand(PING);
      }
    } catch (MongoException e) {
      client.close();
      if (MongoDatasetHandle.isConnectivityFailure(e)) {
        throw new ConnectionException(metadata, e);
      }
      throw e;
    }
    LOGGER.debug("Resolved {}", metadata);
    return new MongoDatasetHandle(metadata, client, config);
  }
}

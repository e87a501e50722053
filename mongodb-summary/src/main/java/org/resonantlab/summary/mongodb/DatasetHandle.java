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

import org.resonantlab.summary.mongodb.pipeline.Pipeline;

import org.bson.BsonDocument;

import java.util.List;

/**
 * A resolved, queryable reference to one collection.
 *
 * <p>Handles are read-only: nothing executed through a handle modifies the
 * collection. {@link #scan()} streams; callers must not assume a whole
 * collection fits in memory.
 */
public interface DatasetHandle extends AutoCloseable {

  /**
   * Get the metadata this handle was resolved from.
   */
  DatasetMetadata getMetadata();

  /**
   * Run an aggregation pipeline against the collection. The pipelines run
   * here end in a grouping stage, so their output is collected eagerly.
   *
   * @param pipeline Stages to run, in order
   * @return Documents produced by the final stage
   * @throws ConnectionException if the store cannot be reached
   */
  List<BsonDocument> aggregate(Pipeline pipeline);

  /**
   * Stream every document of the collection.
   *
   * @throws ConnectionException if the store cannot be reached
   */
  Iterable<BsonDocument> scan();

  /**
   * Release the connection held by this handle.
   */
  @Override void close();
}

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

/**
 * Schema inference and histogram aggregation over MongoDB collections.
 *
 * <p>{@link org.resonantlab.summary.mongodb.DataSummaryService} is the entry
 * point. It resolves a {@link org.resonantlab.summary.mongodb.DatasetMetadata}
 * to a {@link org.resonantlab.summary.mongodb.DatasetHandle} through a
 * {@link org.resonantlab.summary.mongodb.CollectionAccessor}, runs one engine
 * and closes the handle.</p>
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link org.resonantlab.summary.mongodb.schema} - per-key type counts</li>
 *   <li>{@link org.resonantlab.summary.mongodb.histogram} - total count and histograms</li>
 *   <li>{@link org.resonantlab.summary.mongodb.pipeline} - store-neutral aggregation stages</li>
 *   <li>{@link org.resonantlab.summary.mongodb.filter} - validated query predicates</li>
 * </ul>
 */
package org.resonantlab.summary.mongodb;

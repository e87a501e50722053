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

/**
 * Indicates that a dataset's store could not be reached, or that it
 * rejected the supplied credentials. Never retried.
 */
public class ConnectionException extends DataSummaryException {

  private final DatasetMetadata metadata;

  public ConnectionException(DatasetMetadata metadata, Throwable cause) {
    super("Cannot reach " + metadata + ": " + cause.getMessage(), cause);
    this.metadata = metadata;
  }

  /** Returns the dataset whose store could not be reached. */
  public DatasetMetadata getMetadata() {
    return metadata;
  }
}

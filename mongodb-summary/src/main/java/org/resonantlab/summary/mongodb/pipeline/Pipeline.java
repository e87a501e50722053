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
package org.resonantlab.summary.mongodb.pipeline;

import org.resonantlab.summary.mongodb.filter.FilterPredicate;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * An immutable, ordered list of aggregation stages.
 *
 * <p>{@link #append} returns a new pipeline and leaves the receiver
 * untouched, so a shared prefix can be extended independently by every
 * sub-computation.
 */
public final class Pipeline {

  private static final Pipeline EMPTY = new Pipeline(ImmutableList.of());

  private final ImmutableList<PipelineStage> stages;

  private Pipeline(ImmutableList<PipelineStage> stages) {
    this.stages = stages;
  }

  public static Pipeline empty() {
    return EMPTY;
  }

  /**
   * Creates the prefix shared by every sub-computation of one request: a
   * single match stage, or nothing when there is no filter.
   */
  public static Pipeline prefix(@Nullable FilterPredicate filter) {
    if (filter == null || filter.isEmpty()) {
      return EMPTY;
    }
    return EMPTY.append(PipelineStage.match(filter));
  }

  /** Returns a new pipeline with the given stages added at the end. */
  public Pipeline append(PipelineStage... more) {
    return new Pipeline(ImmutableList.<PipelineStage>builder()
        .addAll(stages)
        .add(more)
        .build());
  }

  public List<PipelineStage> getStages() {
    return stages;
  }

  public int size() {
    return stages.size();
  }

  public boolean isEmpty() {
    return stages.isEmpty();
  }

  /** Visits every stage in order and collects the results. */
  public <R> List<R> accept(PipelineStage.Visitor<R> visitor) {
    ImmutableList.Builder<R> results = ImmutableList.builder();
    for (PipelineStage stage : stages) {
      results.add(stage.accept(visitor));
    }
    return results.build();
  }

  @Override public boolean equals(@Nullable Object o) {
    return this == o || o instanceof Pipeline && stages.equals(((Pipeline) o).stages);
  }

  @Override public int hashCode() {
    return stages.hashCode();
  }

  @Override public String toString() {
    return "Pipeline" + stages;
  }
}

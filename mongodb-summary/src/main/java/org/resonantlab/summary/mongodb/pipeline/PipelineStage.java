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
import org.resonantlab.summary.mongodb.histogram.QuantitativeSpec;
import org.resonantlab.summary.mongodb.histogram.TopEdgePolicy;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * One stage of an aggregation pipeline.
 *
 * <p>The set of stages is closed: the only subclasses are the nested
 * classes below, and every consumer implements {@link Visitor}, so adding a
 * stage forces every consumer to handle it.
 */
public abstract class PipelineStage {

  private PipelineStage() {
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static Match match(FilterPredicate predicate) {
    return new Match(predicate);
  }

  public static Project project(String... fields) {
    return new Project(ImmutableList.copyOf(fields));
  }

  public static Group count(@Nullable String keyPath, String countField) {
    return new Group(keyPath, countField);
  }

  public static ComputeBinIndex binIndex(QuantitativeSpec spec, String outputField,
      TopEdgePolicy policy) {
    return new ComputeBinIndex(spec, outputField, policy);
  }

  public static KeyTypeCount keyTypeCount(String countField) {
    return new KeyTypeCount(countField);
  }

  /**
   * Callback for each kind of stage.
   *
   * @param <R> Result type
   */
  public interface Visitor<R> {
    R visit(Match match);

    R visit(Project project);

    R visit(Group group);

    R visit(ComputeBinIndex binIndex);

    R visit(KeyTypeCount keyTypeCount);
  }

  /** Keeps the documents that satisfy a predicate. */
  public static final class Match extends PipelineStage {
    private final FilterPredicate predicate;

    private Match(FilterPredicate predicate) {
      this.predicate = requireNonNull(predicate, "predicate");
    }

    public FilterPredicate getPredicate() {
      return predicate;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public boolean equals(@Nullable Object o) {
      return this == o || o instanceof Match && predicate.equals(((Match) o).predicate);
    }

    @Override public int hashCode() {
      return predicate.hashCode();
    }

    @Override public String toString() {
      return "Match(" + predicate.toJson() + ")";
    }
  }

  /** Restricts documents to {@code _id} and the given field paths. */
  public static final class Project extends PipelineStage {
    private final ImmutableList<String> fields;

    private Project(ImmutableList<String> fields) {
      if (fields.isEmpty()) {
        throw new IllegalArgumentException("Project requires at least one field");
      }
      this.fields = fields;
    }

    public List<String> getFields() {
      return fields;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public boolean equals(@Nullable Object o) {
      return this == o || o instanceof Project && fields.equals(((Project) o).fields);
    }

    @Override public int hashCode() {
      return fields.hashCode();
    }

    @Override public String toString() {
      return "Project" + fields;
    }
  }

  /**
   * Groups documents by the value at a field path and counts each group.
   * A null key path puts every document in one group.
   *
   * <p>Output documents are {@code {_id: key, <countField>: n}}.
   */
  public static final class Group extends PipelineStage {
    private final @Nullable String keyPath;
    private final String countField;

    private Group(@Nullable String keyPath, String countField) {
      this.keyPath = keyPath;
      this.countField = requireNonNull(countField, "countField");
    }

    public @Nullable String getKeyPath() {
      return keyPath;
    }

    public String getCountField() {
      return countField;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public boolean equals(@Nullable Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Group)) {
        return false;
      }
      Group that = (Group) o;
      return Objects.equals(keyPath, that.keyPath) && countField.equals(that.countField);
    }

    @Override public int hashCode() {
      return Objects.hash(keyPath, countField);
    }

    @Override public String toString() {
      return "Group(" + keyPath + ", " + countField + ")";
    }
  }

  /**
   * Replaces each document with {@code {_id, <outputField>: binIndex}} where
   * the bin index is computed from the spec's attribute. Documents are
   * expected to hold a numeric value for that attribute.
   */
  public static final class ComputeBinIndex extends PipelineStage {
    private final QuantitativeSpec spec;
    private final String outputField;
    private final TopEdgePolicy policy;

    private ComputeBinIndex(QuantitativeSpec spec, String outputField, TopEdgePolicy policy) {
      this.spec = requireNonNull(spec, "spec");
      this.outputField = requireNonNull(outputField, "outputField");
      this.policy = requireNonNull(policy, "policy");
      spec.validate();
    }

    public QuantitativeSpec getSpec() {
      return spec;
    }

    public String getOutputField() {
      return outputField;
    }

    public TopEdgePolicy getPolicy() {
      return policy;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public boolean equals(@Nullable Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ComputeBinIndex)) {
        return false;
      }
      ComputeBinIndex that = (ComputeBinIndex) o;
      return spec.equals(that.spec) && outputField.equals(that.outputField)
          && policy == that.policy;
    }

    @Override public int hashCode() {
      return Objects.hash(spec, outputField, policy);
    }

    @Override public String toString() {
      return "ComputeBinIndex(" + spec + ", " + outputField + ", " + policy + ")";
    }
  }

  /**
   * Counts top-level key occurrences by raw key name and BSON type.
   *
   * <p>Output documents are
   * {@code {_id: {key: <name>, type: <bson type alias>}, <countField>: n}}.
   */
  public static final class KeyTypeCount extends PipelineStage {
    public static final String KEY_FIELD = "key";
    public static final String TYPE_FIELD = "type";

    private final String countField;

    private KeyTypeCount(String countField) {
      this.countField = requireNonNull(countField, "countField");
    }

    public String getCountField() {
      return countField;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override public boolean equals(@Nullable Object o) {
      return this == o
          || o instanceof KeyTypeCount && countField.equals(((KeyTypeCount) o).countField);
    }

    @Override public int hashCode() {
      return countField.hashCode();
    }

    @Override public String toString() {
      return "KeyTypeCount(" + countField + ")";
    }
  }
}

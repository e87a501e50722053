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

import org.resonantlab.summary.mongodb.filter.FilterPredicate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Parameters of one histogram computation: an optional filter, the
 * categorical attributes to count and the quantitative attributes to bin.
 *
 * <p>Attribute order is kept as given and duplicates collapse. Specs that
 * could not be read carry over as rejections and are reported in the
 * result, leaving the other attributes unaffected.
 */
public final class HistogramRequest {

  public static final String FILTER_QUERY = "filterQuery";
  public static final String CATEGORICAL_ATTRS = "categoricalAttrs";
  public static final String QUANTITATIVE_ATTRS = "quantitativeAttrs";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final FilterPredicate filter;
  private final ImmutableList<String> categoricalAttributes;
  private final ImmutableMap<String, QuantitativeSpec> quantitativeSpecs;
  private final ImmutableMap<String, String> rejected;
  private final @Nullable TopEdgePolicy topEdgePolicy;

  private HistogramRequest(Builder builder) {
    this.filter = builder.filter;
    this.categoricalAttributes = ImmutableList.copyOf(builder.categorical);
    this.quantitativeSpecs = ImmutableMap.copyOf(builder.quantitative);
    this.rejected = ImmutableMap.copyOf(builder.rejected);
    this.topEdgePolicy = builder.topEdgePolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads a request from string parameters.
   *
   * <ul>
   *   <li>{@code filterQuery} - Extended JSON query document</li>
   *   <li>{@code categoricalAttrs} - comma-separated attribute names</li>
   *   <li>{@code quantitativeAttrs} - JSON object of
   *       {@code {"attr": {"min": 0, "max": 100, "binCount": 10}}}</li>
   * </ul>
   *
   * @throws org.resonantlab.summary.mongodb.filter.MalformedFilterException
   *     if the filter is malformed
   * @throws IllegalArgumentException if {@code quantitativeAttrs} is not a
   *     JSON object
   */
  public static HistogramRequest fromParameters(Map<String, String> parameters) {
    Builder builder = builder()
        .filter(FilterPredicate.parse(parameters.get(FILTER_QUERY)));

    String categorical = parameters.get(CATEGORICAL_ATTRS);
    if (categorical != null) {
      for (String attribute : categorical.split(",")) {
        builder.categorical(attribute.trim());
      }
    }

    String quantitative = parameters.get(QUANTITATIVE_ATTRS);
    if (quantitative != null && !quantitative.trim().isEmpty()) {
      JsonNode root;
      try {
        root = MAPPER.readTree(quantitative);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException(
            QUANTITATIVE_ATTRS + " is not valid JSON: " + e.getOriginalMessage(), e);
      }
      if (root == null || !root.isObject()) {
        throw new IllegalArgumentException(QUANTITATIVE_ATTRS + " must be a JSON object");
      }
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        try {
          builder.quantitative(readSpec(field.getKey(), field.getValue()));
        } catch (InvalidBinSpecException e) {
          builder.rejected(e.getAttribute(), e.getMessage());
        }
      }
    }
    return builder.build();
  }

  private static QuantitativeSpec readSpec(String attribute, JsonNode node) {
    if (!node.isObject()) {
      throw new InvalidBinSpecException(attribute, "expected {min, max, binCount}");
    }
    double min = number(attribute, node, "min").asDouble();
    double max = number(attribute, node, "max").asDouble();
    JsonNode binCount = number(attribute, node, "binCount");
    if (!binCount.canConvertToInt() || binCount.asDouble() != binCount.asInt()) {
      throw new InvalidBinSpecException(attribute, "binCount must be an integer");
    }
    return new QuantitativeSpec(attribute, min, max, binCount.asInt());
  }

  private static JsonNode number(String attribute, JsonNode spec, String name) {
    JsonNode value = spec.get(name);
    if (value == null || !value.isNumber()) {
      throw new InvalidBinSpecException(attribute, name + " must be a number");
    }
    return value;
  }

  public FilterPredicate getFilter() {
    return filter;
  }

  public List<String> getCategoricalAttributes() {
    return categoricalAttributes;
  }

  public Map<String, QuantitativeSpec> getQuantitativeSpecs() {
    return quantitativeSpecs;
  }

  /** Returns attributes rejected while reading the request, with the reason. */
  public Map<String, String> getRejectedAttributes() {
    return rejected;
  }

  /**
   * Returns the top edge policy the request asks for, or null when it leaves
   * the choice to the deployment ({@link TopEdgePolicy#UNCLAMPED} if nothing
   * else is configured).
   */
  public @Nullable TopEdgePolicy getTopEdgePolicy() {
    return topEdgePolicy;
  }

  /** Returns a copy of this request that uses the given top edge policy. */
  public HistogramRequest withTopEdgePolicy(TopEdgePolicy policy) {
    if (policy == topEdgePolicy) {
      return this;
    }
    Builder builder = builder()
        .filter(filter)
        .categorical(categoricalAttributes)
        .topEdgePolicy(policy);
    for (QuantitativeSpec spec : quantitativeSpecs.values()) {
      builder.quantitative(spec);
    }
    for (Map.Entry<String, String> entry : rejected.entrySet()) {
      builder.rejected(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  @Override public String toString() {
    return "HistogramRequest{filter=" + filter.toJson()
        + ", categorical=" + categoricalAttributes
        + ", quantitative=" + quantitativeSpecs.values()
        + ", topEdgePolicy=" + topEdgePolicy + "}";
  }

  /**
   * Builder for HistogramRequest.
   */
  public static final class Builder {
    private FilterPredicate filter = FilterPredicate.none();
    private final Set<String> categorical = new LinkedHashSet<>();
    private final Map<String, QuantitativeSpec> quantitative = new LinkedHashMap<>();
    private final Map<String, String> rejected = new LinkedHashMap<>();
    private @Nullable TopEdgePolicy topEdgePolicy;

    private Builder() {
    }

    public Builder filter(@Nullable FilterPredicate filter) {
      this.filter = filter == null ? FilterPredicate.none() : filter;
      return this;
    }

    /** Adds a categorical attribute; blank names are ignored. */
    public Builder categorical(String attribute) {
      if (attribute != null && !attribute.isEmpty()) {
        categorical.add(attribute);
      }
      return this;
    }

    public Builder categorical(Collection<String> attributes) {
      for (String attribute : attributes) {
        categorical(attribute);
      }
      return this;
    }

    /** Adds a quantitative spec, replacing an earlier one for the same attribute. */
    public Builder quantitative(QuantitativeSpec spec) {
      requireNonNull(spec, "spec");
      rejected.remove(spec.getAttribute());
      quantitative.put(spec.getAttribute(), spec);
      return this;
    }

    public Builder quantitative(String attribute, double min, double max, int binCount) {
      return quantitative(new QuantitativeSpec(attribute, min, max, binCount));
    }

    Builder rejected(String attribute, String reason) {
      quantitative.remove(attribute);
      rejected.put(attribute, reason);
      return this;
    }

    public Builder topEdgePolicy(TopEdgePolicy topEdgePolicy) {
      this.topEdgePolicy = requireNonNull(topEdgePolicy, "topEdgePolicy");
      return this;
    }

    public HistogramRequest build() {
      return new HistogramRequest(this);
    }
  }
}

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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Binning instructions for one numeric attribute: {@code binCount} equal
 * bins spanning {@code [min, max)}.
 *
 * <p>A spec can be created with any values; {@link #validate()} rejects the
 * ones that cannot be binned. Every arithmetic method validates first, so
 * {@code max == min} never reaches a division.
 */
public final class QuantitativeSpec {

  private final String attribute;
  private final double min;
  private final double max;
  private final int binCount;

  public QuantitativeSpec(String attribute, double min, double max, int binCount) {
    this.attribute = requireNonNull(attribute, "attribute");
    this.min = min;
    this.max = max;
    this.binCount = binCount;
  }

  public String getAttribute() {
    return attribute;
  }

  /** Returns this spec with the same bins applied to another attribute. */
  public QuantitativeSpec forAttribute(String attribute) {
    if (this.attribute.equals(attribute)) {
      return this;
    }
    return new QuantitativeSpec(attribute, min, max, binCount);
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public int getBinCount() {
    return binCount;
  }

  /** Returns {@code max - min}. */
  public double getRange() {
    return max - min;
  }

  /** Returns the width of one bin. */
  public double getBinWidth() {
    validate();
    return getRange() / binCount;
  }

  /**
   * Checks that this spec describes a usable histogram.
   *
   * @throws InvalidBinSpecException if the bin count is below 1, a bound is
   *     not finite, or {@code max <= min}
   */
  public void validate() {
    if (attribute.isEmpty()) {
      throw new InvalidBinSpecException(attribute, "attribute name is empty");
    }
    if (binCount < 1) {
      throw new InvalidBinSpecException(attribute, "binCount must be at least 1, got " + binCount);
    }
    if (!Double.isFinite(min) || !Double.isFinite(max)) {
      throw new InvalidBinSpecException(attribute, "min and max must be finite numbers");
    }
    if (max <= min) {
      throw new InvalidBinSpecException(attribute,
          "max (" + max + ") must be greater than min (" + min + ")");
    }
  }

  /**
   * Computes the bin of a value: {@code floor(binCount * (value - min) / (max - min))}.
   *
   * <p>The operations are performed in the same order as in the
   * aggregation stage, so both agree on values close to a bin edge.
   */
  public long binIndex(double value, TopEdgePolicy policy) {
    validate();
    if (policy == TopEdgePolicy.INCLUDE_MAX && value == max) {
      return binCount - 1;
    }
    return (long) Math.floor((value - min) * binCount / getRange());
  }

  /** Returns the inclusive low bound of a bin. */
  public double lowBound(long binIndex) {
    validate();
    return min + binIndex * getRange() / binCount;
  }

  /** Returns the high bound of a bin, exclusive except for an INCLUDE_MAX top bin. */
  public double highBound(long binIndex) {
    return lowBound(binIndex) + getBinWidth();
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QuantitativeSpec)) {
      return false;
    }
    QuantitativeSpec that = (QuantitativeSpec) o;
    return attribute.equals(that.attribute)
        && Double.compare(min, that.min) == 0
        && Double.compare(max, that.max) == 0
        && binCount == that.binCount;
  }

  @Override public int hashCode() {
    return Objects.hash(attribute, min, max, binCount);
  }

  @Override public String toString() {
    return "QuantitativeSpec{" + attribute + ", min=" + min + ", max=" + max
        + ", binCount=" + binCount + "}";
  }
}

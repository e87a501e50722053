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

import org.bson.Document;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One bin of a quantitative histogram. Bounds are reconstructed from the
 * index and the spec, never stored by the store.
 */
public final class HistogramBin {

  private final long index;
  private final long count;
  private final double lowBound;
  private final double highBound;

  public HistogramBin(long index, long count, double lowBound, double highBound) {
    this.index = index;
    this.count = count;
    this.lowBound = lowBound;
    this.highBound = highBound;
  }

  /** Creates a bin with bounds derived from {@code spec}. */
  public static HistogramBin of(QuantitativeSpec spec, long index, long count) {
    return new HistogramBin(index, count, spec.lowBound(index), spec.highBound(index));
  }

  public long getIndex() {
    return index;
  }

  public long getCount() {
    return count;
  }

  public double getLowBound() {
    return lowBound;
  }

  public double getHighBound() {
    return highBound;
  }

  /** Renders {@code {_id: index, count: n, lowBound: l, highBound: h}}. */
  public Document toDocument() {
    return new Document("_id", index)
        .append("count", count)
        .append("lowBound", lowBound)
        .append("highBound", highBound);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HistogramBin)) {
      return false;
    }
    HistogramBin that = (HistogramBin) o;
    return index == that.index && count == that.count
        && Double.compare(lowBound, that.lowBound) == 0
        && Double.compare(highBound, that.highBound) == 0;
  }

  @Override public int hashCode() {
    return Objects.hash(index, count, lowBound, highBound);
  }

  @Override public String toString() {
    return "HistogramBin{" + index + ": [" + lowBound + ", " + highBound + ")=" + count + "}";
  }
}

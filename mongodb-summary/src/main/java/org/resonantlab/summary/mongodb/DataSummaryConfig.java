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

import org.resonantlab.summary.mongodb.histogram.TopEdgePolicy;
import org.resonantlab.summary.mongodb.schema.SchemaInferenceEngine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Settings for connecting to MongoDB and for running the summary engines.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * connectTimeoutMs: 5000
 * serverSelectionTimeoutMs: 10000
 * readTimeoutMs: 0
 * applicationName: "data-summary"
 * verifyConnection: true
 * allowDiskUse: true
 * maxTimeMs: "${SUMMARY_MAX_TIME_MS:-0}"
 * batchSize: 1000
 * schemaMode: scan          # or pushdown
 * topEdgePolicy: unclamped  # or include_max
 * }</pre>
 *
 * <p>Options given in a dataset's connection string take precedence over
 * the timeouts and application name configured here.
 */
public final class DataSummaryConfig {

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final int connectTimeoutMs;
  private final int serverSelectionTimeoutMs;
  private final int readTimeoutMs;
  private final String applicationName;
  private final boolean verifyConnection;
  private final boolean allowDiskUse;
  private final long maxTimeMs;
  private final int batchSize;
  private final SchemaInferenceEngine.Mode schemaMode;
  private final TopEdgePolicy topEdgePolicy;

  private DataSummaryConfig(Builder builder) {
    this.connectTimeoutMs = builder.connectTimeoutMs;
    this.serverSelectionTimeoutMs = builder.serverSelectionTimeoutMs;
    this.readTimeoutMs = builder.readTimeoutMs;
    this.applicationName = builder.applicationName;
    this.verifyConnection = builder.verifyConnection;
    this.allowDiskUse = builder.allowDiskUse;
    this.maxTimeMs = builder.maxTimeMs;
    this.batchSize = builder.batchSize;
    this.schemaMode = builder.schemaMode;
    this.topEdgePolicy = builder.topEdgePolicy;
  }

  public static DataSummaryConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration from an operand map. Unknown keys are ignored;
   * string values may reference environment variables.
   *
   * @throws IllegalArgumentException if a value has the wrong type
   */
  public static DataSummaryConfig fromMap(@Nullable Map<String, ?> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Object value = map.get("connectTimeoutMs");
    if (value != null) {
      builder.connectTimeoutMs(intValue("connectTimeoutMs", value));
    }
    value = map.get("serverSelectionTimeoutMs");
    if (value != null) {
      builder.serverSelectionTimeoutMs(intValue("serverSelectionTimeoutMs", value));
    }
    value = map.get("readTimeoutMs");
    if (value != null) {
      builder.readTimeoutMs(intValue("readTimeoutMs", value));
    }
    value = map.get("applicationName");
    if (value != null) {
      builder.applicationName(ConfigValueResolver.resolve(value.toString()));
    }
    value = map.get("verifyConnection");
    if (value != null) {
      builder.verifyConnection(booleanValue(value));
    }
    value = map.get("allowDiskUse");
    if (value != null) {
      builder.allowDiskUse(booleanValue(value));
    }
    value = map.get("maxTimeMs");
    if (value != null) {
      builder.maxTimeMs(longValue("maxTimeMs", value));
    }
    value = map.get("batchSize");
    if (value != null) {
      builder.batchSize(intValue("batchSize", value));
    }
    value = map.get("schemaMode");
    if (value != null) {
      builder.schemaMode(SchemaInferenceEngine.Mode.valueOf(enumName(value)));
    }
    value = map.get("topEdgePolicy");
    if (value != null) {
      builder.topEdgePolicy(TopEdgePolicy.valueOf(enumName(value)));
    }
    return builder.build();
  }

  /**
   * Loads a configuration file. Files ending in {@code .yaml} or
   * {@code .yml} are read as YAML, anything else as JSON.
   */
  public static DataSummaryConfig load(Path path) throws IOException {
    String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
    ObjectMapper mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml")
        ? YAML_MAPPER : JSON_MAPPER;
    try (InputStream in = Files.newInputStream(path)) {
      Map<String, Object> map = mapper.readValue(in, new TypeReference<Map<String, Object>>() { });
      return fromMap(map);
    }
  }

  private static long longValue(String key, Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    String text = ConfigValueResolver.resolve(value.toString()).trim();
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be a number, got: " + text, e);
    }
  }

  private static int intValue(String key, Object value) {
    long longValue = longValue(key, value);
    try {
      return Math.toIntExact(longValue);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(key + " is out of range: " + longValue, e);
    }
  }

  private static boolean booleanValue(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return Boolean.parseBoolean(ConfigValueResolver.resolve(value.toString()).trim());
  }

  private static String enumName(Object value) {
    return ConfigValueResolver.resolve(value.toString()).trim().toUpperCase(Locale.ROOT);
  }

  /**
   * Builds driver settings for a connection string. Options present in the
   * connection string override the ones held by this configuration.
   */
  public MongoClientSettings toClientSettings(ConnectionString connectionString) {
    return MongoClientSettings.builder()
        .applicationName(applicationName)
        .applyToSocketSettings(socket -> socket
            .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS))
        .applyToClusterSettings(cluster -> cluster
            .serverSelectionTimeout(serverSelectionTimeoutMs, TimeUnit.MILLISECONDS))
        .applyConnectionString(connectionString)
        .build();
  }

  public int getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public int getServerSelectionTimeoutMs() {
    return serverSelectionTimeoutMs;
  }

  public int getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public String getApplicationName() {
    return applicationName;
  }

  /** Whether resolving a handle pings the server before returning. */
  public boolean isVerifyConnection() {
    return verifyConnection;
  }

  public boolean isAllowDiskUse() {
    return allowDiskUse;
  }

  /** Server-side time limit per aggregation, or 0 for none. */
  public long getMaxTimeMs() {
    return maxTimeMs;
  }

  /** Cursor batch size, or 0 for the driver default. */
  public int getBatchSize() {
    return batchSize;
  }

  public SchemaInferenceEngine.Mode getSchemaMode() {
    return schemaMode;
  }

  public TopEdgePolicy getTopEdgePolicy() {
    return topEdgePolicy;
  }

  @Override public String toString() {
    return "DataSummaryConfig{connectTimeoutMs=" + connectTimeoutMs
        + ", serverSelectionTimeoutMs=" + serverSelectionTimeoutMs
        + ", readTimeoutMs=" + readTimeoutMs
        + ", applicationName=" + applicationName
        + ", verifyConnection=" + verifyConnection
        + ", allowDiskUse=" + allowDiskUse
        + ", maxTimeMs=" + maxTimeMs
        + ", batchSize=" + batchSize
        + ", schemaMode=" + schemaMode
        + ", topEdgePolicy=" + topEdgePolicy + "}";
  }

  /**
   * Builder for DataSummaryConfig.
   */
  public static final class Builder {
    private int connectTimeoutMs = 10_000;
    private int serverSelectionTimeoutMs = 30_000;
    private int readTimeoutMs = 0;
    private String applicationName = "data-summary";
    private boolean verifyConnection = true;
    private boolean allowDiskUse = true;
    private long maxTimeMs = 0;
    private int batchSize = 0;
    private SchemaInferenceEngine.Mode schemaMode = SchemaInferenceEngine.Mode.SCAN;
    private TopEdgePolicy topEdgePolicy = TopEdgePolicy.UNCLAMPED;

    private Builder() {
    }

    public Builder connectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = nonNegative("connectTimeoutMs", connectTimeoutMs);
      return this;
    }

    public Builder serverSelectionTimeoutMs(int serverSelectionTimeoutMs) {
      this.serverSelectionTimeoutMs =
          nonNegative("serverSelectionTimeoutMs", serverSelectionTimeoutMs);
      return this;
    }

    public Builder readTimeoutMs(int readTimeoutMs) {
      this.readTimeoutMs = nonNegative("readTimeoutMs", readTimeoutMs);
      return this;
    }

    public Builder applicationName(@Nullable String applicationName) {
      if (applicationName != null && !applicationName.isEmpty()) {
        this.applicationName = applicationName;
      }
      return this;
    }

    public Builder verifyConnection(boolean verifyConnection) {
      this.verifyConnection = verifyConnection;
      return this;
    }

    public Builder allowDiskUse(boolean allowDiskUse) {
      this.allowDiskUse = allowDiskUse;
      return this;
    }

    public Builder maxTimeMs(long maxTimeMs) {
      this.maxTimeMs = nonNegative("maxTimeMs", maxTimeMs);
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = nonNegative("batchSize", batchSize);
      return this;
    }

    public Builder schemaMode(SchemaInferenceEngine.Mode schemaMode) {
      this.schemaMode = schemaMode;
      return this;
    }

    public Builder topEdgePolicy(TopEdgePolicy topEdgePolicy) {
      this.topEdgePolicy = topEdgePolicy;
      return this;
    }

    public DataSummaryConfig build() {
      return new DataSummaryConfig(this);
    }

    private static int nonNegative(String name, int value) {
      if (value < 0) {
        throw new IllegalArgumentException(name + " must not be negative: " + value);
      }
      return value;
    }

    private static long nonNegative(String name, long value) {
      if (value < 0) {
        throw new IllegalArgumentException(name + " must not be negative: " + value);
      }
      return value;
    }
  }
}

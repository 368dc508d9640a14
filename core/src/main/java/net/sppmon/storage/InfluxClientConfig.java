// This file is part of SPPMon.
// Copyright (C) 2021  The SPPMon Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sppmon.storage;

import com.google.common.base.Strings;

import net.sppmon.configuration.Configuration;
import net.sppmon.configuration.ConfigurationException;

/**
 * Connection settings and write tunables of the {@link InfluxClient}.
 * 
 * @since 1.0
 */
public class InfluxClientConfig {
  
  public static final String USERNAME_KEY = "influxDB.username";
  public static final String PASSWORD_KEY = "influxDB.password";
  public static final String SSL_KEY = "influxDB.ssl";
  public static final String VERIFY_SSL_KEY = "influxDB.verify_ssl";
  public static final String PORT_KEY = "influxDB.srv_port";
  public static final String ADDRESS_KEY = "influxDB.srv_address";
  public static final String DATABASE_KEY = "influxDB.dbName";
  public static final String MAX_BATCH_SIZE_KEY = "influxDB.max_batch_size";
  public static final String FLUSH_MULTIPLIER_KEY = "influxDB.flush_multiplier";
  public static final String TIMEOUT_KEY = "influxDB.timeout";
  public static final String COPY_TIMEOUT_KEY = "influxDB.copy_timeout";
  
  public static final int DEFAULT_MAX_BATCH_SIZE = 10000;
  public static final int DEFAULT_FLUSH_MULTIPLIER = 5;
  public static final long DEFAULT_TIMEOUT = 20;
  public static final long DEFAULT_COPY_TIMEOUT = 7200;
  
  private final String username;
  private final String password;
  private final boolean ssl;
  private final boolean verify_ssl;
  private final int port;
  private final String address;
  private final String database;
  private final int max_batch_size;
  private final int flush_multiplier;
  private final long timeout;
  private final long copy_timeout;
  
  protected InfluxClientConfig(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.address)) {
      throw new IllegalArgumentException("Server address cannot be null "
          + "or empty.");
    }
    if (Strings.isNullOrEmpty(builder.database)) {
      throw new IllegalArgumentException("Database name cannot be null "
          + "or empty.");
    }
    if (builder.port < 1 || builder.port > 65535) {
      throw new IllegalArgumentException("Invalid server port: " 
          + builder.port);
    }
    if (builder.max_batch_size < 1) {
      throw new IllegalArgumentException("Max batch size must be at least "
          + "1: " + builder.max_batch_size);
    }
    if (builder.flush_multiplier < 1) {
      throw new IllegalArgumentException("Flush multiplier must be at "
          + "least 1: " + builder.flush_multiplier);
    }
    if (builder.timeout < 1 || builder.copy_timeout < 1) {
      throw new IllegalArgumentException("Timeouts must be positive.");
    }
    username = builder.username;
    password = builder.password;
    ssl = builder.ssl;
    verify_ssl = builder.verify_ssl;
    port = builder.port;
    address = builder.address;
    database = builder.database;
    max_batch_size = builder.max_batch_size;
    flush_multiplier = builder.flush_multiplier;
    timeout = builder.timeout;
    copy_timeout = builder.copy_timeout;
  }
  
  public String username() {
    return username;
  }
  
  public String password() {
    return password;
  }
  
  public boolean ssl() {
    return ssl;
  }
  
  public boolean verifySsl() {
    return verify_ssl;
  }
  
  public int port() {
    return port;
  }
  
  public String address() {
    return address;
  }
  
  public String database() {
    return database;
  }
  
  /** @return The maximum number of lines per write request. */
  public int maxBatchSize() {
    return max_batch_size;
  }
  
  /** @return How many batches a table may buffer before it is flushed. */
  public int flushMultiplier() {
    return flush_multiplier;
  }
  
  /** @return The request timeout in seconds. */
  public long timeout() {
    return timeout;
  }
  
  /** @return The request timeout in seconds when copying a database. */
  public long copyTimeout() {
    return copy_timeout;
  }
  
  /** @return The server URL, http or https depending on the SSL flag. */
  public String url() {
    return (ssl ? "https://" : "http://") + address + ":" + port;
  }
  
  @Override
  public String toString() {
    // password left out on purpose
    return new StringBuilder()
        .append("url=")
        .append(url())
        .append(", database=")
        .append(database)
        .append(", username=")
        .append(username)
        .append(", verifySsl=")
        .append(verify_ssl)
        .toString();
  }
  
  /**
   * Registers the InfluxDB keys, if not already registered, and reads them.
   * The connection keys have no defaults and must be supplied by the config
   * file, a system property or an override.
   * @param config A non-null configuration.
   * @return The settings.
   * @throws ConfigurationException if a required key was missing.
   */
  public static InfluxClientConfig fromConfiguration(final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Configuration cannot be null.");
    }
    registerKeys(config);
    for (final String key : new String[] { USERNAME_KEY, PASSWORD_KEY, 
        PORT_KEY, ADDRESS_KEY, DATABASE_KEY }) {
      if (config.getString(key) == null) {
        throw new ConfigurationException("Missing required config value: " 
            + key);
      }
    }
    return newBuilder()
        .setUsername(config.getString(USERNAME_KEY))
        .setPassword(config.getString(PASSWORD_KEY))
        .setSsl(config.getBoolean(SSL_KEY))
        .setVerifySsl(config.getBoolean(VERIFY_SSL_KEY))
        .setPort(config.getInt(PORT_KEY))
        .setAddress(config.getString(ADDRESS_KEY))
        .setDatabase(config.getString(DATABASE_KEY))
        .setMaxBatchSize(config.getInt(MAX_BATCH_SIZE_KEY))
        .setFlushMultiplier(config.getInt(FLUSH_MULTIPLIER_KEY))
        .setTimeout(config.getLong(TIMEOUT_KEY))
        .setCopyTimeout(config.getLong(COPY_TIMEOUT_KEY))
        .build();
  }
  
  private static void registerKeys(final Configuration config) {
    register(config, USERNAME_KEY, null, 
        "The user to authenticate with against InfluxDB.");
    register(config, PASSWORD_KEY, null, 
        "The password of the InfluxDB user.");
    register(config, SSL_KEY, false, 
        "Whether or not to connect to InfluxDB via HTTPS.");
    register(config, VERIFY_SSL_KEY, false, 
        "Whether or not to verify the certificate of the InfluxDB server.");
    register(config, PORT_KEY, null, "The port of the InfluxDB server.");
    register(config, ADDRESS_KEY, null, 
        "The host name or IP address of the InfluxDB server.");
    register(config, DATABASE_KEY, null, 
        "The database SPPMon writes into.");
    register(config, MAX_BATCH_SIZE_KEY, DEFAULT_MAX_BATCH_SIZE, 
        "The maximum number of points sent in one write request.");
    register(config, FLUSH_MULTIPLIER_KEY, DEFAULT_FLUSH_MULTIPLIER, 
        "Buffered batches per table after which the buffer is flushed.");
    register(config, TIMEOUT_KEY, DEFAULT_TIMEOUT, 
        "The request timeout in seconds.");
    register(config, COPY_TIMEOUT_KEY, DEFAULT_COPY_TIMEOUT, 
        "The request timeout in seconds when copying a database.");
  }
  
  private static void register(final Configuration config, 
                               final String key, 
                               final Object default_value, 
                               final String description) {
    if (!config.hasProperty(key)) {
      config.register(key, default_value, description);
    }
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String username;
    private String password;
    private boolean ssl;
    private boolean verify_ssl;
    private int port;
    private String address;
    private String database;
    private int max_batch_size = DEFAULT_MAX_BATCH_SIZE;
    private int flush_multiplier = DEFAULT_FLUSH_MULTIPLIER;
    private long timeout = DEFAULT_TIMEOUT;
    private long copy_timeout = DEFAULT_COPY_TIMEOUT;
    
    public Builder setUsername(final String username) {
      this.username = username;
      return this;
    }
    
    public Builder setPassword(final String password) {
      this.password = password;
      return this;
    }
    
    public Builder setSsl(final boolean ssl) {
      this.ssl = ssl;
      return this;
    }
    
    public Builder setVerifySsl(final boolean verify_ssl) {
      this.verify_ssl = verify_ssl;
      return this;
    }
    
    public Builder setPort(final int port) {
      this.port = port;
      return this;
    }
    
    public Builder setAddress(final String address) {
      this.address = address;
      return this;
    }
    
    public Builder setDatabase(final String database) {
      this.database = database;
      return this;
    }
    
    public Builder setMaxBatchSize(final int max_batch_size) {
      this.max_batch_size = max_batch_size;
      return this;
    }
    
    public Builder setFlushMultiplier(final int flush_multiplier) {
      this.flush_multiplier = flush_multiplier;
      return this;
    }
    
    public Builder setTimeout(final long timeout) {
      this.timeout = timeout;
      return this;
    }
    
    public Builder setCopyTimeout(final long copy_timeout) {
      this.copy_timeout = copy_timeout;
      return this;
    }
    
    public InfluxClientConfig build() {
      return new InfluxClientConfig(this);
    }
  }
}

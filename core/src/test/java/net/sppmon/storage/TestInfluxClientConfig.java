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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.Files;

import net.sppmon.configuration.Configuration;
import net.sppmon.configuration.ConfigurationException;

public final class TestInfluxClientConfig {
  
  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();
  
  @Test
  public void builder() throws Exception {
    final InfluxClientConfig config = InfluxClientConfig.newBuilder()
        .setAddress("influx.local")
        .setPort(8086)
        .setDatabase("spp")
        .build();
    assertEquals("http://influx.local:8086", config.url());
    assertEquals(InfluxClientConfig.DEFAULT_MAX_BATCH_SIZE, 
        config.maxBatchSize());
    assertEquals(InfluxClientConfig.DEFAULT_FLUSH_MULTIPLIER, 
        config.flushMultiplier());
    assertEquals(InfluxClientConfig.DEFAULT_TIMEOUT, config.timeout());
    assertEquals(InfluxClientConfig.DEFAULT_COPY_TIMEOUT, 
        config.copyTimeout());
    assertFalse(config.ssl());
  }
  
  @Test
  public void builderInvalid() throws Exception {
    try {
      InfluxClientConfig.newBuilder().setPort(8086).setDatabase("spp").build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      InfluxClientConfig.newBuilder().setPort(8086).setAddress("a").build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      InfluxClientConfig.newBuilder().setPort(70000).setAddress("a")
        .setDatabase("spp").build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      InfluxClientConfig.newBuilder().setPort(8086).setAddress("a")
        .setDatabase("spp").setMaxBatchSize(0).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      InfluxClientConfig.newBuilder().setPort(8086).setAddress("a")
        .setDatabase("spp").setTimeout(0).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void fromConfiguration() throws Exception {
    final Configuration configuration = new Configuration();
    configuration.loadFile(write("{\"influxDB\":{\"username\":\"admin\","
        + "\"password\":\"secret\",\"ssl\":true,\"verify_ssl\":false,"
        + "\"srv_port\":8086,\"srv_address\":\"influx.local\","
        + "\"dbName\":\"spp\",\"max_batch_size\":500}}"));
    
    final InfluxClientConfig config = 
        InfluxClientConfig.fromConfiguration(configuration);
    assertEquals("admin", config.username());
    assertEquals("secret", config.password());
    assertTrue(config.ssl());
    assertFalse(config.verifySsl());
    assertEquals("https://influx.local:8086", config.url());
    assertEquals("spp", config.database());
    assertEquals(500, config.maxBatchSize());
    assertEquals(InfluxClientConfig.DEFAULT_FLUSH_MULTIPLIER, 
        config.flushMultiplier());
    assertFalse(config.toString().contains("secret"));
    
    // keys stay registered
    configuration.addOverride(InfluxClientConfig.DATABASE_KEY, "other");
    assertEquals("other", 
        InfluxClientConfig.fromConfiguration(configuration).database());
  }
  
  @Test
  public void fromConfigurationMissingKey() throws Exception {
    final Configuration configuration = new Configuration();
    configuration.loadFile(write("{\"influxDB\":{\"username\":\"admin\","
        + "\"password\":\"secret\",\"srv_port\":8086,"
        + "\"srv_address\":\"influx.local\"}}"));
    try {
      InfluxClientConfig.fromConfiguration(configuration);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage().contains(InfluxClientConfig.DATABASE_KEY));
    }
  }
  
  private String write(final String json) throws Exception {
    final File file = folder.newFile("sppmon.conf");
    Files.asCharSink(file, StandardCharsets.UTF_8).write(json);
    return file.getAbsolutePath();
  }
}

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
package net.sppmon.configuration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public final class TestConfiguration {
  private static final String PROPERTY_KEY = "sppmon.test.property";
  
  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();
  
  private Configuration config;
  
  @Before
  public void before() throws Exception {
    config = new Configuration();
  }
  
  @After
  public void after() throws Exception {
    System.clearProperty(PROPERTY_KEY);
  }
  
  @Test
  public void registerAndDefaults() throws Exception {
    config.register("influxDB.srv_port", 8086, "The port.");
    config.register("influxDB.ssl", false, "SSL.");
    config.register("influxDB.username", null, "User.");
    
    assertTrue(config.hasProperty("influxDB.srv_port"));
    assertFalse(config.hasProperty("influxDB.nope"));
    assertEquals(8086, config.getInt("influxDB.srv_port"));
    assertEquals(8086L, config.getLong("influxDB.srv_port"));
    assertEquals("8086", config.getString("influxDB.srv_port"));
    assertFalse(config.getBoolean("influxDB.ssl"));
    assertNull(config.getString("influxDB.username"));
    assertFalse(config.isSet("influxDB.srv_port"));
  }
  
  @Test
  public void registerErrors() throws Exception {
    config.register("key", 1, "desc");
    try {
      config.register("key", 2, "desc");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    
    try {
      config.register(null, 2, "desc");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      config.register("other", 2, "");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void unregisteredKey() throws Exception {
    try {
      config.getString("influxDB.nope");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    
    try {
      config.addOverride("influxDB.nope", "x");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }
  
  @Test
  public void nullToPrimitive() throws Exception {
    config.register("influxDB.srv_port", null, "The port.");
    try {
      config.getInt("influxDB.srv_port");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }
  
  @Test
  public void loadFileFlattens() throws Exception {
    final File file = folder.newFile("conf.json");
    Files.write(file.toPath(), ("{\"influxDB\": {\"srv_address\": \"localhost\", "
        + "\"srv_port\": 8086, \"ssl\": true, \"dbName\": \"spp1\"}, "
        + "\"sshclients\": [1, 2]}").getBytes(StandardCharsets.UTF_8));
    config.register("influxDB.srv_address", null, "Address.");
    config.register("influxDB.srv_port", 1, "Port.");
    config.register("influxDB.ssl", false, "SSL.");
    config.register("influxDB.dbName", null, "Database.");
    
    config.loadFile(file.getAbsolutePath());
    assertEquals("localhost", config.getString("influxDB.srv_address"));
    assertEquals(8086, config.getInt("influxDB.srv_port"));
    assertTrue(config.getBoolean("influxDB.ssl"));
    assertEquals("spp1", config.getString("influxDB.dbName"));
    assertTrue(config.isSet("influxDB.dbName"));
    assertEquals("[1,2]", config.fileValues().get("sshclients"));
  }
  
  @Test
  public void loadFileErrors() throws Exception {
    try {
      config.loadFile(new File(folder.getRoot(), "missing.json")
          .getAbsolutePath());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    
    final File file = folder.newFile("array.json");
    Files.write(file.toPath(), "[1, 2]".getBytes(StandardCharsets.UTF_8));
    try {
      config.loadFile(file.getAbsolutePath());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    
    final File broken = folder.newFile("broken.json");
    Files.write(broken.toPath(), "{\"a\": ".getBytes(StandardCharsets.UTF_8));
    try {
      config.loadFile(broken.getAbsolutePath());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }
  
  @Test
  public void precedence() throws Exception {
    final File file = folder.newFile("conf.json");
    Files.write(file.toPath(), ("{\"sppmon\": {\"test\": {\"property\": "
        + "\"file\"}}}").getBytes(StandardCharsets.UTF_8));
    config.register(PROPERTY_KEY, "default", "A test key.");
    assertEquals("default", config.getString(PROPERTY_KEY));
    
    config.loadFile(file.getAbsolutePath());
    assertEquals("file", config.getString(PROPERTY_KEY));
    
    System.setProperty(PROPERTY_KEY, "system");
    assertEquals("system", config.getString(PROPERTY_KEY));
    
    config.addOverride(PROPERTY_KEY, "override");
    assertEquals("override", config.getString(PROPERTY_KEY));
  }
  
  @Test
  public void getBoolean() throws Exception {
    config.register("a", "yes", "desc");
    config.register("b", "1", "desc");
    config.register("c", "TRUE", "desc");
    config.register("d", "nope", "desc");
    config.register("e", null, "desc");
    assertTrue(config.getBoolean("a"));
    assertTrue(config.getBoolean("b"));
    assertTrue(config.getBoolean("c"));
    assertFalse(config.getBoolean("d"));
    assertFalse(config.getBoolean("e"));
  }
}

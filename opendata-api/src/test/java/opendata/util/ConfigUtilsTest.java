/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package opendata.util;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;


@Test(groups = {"opendata.util"})
public class ConfigUtilsTest {

  public void testGetStringListFromList() {
    Config config = ConfigFactory.parseString("iris = [\"https://a.example/1\", \"https://a.example/2\"]");
    Assert.assertEquals(ConfigUtils.getStringList(config, "iris"),
        ImmutableList.of("https://a.example/1", "https://a.example/2"));
  }

  public void testGetStringListFromCommaSeparatedString() {
    Config config = ConfigFactory.parseMap(ImmutableMap.of("iris", " https://a.example/1 ,,https://a.example/2"));
    Assert.assertEquals(ConfigUtils.getStringList(config, "iris"),
        ImmutableList.of("https://a.example/1", "https://a.example/2"));
  }

  public void testGetStringListMissingPath() {
    Assert.assertTrue(ConfigUtils.getStringList(ConfigFactory.empty(), "iris").isEmpty());
  }

  public void testDefaults() {
    Config config = ConfigFactory.parseMap(ImmutableMap.of("a.b", "x", "a.n", 3, "a.flag", false));
    Assert.assertEquals(ConfigUtils.getString(config, "a.b", "def"), "x");
    Assert.assertEquals(ConfigUtils.getString(config, "a.c", "def"), "def");
    Assert.assertEquals(ConfigUtils.getInt(config, "a.n", 10), Integer.valueOf(3));
    Assert.assertEquals(ConfigUtils.getInt(config, "a.m", 10), Integer.valueOf(10));
    Assert.assertFalse(ConfigUtils.getBoolean(config, "a.flag", true));
    Assert.assertTrue(ConfigUtils.getBoolean(config, "a.other", true));
    Assert.assertEquals(ConfigUtils.getConfig(config, "a").getString("b"), "x");
    Assert.assertTrue(ConfigUtils.getConfig(config, "z").isEmpty());
  }
}

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

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueType;


/**
 * Utility class for working with {@link Config}.
 */
public class ConfigUtils {

  private static final Splitter LIST_SPLITTER = Splitter.on(",").trimResults().omitEmptyStrings();

  private ConfigUtils() {
  }

  /**
   * Return string value at <code>path</code> if <code>config</code> has path. If not return <code>def</code>
   */
  public static String getString(Config config, String path, String def) {
    if (config.hasPath(path)) {
      return config.getString(path);
    }
    return def;
  }

  /**
   * Return {@link Integer} value at <code>path</code> if <code>config</code> has path. If not return <code>def</code>
   */
  public static Integer getInt(Config config, String path, Integer def) {
    if (config.hasPath(path)) {
      return Integer.valueOf(config.getInt(path));
    }
    return def;
  }

  /**
   * Return boolean value at <code>path</code> if <code>config</code> has path. If not return <code>def</code>
   */
  public static boolean getBoolean(Config config, String path, boolean def) {
    if (config.hasPath(path)) {
      return config.getBoolean(path);
    }
    return def;
  }

  /**
   * Return the sub {@link Config} at <code>path</code> if <code>config</code> has path. If not return an empty one.
   */
  public static Config getConfig(Config config, String path) {
    if (config.hasPath(path)) {
      return config.getConfig(path);
    }
    return ConfigFactory.empty();
  }

  /**
   * Read a list of strings at <code>path</code>.
   *
   * <p>
   *   Both a proper list and a single comma separated string are accepted. A missing path yields an empty list.
   * </p>
   */
  public static List<String> getStringList(Config config, String path) {
    if (!config.hasPath(path)) {
      return ImmutableList.of();
    }
    if (config.getValue(path).valueType() == ConfigValueType.LIST) {
      return ImmutableList.copyOf(config.getStringList(path));
    }
    return LIST_SPLITTER.splitToList(config.getString(path));
  }
}

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

package opendata.catalog.extractor;

import java.util.Locale;

import com.typesafe.config.Config;

import opendata.configuration.ConfigurationKeys;
import opendata.util.ConfigUtils;


/**
 * What to do with a payload row whose values cannot be cast to their column datatypes.
 */
public enum RowErrorPolicy {

  /** Abort the extraction of the stream with the cast error. */
  FAIL,

  /** Log the row and continue with the next one. */
  SKIP;

  /**
   * Read the policy at {@value ConfigurationKeys#EXTRACT_ROW_ERROR_POLICY_KEY}, {@link #FAIL} if absent.
   *
   * @throws IllegalArgumentException if the configured value is not a policy name
   */
  public static RowErrorPolicy fromConfig(Config config) {
    String value = ConfigUtils.getString(config, ConfigurationKeys.EXTRACT_ROW_ERROR_POLICY_KEY,
        ConfigurationKeys.DEFAULT_EXTRACT_ROW_ERROR_POLICY);
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

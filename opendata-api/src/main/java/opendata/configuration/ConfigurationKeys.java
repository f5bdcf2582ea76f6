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

package opendata.configuration;

/**
 * A central place for all configuration property keys.
 */
public class ConfigurationKeys {

  private ConfigurationKeys() {
  }

  /**
   * Job configuration properties.
   */
  // Identifiers (IRIs) of the datasets to extract, in extraction order
  public static final String DATASET_IRIS_KEY = "iris";

  /**
   * Catalog (metadata service) properties.
   */
  public static final String CATALOG_PREFIX = "opendata.catalog";
  public static final String CATALOG_URL_KEY = CATALOG_PREFIX + ".url";
  public static final String DEFAULT_CATALOG_URL = "https://data.gov.cz/graphql";
  public static final String CATALOG_LOCALE_KEY = CATALOG_PREFIX + ".locale";
  public static final String DEFAULT_CATALOG_LOCALE = "cs";
  public static final String CATALOG_INTROSPECTION_ENABLED_KEY = CATALOG_PREFIX + ".introspection.enabled";
  public static final boolean DEFAULT_CATALOG_INTROSPECTION_ENABLED = true;

  /**
   * Http client properties. Values of this sub tree are handed to the http client as is.
   */
  public static final String HTTP_CLIENT_PREFIX = "opendata.http";

  /**
   * Extractor properties.
   */
  public static final String EXTRACT_PREFIX = "opendata.extract";
  public static final String EXTRACT_SNIFF_SAMPLE_SIZE_KEY = EXTRACT_PREFIX + ".sniffSampleSize";
  public static final int DEFAULT_EXTRACT_SNIFF_SAMPLE_SIZE = 8192;
  public static final String EXTRACT_ROW_ERROR_POLICY_KEY = EXTRACT_PREFIX + ".rowErrorPolicy";
  public static final String DEFAULT_EXTRACT_ROW_ERROR_POLICY = "FAIL";

  /**
   * Common constants.
   */
  public static final String DEFAULT_CHARSET_ENCODING = "UTF-8";
}

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

package opendata.catalog.source;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;

import com.google.common.collect.Lists;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import lombok.extern.slf4j.Slf4j;

import opendata.catalog.schema.DocumentSchema;
import opendata.configuration.ConfigurationKeys;
import opendata.http.ApacheHttpClient;
import opendata.http.HttpClient;
import opendata.source.Source;
import opendata.stream.StreamHandle;
import opendata.util.ConfigUtils;


/**
 * An implementation of {@link Source} for the open data catalog.
 *
 * <p>
 *   This source creates one {@link CatalogStream} per dataset IRI listed at
 *   {@value ConfigurationKeys#DATASET_IRIS_KEY}. All streams share one {@link ApacheHttpClient}, configured from the
 *   {@value ConfigurationKeys#HTTP_CLIENT_PREFIX} sub tree, which is closed by {@link #shutdown()}.
 * </p>
 */
@Slf4j
public class CatalogSource implements Source<DocumentSchema, Map<String, Object>> {

  private HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient;

  /**
   * @throws ConfigException.Missing if {@value ConfigurationKeys#DATASET_IRIS_KEY} is not configured
   */
  @Override
  public List<StreamHandle<DocumentSchema, Map<String, Object>>> getStreams(Config config) throws IOException {
    if (!config.hasPath(ConfigurationKeys.DATASET_IRIS_KEY)) {
      throw new ConfigException.Missing(ConfigurationKeys.DATASET_IRIS_KEY);
    }
    List<String> iris = ConfigUtils.getStringList(config, ConfigurationKeys.DATASET_IRIS_KEY);
    if (iris.isEmpty()) {
      log.warn("No dataset IRIs configured at {}.", ConfigurationKeys.DATASET_IRIS_KEY);
    }

    CatalogStreamFactory factory = new CatalogStreamFactory(getHttpClient(config), config);
    List<StreamHandle<DocumentSchema, Map<String, Object>>> streams = Lists.newArrayList();
    for (String iri : iris) {
      streams.add(factory.forIri(iri).resolve());
    }
    return streams;
  }

  private synchronized HttpClient<HttpUriRequest, CloseableHttpResponse> getHttpClient(Config config) {
    if (this.httpClient == null) {
      this.httpClient = new ApacheHttpClient(ConfigUtils.getConfig(config, ConfigurationKeys.HTTP_CLIENT_PREFIX));
    }
    return this.httpClient;
  }

  @Override
  public synchronized void shutdown() throws IOException {
    if (this.httpClient != null) {
      this.httpClient.close();
      this.httpClient = null;
    }
  }
}

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

package opendata.http;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.conn.BasicHttpClientConnectionManager;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;


@Test(groups = {"opendata.http"})
public class ApacheHttpClientTest {

  public void testDefaultRequestConfig() {
    RequestConfig requestConfig = ApacheHttpClient.toRequestConfig(ApacheHttpClient.DEFAULTS);
    Assert.assertEquals(requestConfig.getConnectTimeout(), 10000);
    Assert.assertEquals(requestConfig.getConnectionRequestTimeout(), 10000);
    Assert.assertEquals(requestConfig.getSocketTimeout(), 60000);
  }

  public void testOverriddenTimeouts() {
    Config config = ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
        ApacheHttpClient.CONNECT_TIMEOUT_MS_KEY, 500,
        ApacheHttpClient.SOCKET_TIMEOUT_MS_KEY, 1500)).withFallback(ApacheHttpClient.DEFAULTS);
    RequestConfig requestConfig = ApacheHttpClient.toRequestConfig(config);
    Assert.assertEquals(requestConfig.getConnectTimeout(), 500);
    Assert.assertEquals(requestConfig.getSocketTimeout(), 1500);
  }

  public void testConnectionManagerType() {
    Assert.assertEquals(ApacheHttpClient.ConnectionManagerType.fromConfig(ApacheHttpClient.DEFAULTS),
        ApacheHttpClient.ConnectionManagerType.BASIC);
    Assert.assertTrue(ApacheHttpClient.ConnectionManagerType.BASIC.create(ApacheHttpClient.DEFAULTS)
        instanceof BasicHttpClientConnectionManager);

    Config pooling = ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
        ApacheHttpClient.CONNECTION_MANAGER_KEY, "pooling",
        ApacheHttpClient.POOLING_MAX_TOTAL_KEY, 7)).withFallback(ApacheHttpClient.DEFAULTS);
    Assert.assertEquals(ApacheHttpClient.ConnectionManagerType.fromConfig(pooling),
        ApacheHttpClient.ConnectionManagerType.POOLING);
    PoolingHttpClientConnectionManager manager = (PoolingHttpClientConnectionManager)
        ApacheHttpClient.ConnectionManagerType.POOLING.create(pooling);
    Assert.assertEquals(manager.getMaxTotal(), 7);
    Assert.assertEquals(manager.getDefaultMaxPerRoute(), 2);
    manager.shutdown();
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnsupportedConnectionManager() {
    ApacheHttpClient.ConnectionManagerType.fromConfig(ConfigFactory.parseMap(
        ImmutableMap.<String, Object>of(ApacheHttpClient.CONNECTION_MANAGER_KEY, "async")));
  }

  public void testCreateAndClose() throws Exception {
    Config config = ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
        ApacheHttpClient.CONNECTION_MANAGER_KEY, "POOLING", ApacheHttpClient.USER_AGENT_KEY, "test-agent"));
    ApacheHttpClient client = new ApacheHttpClient(config);
    client.close();
  }
}

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

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.apache.http.HttpHost;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.conn.HttpClientConnectionManager;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.BasicHttpClientConnectionManager;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import lombok.extern.slf4j.Slf4j;


/**
 * The blocking {@link HttpClient} all catalog components share, backed by a {@link CloseableHttpClient}.
 *
 * <p>
 *   It is configured from the {@code opendata.http} sub tree of the job configuration:
 *   <ul>
 *     <li>{@value #CONNECT_TIMEOUT_MS_KEY}: connect and connection lease timeout, 10s by default</li>
 *     <li>{@value #SOCKET_TIMEOUT_MS_KEY}: maximum inactivity while reading a response, 60s by default</li>
 *     <li>{@value #CONNECTION_MANAGER_KEY}: {@code BASIC} (default) or {@code POOLING}, the latter bounded by
 *         {@value #POOLING_MAX_TOTAL_KEY} and {@value #POOLING_MAX_PER_ROUTE_KEY}</li>
 *     <li>{@value #USER_AGENT_KEY}: the {@code User-Agent} sent with every request</li>
 *     <li>the proxy keys of {@link HttpUtils}</li>
 *   </ul>
 *   Requests are never retried and cookies are not kept.
 * </p>
 */
@Slf4j
public class ApacheHttpClient implements HttpClient<HttpUriRequest, CloseableHttpResponse> {

  public static final String CONNECT_TIMEOUT_MS_KEY = "connectTimeoutMs";
  public static final String SOCKET_TIMEOUT_MS_KEY = "socketTimeoutMs";
  public static final String CONNECTION_MANAGER_KEY = "connectionManager";
  public static final String POOLING_MAX_TOTAL_KEY = "pooling.maxTotal";
  public static final String POOLING_MAX_PER_ROUTE_KEY = "pooling.maxPerRoute";
  public static final String USER_AGENT_KEY = "userAgent";

  public static final String DEFAULT_USER_AGENT = "opendata-extractor";

  /**
   * How connections are managed. The extraction is sequential, a single connection is enough unless the client is
   * shared by concurrent callers.
   */
  public enum ConnectionManagerType {
    BASIC {
      @Override
      HttpClientConnectionManager create(Config config) {
        return new BasicHttpClientConnectionManager();
      }
    },
    POOLING {
      @Override
      HttpClientConnectionManager create(Config config) {
        PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(config.getInt(POOLING_MAX_TOTAL_KEY));
        manager.setDefaultMaxPerRoute(config.getInt(POOLING_MAX_PER_ROUTE_KEY));
        return manager;
      }
    };

    abstract HttpClientConnectionManager create(Config config);

    static ConnectionManagerType fromConfig(Config config) {
      String name = config.getString(CONNECTION_MANAGER_KEY);
      try {
        return valueOf(name.trim().toUpperCase());
      } catch (IllegalArgumentException iae) {
        throw new IllegalArgumentException("Unsupported connection manager: " + name, iae);
      }
    }
  }

  @VisibleForTesting
  static final Config DEFAULTS = ConfigFactory.parseMap(ImmutableMap.<String, Object>builder()
      .put(CONNECT_TIMEOUT_MS_KEY, TimeUnit.SECONDS.toMillis(10L))
      .put(SOCKET_TIMEOUT_MS_KEY, TimeUnit.SECONDS.toMillis(60L))
      .put(CONNECTION_MANAGER_KEY, ConnectionManagerType.BASIC.name())
      .put(POOLING_MAX_TOTAL_KEY, 20)
      .put(POOLING_MAX_PER_ROUTE_KEY, 2)
      .put(USER_AGENT_KEY, DEFAULT_USER_AGENT)
      .build());

  private final CloseableHttpClient client;

  public ApacheHttpClient(Config config) {
    this(HttpClientBuilder.create(), config);
  }

  public ApacheHttpClient(HttpClientBuilder builder, Config config) {
    Config resolved = config.withFallback(DEFAULTS);
    ConnectionManagerType managerType = ConnectionManagerType.fromConfig(resolved);

    builder.disableCookieManagement()
        .disableAutomaticRetries()
        .useSystemProperties()
        .setUserAgent(resolved.getString(USER_AGENT_KEY))
        .setDefaultRequestConfig(toRequestConfig(resolved))
        .setConnectionManager(managerType.create(resolved));
    Optional<HttpHost> proxy = HttpUtils.getProxyAddr(resolved);
    if (proxy.isPresent()) {
      builder.setProxy(proxy.get());
    }
    log.info("Created http client with {} connection manager{}.", managerType,
        proxy.isPresent() ? " through proxy " + proxy.get() : "");
    this.client = builder.build();
  }

  @VisibleForTesting
  static RequestConfig toRequestConfig(Config config) {
    int connectTimeout = config.getInt(CONNECT_TIMEOUT_MS_KEY);
    return RequestConfig.custom()
        .setConnectTimeout(connectTimeout)
        .setConnectionRequestTimeout(connectTimeout)
        .setSocketTimeout(config.getInt(SOCKET_TIMEOUT_MS_KEY))
        .build();
  }

  @Override
  public CloseableHttpResponse sendRequest(HttpUriRequest request) throws IOException {
    log.debug("{} {}", request.getMethod(), request.getURI());
    return this.client.execute(request);
  }

  @Override
  public void close() throws IOException {
    this.client.close();
  }
}

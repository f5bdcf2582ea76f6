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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.http.HttpHost;

import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.typesafe.config.Config;


/**
 * Utilities to build opendata http components
 */
public class HttpUtils {

  /** The hostname of the HTTP proxy to use */
  public static final String PROXY_URL_KEY = "proxy.url";
  /** The port of the HTTP proxy to use */
  public static final String PROXY_PORT_KEY = "proxy.port";
  /** Similar to {@link #PROXY_URL_KEY} and {@link #PROXY_PORT_KEY} but allows you to set it on
   * one property as <host>:<port> . This property takes precedence over those properties.  */
  public static final String PROXY_HOSTPORT_KEY = "proxyHostport";
  /** Port to use if the HTTP Proxy is enabled but no port is specified */
  public static final int DEFAULT_HTTP_PROXY_PORT = 8080;

  private static final Pattern HOSTPORT_PATTERN = Pattern.compile("([^:]+)(:([0-9]+))?");

  private HttpUtils() {
  }

  /**
   * Get the {@link StatusType} of a response by its status code. Only 2xx codes are successful; redirects the
   * client did not follow count as client errors.
   */
  public static StatusType getStatusType(int statusCode) {
    if (statusCode >= 200 && statusCode < 300) {
      return StatusType.OK;
    }
    if (statusCode >= 500) {
      return StatusType.SERVER_ERROR;
    }
    return StatusType.CLIENT_ERROR;
  }

  /**
   * Read the proxy to use from a http client config, if any
   */
  public static Optional<HttpHost> getProxyAddr(Config httpClientConfig) {
    String proxyHost = null;
    int proxyPort = DEFAULT_HTTP_PROXY_PORT;
    if (httpClientConfig.hasPath(PROXY_URL_KEY) && !httpClientConfig.getString(PROXY_URL_KEY).isEmpty()) {
      proxyHost = httpClientConfig.getString(PROXY_URL_KEY);
    }
    if (httpClientConfig.hasPath(PROXY_PORT_KEY)) {
      proxyPort = httpClientConfig.getInt(PROXY_PORT_KEY);
    }
    if (httpClientConfig.hasPath(PROXY_HOSTPORT_KEY)) {
      String hostport = httpClientConfig.getString(PROXY_HOSTPORT_KEY);
      Matcher hostportMatcher = HOSTPORT_PATTERN.matcher(hostport);
      if (!hostportMatcher.matches()) {
        throw new IllegalArgumentException("Invalid HTTP proxy hostport: " + hostport);
      }
      proxyHost = hostportMatcher.group(1);
      if (!Strings.isNullOrEmpty(hostportMatcher.group(3))) {
        proxyPort = Integer.parseInt(hostportMatcher.group(3));
      }
    }
    return null != proxyHost ? Optional.of(new HttpHost(proxyHost, proxyPort)) : Optional.<HttpHost>absent();
  }
}

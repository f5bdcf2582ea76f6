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

package opendata.catalog;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.util.EntityUtils;

import com.google.common.io.Resources;

import opendata.http.HttpClient;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;


/**
 * Helpers to fake http exchanges in tests.
 */
public class HttpTestUtils {

  private HttpTestUtils() {
  }

  @SuppressWarnings("unchecked")
  public static HttpClient<HttpUriRequest, CloseableHttpResponse> mockHttpClient() {
    return mock(HttpClient.class);
  }

  public static CloseableHttpResponse response(int statusCode, byte[] body, ContentType contentType) {
    CloseableHttpResponse response = mock(CloseableHttpResponse.class);
    StatusLine statusLine = mock(StatusLine.class);
    when(statusLine.getStatusCode()).thenReturn(statusCode);
    when(response.getStatusLine()).thenReturn(statusLine);
    when(response.getEntity()).thenReturn(new ByteArrayEntity(body, contentType));
    return response;
  }

  public static CloseableHttpResponse response(int statusCode, String body, ContentType contentType) {
    Charset charset = contentType != null && contentType.getCharset() != null ? contentType.getCharset()
        : StandardCharsets.UTF_8;
    return response(statusCode, body.getBytes(charset), contentType);
  }

  public static CloseableHttpResponse jsonResponse(String body) {
    return response(200, body, ContentType.APPLICATION_JSON);
  }

  public static String readResource(String name) throws IOException {
    URL url = Resources.getResource(name);
    return Resources.toString(url, StandardCharsets.UTF_8);
  }

  public static String requestBody(HttpUriRequest request) throws IOException {
    return EntityUtils.toString(((HttpEntityEnclosingRequest) request).getEntity(), StandardCharsets.UTF_8);
  }
}

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

package opendata.catalog.metadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import lombok.extern.slf4j.Slf4j;

import opendata.catalog.exception.MetadataServiceException;
import opendata.http.ApacheHttpResponseHandler;
import opendata.http.ApacheHttpResponseStatus;
import opendata.http.HttpClient;


/**
 * A minimal GraphQL client: posts a query document to an endpoint and returns the {@code data} member of the
 * response.
 *
 * <p>
 *   Every call is a fresh round trip, there is no caching and no retry.
 * </p>
 */
@Slf4j
public class GraphQLClient {

  static final String INTROSPECTION_QUERY = "query { __schema { queryType { fields { name } } } }";

  private static final String QUERY = "query";
  private static final String DATA = "data";
  private static final String ERRORS = "errors";
  private static final String MESSAGE = "message";

  private final HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient;
  private final ApacheHttpResponseHandler responseHandler = new ApacheHttpResponseHandler();
  private final String endpoint;

  public GraphQLClient(HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient, String endpoint) {
    this.httpClient = httpClient;
    this.endpoint = endpoint;
  }

  /**
   * Execute a query.
   *
   * @param query the GraphQL query document
   * @return the {@code data} member of the response
   * @throws MetadataServiceException if the request fails, the response is not a GraphQL response or it reports
   *         errors
   */
  public JsonObject execute(String query) throws MetadataServiceException {
    log.debug("Executing GraphQL query: {}", query);
    JsonObject body = new JsonObject();
    body.addProperty(QUERY, query);

    HttpPost request = new HttpPost(this.endpoint);
    request.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
    request.setEntity(new StringEntity(body.toString(), ContentType.APPLICATION_JSON));

    ApacheHttpResponseStatus status;
    try (CloseableHttpResponse response = this.httpClient.sendRequest(request)) {
      status = this.responseHandler.handleResponse(response);
    } catch (IOException ioe) {
      throw new MetadataServiceException("GraphQL request to " + this.endpoint + " failed: " + ioe.getMessage(), ioe);
    }
    if (!status.isOk()) {
      throw new MetadataServiceException(
          String.format("GraphQL endpoint %s responded with status %d.", this.endpoint, status.getStatusCode()));
    }

    JsonObject result = parse(status.getContent());
    if (result.has(ERRORS) && result.get(ERRORS).isJsonArray() && result.getAsJsonArray(ERRORS).size() > 0) {
      List<String> messages = Lists.newArrayList();
      for (JsonElement error : result.getAsJsonArray(ERRORS)) {
        messages.add(error.isJsonObject() && error.getAsJsonObject().has(MESSAGE)
            ? error.getAsJsonObject().get(MESSAGE).getAsString() : error.toString());
      }
      throw new MetadataServiceException("GraphQL query failed: " + Joiner.on("; ").join(messages));
    }
    if (!result.has(DATA) || !result.get(DATA).isJsonObject()) {
      throw new MetadataServiceException("GraphQL response from " + this.endpoint + " has no data.");
    }
    return result.getAsJsonObject(DATA);
  }

  /**
   * Check that the endpoint's schema offers the given root query field.
   *
   * @throws MetadataServiceException if the schema cannot be retrieved or does not have the field
   */
  public void validateQueryField(String fieldName) throws MetadataServiceException {
    JsonObject data = execute(INTROSPECTION_QUERY);
    try {
      for (JsonElement field : data.getAsJsonObject("__schema").getAsJsonObject("queryType").getAsJsonArray("fields")) {
        if (fieldName.equals(field.getAsJsonObject().get("name").getAsString())) {
          return;
        }
      }
    } catch (RuntimeException exc) {
      throw new MetadataServiceException("Unexpected introspection response from " + this.endpoint, exc);
    }
    throw new MetadataServiceException(
        String.format("GraphQL endpoint %s does not offer the query field '%s'.", this.endpoint, fieldName));
  }

  private JsonObject parse(byte[] content) throws MetadataServiceException {
    if (content == null || content.length == 0) {
      throw new MetadataServiceException("Empty GraphQL response from " + this.endpoint);
    }
    try {
      JsonElement element = JsonParser.parseString(new String(content, StandardCharsets.UTF_8));
      if (!element.isJsonObject()) {
        throw new MetadataServiceException("GraphQL response from " + this.endpoint + " is not a JSON object.");
      }
      return element.getAsJsonObject();
    } catch (JsonParseException jpe) {
      throw new MetadataServiceException("GraphQL response from " + this.endpoint + " is not valid JSON.", jpe);
    }
  }
}

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

package opendata.catalog.schema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import lombok.extern.slf4j.Slf4j;

import opendata.catalog.exception.MalformedSchemaException;
import opendata.catalog.exception.OpenDataException;
import opendata.catalog.exception.SchemaUnavailableException;
import opendata.catalog.metadata.DatasetDescriptor;
import opendata.http.ApacheHttpResponseHandler;
import opendata.http.ApacheHttpResponseStatus;
import opendata.http.HttpClient;


/**
 * A {@link SchemaFetcher} downloading the CSV on the Web metadata document a distribution conforms to.
 *
 * <p>
 *   The document is expected to look like
 *   <pre>
 *   {"tableSchema": {"primaryKey": "id", "columns": [
 *     {"name": "id", "titles": "Identifier", "dc:description": "...", "required": true, "datatype": "string"}]}}
 *   </pre>
 *   {@code titles} and {@code dc:description} may also be lists or language maps, {@code datatype} may be an
 *   object with a {@code base}. {@code required} defaults to {@code false} and {@code datatype} to {@code string}.
 * </p>
 */
@Slf4j
public class HttpSchemaFetcher implements SchemaFetcher {

  private static final String TABLE_SCHEMA = "tableSchema";
  private static final String PRIMARY_KEY = "primaryKey";
  private static final String COLUMNS = "columns";
  private static final String NAME = "name";
  private static final String TITLES = "titles";
  private static final String DESCRIPTION = "dc:description";
  private static final String REQUIRED = "required";
  private static final String DATATYPE = "datatype";
  private static final String DATATYPE_BASE = "base";
  private static final String JSON_LD_VALUE = "@value";

  private final HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient;
  private final ApacheHttpResponseHandler responseHandler = new ApacheHttpResponseHandler();

  public HttpSchemaFetcher(HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public DocumentSchema fetchSchema(DatasetDescriptor dataset) throws OpenDataException {
    String schemaUrl = dataset.getDistribution().getConformsTo();
    log.info("Retrieving schema for dataset {}.", dataset.getIri());
    log.info("GET {}", schemaUrl);

    ApacheHttpResponseStatus status;
    try {
      HttpGet request = new HttpGet(schemaUrl);
      request.setHeader(HttpHeaders.ACCEPT, "application/csvm+json, application/ld+json, application/json");
      try (CloseableHttpResponse response = this.httpClient.sendRequest(request)) {
        status = this.responseHandler.handleResponse(response);
      }
    } catch (IOException | IllegalArgumentException exc) {
      throw new SchemaUnavailableException("Cannot retrieve schema " + schemaUrl + ": " + exc.getMessage(), exc);
    }
    if (!status.isOk()) {
      throw new SchemaUnavailableException(
          String.format("Schema %s responded with status %d.", schemaUrl, status.getStatusCode()));
    }

    DocumentSchema schema = parseSchema(schemaUrl, status.getContent());
    if (!schema.isPrimaryKeyConsistent()) {
      log.warn("Primary key '{}' of schema {} does not name any of its columns {}.", schema.getPrimaryKey(), schemaUrl,
          schema.getColumnNames());
    }
    return schema;
  }

  static DocumentSchema parseSchema(String schemaUrl, @Nullable byte[] content) throws MalformedSchemaException {
    JsonObject document;
    try {
      JsonElement element = JsonParser.parseString(content == null ? "" : new String(content, StandardCharsets.UTF_8));
      if (!element.isJsonObject()) {
        throw new MalformedSchemaException("Schema " + schemaUrl + " is not a JSON object.");
      }
      document = element.getAsJsonObject();
    } catch (JsonParseException jpe) {
      throw new MalformedSchemaException("Schema " + schemaUrl + " is not valid JSON.", jpe);
    }

    JsonObject tableSchema = getObject(schemaUrl, document, TABLE_SCHEMA);
    String primaryKey = getPrimaryKey(schemaUrl, tableSchema);
    JsonElement columnsElement = tableSchema.get(COLUMNS);
    if (columnsElement == null || !columnsElement.isJsonArray()) {
      throw new MalformedSchemaException("Schema " + schemaUrl + " has no list of columns.");
    }

    List<ColumnDefinition> columns = Lists.newArrayList();
    Set<String> names = Sets.newHashSet();
    for (JsonElement columnElement : columnsElement.getAsJsonArray()) {
      if (!columnElement.isJsonObject()) {
        throw new MalformedSchemaException("Column of schema " + schemaUrl + " is not an object: " + columnElement);
      }
      JsonObject column = columnElement.getAsJsonObject();
      String name = getText(column.get(NAME));
      if (name == null || name.isEmpty()) {
        throw new MalformedSchemaException("Column of schema " + schemaUrl + " has no name: " + column);
      }
      if (!names.add(name)) {
        throw new MalformedSchemaException("Schema " + schemaUrl + " declares column '" + name + "' twice.");
      }
      columns.add(new ColumnDefinition(name, getText(column.get(TITLES)), getText(column.get(DESCRIPTION)),
          getRequired(schemaUrl, name, column), getDatatype(column)));
    }
    return new DocumentSchema(primaryKey, columns);
  }

  private static JsonObject getObject(String schemaUrl, JsonObject parent, String member)
      throws MalformedSchemaException {
    JsonElement element = parent.get(member);
    if (element == null || !element.isJsonObject()) {
      throw new MalformedSchemaException("Schema " + schemaUrl + " has no '" + member + "' object.");
    }
    return element.getAsJsonObject();
  }

  private static String getPrimaryKey(String schemaUrl, JsonObject tableSchema) throws MalformedSchemaException {
    JsonElement element = tableSchema.get(PRIMARY_KEY);
    if (element != null && element.isJsonArray() && element.getAsJsonArray().size() == 1) {
      element = element.getAsJsonArray().get(0);
    }
    if (element == null || !element.isJsonPrimitive() || element.getAsString().isEmpty()) {
      throw new MalformedSchemaException("Schema " + schemaUrl + " has no single column primary key: " + element);
    }
    return element.getAsString();
  }

  private static boolean getRequired(String schemaUrl, String name, JsonObject column)
      throws MalformedSchemaException {
    JsonElement element = column.get(REQUIRED);
    if (element == null || element.isJsonNull()) {
      return false;
    }
    if (element.isJsonPrimitive()) {
      String value = element.getAsString();
      if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
        return Boolean.parseBoolean(value);
      }
    }
    throw new MalformedSchemaException(
        String.format("Column '%s' of schema %s has a non boolean 'required': %s", name, schemaUrl, element));
  }

  private static String getDatatype(JsonObject column) {
    JsonElement element = column.get(DATATYPE);
    if (element != null && element.isJsonObject()) {
      element = element.getAsJsonObject().get(DATATYPE_BASE);
    }
    String datatype = getText(element);
    return datatype == null ? ColumnType.STRING.getDatatype() : datatype;
  }

  /**
   * Read a natural language property: a plain string, the first entry of a list, the {@code @value} of a value
   * object or the first entry of a language map.
   */
  @Nullable
  private static String getText(@Nullable JsonElement element) {
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (element.isJsonPrimitive()) {
      return element.getAsString();
    }
    if (element.isJsonArray()) {
      JsonArray array = element.getAsJsonArray();
      return array.size() == 0 ? null : getText(array.get(0));
    }
    JsonObject object = element.getAsJsonObject();
    if (object.has(JSON_LD_VALUE)) {
      return getText(object.get(JSON_LD_VALUE));
    }
    Map.Entry<String, JsonElement> first = Iterables.getFirst(object.entrySet(), null);
    return first == null ? null : getText(first.getValue());
  }
}

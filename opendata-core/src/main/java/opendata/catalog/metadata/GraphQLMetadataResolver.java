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

import java.util.List;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import opendata.catalog.exception.MalformedMetadataException;
import opendata.catalog.exception.MetadataNotFoundException;
import opendata.catalog.exception.OpenDataException;
import opendata.configuration.ConfigurationKeys;
import opendata.http.HttpClient;
import opendata.util.ConfigUtils;


/**
 * A {@link MetadataResolver} querying the GraphQL endpoint of the national open data catalog
 * ({@value ConfigurationKeys#DEFAULT_CATALOG_URL} by default).
 *
 * <p>
 *   Titles and descriptions are multilingual in the catalog. Only the configured locale
 *   ({@value ConfigurationKeys#DEFAULT_CATALOG_LOCALE} by default) is requested and unwrapped.
 * </p>
 *
 * <p>
 *   When introspection is enabled, every {@link #resolve(String)} first checks that the endpoint's schema offers
 *   the {@code dataset} query. That doubles the number of round trips per resolution.
 * </p>
 */
@Slf4j
public class GraphQLMetadataResolver implements MetadataResolver {

  static final String DATASET_FIELD = "dataset";

  private static final String DATASET_QUERY_TEMPLATE = "query {\n"
      + "  dataset(iri: %1$s) {\n"
      + "    iri\n"
      + "    accrualPeriodicity\n"
      + "    documentation\n"
      + "    isPartOf\n"
      + "    distribution {\n"
      + "      accessURL\n"
      + "      conformsTo\n"
      + "    }\n"
      + "    description {\n"
      + "      %2$s\n"
      + "    }\n"
      + "    title {\n"
      + "      %2$s\n"
      + "    }\n"
      + "  }\n"
      + "}";

  private static final Pattern LOCALE_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Gson GSON = new Gson();

  private final GraphQLClient client;
  @Getter
  private final String locale;
  private final boolean introspectionEnabled;

  public GraphQLMetadataResolver(HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient, Config config) {
    this(new GraphQLClient(httpClient,
            ConfigUtils.getString(config, ConfigurationKeys.CATALOG_URL_KEY, ConfigurationKeys.DEFAULT_CATALOG_URL)),
        ConfigUtils.getString(config, ConfigurationKeys.CATALOG_LOCALE_KEY, ConfigurationKeys.DEFAULT_CATALOG_LOCALE),
        ConfigUtils.getBoolean(config, ConfigurationKeys.CATALOG_INTROSPECTION_ENABLED_KEY,
            ConfigurationKeys.DEFAULT_CATALOG_INTROSPECTION_ENABLED));
  }

  public GraphQLMetadataResolver(GraphQLClient client, String locale, boolean introspectionEnabled) {
    Preconditions.checkArgument(LOCALE_PATTERN.matcher(locale).matches(), "Invalid locale: " + locale);
    this.client = client;
    this.locale = locale;
    this.introspectionEnabled = introspectionEnabled;
  }

  @Override
  public DatasetDescriptor resolve(String iri) throws OpenDataException {
    Preconditions.checkNotNull(iri, "Dataset IRI must not be null");
    log.info("Retrieving dataset metadata for IRI {}.", iri);
    if (this.introspectionEnabled) {
      this.client.validateQueryField(DATASET_FIELD);
    }

    JsonObject data = this.client.execute(buildDatasetQuery(iri));
    JsonElement dataset = data.get(DATASET_FIELD);
    if (dataset == null || dataset.isJsonNull()) {
      throw new MetadataNotFoundException("No dataset found for IRI '" + iri + "'.");
    }
    if (!dataset.isJsonObject()) {
      throw new MalformedMetadataException("Dataset for IRI '" + iri + "' is not an object: " + dataset);
    }
    return toDescriptor(iri, dataset.getAsJsonObject());
  }

  String buildDatasetQuery(String iri) {
    // a JSON string literal is a valid GraphQL string literal
    return String.format(DATASET_QUERY_TEMPLATE, GSON.toJson(iri), this.locale);
  }

  private DatasetDescriptor toDescriptor(String requestedIri, JsonObject dataset) throws MalformedMetadataException {
    String iri = getOptionalString(dataset, "iri");
    if (iri == null) {
      iri = requestedIri;
    }
    return DatasetDescriptor.create(iri,
        getLocalizedString(iri, dataset, "title"),
        getLocalizedString(iri, dataset, "description"),
        getOptionalString(dataset, "accrualPeriodicity"),
        getOptionalString(dataset, "documentation"),
        getOptionalString(dataset, "isPartOf"),
        getDistributions(iri, dataset));
  }

  private String getLocalizedString(String iri, JsonObject dataset, String member) throws MalformedMetadataException {
    JsonElement envelope = dataset.get(member);
    if (envelope == null || envelope.isJsonNull()) {
      throw new MalformedMetadataException(String.format("Dataset %s has no %s.", iri, member));
    }
    if (!envelope.isJsonObject()) {
      throw new MalformedMetadataException(String.format("The %s of dataset %s is not localized: %s", member, iri,
          envelope));
    }
    String value = getOptionalString(envelope.getAsJsonObject(), this.locale);
    if (value == null) {
      throw new MalformedMetadataException(String.format("Dataset %s has no '%s' %s.", iri, this.locale, member));
    }
    return value;
  }

  private static List<Distribution> getDistributions(String iri, JsonObject dataset) throws MalformedMetadataException {
    List<Distribution> distributions = Lists.newArrayList();
    JsonElement element = dataset.get("distribution");
    if (element == null || element.isJsonNull()) {
      return distributions;
    }
    if (!element.isJsonArray()) {
      throw new MalformedMetadataException("Distributions of dataset " + iri + " are not a list: " + element);
    }
    for (JsonElement distribution : element.getAsJsonArray()) {
      if (!distribution.isJsonObject()) {
        throw new MalformedMetadataException("Distribution of dataset " + iri + " is not an object: " + distribution);
      }
      distributions.add(Distribution.create(getOptionalString(distribution.getAsJsonObject(), "accessURL"),
          getOptionalString(distribution.getAsJsonObject(), "conformsTo")));
    }
    return distributions;
  }

  @Nullable
  private static String getOptionalString(JsonObject object, String member) {
    JsonElement element = object.get(member);
    if (element == null || element.isJsonNull()) {
      return null;
    }
    return element.isJsonPrimitive() ? element.getAsString() : element.toString();
  }
}

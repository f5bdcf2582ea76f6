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

import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.mockito.ArgumentCaptor;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.ConfigFactory;

import opendata.catalog.exception.MalformedMetadataException;
import opendata.catalog.exception.MetadataNotFoundException;
import opendata.catalog.exception.MetadataServiceException;
import opendata.configuration.ConfigurationKeys;
import opendata.http.HttpClient;

import static opendata.catalog.HttpTestUtils.jsonResponse;
import static opendata.catalog.HttpTestUtils.mockHttpClient;
import static opendata.catalog.HttpTestUtils.readResource;
import static opendata.catalog.HttpTestUtils.requestBody;
import static opendata.catalog.HttpTestUtils.response;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;


@Test(groups = {"opendata.catalog.metadata"})
public class GraphQLMetadataResolverTest {

  private static final String ENDPOINT = "https://catalog.example.org/graphql";
  private static final String IRI = "https://data.gov.cz/zdroj/datové-sady/00064581/1234";

  private static final String DATASET_TEMPLATE = "{\"data\":{\"dataset\":{\"iri\":\"" + IRI + "\","
      + "\"title\":%s,\"description\":{\"cs\":\"Popis\"},\"distribution\":%s}}}";
  private static final String ONE_DISTRIBUTION = "[{\"accessURL\":\"https://example.org/a.csv\","
      + "\"conformsTo\":\"https://example.org/a.json\"}]";

  private GraphQLMetadataResolver newResolver(HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient) {
    return new GraphQLMetadataResolver(new GraphQLClient(httpClient, ENDPOINT), "cs", false);
  }

  public void testResolve() throws Exception {
    HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient = mockHttpClient();
    when(httpClient.sendRequest(any(HttpUriRequest.class)))
        .thenReturn(jsonResponse(readResource("graphql/dataset.json")));

    DatasetDescriptor dataset = newResolver(httpClient).resolve(IRI);
    Assert.assertEquals(dataset.getIri(), IRI);
    Assert.assertEquals(dataset.getTitle(), "Počet obyvatel v obcích");
    Assert.assertEquals(dataset.getTitleSlug(), "pocet_obyvatel_v_obcich");
    Assert.assertEquals(dataset.getDescription(), "Počet obyvatel v jednotlivých městských částech.");
    Assert.assertEquals(dataset.getAccrualPeriodicity(),
        "http://publications.europa.eu/resource/authority/frequency/MONTHLY");
    Assert.assertFalse(dataset.getParentIri().isPresent());
    Assert.assertEquals(dataset.getDistribution().getAccessUrl(), "https://example.org/data/obyvatele.csv");
    Assert.assertEquals(dataset.getDistribution().getConformsTo(),
        "https://example.org/data/obyvatele.csv-metadata.json");

    ArgumentCaptor<HttpUriRequest> request = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(httpClient).sendRequest(request.capture());
    Assert.assertEquals(request.getValue().getMethod(), "POST");
    Assert.assertEquals(request.getValue().getURI().toString(), ENDPOINT);
    String body = requestBody(request.getValue());
    Assert.assertTrue(body.contains("dataset(iri: \\\"" + IRI + "\\\")"), body);
  }

  public void testQueryRequestsConfiguredLocale() {
    GraphQLMetadataResolver resolver = new GraphQLMetadataResolver(mockHttpClient(), ConfigFactory.parseMap(
        ImmutableMap.of(ConfigurationKeys.CATALOG_LOCALE_KEY, "en")));
    Assert.assertEquals(resolver.getLocale(), "en");
    String query = resolver.buildDatasetQuery("https://example.org/\"quoted\"");
    Assert.assertTrue(query.contains("dataset(iri: \"https://example.org/\\\"quoted\\\"\")"), query);
    Assert.assertTrue(query.contains("title {\n      en\n    }"), query);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testInvalidLocale() {
    new GraphQLMetadataResolver(new GraphQLClient(mockHttpClient(), ENDPOINT), "cs } evil {", false);
  }

  @Test(expectedExceptions = MetadataNotFoundException.class)
  public void testDatasetNotFound() throws Exception {
    HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient = mockHttpClient();
    when(httpClient.sendRequest(any(HttpUriRequest.class))).thenReturn(jsonResponse("{\"data\":{\"dataset\":null}}"));
    newResolver(httpClient).resolve(IRI);
  }

  public void testServiceErrors() throws Exception {
    HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient = mockHttpClient();
    when(httpClient.sendRequest(any(HttpUriRequest.class)))
        .thenReturn(jsonResponse("{\"errors\":[{\"message\":\"Cannot query field\"}],\"data\":null}"))
        .thenReturn(response(502, "Bad gateway", ContentType.TEXT_PLAIN))
        .thenReturn(response(200, "<html></html>", ContentType.TEXT_HTML))
        .thenThrow(new IOException("Connection refused"));

    GraphQLMetadataResolver resolver = newResolver(httpClient);
    for (int i = 0; i < 4; i++) {
      try {
        resolver.resolve(IRI);
        Assert.fail("Attempt " + i + " should have failed");
      } catch (MetadataServiceException expected) {
        if (i == 0) {
          Assert.assertTrue(expected.getMessage().contains("Cannot query field"));
        }
      }
    }
  }

  public void testDistributionCount() throws Exception {
    String twoDistributions = "[{\"accessURL\":\"https://example.org/a.csv\",\"conformsTo\":\"https://example.org/a.json\"},"
        + "{\"accessURL\":\"https://example.org/b.csv\",\"conformsTo\":\"https://example.org/b.json\"}]";
    for (String distributions : new String[] {"[]", "null", twoDistributions}) {
      HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient = mockHttpClient();
      when(httpClient.sendRequest(any(HttpUriRequest.class)))
          .thenReturn(jsonResponse(String.format(DATASET_TEMPLATE, "{\"cs\":\"Titulek\"}", distributions)));
      try {
        newResolver(httpClient).resolve(IRI);
        Assert.fail("Distributions " + distributions + " should be rejected");
      } catch (MalformedMetadataException expected) {
        // expected
      }
    }
  }

  @Test(expectedExceptions = MalformedMetadataException.class)
  public void testMissingLocalizedTitle() throws Exception {
    HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient = mockHttpClient();
    when(httpClient.sendRequest(any(HttpUriRequest.class)))
        .thenReturn(jsonResponse(String.format(DATASET_TEMPLATE, "{\"cs\":null}", ONE_DISTRIBUTION)));
    newResolver(httpClient).resolve(IRI);
  }

  public void testIntrospection() throws Exception {
    HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient = mockHttpClient();
    when(httpClient.sendRequest(any(HttpUriRequest.class)))
        .thenReturn(jsonResponse(readResource("graphql/introspection.json")))
        .thenReturn(jsonResponse(readResource("graphql/dataset.json")));

    GraphQLMetadataResolver resolver = new GraphQLMetadataResolver(new GraphQLClient(httpClient, ENDPOINT), "cs", true);
    Assert.assertEquals(resolver.resolve(IRI).getIri(), IRI);

    ArgumentCaptor<HttpUriRequest> requests = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(httpClient, times(2)).sendRequest(requests.capture());
    Assert.assertTrue(requestBody(requests.getAllValues().get(0)).contains("__schema"));
  }

  @Test(expectedExceptions = MetadataServiceException.class)
  public void testIntrospectionWithoutDatasetField() throws Exception {
    HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient = mockHttpClient();
    when(httpClient.sendRequest(any(HttpUriRequest.class))).thenReturn(
        jsonResponse("{\"data\":{\"__schema\":{\"queryType\":{\"fields\":[{\"name\":\"datasets\"}]}}}}"));
    new GraphQLMetadataResolver(new GraphQLClient(httpClient, ENDPOINT), "cs", true).resolve(IRI);
  }
}

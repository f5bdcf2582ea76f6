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

import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.typesafe.config.Config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import opendata.catalog.exception.OpenDataException;
import opendata.catalog.extractor.CsvRecordStreamer;
import opendata.catalog.extractor.RecordStreamer;
import opendata.catalog.metadata.DatasetDescriptor;
import opendata.catalog.metadata.GraphQLMetadataResolver;
import opendata.catalog.metadata.MetadataResolver;
import opendata.catalog.schema.DocumentSchema;
import opendata.catalog.schema.HttpSchemaFetcher;
import opendata.catalog.schema.SchemaFetcher;
import opendata.http.HttpClient;


/**
 * Creates {@link CatalogStream}s by chaining a {@link MetadataResolver}, a {@link SchemaFetcher} and a
 * {@link RecordStreamer}.
 */
@Slf4j
@Getter
@AllArgsConstructor
public class CatalogStreamFactory {

  private final MetadataResolver metadataResolver;
  private final SchemaFetcher schemaFetcher;
  private final RecordStreamer recordStreamer;

  /**
   * Build the catalog components on top of a shared http client.
   */
  public CatalogStreamFactory(HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient, Config config) {
    this(new GraphQLMetadataResolver(httpClient, config), new HttpSchemaFetcher(httpClient),
        new CsvRecordStreamer(httpClient, config));
  }

  /**
   * Reference a dataset without resolving it.
   *
   * @param iri the dataset identifier
   */
  public UnresolvedCatalogStream forIri(String iri) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(iri), "Dataset IRI must not be empty");
    return new UnresolvedCatalogStream(this, iri);
  }

  /**
   * Resolve a dataset and its schema into a stream. The payload is not retrieved until an extractor is requested.
   *
   * @param iri the dataset identifier
   */
  public CatalogStream createStream(String iri) throws OpenDataException {
    DatasetDescriptor dataset = this.metadataResolver.resolve(iri);
    DocumentSchema schema = this.schemaFetcher.fetchSchema(dataset);
    CatalogStream stream = new CatalogStream(this, dataset, schema);
    log.info("Created stream {} with columns {}.", stream.getName(), schema.getColumnNames());
    return stream;
  }
}

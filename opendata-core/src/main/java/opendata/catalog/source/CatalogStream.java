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

import com.google.common.collect.ImmutableList;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import opendata.catalog.metadata.DatasetDescriptor;
import opendata.catalog.schema.DocumentSchema;
import opendata.source.extractor.Extractor;
import opendata.stream.StreamHandle;


/**
 * A {@link StreamHandle} over one catalog dataset.
 *
 * <p>
 *   The name, schema and primary key are those of the dataset as it was resolved when the stream was created. Every
 *   {@link #getExtractor()} runs the full resolution chain again through its {@link CatalogStreamFactory}, so the
 *   records always reflect the current state of the catalog.
 * </p>
 */
@Slf4j
public class CatalogStream implements StreamHandle<DocumentSchema, Map<String, Object>> {

  private final CatalogStreamFactory factory;
  @Getter
  private final DatasetDescriptor dataset;
  private final DocumentSchema schema;

  CatalogStream(CatalogStreamFactory factory, DatasetDescriptor dataset, DocumentSchema schema) {
    this.factory = factory;
    this.dataset = dataset;
    this.schema = schema;
  }

  /**
   * @return the slug of the dataset title
   */
  @Override
  public String getName() {
    return this.dataset.getTitleSlug();
  }

  @Override
  public DocumentSchema getSchema() {
    return this.schema;
  }

  @Override
  public List<String> getPrimaryKeys() {
    return ImmutableList.of(this.schema.getPrimaryKey());
  }

  @Override
  public Extractor<DocumentSchema, Map<String, Object>> getExtractor() throws IOException {
    DatasetDescriptor current = this.factory.getMetadataResolver().resolve(this.dataset.getIri());
    if (!current.getTitleSlug().equals(getName())) {
      log.warn("Title of dataset {} changed since stream {} was created, keeping the stream name.",
          current.getIri(), getName());
    }
    DocumentSchema currentSchema = this.factory.getSchemaFetcher().fetchSchema(current);
    return this.factory.getRecordStreamer().stream(current, currentSchema);
  }

  @Override
  public String toString() {
    return String.format("CatalogStream[%s <- %s]", getName(), this.dataset.getIri());
  }
}

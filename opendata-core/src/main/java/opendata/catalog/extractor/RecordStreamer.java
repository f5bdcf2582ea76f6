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

package opendata.catalog.extractor;

import java.util.Map;

import opendata.catalog.exception.OpenDataException;
import opendata.catalog.metadata.DatasetDescriptor;
import opendata.catalog.schema.DocumentSchema;
import opendata.source.extractor.Extractor;


/**
 * Retrieves the payload of a dataset's distribution and exposes it as typed records.
 */
public interface RecordStreamer {

  /**
   * Open the payload of a dataset.
   *
   * <p>
   *   The payload is retrieved and its dialect detected before this method returns; rows are parsed lazily by the
   *   returned {@link Extractor}, which must be closed by the caller.
   * </p>
   *
   * @param dataset the dataset whose distribution is read
   * @param schema the schema the records are cast with
   * @return an {@link Extractor} of records keyed by column name, in schema column order
   */
  Extractor<DocumentSchema, Map<String, Object>> stream(DatasetDescriptor dataset, DocumentSchema schema)
      throws OpenDataException;
}

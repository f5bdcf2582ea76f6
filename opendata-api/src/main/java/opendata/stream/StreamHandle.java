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

package opendata.stream;

import java.io.IOException;
import java.util.List;

import opendata.source.extractor.Extractor;


/**
 * A named, schema-bound stream of records that an orchestrator can drive.
 *
 * <p>
 *   The name, schema and primary keys are fixed once the handle exists. Every call to {@link #getExtractor()}
 *   pulls the data again from the origin; nothing is cached between calls.
 * </p>
 *
 * @param <S> schema type
 * @param <D> record type
 */
public interface StreamHandle<S, D> {

  /**
   * @return a stable name of the stream, usable as an identifier in the output
   */
  String getName();

  /**
   * @return the schema the records of this stream conform to
   */
  S getSchema();

  /**
   * @return names of the columns forming the primary key of the records
   */
  List<String> getPrimaryKeys();

  /**
   * Open a new {@link Extractor} producing the records of this stream.
   *
   * @throws IOException if the data cannot be retrieved
   */
  Extractor<S, D> getExtractor() throws IOException;
}

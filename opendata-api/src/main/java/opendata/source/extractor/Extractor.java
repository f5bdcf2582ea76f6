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

package opendata.source.extractor;

import java.io.Closeable;
import java.io.IOException;

import javax.annotation.Nullable;


/**
 * An interface for classes that are responsible for extracting data from a data source.
 *
 * <p>
 *     All source specific logic for a data source should be encapsulated in an
 *     implementation of this interface and {@link opendata.source.Source}.
 * </p>
 *
 * <p>
 *     An {@link Extractor} is single use: once {@link #readRecord()} returned {@code null} or the
 *     extractor was closed, a new one has to be obtained to read the data again.
 * </p>
 *
 * @param <S> output schema type
 * @param <D> output record type
 */
public interface Extractor<S, D> extends Closeable {

  /**
   * Get the schema (metadata) of the extracted data records.
   *
   * @return schema of the extracted data records
   * @throws java.io.IOException if there is problem getting the schema
   */
  S getSchema() throws IOException;

  /**
   * Read the next data record from the data source.
   *
   * @return the next data record extracted from the data source, or {@code null} when the source is exhausted
   * @throws DataRecordException if there is problem with the extracted data record
   * @throws java.io.IOException if there is problem extracting the next data record from the source
   */
  @Nullable
  D readRecord() throws DataRecordException, IOException;

  /**
   * Get the expected source record count.
   *
   * @return the expected source record count, {@code 0} if it is not known up front
   */
  long getExpectedRecordCount();
}

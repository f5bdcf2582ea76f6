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

package opendata.source;

import java.io.IOException;
import java.util.List;

import com.typesafe.config.Config;

import opendata.stream.StreamHandle;


/**
 * An interface for classes that the end users implement to work with a data source from which
 * schema and data records can be extracted.
 *
 * <p>
 *   An implementation of this interface should contain all the logic required to work with a
 *   specific data source: which streams exist for a given configuration and how to connect to them.
 * </p>
 *
 * @param <S> output schema type
 * @param <D> output record type
 */
public interface Source<S, D> {

  /**
   * Discover the streams described by the given job configuration.
   *
   * <p>
   *   Streams are returned in the order the configuration lists them, and are meant to be extracted
   *   one after another.
   * </p>
   *
   * @param config job configuration
   * @return a list of {@link StreamHandle}s, one per configured dataset
   * @throws IOException if a stream cannot be discovered
   */
  List<StreamHandle<S, D>> getStreams(Config config) throws IOException;

  /**
   * Shutdown this {@link Source} instance and release whatever it holds. Called once when the job completes.
   */
  void shutdown() throws IOException;
}

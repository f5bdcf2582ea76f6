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

import opendata.catalog.exception.OpenDataException;


/**
 * Resolves a dataset identifier to the dataset's metadata.
 */
public interface MetadataResolver {

  /**
   * @param iri the dataset identifier
   * @return the dataset's metadata
   * @throws opendata.catalog.exception.MetadataNotFoundException if the catalog does not know the dataset
   * @throws opendata.catalog.exception.MetadataServiceException if the catalog cannot be queried
   * @throws opendata.catalog.exception.MalformedMetadataException if the metadata is incomplete or the dataset does
   *         not have exactly one distribution
   */
  DatasetDescriptor resolve(String iri) throws OpenDataException;
}

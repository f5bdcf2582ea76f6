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

import lombok.Getter;

import opendata.catalog.exception.OpenDataException;


/**
 * A catalog dataset known only by its identifier. Nothing has been fetched yet: {@link #resolve()} retrieves the
 * dataset's metadata and schema and binds them into a {@link CatalogStream}.
 */
public class UnresolvedCatalogStream {

  private final CatalogStreamFactory factory;
  @Getter
  private final String iri;

  UnresolvedCatalogStream(CatalogStreamFactory factory, String iri) {
    this.factory = factory;
    this.iri = iri;
  }

  public CatalogStream resolve() throws OpenDataException {
    return this.factory.createStream(this.iri);
  }

  @Override
  public String toString() {
    return "UnresolvedCatalogStream[" + this.iri + "]";
  }
}

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

import com.google.common.base.Strings;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import opendata.catalog.exception.MalformedMetadataException;


/**
 * A physical representation of a dataset: where its data is downloaded from ({@code accessURL}) and where the
 * schema describing that data lives ({@code conformsTo}).
 */
@Getter
@EqualsAndHashCode
@ToString
public class Distribution {

  private final String accessUrl;
  private final String conformsTo;

  private Distribution(String accessUrl, String conformsTo) {
    this.accessUrl = accessUrl;
    this.conformsTo = conformsTo;
  }

  public static Distribution create(String accessUrl, String conformsTo) throws MalformedMetadataException {
    if (Strings.isNullOrEmpty(accessUrl)) {
      throw new MalformedMetadataException("Distribution has no accessURL.");
    }
    if (Strings.isNullOrEmpty(conformsTo)) {
      throw new MalformedMetadataException("Distribution " + accessUrl + " has no conformsTo schema reference.");
    }
    return new Distribution(accessUrl, conformsTo);
  }
}

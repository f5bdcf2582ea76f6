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

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Optional;
import com.google.common.base.Strings;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import opendata.catalog.exception.MalformedMetadataException;
import opendata.catalog.util.Slugs;


/**
 * Metadata of a catalog dataset.
 *
 * <p>
 *   A dataset is only supported when it has exactly one {@link Distribution}. The rule is enforced by
 *   {@link #create(String, String, String, String, String, String, List)}; datasets without a distribution or with
 *   several of them are rejected rather than reduced to their first distribution.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class DatasetDescriptor {

  private final String iri;
  private final String title;
  private final String description;
  @Nullable
  private final String accrualPeriodicity;
  @Nullable
  private final String documentation;
  @Nullable
  private final String isPartOf;
  private final Distribution distribution;

  private DatasetDescriptor(String iri, String title, String description, String accrualPeriodicity,
      String documentation, String isPartOf, Distribution distribution) {
    this.iri = iri;
    this.title = title;
    this.description = description;
    this.accrualPeriodicity = accrualPeriodicity;
    this.documentation = documentation;
    this.isPartOf = isPartOf;
    this.distribution = distribution;
  }

  /**
   * Build a {@link DatasetDescriptor}.
   *
   * @throws MalformedMetadataException if the title or description is missing, or if there is not exactly one
   *         distribution
   */
  public static DatasetDescriptor create(String iri, String title, String description,
      @Nullable String accrualPeriodicity, @Nullable String documentation, @Nullable String isPartOf,
      List<Distribution> distributions) throws MalformedMetadataException {
    if (Strings.isNullOrEmpty(iri)) {
      throw new MalformedMetadataException("Dataset has no IRI.");
    }
    if (title == null) {
      throw new MalformedMetadataException("Dataset " + iri + " has no title.");
    }
    if (description == null) {
      throw new MalformedMetadataException("Dataset " + iri + " has no description.");
    }
    return new DatasetDescriptor(iri, title, description, accrualPeriodicity, documentation, isPartOf,
        requireSingleDistribution(iri, distributions));
  }

  /**
   * Only single distribution datasets are supported. Supporting more means choosing a distribution here.
   */
  private static Distribution requireSingleDistribution(String iri, @Nullable List<Distribution> distributions)
      throws MalformedMetadataException {
    if (distributions == null || distributions.isEmpty()) {
      throw new MalformedMetadataException("No distribution found for IRI '" + iri + "'.");
    }
    if (distributions.size() > 1) {
      throw new MalformedMetadataException(String.format(
          "Dataset for IRI '%s' has %d distributions, only datasets with a single distribution are supported.",
          iri, distributions.size()));
    }
    return distributions.get(0);
  }

  /**
   * @return a slug of the title, used as a stable stream name
   */
  public String getTitleSlug() {
    return Slugs.slugify(this.title);
  }

  public Optional<String> getParentIri() {
    return Optional.fromNullable(this.isPartOf);
  }
}

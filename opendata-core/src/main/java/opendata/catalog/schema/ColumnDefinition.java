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

package opendata.catalog.schema;

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.gson.JsonObject;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * A column of a table schema.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ColumnDefinition {

  private final String name;
  @Nullable
  private final String title;
  @Nullable
  private final String description;
  private final boolean required;
  /** The datatype as declared by the schema document, which may be one {@link ColumnType} does not know */
  private final String datatype;

  public ColumnType getType() {
    return ColumnType.fromDatatype(this.datatype);
  }

  /**
   * Describe this column as a JSON schema property. Columns that are not required are nullable.
   */
  public JsonObject toJsonSchema() {
    JsonObject property = getType().toJsonSchema(!this.required);
    if (!Strings.isNullOrEmpty(this.description)) {
      property.addProperty("description", this.description);
    }
    return property;
  }
}

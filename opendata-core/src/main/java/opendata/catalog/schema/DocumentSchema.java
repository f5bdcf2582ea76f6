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

import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * The table schema of a distribution: ordered column definitions and the primary key column.
 */
@Getter
@EqualsAndHashCode
@ToString
public class DocumentSchema {

  private final String primaryKey;
  private final ImmutableList<ColumnDefinition> columns;

  public DocumentSchema(String primaryKey, List<ColumnDefinition> columns) {
    this.primaryKey = primaryKey;
    this.columns = ImmutableList.copyOf(columns);
  }

  public List<String> getColumnNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (ColumnDefinition column : this.columns) {
      names.add(column.getName());
    }
    return names.build();
  }

  public Optional<ColumnDefinition> getColumn(String name) {
    for (ColumnDefinition column : this.columns) {
      if (column.getName().equals(name)) {
        return Optional.of(column);
      }
    }
    return Optional.absent();
  }

  /**
   * @return whether the primary key names one of the columns
   */
  public boolean isPrimaryKeyConsistent() {
    return getColumn(this.primaryKey).isPresent();
  }

  /**
   * Describe the records of this schema as a JSON schema object, one property per column in column order.
   */
  public JsonObject toJsonSchema() {
    JsonObject properties = new JsonObject();
    JsonArray required = new JsonArray();
    for (ColumnDefinition column : this.columns) {
      properties.add(column.getName(), column.toJsonSchema());
      if (column.isRequired()) {
        required.add(column.getName());
      }
    }
    JsonObject schema = new JsonObject();
    schema.addProperty("type", "object");
    schema.add("properties", properties);
    if (required.size() > 0) {
      schema.add("required", required);
    }
    return schema;
  }
}

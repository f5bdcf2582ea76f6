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

import java.util.Locale;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import org.joda.time.DateTimeFieldType;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.DateTimeFormatterBuilder;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;


/**
 * The value kinds a column can hold, each with the cast turning the raw payload text into a typed value.
 *
 * <p>
 *   The mapping from declared datatypes is total: a datatype this enum does not know resolves to {@link #STRING},
 *   whose values are passed through as raw text.
 * </p>
 */
public enum ColumnType {

  STRING("string", "string", null) {
    @Override
    public Object cast(String value) {
      return value;
    }

    @Override
    public boolean hasCast() {
      return false;
    }
  },

  /**
   * A calendar date written as {@code yyyy-MM-dd}, cast to a {@link org.joda.time.LocalDate}.
   */
  DATE("date", "string", "date") {
    @Override
    public Object cast(String value) {
      return DATE_FORMATTER.parseLocalDate(value);
    }
  },

  /**
   * A decimal number, cast to a {@link Double}. Only finite values in plain or exponent notation are accepted.
   */
  NUMBER("number", "number", null) {
    @Override
    public Object cast(String value) {
      String trimmed = value.trim();
      if (!NUMBER_PATTERN.matcher(trimmed).matches()) {
        throw new NumberFormatException("Not a number: '" + value + "'");
      }
      return Double.valueOf(trimmed);
    }
  };

  // exactly four unsigned year digits, one or two digits of month and day
  private static final DateTimeFormatter DATE_FORMATTER = new DateTimeFormatterBuilder()
      .appendFixedDecimal(DateTimeFieldType.year(), 4)
      .appendLiteral('-')
      .appendMonthOfYear(1)
      .appendLiteral('-')
      .appendDayOfMonth(1)
      .toFormatter();
  private static final Pattern NUMBER_PATTERN = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private final String datatype;
  private final String jsonType;
  private final String jsonFormat;

  ColumnType(String datatype, String jsonType, @Nullable String jsonFormat) {
    this.datatype = datatype;
    this.jsonType = jsonType;
    this.jsonFormat = jsonFormat;
  }

  /**
   * Cast a raw payload value.
   *
   * @throws IllegalArgumentException if the value cannot be cast
   */
  public abstract Object cast(String value);

  /**
   * @return whether {@link #cast(String)} transforms the raw text at all
   */
  public boolean hasCast() {
    return true;
  }

  /**
   * @return the datatype name this type is declared with in a table schema
   */
  public String getDatatype() {
    return this.datatype;
  }

  /**
   * Describe this type as a JSON schema property.
   *
   * @param nullable whether {@code null} is an allowed value
   */
  public JsonObject toJsonSchema(boolean nullable) {
    JsonObject property = new JsonObject();
    JsonArray types = new JsonArray();
    types.add(this.jsonType);
    if (nullable) {
      types.add("null");
    }
    property.add("type", types);
    if (this.jsonFormat != null) {
      property.addProperty("format", this.jsonFormat);
    }
    return property;
  }

  /**
   * Resolve a declared datatype. Unknown or missing datatypes resolve to {@link #STRING}.
   */
  public static ColumnType fromDatatype(@Nullable String datatype) {
    if (datatype != null) {
      String normalized = datatype.trim().toLowerCase(Locale.ROOT);
      for (ColumnType type : values()) {
        if (type.datatype.equals(normalized)) {
          return type;
        }
      }
    }
    return STRING;
  }
}

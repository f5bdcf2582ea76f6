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

package opendata.catalog.exception;

import lombok.Getter;

import opendata.source.extractor.DataRecordException;


/**
 * Thrown when a field of a payload row cannot be cast to the datatype declared by its column.
 */
@Getter
public class RowCastException extends DataRecordException {

  private static final long serialVersionUID = 1L;

  private final long rowNumber;
  private final String column;
  private final String value;

  public RowCastException(long rowNumber, String column, String value, String reason) {
    super(String.format("Row %d: cannot cast value '%s' of column '%s': %s", rowNumber, value, column, reason));
    this.rowNumber = rowNumber;
    this.column = column;
    this.value = value;
  }
}

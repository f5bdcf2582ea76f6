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

package opendata.catalog.extractor;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * The conventions of a delimited text payload. A quote inside a quoted field is always escaped by doubling it.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CsvDialect {

  public static final char DEFAULT_QUOTE_CHAR = '"';

  /** RFC 4180 comma separated values */
  public static final CsvDialect RFC4180 = new CsvDialect(',', DEFAULT_QUOTE_CHAR, false);

  private final char delimiter;
  private final char quoteChar;
  /** Whether spaces directly following a delimiter are ignored */
  private final boolean skipInitialSpace;
}

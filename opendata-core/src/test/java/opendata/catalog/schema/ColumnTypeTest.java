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

import org.joda.time.LocalDate;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.gson.JsonObject;


@Test(groups = {"opendata.catalog.schema"})
public class ColumnTypeTest {

  public void testFromDatatype() {
    Assert.assertEquals(ColumnType.fromDatatype("number"), ColumnType.NUMBER);
    Assert.assertEquals(ColumnType.fromDatatype(" Date "), ColumnType.DATE);
    Assert.assertEquals(ColumnType.fromDatatype("string"), ColumnType.STRING);
    Assert.assertEquals(ColumnType.fromDatatype("integer"), ColumnType.STRING);
    Assert.assertEquals(ColumnType.fromDatatype(null), ColumnType.STRING);
  }

  public void testCastDate() {
    Assert.assertEquals(ColumnType.DATE.cast("2024-01-15"), new LocalDate(2024, 1, 15));
    Assert.assertEquals(ColumnType.DATE.cast("2024-02-29"), new LocalDate(2024, 2, 29));
    Assert.assertEquals(ColumnType.DATE.cast("2024-1-5"), new LocalDate(2024, 1, 5));
    for (String value : new String[] {"2023-02-29", "15.01.2024", "2024-13-01", "yesterday", "24-01-15",
        "-2024-01-15", "+2024-01-15", "02024-01-15", "2024-01-15T00:00", ""}) {
      try {
        ColumnType.DATE.cast(value);
        Assert.fail("Should reject " + value);
      } catch (IllegalArgumentException expected) {
        // expected
      }
    }
  }

  public void testCastNumber() {
    Assert.assertEquals(ColumnType.NUMBER.cast("12.5"), 12.5);
    Assert.assertEquals(ColumnType.NUMBER.cast("-3"), -3.0);
    Assert.assertEquals(ColumnType.NUMBER.cast(" .5 "), 0.5);
    Assert.assertEquals(ColumnType.NUMBER.cast("1e3"), 1000.0);
    Assert.assertEquals(ColumnType.NUMBER.cast("+2.5E-1"), 0.25);
    for (String value : new String[] {"not-a-number", "NaN", "Infinity", "0x10", "1d", "12,5", ""}) {
      try {
        ColumnType.NUMBER.cast(value);
        Assert.fail("Should reject " + value);
      } catch (NumberFormatException expected) {
        // expected
      }
    }
  }

  public void testStringIsPassedThrough() {
    Assert.assertFalse(ColumnType.STRING.hasCast());
    Assert.assertEquals(ColumnType.STRING.cast(" raw text "), " raw text ");
  }

  public void testJsonSchema() {
    JsonObject date = ColumnType.DATE.toJsonSchema(true);
    Assert.assertEquals(date.getAsJsonArray("type").size(), 2);
    Assert.assertEquals(date.getAsJsonArray("type").get(0).getAsString(), "string");
    Assert.assertEquals(date.get("format").getAsString(), "date");

    JsonObject number = ColumnType.NUMBER.toJsonSchema(false);
    Assert.assertEquals(number.getAsJsonArray("type").size(), 1);
    Assert.assertFalse(number.has("format"));
  }
}

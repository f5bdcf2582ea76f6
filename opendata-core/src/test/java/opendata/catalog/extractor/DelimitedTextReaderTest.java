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

import java.io.IOException;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;


@Test(groups = {"opendata.catalog.extractor"})
public class DelimitedTextReaderTest {

  public void testReadRecords() throws IOException {
    String input = "id,name,note\r\n"
        + "1,\"Doe, John\",\"said \"\"hi\"\"\"\r\n"
        + "\r\n"
        + "2,\"multi\nline\",\n"
        + "3,plain,last";
    try (DelimitedTextReader reader = new DelimitedTextReader(input, CsvDialect.RFC4180)) {
      Assert.assertEquals(reader.nextRecord(), ImmutableList.of("id", "name", "note"));
      Assert.assertEquals(reader.nextRecord(), ImmutableList.of("1", "Doe, John", "said \"hi\""));
      Assert.assertEquals(reader.nextRecord(), ImmutableList.of("2", "multi\nline", ""));
      Assert.assertEquals(reader.getLineNumber(), 6);
      Assert.assertEquals(reader.nextRecord(), ImmutableList.of("3", "plain", "last"));
      Assert.assertNull(reader.nextRecord());
      Assert.assertNull(reader.nextRecord());
    }
  }

  public void testSplitRecordKeepsEmptyLines() throws IOException {
    try (DelimitedTextReader reader = new DelimitedTextReader("a;b\r\rc;d\r", new CsvDialect(';', '"', false))) {
      Assert.assertEquals(reader.splitRecord(), ImmutableList.of("a", "b"));
      Assert.assertEquals(reader.splitRecord(), ImmutableList.of(""));
      Assert.assertEquals(reader.splitRecord(), ImmutableList.of("c", "d"));
      Assert.assertNull(reader.splitRecord());
    }
  }

  public void testDialectOptions() throws IOException {
    try (DelimitedTextReader reader = new DelimitedTextReader("a, 'b, c', d\n", new CsvDialect(',', '\'', true))) {
      Assert.assertEquals(reader.nextRecord(), ImmutableList.of("a", "b, c", "d"));
    }
    try (DelimitedTextReader reader = new DelimitedTextReader("a, b\n", CsvDialect.RFC4180)) {
      Assert.assertEquals(reader.nextRecord(), ImmutableList.of("a", " b"));
    }
    try (DelimitedTextReader reader = new DelimitedTextReader("a\t\"b\"c\tx\"y\n", new CsvDialect('\t', '"', false))) {
      Assert.assertEquals(reader.nextRecord(), ImmutableList.of("a", "bc", "x\"y"));
    }
  }

  public void testUnterminatedQuote() throws IOException {
    try (DelimitedTextReader reader = new DelimitedTextReader("a,b\n1,\"open\n2,3\n", CsvDialect.RFC4180)) {
      reader.nextRecord();
      reader.nextRecord();
      Assert.fail();
    } catch (DelimitedTextReader.CSVParseException expected) {
      Assert.assertEquals(expected.getLineNumber(), 2);
    }
  }
}

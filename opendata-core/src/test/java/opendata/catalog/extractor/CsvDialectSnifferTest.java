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

import org.testng.Assert;
import org.testng.annotations.Test;

import opendata.catalog.exception.DialectDetectionException;


@Test(groups = {"opendata.catalog.extractor"})
public class CsvDialectSnifferTest {

  private final CsvDialectSniffer sniffer = new CsvDialectSniffer();

  public void testComma() throws Exception {
    CsvDialect dialect = this.sniffer.sniff("id,amount,date\nA1,12.5,2024-01-15\nA2,3,2024-01-16\n");
    Assert.assertEquals(dialect, CsvDialect.RFC4180);
  }

  public void testSemicolonWithDecimalComma() throws Exception {
    CsvDialect dialect = this.sniffer.sniff("kod;pocet;datum\r\nA1;12,5;2024-01-15\r\nA2;3,25;2024-01-16\r\n");
    Assert.assertEquals(dialect.getDelimiter(), ';');
    Assert.assertEquals(dialect.getQuoteChar(), '"');
  }

  public void testTabAndPipe() throws Exception {
    Assert.assertEquals(this.sniffer.sniff("a\tb\tc\n1\t2\t3\n4\t5\t6\n").getDelimiter(), '\t');
    Assert.assertEquals(this.sniffer.sniff("a|b\n1|2\n3|4\n").getDelimiter(), '|');
  }

  public void testQuotedFields() throws Exception {
    CsvDialect dialect = this.sniffer.sniff("\"id\",\"name\"\n\"1\",\"Doe, John\"\n\"2\",\"Roe; Jane\"\n");
    Assert.assertEquals(dialect.getDelimiter(), ',');
    Assert.assertEquals(dialect.getQuoteChar(), '"');
    Assert.assertFalse(dialect.isSkipInitialSpace());

    dialect = this.sniffer.sniff("id;name\n1; 'Doe; John'\n2; 'Roe'\n");
    Assert.assertEquals(dialect.getDelimiter(), ';');
    Assert.assertEquals(dialect.getQuoteChar(), '\'');
    Assert.assertTrue(dialect.isSkipInitialSpace());
  }

  public void testSpaceAfterDelimiter() throws Exception {
    CsvDialect dialect = this.sniffer.sniff("a, b, c\n1, 2, 3\n4, 5, 6\n");
    Assert.assertEquals(dialect.getDelimiter(), ',');
    Assert.assertTrue(dialect.isSkipInitialSpace());
  }

  public void testTruncatedSampleIgnoresPartialLine() throws Exception {
    String sample = "a,b\n1,2\n3";
    Assert.assertEquals(this.sniffer.sniff(sample, true).getDelimiter(), ',');
    try {
      this.sniffer.sniff(sample, false);
      Assert.fail();
    } catch (DialectDetectionException expected) {
      // the incomplete last line breaks the consistency of ','
    }
  }

  public void testInsufficientStructure() {
    for (String sample : new String[] {"", "justoneword\n", "abc\ndef\nghi\n"}) {
      try {
        this.sniffer.sniff(sample);
        Assert.fail("Should not detect a dialect in '" + sample + "'");
      } catch (DialectDetectionException expected) {
        // expected
      }
    }
  }
}

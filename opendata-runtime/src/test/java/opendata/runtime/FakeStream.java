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

package opendata.runtime;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import opendata.catalog.schema.ColumnDefinition;
import opendata.catalog.schema.DocumentSchema;
import opendata.source.extractor.DataRecordException;
import opendata.source.extractor.Extractor;
import opendata.stream.StreamHandle;


/**
 * A {@link StreamHandle} over records held in memory, optionally failing after the last one.
 */
public class FakeStream implements StreamHandle<DocumentSchema, Map<String, Object>> {

  public static final DocumentSchema SCHEMA = new DocumentSchema("id", ImmutableList.of(
      new ColumnDefinition("id", "Identifier", null, true, "string"),
      new ColumnDefinition("amount", "Amount", null, false, "number"),
      new ColumnDefinition("date", "Date", null, false, "date")));

  private final String name;
  private final List<Map<String, Object>> records;
  private final boolean failAtEnd;
  private int extractorsClosed = 0;

  public FakeStream(String name, List<Map<String, Object>> records, boolean failAtEnd) {
    this.name = name;
    this.records = records;
    this.failAtEnd = failAtEnd;
  }

  @Override
  public String getName() {
    return this.name;
  }

  @Override
  public DocumentSchema getSchema() {
    return SCHEMA;
  }

  @Override
  public List<String> getPrimaryKeys() {
    return ImmutableList.of(SCHEMA.getPrimaryKey());
  }

  public int getExtractorsClosed() {
    return this.extractorsClosed;
  }

  @Override
  public Extractor<DocumentSchema, Map<String, Object>> getExtractor() {
    final Iterator<Map<String, Object>> iterator = this.records.iterator();
    return new Extractor<DocumentSchema, Map<String, Object>>() {
      @Override
      public DocumentSchema getSchema() {
        return SCHEMA;
      }

      @Override
      public Map<String, Object> readRecord() throws DataRecordException {
        if (iterator.hasNext()) {
          return iterator.next();
        }
        if (FakeStream.this.failAtEnd) {
          throw new DataRecordException("Row 3: cannot cast value 'x' of column 'amount'");
        }
        return null;
      }

      @Override
      public long getExpectedRecordCount() {
        return FakeStream.this.records.size();
      }

      @Override
      public void close() throws IOException {
        FakeStream.this.extractorsClosed++;
      }
    };
  }
}

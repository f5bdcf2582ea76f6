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
import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import com.google.common.collect.Maps;
import com.google.common.io.Closer;
import com.google.gson.JsonObject;

import lombok.extern.slf4j.Slf4j;

import opendata.catalog.schema.DocumentSchema;
import opendata.source.extractor.DataRecordException;
import opendata.source.extractor.Extractor;
import opendata.stream.StreamHandle;


/**
 * Drives the extraction of streams, one after another, into a {@link MessageWriter}.
 *
 * <p>
 *   For every stream a SCHEMA message is written, then one RECORD message per record, then a STATE message
 *   carrying the bookmarks of all streams completed so far. The first failing stream aborts the run.
 * </p>
 */
@Slf4j
public class ExtractionJob {

  static final String RECORDS_EXTRACTED = "records_extracted";
  static final String TIME_EXTRACTED = "time_extracted";

  private final MessageWriter writer;
  private final JsonObject bookmarks = new JsonObject();

  public ExtractionJob(MessageWriter writer) {
    this.writer = writer;
  }

  /**
   * @return the number of records extracted per stream name, in extraction order
   */
  public Map<String, Long> run(List<? extends StreamHandle<DocumentSchema, Map<String, Object>>> streams)
      throws IOException, DataRecordException {
    Map<String, Long> counts = Maps.newLinkedHashMap();
    for (StreamHandle<DocumentSchema, Map<String, Object>> stream : streams) {
      counts.put(stream.getName(), extract(stream));
    }
    return counts;
  }

  private long extract(StreamHandle<DocumentSchema, Map<String, Object>> stream)
      throws IOException, DataRecordException {
    String name = stream.getName();
    log.info("Extracting stream {}.", name);
    this.writer.writeSchema(name, stream.getSchema().toJsonSchema(), stream.getPrimaryKeys());

    DateTime timeExtracted = DateTime.now(DateTimeZone.UTC);
    long count = 0;
    Closer closer = Closer.create();
    try {
      Extractor<DocumentSchema, Map<String, Object>> extractor = closer.register(stream.getExtractor());
      Map<String, Object> record;
      while ((record = extractor.readRecord()) != null) {
        this.writer.writeRecord(name, record, timeExtracted);
        count++;
      }
    } catch (Throwable t) {
      throw closer.rethrow(t, DataRecordException.class);
    } finally {
      closer.close();
    }
    this.writer.flush();

    JsonObject bookmark = new JsonObject();
    bookmark.addProperty(RECORDS_EXTRACTED, count);
    bookmark.addProperty(TIME_EXTRACTED, timeExtracted.toString());
    this.bookmarks.add(name, bookmark);
    this.writer.writeState(this.bookmarks.deepCopy());

    log.info("Extracted {} records of stream {}.", count, name);
    return count;
  }
}

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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Closer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import opendata.catalog.exception.PayloadSchemaMismatchException;
import opendata.catalog.exception.RowCastException;
import opendata.catalog.schema.ColumnDefinition;
import opendata.catalog.schema.ColumnType;
import opendata.catalog.schema.DocumentSchema;
import opendata.source.extractor.DataRecordException;
import opendata.source.extractor.Extractor;


/**
 * An implementation of {@link Extractor} reading the rows of a downloaded CSV payload.
 *
 * <p>
 *   The first non empty row of the payload is its header. Every schema column has to appear in the header, header
 *   columns the schema does not declare are ignored. Each further row becomes one record holding exactly the schema
 *   columns, in schema order:
 *   <ul>
 *     <li>a field missing from a short row is {@code null},</li>
 *     <li>an empty field of a typed column is {@code null}, unless the column is required,</li>
 *     <li>every other field is cast according to its column's datatype.</li>
 *   </ul>
 *   The payload file is owned by this extractor and deleted when it is closed. The extractor closes itself once
 *   the payload is exhausted, and when a row fails under {@link RowErrorPolicy#FAIL}.
 * </p>
 */
@Slf4j
public class CsvRecordExtractor implements Extractor<DocumentSchema, Map<String, Object>> {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final String streamName;
  private final DocumentSchema schema;
  private final RowErrorPolicy rowErrorPolicy;
  private final DelimitedTextReader reader;
  private final Closer closer = Closer.create();
  private final int[] columnIndexes;

  @Getter
  private long recordsRead = 0;
  @Getter
  private long rowsSkipped = 0;
  private long rowNumber = 0;
  private boolean closed = false;

  /**
   * @param streamName name of the stream, for logging
   * @param payload the downloaded payload, deleted by {@link #close()} (also when this constructor fails)
   * @throws PayloadSchemaMismatchException if the header lacks a schema column
   * @throws IOException if the header cannot be read
   */
  public CsvRecordExtractor(String streamName, DocumentSchema schema, final File payload, Charset charset,
      CsvDialect dialect, RowErrorPolicy rowErrorPolicy) throws IOException {
    this.streamName = streamName;
    this.schema = schema;
    this.rowErrorPolicy = rowErrorPolicy;

    Closeable payloadDeleter = () -> {
      if (!FileUtils.deleteQuietly(payload) && payload.exists()) {
        log.warn("Failed to delete payload file {}", payload);
      }
    };
    this.closer.register(payloadDeleter);
    DelimitedTextReader textReader;
    int[] indexes;
    try {
      textReader = this.closer.register(new DelimitedTextReader(newPayloadReader(payload, charset), dialect));
      indexes = bindHeader(textReader.nextRecord());
    } catch (IOException | RuntimeException exc) {
      try {
        close();
      } catch (IOException ioe) {
        exc.addSuppressed(ioe);
      }
      throw exc;
    }
    this.reader = textReader;
    this.columnIndexes = indexes;
  }

  /**
   * Open a payload for reading. Byte sequences that are invalid in the charset are decoded as U+FFFD instead of
   * failing the read.
   */
  static BufferedReader newPayloadReader(File payload, Charset charset) throws IOException {
    CharsetDecoder decoder = charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    return new BufferedReader(new InputStreamReader(Files.newInputStream(payload.toPath()), decoder));
  }

  private int[] bindHeader(List<String> header) throws PayloadSchemaMismatchException {
    if (header == null) {
      throw new PayloadSchemaMismatchException("Payload of stream " + this.streamName + " has no header.");
    }
    Map<String, Integer> headerIndexes = Maps.newHashMap();
    for (int i = 0; i < header.size(); i++) {
      String name = i == 0 ? StringUtils.stripStart(header.get(i), String.valueOf(BYTE_ORDER_MARK)) : header.get(i);
      if (!headerIndexes.containsKey(name)) {
        headerIndexes.put(name, i);
      }
    }

    List<ColumnDefinition> columns = this.schema.getColumns();
    int[] indexes = new int[columns.size()];
    List<String> missing = Lists.newArrayList();
    for (int i = 0; i < columns.size(); i++) {
      Integer index = headerIndexes.remove(columns.get(i).getName());
      if (index == null) {
        missing.add(columns.get(i).getName());
      } else {
        indexes[i] = index;
      }
    }
    if (!missing.isEmpty()) {
      throw new PayloadSchemaMismatchException(String.format(
          "Header %s of the payload of stream %s lacks schema columns %s.", header, this.streamName, missing));
    }
    if (!headerIndexes.isEmpty()) {
      log.info("Ignoring payload columns {} of stream {} not declared by its schema.", headerIndexes.keySet(),
          this.streamName);
    }
    return indexes;
  }

  @Override
  public DocumentSchema getSchema() {
    return this.schema;
  }

  @Override
  public Map<String, Object> readRecord() throws DataRecordException, IOException {
    if (this.closed) {
      return null;
    }

    while (true) {
      List<String> row = this.reader.nextRecord();
      if (row == null) {
        log.info("Read {} records of stream {}.", this.recordsRead, this.streamName);
        close();
        return null;
      }
      this.rowNumber++;

      try {
        Map<String, Object> record = toRecord(row);
        this.recordsRead++;
        return record;
      } catch (RowCastException rce) {
        if (this.rowErrorPolicy == RowErrorPolicy.FAIL) {
          close();
          throw rce;
        }
        this.rowsSkipped++;
        log.warn("Skipping row of stream {}: {}", this.streamName, rce.getMessage());
      }
    }
  }

  private Map<String, Object> toRecord(List<String> row) throws RowCastException {
    List<ColumnDefinition> columns = this.schema.getColumns();
    Map<String, Object> record = new LinkedHashMap<>(columns.size() * 2);
    for (int i = 0; i < columns.size(); i++) {
      ColumnDefinition column = columns.get(i);
      String raw = this.columnIndexes[i] < row.size() ? row.get(this.columnIndexes[i]) : null;
      record.put(column.getName(), castValue(column, raw));
    }
    return Collections.unmodifiableMap(record);
  }

  private Object castValue(ColumnDefinition column, String raw) throws RowCastException {
    if (raw == null) {
      return null;
    }
    ColumnType type = column.getType();
    if (!type.hasCast()) {
      return raw;
    }
    if (raw.isEmpty()) {
      if (column.isRequired()) {
        throw new RowCastException(this.rowNumber, column.getName(), raw, "required value is empty");
      }
      return null;
    }
    try {
      return type.cast(raw);
    } catch (IllegalArgumentException iae) {
      throw new RowCastException(this.rowNumber, column.getName(), raw, iae.getMessage());
    }
  }

  @Override
  public long getExpectedRecordCount() {
    // The number of rows is not known before reading them
    return 0;
  }

  @Override
  public void close() throws IOException {
    if (this.closed) {
      return;
    }
    this.closed = true;
    if (this.rowsSkipped > 0) {
      log.warn("Skipped {} rows of stream {} that could not be cast.", this.rowsSkipped, this.streamName);
    }
    this.closer.close();
  }
}

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
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;

import com.google.common.annotations.VisibleForTesting;


/**
 * Reads records of a delimited text source as lists of field values, following a {@link CsvDialect}.
 *
 * <p>
 *   Line breaks may be {@code \n}, {@code \r\n} or {@code \r}, and may appear inside quoted fields. Text following
 *   the closing quote of a field is appended to the field. Lines without any value are skipped by
 *   {@link #nextRecord()}.
 * </p>
 */
public class DelimitedTextReader implements Closeable {

  private static final int NO_CHAR = -2;

  private final BufferedReader input;
  private final char separator;
  private final char enclosedChar;
  private final boolean skipInitialSpace;

  private int maxFieldCount;
  private int pushedBack = NO_CHAR;
  private long lineNumber = 1;
  private boolean atEOF;

  @VisibleForTesting
  DelimitedTextReader(String input, CsvDialect dialect) {
    this(new StringReader(input), dialect);
  }

  public DelimitedTextReader(Reader input, CsvDialect dialect) {
    this.input = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
    this.separator = dialect.getDelimiter();
    this.enclosedChar = dialect.getQuoteChar();
    this.skipInitialSpace = dialect.isSkipInitialSpace();
    this.atEOF = false;
  }

  /**
   * @return the fields of the next record, or {@code null} at the end of the input. An empty line is returned as a
   *         record with a single empty field.
   */
  @VisibleForTesting
  ArrayList<String> splitRecord() throws IOException {
    return getNextRecordFromStream();
  }

  /**
   * @return the fields of the next non empty record, or {@code null} at the end of the input
   */
  public ArrayList<String> nextRecord() throws IOException {
    ArrayList<String> record = getNextRecordFromStream();

    // skip record if it is empty
    while (record != null && record.size() == 1 && record.get(0).isEmpty()) {
      record = getNextRecordFromStream();
    }
    return record;
  }

  /**
   * @return the 1-based number of the line the reader is positioned on
   */
  @VisibleForTesting
  long getLineNumber() {
    return this.lineNumber;
  }

  private ArrayList<String> getNextRecordFromStream() throws IOException {
    if (this.atEOF) {
      return null;
    }

    ArrayList<String> record = new ArrayList<>(this.maxFieldCount);
    StringBuilder fieldValue = new StringBuilder();
    boolean inQuotes = false;
    boolean fieldStarted = false;
    boolean anyChar = false;
    long startLine = this.lineNumber;

    while (true) {
      int token = read();

      if (token == -1) {
        this.atEOF = true;
        if (inQuotes) {
          throw new CSVParseException("EOF reached before closing an opened quote", startLine);
        }
        if (!anyChar) {
          return null;
        }
        record.add(fieldValue.toString());
        break;
      }
      anyChar = true;
      char c = (char) token;

      if (inQuotes) {
        if (c == this.enclosedChar) {
          int next = read();
          if (next == this.enclosedChar) {
            fieldValue.append(c);
          } else {
            inQuotes = false;
            unread(next);
          }
        } else {
          if (c == '\n') {
            this.lineNumber++;
          }
          fieldValue.append(c);
        }
        continue;
      }

      if (c == this.separator) {
        record.add(fieldValue.toString());
        fieldValue.setLength(0);
        fieldStarted = false;
        continue;
      }

      if (c == '\n' || c == '\r') {
        if (c == '\r') {
          int next = read();
          if (next != '\n') {
            unread(next);
          }
        }
        this.lineNumber++;
        record.add(fieldValue.toString());
        break;
      }

      if (!fieldStarted && c == this.enclosedChar) {
        inQuotes = true;
        fieldStarted = true;
        continue;
      }

      if (!fieldStarted && c == ' ' && this.skipInitialSpace) {
        continue;
      }

      fieldStarted = true;
      fieldValue.append(c);
    }

    if (record.size() > this.maxFieldCount) {
      this.maxFieldCount = record.size();
    }
    return record;
  }

  private int read() throws IOException {
    if (this.pushedBack != NO_CHAR) {
      int c = this.pushedBack;
      this.pushedBack = NO_CHAR;
      return c;
    }
    return this.input.read();
  }

  private void unread(int c) {
    this.pushedBack = c;
  }

  @Override
  public void close() throws IOException {
    this.input.close();
  }

  public static class CSVParseException extends IOException {

    private static final long serialVersionUID = 1L;

    final long lineNumber;

    CSVParseException(String message, long lineNumber) {
      super(message + " (line " + lineNumber + ")");
      this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
      return this.lineNumber;
    }
  }
}

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

import java.io.Flushable;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.reflect.TypeToken;

import opendata.catalog.schema.DocumentSchema;
import opendata.stream.StreamHandle;


/**
 * Writes the messages of an extraction run, one JSON document per line.
 *
 * <p>
 *   Message shapes:
 *   <pre>
 *   {"type": "SCHEMA", "stream": ..., "schema": {...}, "key_properties": [...]}
 *   {"type": "RECORD", "stream": ..., "record": {...}, "time_extracted": "2024-01-15T10:00:00.000Z"}
 *   {"type": "STATE", "value": {"bookmarks": {...}}}
 *   </pre>
 *   Calendar dates in records are written as {@code yyyy-MM-dd} strings.
 * </p>
 */
public class MessageWriter implements Flushable {

  public static final String TYPE_SCHEMA = "SCHEMA";
  public static final String TYPE_RECORD = "RECORD";
  public static final String TYPE_STATE = "STATE";

  private static final Type RECORD_TYPE = new TypeToken<Map<String, Object>>() { }.getType();
  private static final DateTimeFormatter TIMESTAMP_FORMATTER = ISODateTimeFormat.dateTime().withZoneUTC();

  private final PrintStream out;
  private final Gson gson = new GsonBuilder()
      .disableHtmlEscaping()
      .serializeNulls()
      .registerTypeAdapter(LocalDate.class, new LocalDateSerializer())
      .create();

  public MessageWriter(PrintStream out) {
    this.out = out;
  }

  public void writeSchema(String stream, JsonObject schema, List<String> keyProperties) {
    JsonObject message = message(TYPE_SCHEMA);
    message.addProperty("stream", stream);
    message.add("schema", schema);
    message.add("key_properties", toArray(keyProperties));
    write(message);
  }

  public void writeRecord(String stream, Map<String, Object> record, DateTime timeExtracted) {
    JsonObject message = message(TYPE_RECORD);
    message.addProperty("stream", stream);
    message.add("record", this.gson.toJsonTree(record, RECORD_TYPE));
    message.addProperty("time_extracted", TIMESTAMP_FORMATTER.print(timeExtracted.withZone(DateTimeZone.UTC)));
    write(message);
  }

  public void writeState(JsonObject bookmarks) {
    JsonObject value = new JsonObject();
    value.add("bookmarks", bookmarks);
    JsonObject message = message(TYPE_STATE);
    message.add("value", value);
    write(message);
  }

  /**
   * Write the catalog of the given streams as a single, pretty printed JSON document.
   */
  public void writeCatalog(List<? extends StreamHandle<DocumentSchema, ?>> streams) {
    JsonArray entries = new JsonArray();
    for (StreamHandle<DocumentSchema, ?> stream : streams) {
      JsonObject entry = new JsonObject();
      entry.addProperty("tap_stream_id", stream.getName());
      entry.addProperty("stream", stream.getName());
      entry.add("schema", stream.getSchema().toJsonSchema());
      entry.add("key_properties", toArray(stream.getPrimaryKeys()));
      entries.add(entry);
    }
    JsonObject catalog = new JsonObject();
    catalog.add("streams", entries);
    this.out.println(new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create().toJson(catalog));
    this.out.flush();
  }

  private static JsonObject message(String type) {
    JsonObject message = new JsonObject();
    message.addProperty("type", type);
    return message;
  }

  private static JsonArray toArray(List<String> values) {
    JsonArray array = new JsonArray();
    for (String value : values) {
      array.add(value);
    }
    return array;
  }

  private void write(JsonObject message) {
    this.out.println(this.gson.toJson(message));
  }

  @Override
  public void flush() throws IOException {
    this.out.flush();
  }

  private static class LocalDateSerializer implements JsonSerializer<LocalDate> {
    @Override
    public JsonElement serialize(LocalDate src, Type typeOfSrc, JsonSerializationContext context) {
      return new JsonPrimitive(src.toString());
    }
  }
}

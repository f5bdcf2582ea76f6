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

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.ParseException;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;

import lombok.extern.slf4j.Slf4j;

import opendata.catalog.exception.OpenDataException;
import opendata.catalog.exception.PayloadUnavailableException;
import opendata.catalog.exception.UnsupportedContentTypeException;
import opendata.catalog.metadata.DatasetDescriptor;
import opendata.catalog.schema.DocumentSchema;
import opendata.configuration.ConfigurationKeys;
import opendata.http.HttpClient;
import opendata.http.HttpUtils;
import opendata.http.StatusType;
import opendata.source.extractor.Extractor;
import opendata.util.ConfigUtils;


/**
 * A {@link RecordStreamer} downloading the {@code accessURL} of a distribution and reading it as CSV.
 *
 * <p>
 *   Only payloads served as {@code text/csv} are read; the body of any other response is never consumed. The
 *   payload is decoded with the charset of its content type, {@value ConfigurationKeys#DEFAULT_CHARSET_ENCODING}
 *   when none is declared, and bytes invalid in that charset become U+FFFD. It is spooled to a temporary file, whose
 *   leading characters ({@value ConfigurationKeys#DEFAULT_EXTRACT_SNIFF_SAMPLE_SIZE} by default) are sniffed for
 *   the {@link CsvDialect}.
 * </p>
 */
@Slf4j
public class CsvRecordStreamer implements RecordStreamer {

  static final String CSV_MIME_TYPE = "text/csv";

  private static final String TEMP_FILE_PREFIX = "opendata-";
  private static final String TEMP_FILE_SUFFIX = ".csv";

  private final HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient;
  private final CsvDialectSniffer sniffer = new CsvDialectSniffer();
  private final int sampleSize;
  private final RowErrorPolicy rowErrorPolicy;

  public CsvRecordStreamer(HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient, Config config) {
    this(httpClient,
        ConfigUtils.getInt(config, ConfigurationKeys.EXTRACT_SNIFF_SAMPLE_SIZE_KEY,
            ConfigurationKeys.DEFAULT_EXTRACT_SNIFF_SAMPLE_SIZE),
        RowErrorPolicy.fromConfig(config));
  }

  public CsvRecordStreamer(HttpClient<HttpUriRequest, CloseableHttpResponse> httpClient, int sampleSize,
      RowErrorPolicy rowErrorPolicy) {
    Preconditions.checkArgument(sampleSize > 0, "Sniff sample size must be positive: " + sampleSize);
    this.httpClient = httpClient;
    this.sampleSize = sampleSize;
    this.rowErrorPolicy = rowErrorPolicy;
  }

  @Override
  public Extractor<DocumentSchema, Map<String, Object>> stream(DatasetDescriptor dataset, DocumentSchema schema)
      throws OpenDataException {
    String accessUrl = dataset.getDistribution().getAccessUrl();
    String streamName = dataset.getTitleSlug();
    log.info("Downloading payload of dataset {}.", dataset.getIri());
    log.info("GET {}", accessUrl);

    Charset charset;
    File payload;
    try (CloseableHttpResponse response = this.httpClient.sendRequest(newRequest(accessUrl))) {
      int statusCode = response.getStatusLine().getStatusCode();
      if (HttpUtils.getStatusType(statusCode) != StatusType.OK) {
        throw new PayloadUnavailableException(
            String.format("Payload %s responded with status %d.", accessUrl, statusCode));
      }
      charset = getCsvCharset(response);
      payload = spool(accessUrl, response.getEntity());
    } catch (OpenDataException ode) {
      throw ode;
    } catch (IOException ioe) {
      throw new PayloadUnavailableException("Cannot retrieve payload " + accessUrl + ": " + ioe.getMessage(), ioe);
    }

    try {
      CsvDialect dialect = sniff(payload, charset);
      return new CsvRecordExtractor(streamName, schema, payload, charset, dialect, this.rowErrorPolicy);
    } catch (OpenDataException ode) {
      FileUtils.deleteQuietly(payload);
      throw ode;
    } catch (IOException ioe) {
      FileUtils.deleteQuietly(payload);
      throw new PayloadUnavailableException("Cannot read payload " + accessUrl + ": " + ioe.getMessage(), ioe);
    }
  }

  private static HttpGet newRequest(String accessUrl) throws PayloadUnavailableException {
    try {
      HttpGet request = new HttpGet(accessUrl);
      request.setHeader(HttpHeaders.ACCEPT, CSV_MIME_TYPE);
      return request;
    } catch (IllegalArgumentException iae) {
      throw new PayloadUnavailableException("Invalid payload URL " + accessUrl, iae);
    }
  }

  /**
   * Check the content type of a response is {@code text/csv} and return its charset.
   */
  static Charset getCsvCharset(CloseableHttpResponse response) throws UnsupportedContentTypeException {
    HttpEntity entity = response.getEntity();
    Header header = entity == null ? null : entity.getContentType();
    if (header == null) {
      header = response.getFirstHeader(HttpHeaders.CONTENT_TYPE);
    }
    if (header == null) {
      throw new UnsupportedContentTypeException(null);
    }

    ContentType contentType;
    try {
      contentType = ContentType.parse(header.getValue());
    } catch (ParseException | IllegalArgumentException exc) {
      throw new UnsupportedContentTypeException(header.getValue());
    }
    if (contentType.getMimeType() == null || !CSV_MIME_TYPE.equalsIgnoreCase(contentType.getMimeType())) {
      throw new UnsupportedContentTypeException(header.getValue());
    }
    return contentType.getCharset() == null ? StandardCharsets.UTF_8 : contentType.getCharset();
  }

  private static File spool(String accessUrl, HttpEntity entity) throws IOException {
    File payload = File.createTempFile(TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
    try {
      if (entity != null) {
        FileUtils.copyInputStreamToFile(entity.getContent(), payload);
      }
    } catch (IOException ioe) {
      FileUtils.deleteQuietly(payload);
      throw ioe;
    }
    log.debug("Spooled payload {} to {} ({} bytes).", accessUrl, payload, payload.length());
    return payload;
  }

  private CsvDialect sniff(File payload, Charset charset) throws IOException {
    char[] sample = new char[this.sampleSize];
    int length;
    boolean truncated;
    try (Reader reader = CsvRecordExtractor.newPayloadReader(payload, charset)) {
      length = IOUtils.read(reader, sample);
      truncated = length == sample.length && reader.read() != -1;
    }
    return this.sniffer.sniff(new String(sample, 0, length), truncated);
  }
}

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

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;

import lombok.extern.slf4j.Slf4j;

import opendata.catalog.exception.DialectDetectionException;


/**
 * Infers the {@link CsvDialect} of a delimited text payload from a sample of its leading text.
 *
 * <p>
 *   Two strategies are tried in order:
 *   <ol>
 *     <li>Quoted fields: a quote character directly surrounded by the same punctuation character on many lines
 *         gives away both the quote character and the delimiter.</li>
 *     <li>Consistency: the delimiter is a character occurring the same number of times on (nearly) every line. The
 *         lines are examined in chunks, growing until a single candidate remains. Ties are broken by
 *         {@link #PREFERRED_DELIMITERS}.</li>
 *   </ol>
 *   Letters, digits, quotes and line breaks are never delimiters.
 * </p>
 */
@Slf4j
public class CsvDialectSniffer {

  @VisibleForTesting
  static final List<Character> PREFERRED_DELIMITERS = ImmutableList.of(',', '\t', ';', ' ', ':', '|');

  private static final int CHUNK_LENGTH = 10;
  private static final double MIN_CONSISTENCY = 0.9;
  private static final double CONSISTENCY_STEP = 0.01;
  private static final char MAX_ASCII = 127;

  private static final String QUOTE = "(?<quote>[\"'])";
  private static final String DELIM = "(?<delim>[^\\w\\n\"'])";
  private static final List<Pattern> QUOTED_FIELD_PATTERNS = ImmutableList.of(
      // ,".*?",
      Pattern.compile(DELIM + "(?<space> ?)" + QUOTE + ".*?\\k<quote>(?=\\k<delim>)", Pattern.DOTALL | Pattern.MULTILINE),
      // ".*?",
      Pattern.compile("(?:^|\\n)" + QUOTE + ".*?\\k<quote>" + DELIM + "(?<space> ?)", Pattern.DOTALL | Pattern.MULTILINE),
      // ,".*?"
      Pattern.compile(DELIM + "(?<space> ?)" + QUOTE + ".*?\\k<quote>(?:$|\\n)", Pattern.DOTALL | Pattern.MULTILINE),
      // ".*?" (no delimiter)
      Pattern.compile("(?:^|\\n)" + QUOTE + ".*?\\k<quote>(?:$|\\n)", Pattern.DOTALL | Pattern.MULTILINE));

  private static final Splitter LINE_SPLITTER = Splitter.on('\n').omitEmptyStrings();

  /**
   * Sniff a sample which is the complete payload.
   */
  public CsvDialect sniff(String sample) throws DialectDetectionException {
    return sniff(sample, false);
  }

  /**
   * Sniff a sample.
   *
   * @param sample the leading text of the payload
   * @param truncated whether the payload continues after the sample, in which case its last line is incomplete and
   *        ignored
   * @throws DialectDetectionException if no delimiter can be inferred
   */
  public CsvDialect sniff(String sample, boolean truncated) throws DialectDetectionException {
    String text = sample.replace("\r\n", "\n").replace('\r', '\n');
    if (truncated && text.lastIndexOf('\n') > 0) {
      text = text.substring(0, text.lastIndexOf('\n') + 1);
    }

    QuoteGuess quoteGuess = guessQuoteAndDelimiter(text);
    if (quoteGuess != null && quoteGuess.delimiter != null) {
      CsvDialect dialect = new CsvDialect(quoteGuess.delimiter, quoteGuess.quoteChar, quoteGuess.skipInitialSpace);
      log.info("Detected dialect {} from quoted fields.", dialect);
      return dialect;
    }

    char quoteChar = quoteGuess == null ? CsvDialect.DEFAULT_QUOTE_CHAR : quoteGuess.quoteChar;
    List<String> lines = LINE_SPLITTER.splitToList(text);
    Character delimiter = guessDelimiter(lines, quoteChar);
    if (delimiter == null) {
      throw new DialectDetectionException("Could not determine delimiter from a sample of " + sample.length()
          + " characters.");
    }
    String firstLine = lines.get(0);
    boolean skipInitialSpace = delimiter != ' '
        && countOf(firstLine, String.valueOf(delimiter)) == countOf(firstLine, delimiter + " ");
    CsvDialect dialect = new CsvDialect(delimiter, quoteChar, skipInitialSpace);
    log.info("Detected dialect {} from character frequencies.", dialect);
    return dialect;
  }

  @Nullable
  private static QuoteGuess guessQuoteAndDelimiter(String text) {
    for (Pattern pattern : QUOTED_FIELD_PATTERNS) {
      Multiset<Character> quotes = TreeMultiset.create();
      Multiset<Character> delims = TreeMultiset.create();
      int spaces = 0;
      boolean hasDelimiter = pattern.pattern().contains("?<delim>");

      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        quotes.add(matcher.group("quote").charAt(0));
        if (hasDelimiter) {
          delims.add(matcher.group("delim").charAt(0));
          if (!matcher.group("space").isEmpty()) {
            spaces++;
          }
        }
      }
      if (quotes.isEmpty()) {
        continue;
      }

      char quoteChar = mostFrequent(quotes);
      if (delims.isEmpty()) {
        return new QuoteGuess(quoteChar, null, false);
      }
      char delimiter = mostFrequent(delims);
      return new QuoteGuess(quoteChar, delimiter, delims.count(delimiter) == spaces);
    }
    return null;
  }

  @Nullable
  private static Character guessDelimiter(List<String> lines, char quoteChar) {
    if (lines.isEmpty()) {
      return null;
    }

    // per candidate character: how many lines contain it how many times
    Map<Character, Map<Integer, Integer>> charFrequency = Maps.newTreeMap();
    Map<Character, int[]> candidates = Maps.newTreeMap();
    int start = 0;
    int end = Math.min(CHUNK_LENGTH, lines.size());

    while (start < lines.size()) {
      for (String line : lines.subList(start, end)) {
        for (char c = 0; c < MAX_ASCII; c++) {
          if (!isDelimiterCandidate(c, quoteChar)) {
            continue;
          }
          Map<Integer, Integer> frequencies = charFrequency.get(c);
          if (frequencies == null) {
            frequencies = Maps.newHashMap();
            charFrequency.put(c, frequencies);
          }
          int freq = countOf(line, String.valueOf(c));
          frequencies.put(freq, frequencies.containsKey(freq) ? frequencies.get(freq) + 1 : 1);
        }
      }

      double total = end;
      candidates = Maps.newTreeMap();
      for (double consistency = 1.0; candidates.isEmpty() && consistency >= MIN_CONSISTENCY - 1e-9;
          consistency -= CONSISTENCY_STEP) {
        for (Map.Entry<Character, Map<Integer, Integer>> entry : charFrequency.entrySet()) {
          int[] mode = adjustedMode(entry.getValue());
          if (mode[0] > 0 && mode[1] > 0 && mode[1] / total >= consistency) {
            candidates.put(entry.getKey(), mode);
          }
        }
      }

      if (candidates.size() == 1) {
        return candidates.keySet().iterator().next();
      }
      start = end;
      end = Math.min(end + CHUNK_LENGTH, lines.size());
    }

    if (candidates.isEmpty()) {
      return null;
    }
    for (Character preferred : PREFERRED_DELIMITERS) {
      if (candidates.containsKey(preferred)) {
        return preferred;
      }
    }
    // nothing else indicates a preference, pick the most consistent, then most frequent character
    Character best = null;
    for (Map.Entry<Character, int[]> entry : candidates.entrySet()) {
      int[] mode = entry.getValue();
      if (best == null || mode[1] > candidates.get(best)[1]
          || (mode[1] == candidates.get(best)[1] && mode[0] > candidates.get(best)[0])) {
        best = entry.getKey();
      }
    }
    return best;
  }

  /**
   * @return the most common number of occurrences per line, and the number of lines having it minus the number of
   *         lines not having it
   */
  private static int[] adjustedMode(Map<Integer, Integer> frequencies) {
    int modeFrequency = -1;
    int modeLines = -1;
    int totalLines = 0;
    for (Map.Entry<Integer, Integer> entry : frequencies.entrySet()) {
      totalLines += entry.getValue();
      if (entry.getValue() > modeLines || (entry.getValue() == modeLines && entry.getKey() > modeFrequency)) {
        modeFrequency = entry.getKey();
        modeLines = entry.getValue();
      }
    }
    return new int[] {modeFrequency, modeLines - (totalLines - modeLines)};
  }

  private static boolean isDelimiterCandidate(char c, char quoteChar) {
    return !Character.isLetterOrDigit(c) && c != '\n' && c != '\r' && c != quoteChar && c != '"' && c != '\'';
  }

  private static char mostFrequent(Multiset<Character> multiset) {
    Character best = null;
    for (Multiset.Entry<Character> entry : multiset.entrySet()) {
      if (best == null || entry.getCount() > multiset.count(best)) {
        best = entry.getElement();
      }
    }
    return best;
  }

  private static int countOf(String text, String token) {
    int count = 0;
    int index = text.indexOf(token);
    while (index >= 0) {
      count++;
      index = text.indexOf(token, index + token.length());
    }
    return count;
  }

  private static class QuoteGuess {
    private final char quoteChar;
    @Nullable
    private final Character delimiter;
    private final boolean skipInitialSpace;

    QuoteGuess(char quoteChar, @Nullable Character delimiter, boolean skipInitialSpace) {
      this.quoteChar = quoteChar;
      this.delimiter = delimiter;
      this.skipInitialSpace = skipInitialSpace;
    }
  }
}

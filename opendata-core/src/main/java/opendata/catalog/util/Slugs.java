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

package opendata.catalog.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;


/**
 * Turns human readable titles into stable identifiers.
 *
 * <p>
 *   A slug only consists of lowercase ASCII letters, digits and single {@code _} separators. Diacritics are
 *   stripped ({@code "Počet obyvatel"} becomes {@code "pocet_obyvatel"}) and Latin letters that do not decompose
 *   ({@code Ł}, {@code ß}, {@code ø}, ...) are spelled out in ASCII. Apostrophes are dropped and every other run of
 *   characters turns into one separator, so letters of non Latin scripts are not transliterated. Slugging a slug
 *   returns it unchanged.
 * </p>
 */
public class Slugs {

  public static final char SEPARATOR = '_';

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final CharMatcher APOSTROPHES = CharMatcher.anyOf("'‘’");
  private static final Pattern DISALLOWED_CHARS = Pattern.compile("[^a-z0-9]+");
  private static final CharMatcher SEPARATOR_MATCHER = CharMatcher.is(SEPARATOR);

  // Latin letters without a canonical or compatibility decomposition
  private static final ImmutableMap<Character, String> LATIN_LETTERS = ImmutableMap.<Character, String>builder()
      .put('Ł', "L").put('ł', "l")
      .put('Đ', "D").put('đ', "d")
      .put('Ø', "O").put('ø', "o")
      .put('Ħ', "H").put('ħ', "h")
      .put('ß', "ss").put('ẞ', "SS")
      .put('Æ', "AE").put('æ', "ae")
      .put('Œ', "OE").put('œ', "oe")
      .put('Þ', "Th").put('þ', "th")
      .put('Ð', "D").put('ð', "d")
      .put('ı', "i")
      .build();

  private Slugs() {
  }

  public static String slugify(String text) {
    String normalized = Normalizer.normalize(spellOutLatinLetters(text), Normalizer.Form.NFKD);
    normalized = COMBINING_MARKS.matcher(normalized).replaceAll("");
    normalized = APOSTROPHES.removeFrom(normalized).toLowerCase(Locale.ROOT);
    normalized = DISALLOWED_CHARS.matcher(normalized).replaceAll(String.valueOf(SEPARATOR));
    return SEPARATOR_MATCHER.trimFrom(normalized);
  }

  private static String spellOutLatinLetters(String text) {
    StringBuilder builder = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      String replacement = LATIN_LETTERS.get(c);
      if (replacement == null) {
        builder.append(c);
      } else {
        builder.append(replacement);
      }
    }
    return builder.toString();
  }
}

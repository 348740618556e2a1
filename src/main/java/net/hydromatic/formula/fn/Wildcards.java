/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.formula.fn;

import java.util.regex.Pattern;

/**
 * Wildcard patterns, as used by lookup and criteria functions.
 *
 * <p>{@code *} matches any sequence of characters, {@code ?} matches any
 * single character, and {@code ~} escapes the next character. Matching is
 * case-insensitive.
 */
abstract class Wildcards {
  private Wildcards() {}

  /** Returns whether a string contains an unescaped wildcard. */
  static boolean hasWildcards(String s) {
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '~') {
        ++i;
      } else if (c == '*' || c == '?') {
        return true;
      }
    }
    return false;
  }

  /** Converts a wildcard pattern to a regular expression. */
  static Pattern toPattern(String s) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '~':
        if (i + 1 < s.length()) {
          b.append(Pattern.quote(String.valueOf(s.charAt(++i))));
        } else {
          b.append(Pattern.quote("~"));
        }
        break;
      case '*':
        b.append(".*");
        break;
      case '?':
        b.append('.');
        break;
      default:
        b.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(b.toString(),
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
  }

  /** Returns whether a string matches a wildcard pattern. */
  static boolean matches(String pattern, String s) {
    return toPattern(pattern).matcher(s).matches();
  }

  /** Removes escape characters, for a pattern that is to be matched
   * literally. */
  static String unescape(String s) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '~' && i + 1 < s.length()) {
        b.append(s.charAt(++i));
      } else {
        b.append(c);
      }
    }
    return b.toString();
  }
}

// End Wildcards.java

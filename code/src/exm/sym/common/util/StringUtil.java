/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sym.common.util;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

public class StringUtil {

  private static final String SUPERSCRIPT_DIGITS =
      "\u2070\u00b9\u00b2\u00b3\u2074\u2075\u2076\u2077\u2078\u2079";
  private static final char SUPERSCRIPT_MINUS = '\u207b';

  /**
   * Render an integer exponent with Unicode superscript characters,
   * e.g. -12 becomes ⁻¹²
   */
  public static String superscript(long i) {
    String digits = Long.toString(i);
    StringBuilder sb = new StringBuilder(digits.length());
    for (int k = 0; k < digits.length(); k++) {
      char c = digits.charAt(k);
      if (c == '-') {
        sb.append(SUPERSCRIPT_MINUS);
      } else {
        sb.append(SUPERSCRIPT_DIGITS.charAt(c - '0'));
      }
    }
    return sb.toString();
  }

  /**
   * Join tokens with single spaces
   */
  public static String concat(List<String> tokens) {
    return StringUtils.join(tokens, ' ');
  }

  /**
   * Join tokens with given separator, calling toString() on each
   */
  public static String concat(String separator, List<? extends Object> objs) {
    return StringUtils.join(objs, separator);
  }

  /**
   * Append n spaces to sb
   */
  public static void spaces(StringBuilder sb, int n) {
    for (int i = 0; i < n; i++) {
      sb.append(' ');
    }
  }
}

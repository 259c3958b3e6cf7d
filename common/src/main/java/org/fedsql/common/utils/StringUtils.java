/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedsql.common.utils;

import com.google.common.base.Strings;
import java.util.List;
import java.util.Locale;

public class StringUtils {

  private static final String BACKTICK = "`";
  private static final String DOUBLE_QUOTE = "\"";

  private StringUtils() {}

  /**
   * Format a string with {@link Locale#ROOT} so messages do not depend on the JVM default locale.
   *
   * @param format format string
   * @param args arguments
   * @return formatted string
   */
  public static String format(final String format, Object... args) {
    return String.format(Locale.ROOT, format, args);
  }

  /**
   * Lower-case a name with {@link Locale#ROOT}. Null stays null.
   */
  public static String toLowerCase(String name) {
    return name == null ? null : name.toLowerCase(Locale.ROOT);
  }

  /** Null-safe, locale-independent case-insensitive comparison. */
  public static boolean equalsIgnoreCase(String left, String right) {
    if (left == null || right == null) {
      return left == right;
    }
    return left.equalsIgnoreCase(right);
  }

  /**
   * Remove back quotes or double quotes around an identifier, if present.
   *
   * @param identifier identifier possibly quoted
   * @return identifier without the surrounding quotes
   */
  public static String unquoteIdentifier(String identifier) {
    if (isQuoted(identifier, BACKTICK) || isQuoted(identifier, DOUBLE_QUOTE)) {
      return identifier.substring(1, identifier.length() - 1);
    }
    return identifier;
  }

  /** Join the parts of a dotted name. */
  public static String joinPath(List<String> parts) {
    return String.join(".", parts);
  }

  private static boolean isQuoted(String text, String mark) {
    return !Strings.isNullOrEmpty(text)
        && text.length() > 1
        && text.startsWith(mark)
        && text.endsWith(mark);
  }
}

package com.onthegomap.tileserve.util;

import java.util.Set;

/**
 * Utilities to coerce loosely-typed values from a parsed JSON/YAML document.
 * <p>
 * The {@code to*} methods are strict: they throw the raw {@link NumberFormatException} for input that can not be
 * converted.
 */
public class Parse {

  private static final Set<String> BOOLEAN_FALSE_VALUES = Set.of("", "0", "false", "no");

  private Parse() {}

  /**
   * Returns {@code value} as an integer, truncating floating-point numbers.
   *
   * @throws NumberFormatException if {@code value} is a string that is not an integer
   */
  public static int toInt(Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    } else if (value instanceof Boolean bool) {
      return bool ? 1 : 0;
    }
    return Integer.parseInt(String.valueOf(value).strip());
  }

  /**
   * Returns {@code value} as a double.
   *
   * @throws NumberFormatException if {@code value} is a string that is not a number
   */
  public static double toDouble(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    } else if (value instanceof Boolean bool) {
      return bool ? 1 : 0;
    }
    return Double.parseDouble(String.valueOf(value).strip());
  }

  /**
   * Returns {@code value} parsed as a base-8 integer, i.e. a file mode mask like {@code "0022"}.
   *
   * @throws NumberFormatException if {@code value} is not a valid octal number
   */
  public static int octal(Object value) {
    return Integer.parseInt(String.valueOf(value).strip(), 8);
  }

  /**
   * Returns {@code false} if {@code value} is null, {@code false}, zero, or a string that is empty, "0", "false", or
   * "no" and {@code true} otherwise.
   */
  public static boolean bool(Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    } else if (value instanceof Number number) {
      return number.doubleValue() != 0;
    }
    return !(value == null || BOOLEAN_FALSE_VALUES.contains(value.toString().strip().toLowerCase()));
  }
}

package com.onthegomap.tileserve.config;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options for the command-line tools, read from command-line arguments, JVM properties or environmental variables.
 * <p>
 * Keys are matched ignoring case and separators, so {@code stale-lock}, {@code stale_lock} and {@code STALE.LOCK} are
 * the same option.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String JVM_PREFIX = "tileserve";
  private static final String ENV_PREFIX = "TILESERVE";

  private final UnaryOperator<String> lookup;
  private final Supplier<? extends Collection<String>> keys;

  private Arguments(UnaryOperator<String> lookup, Supplier<? extends Collection<String>> keys) {
    this.lookup = lookup;
    this.keys = keys;
  }

  /** Returns options from JVM properties like {@code -Dtileserve.config=tiles.yml}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty, () -> System.getProperties().stringPropertyNames());
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return withPrefix(getter, keys, JVM_PREFIX, ".", false);
  }

  /** Returns options from environmental variables like {@code TILESERVE_CONFIG=tiles.yml}. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv, () -> System.getenv().keySet());
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter, Supplier<Set<String>> keys) {
    return withPrefix(getter, keys, ENV_PREFIX, "_", true);
  }

  /**
   * Returns options from command-line arguments written as {@code key=value}, {@code --key value}, or {@code --key}
   * alone for {@code key=true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      if (equals >= 0) {
        parsed.put(stripDashes(arg.substring(0, equals)), arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(stripDashes(arg), args[i++].strip());
      } else {
        parsed.put(stripDashes(arg), "true");
      }
    }
    return of(parsed);
  }

  /**
   * Returns options from command-line arguments, falling back to JVM properties and then to environmental variables.
   */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new LinkedHashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get, normalized::keySet);
  }

  /** Returns options from alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  private static String stripDashes(String key) {
    return key.replaceAll("^[\\s-]+", "");
  }

  private static String normalize(String key, String separator, boolean upperCase) {
    String result = key.replaceAll("[._-]", separator);
    return upperCase ? result.toUpperCase(Locale.ROOT) : result.toLowerCase(Locale.ROOT);
  }

  private static String normalize(String key) {
    return normalize(key, "_", false);
  }

  private static Arguments withPrefix(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys,
    String prefix, String separator, boolean upperCase) {
    Pattern prefixPattern = Pattern.compile("^" + Pattern.quote(normalize(prefix + separator, separator, upperCase)),
      Pattern.CASE_INSENSITIVE);
    Supplier<List<String>> unprefixed = () -> keys.get().stream()
      .filter(key -> prefixPattern.matcher(key).find())
      .map(key -> normalize(prefixPattern.matcher(key).replaceFirst("")))
      .toList();
    return new Arguments(key -> getter.apply(normalize(prefix + separator + key, separator, upperCase)), unprefixed);
  }

  private String get(String key) {
    return lookup.apply(normalize(key));
  }

  /** Returns options that check this instance first and {@code other} for anything missing. */
  public Arguments orElse(Arguments other) {
    return new Arguments(
      key -> {
        String value = get(key);
        return value != null ? value : other.get(key);
      },
      () -> Stream.concat(other.keys.get().stream(), keys.get().stream()).distinct().toList()
    );
  }

  String getArg(String key) {
    String value = get(key);
    return value == null ? null : value.strip();
  }

  private void logValue(String key, String description, Object value) {
    LOGGER.debug("argument: {}={} ({})", key, value, description);
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key);
    String result = value == null ? defaultValue : value;
    logValue(key, description, result);
    return result;
  }

  /**
   * Returns the value for {@code key}.
   *
   * @throws IllegalArgumentException if the argument is missing
   */
  public String getString(String key, String description) {
    String value = getArg(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required argument " + key + " (" + description + ")");
    }
    logValue(key, description, value);
    return value;
  }

  /** Returns every option that was provided, by normalized key. */
  public Map<String, String> toMap() {
    Map<String, String> result = new TreeMap<>();
    for (String key : keys.get()) {
      String value = get(key);
      if (value != null) {
        result.put(key, value);
      }
    }
    return result;
  }
}

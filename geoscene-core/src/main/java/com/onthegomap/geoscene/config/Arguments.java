package com.onthegomap.geoscene.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value options for a geoscene run, read from command-line arguments, JVM properties, environmental variables or a
 * properties file.
 * <p>
 * Keys are compared after lower-casing and treating {@code .}, {@code -} and {@code _} as the same separator, so
 * {@code --http-timeout}, {@code http_timeout} and {@code GEOSCENE_HTTP_TIMEOUT} all set {@code http_timeout}.
 * <p>
 * A renamed option can be read as {@code "new_name|old_name"}: the first one that is set wins, and a warning is logged
 * when only the old name is set.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  private static final String JVM_PREFIX = "geoscene";
  private static final String ENV_PREFIX = "GEOSCENE";

  /** Returns the value of a canonical key, or {@code null}. */
  private final Function<String, String> lookup;
  /** Returns every canonical key this instance knows about, with its value. */
  private final Supplier<Map<String, String>> entries;

  private Arguments(Function<String, String> lookup, Supplier<Map<String, String>> entries) {
    this.lookup = lookup;
    this.entries = entries;
  }

  private static Arguments fromEntries(Supplier<Map<String, String>> entries) {
    return new Arguments(key -> entries.get().get(key), entries);
  }

  /** Returns {@code key} lower-cased with every {@code .}, {@code -} or {@code _} turned into {@code _}. */
  static String canonical(String key) {
    return key.strip().replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  private static Map<String, String> canonicalize(Collection<String> keys, UnaryOperator<String> getter) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String key : keys) {
      String value = getter.apply(key);
      if (value != null) {
        result.put(canonical(key), value);
      }
    }
    return result;
  }

  /**
   * Returns the keys that start with {@code prefix} followed by a separator, with the prefix removed. Keys are listed
   * each time so that options set after this instance was created are still seen.
   */
  private static Arguments fromPrefixed(String prefix, UnaryOperator<String> getter,
    Supplier<? extends Collection<String>> keys) {
    String start = canonical(prefix) + "_";
    return fromEntries(() -> {
      Map<String, String> result = new LinkedHashMap<>();
      for (String key : keys.get()) {
        String name = canonical(key);
        String value = getter.apply(key);
        if (name.startsWith(start) && name.length() > start.length() && value != null) {
          result.put(name.substring(start.length()), value);
        }
      }
      return result;
    });
  }

  /**
   * Returns arguments from JVM system properties that start with {@code geoscene.}, for example
   * {@code java -Dgeoscene.http_timeout=1m -jar ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty, () -> System.getProperties().stringPropertyNames());
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return fromPrefixed(JVM_PREFIX, getter, keys);
  }

  /**
   * Returns arguments from environmental variables that start with {@code GEOSCENE_}, for example
   * {@code GEOSCENE_HTTP_TIMEOUT=1m java -jar ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv, () -> System.getenv().keySet());
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter, Supplier<? extends Collection<String>> keys) {
    return fromPrefixed(ENV_PREFIX, getter, keys);
  }

  /** Returns arguments from every entry of {@code properties}. */
  public static Arguments from(Properties properties) {
    return fromEntries(() -> canonicalize(properties.stringPropertyNames(), properties::getProperty));
  }

  /**
   * Returns arguments parsed from the command line.
   * <p>
   * Accepts {@code key=value}, {@code --key=value} and {@code --key value}. A {@code --flag} with no value, or a bare
   * word, is set to {@code true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new LinkedHashMap<>();
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

  private static String stripDashes(String arg) {
    return arg.replaceFirst("^[\\s-]+", "");
  }

  /**
   * Returns arguments read from a {@code .properties} file.
   *
   * @throws IllegalArgumentException if the file cannot be read
   */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return from(properties);
  }

  /**
   * Returns arguments from the command line, then JVM properties, then environmental variables, then the properties
   * file named by a {@code config} argument from any of those, in that order of priority.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments arguments = fromEnvOrArgs(args);
    Path configFile = arguments.file("config", "path to config file", null);
    return configFile == null ? arguments : arguments.orElse(fromConfigFile(configFile));
  }

  /** Returns arguments from the command line, then JVM properties, then environmental variables. */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> values = canonicalize(map.keySet(), map::get);
    return fromEntries(() -> values);
  }

  /** Shorthand for {@link #of(Map)} from alternating keys and values, which are converted with {@code toString}. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs, got: " + Arrays.toString(keysAndValues));
    }
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  /** Returns arguments that read from this instance first, and from {@code fallback} for keys this one lacks. */
  public Arguments orElse(Arguments fallback) {
    return new Arguments(
      key -> {
        String value = lookup.apply(key);
        return value != null ? value : fallback.lookup.apply(key);
      },
      () -> {
        Map<String, String> merged = new LinkedHashMap<>(fallback.entries.get());
        merged.putAll(entries.get());
        return merged;
      }
    );
  }

  private String get(String key) {
    String[] names = key.split("\\|");
    for (int i = 0; i < names.length; i++) {
      String value = lookup.apply(canonical(names[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}' instead", names[i].strip(), names[0].strip());
        }
        return value.strip();
      }
    }
    return null;
  }

  private String get(String key, String defaultValue) {
    String value = get(key);
    return value == null ? defaultValue : value;
  }

  private <T> T logged(String key, String description, T value) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.split("\\|")[0], value, description);
    }
    return value;
  }

  public String getString(String key, String description, String defaultValue) {
    return logged(key, description, get(key, defaultValue));
  }

  /**
   * Returns a required string argument.
   *
   * @throws IllegalArgumentException if the argument is not set
   */
  public String getString(String key, String description) {
    String value = get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return logged(key, description, value);
  }

  /** Returns the argument as a {@link Path}, without checking that it exists. */
  public Path file(String key, String description, Path defaultValue) {
    String value = get(key);
    return logged(key, description, value == null ? defaultValue : Path.of(value));
  }

  /** Returns a comma-separated argument as a list with blank entries removed. */
  public List<String> getList(String key, String description, List<String> defaultValue) {
    String value = get(key);
    List<String> result = value == null ? defaultValue : Arrays.stream(value.split(","))
      .map(String::strip)
      .filter(item -> !item.isEmpty())
      .toList();
    return logged(key, description, result);
  }

  /**
   * Returns the argument as an integer.
   *
   * @throws NumberFormatException if the argument is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    String value = get(key);
    return logged(key, description, value == null ? defaultValue : Integer.parseInt(value));
  }

  /**
   * Returns the argument as a {@link Duration} like {@code 10s}, {@code 90m} or {@code 1h30m}.
   *
   * @throws DateTimeParseException if the argument is not a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    return logged(key, description, Duration.parse("PT" + get(key, defaultValue)));
  }

  /** Returns every argument this instance can see, keyed by canonical name. */
  public Map<String, String> toMap() {
    return new HashMap<>(entries.get());
  }
}

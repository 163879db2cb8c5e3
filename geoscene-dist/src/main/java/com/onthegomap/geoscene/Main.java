package com.onthegomap.geoscene;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point of the executable jar.
 * <p>
 * An optional first word picks the task ({@code load}, or {@code export} which also requires {@code output}) and the
 * remaining arguments go to it.
 * Without a task word, arguments go to {@link LoadGeoJson}.
 */
public class Main {

  private static final Map<String, Task> TASKS = Map.of(
    "load", LoadGeoJson::main,
    "export", LoadGeoJson::export
  );

  public static void main(String[] args) throws Exception {
    String first = args.length == 0 ? "" : args[0].strip().toLowerCase(Locale.ROOT);
    Task task = TASKS.get(first);
    if (task != null) {
      task.run(Arrays.copyOfRange(args, 1, args.length));
    } else if (first.isEmpty() || first.startsWith("-") || first.contains("=")) {
      LoadGeoJson.main(args);
    } else {
      System.err.println("Unknown task '" + first + "', expected one of " + TASKS.keySet());
      System.exit(1);
    }
  }

  @FunctionalInterface
  private interface Task {

    void run(String[] args) throws Exception;
  }
}

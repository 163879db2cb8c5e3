package com.onthegomap.geoscene.util;

import org.slf4j.MDC;

/**
 * Tags log lines from the current thread with the name of the pipeline stage it is running, through the {@code stage}
 * key of the SLF4J {@link MDC}.
 * <p>
 * The log4j2 pattern renders the tag as {@code [stage] } when it is set.
 */
public final class LogUtil {

  static final String STAGE_KEY = "stage";

  private LogUtil() {}

  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, stage);
  }

  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the stage set on this thread, or {@code null} outside of any stage. */
  public static String getStage() {
    return MDC.get(STAGE_KEY);
  }
}

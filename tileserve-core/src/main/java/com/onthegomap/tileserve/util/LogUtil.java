package com.onthegomap.tileserve.util;

import org.slf4j.MDC;

/**
 * Wrapper for SLF4j {@link MDC} log utility to prepend {@code [stage]} to log output.
 */
public class LogUtil {

  private LogUtil() {}

  private static final String STAGE_KEY = "stage";

  /** Prepends {@code [stage]} to all subsequent logs from this thread. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[%s] ".formatted(stage));
  }

  /** Removes {@code [stage]} from subsequent logs from this thread. */
  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the current {@code [stage]} value prepended to log for this thread. */
  public static String getStage() {
    String stage = MDC.get(STAGE_KEY);
    return stage == null ? null : stage.substring(1, stage.length() - 2);
  }
}

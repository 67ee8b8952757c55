package com.onthegomap.tileserve.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class LogUtilTest {

  @AfterEach
  void clear() {
    LogUtil.clearStage();
  }

  @Test
  void testStage() {
    assertNull(LogUtil.getStage());
    LogUtil.setStage("config");
    assertEquals("config", LogUtil.getStage());
    assertEquals("[config] ", MDC.get("stage"));
    LogUtil.clearStage();
    assertNull(LogUtil.getStage());
  }
}

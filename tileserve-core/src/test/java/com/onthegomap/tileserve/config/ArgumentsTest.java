package com.onthegomap.tileserve.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ArgumentsTest {

  @Test
  void testEmpty() {
    assertEquals("fallback", Arguments.of().getString("key", "key", "fallback"));
  }

  @Test
  void testOrElse() {
    Arguments args = Arguments.of("key1", "value1a", "key2", "value2a")
      .orElse(Arguments.of("key2", "value2b", "key3", "value3b"));

    assertEquals("value1a", args.getString("key1", "key", "fallback"));
    assertEquals("value2a", args.getString("key2", "key", "fallback"));
    assertEquals("value3b", args.getString("key3", "key", "fallback"));
    assertEquals("fallback", args.getString("key4", "key", "fallback"));
  }

  @Test
  void testRequiredString() {
    assertEquals("cfg.yml", Arguments.of("config", "cfg.yml").getString("config", "config file"));
    var exception = assertThrows(IllegalArgumentException.class,
      () -> Arguments.of().getString("config", "config file"));
    assertTrue(exception.getMessage().contains("config"), exception.getMessage());
  }

  @Test
  void testArgsKeyPresentImplies() {
    assertEquals("true", Arguments.fromArgs("--force").getString("force", "force", null));
  }

  @Test
  void testUnderscoreDashSame() {
    assertEquals("a", Arguments.fromArgs("--stale-lock=a").getString("stale_lock", "lock", null));
    assertEquals("b", Arguments.fromArgs("--stale_lock=b").getString("stale-lock", "lock", null));
  }

  @Test
  void testSpaceBetweenArgs() {
    Arguments args = Arguments.fromArgs("--config tiles.yml --tile 9/2/2 --force".split("\\s+"));

    assertEquals("tiles.yml", args.getString("config", "config", null));
    assertEquals("9/2/2", args.getString("tile", "tile", null));
    assertEquals("true", args.getString("force", "force", null));
    assertEquals(Map.of("config", "tiles.yml", "tile", "9/2/2", "force", "true"),
      Arguments.fromArgs("--config tiles.yml --tile 9/2/2 --force".split("\\s+")).toMap());
  }

  @Test
  void testListArgumentsFromEnvironment() {
    Map<String, String> env = Map.of(
      "OTHER", "value",
      "TILESERVEOTHER", "VALUE",
      "TILESERVE_KEY1", "value1",
      "TILESERVE_KEY2", "value2"
    );
    Arguments args = Arguments.fromEnvironment(env::get, env::keySet);
    assertEquals(Map.of(
      "key1", "value1",
      "key2", "value2"
    ), args.toMap());
  }

  @Test
  void testListArgumentsFromMerged() {
    Map<String, String> env = Map.of(
      "TILESERVE_KEY1", "value1",
      "TILESERVE_KEY3", "value3"
    );
    Map<String, String> jvm = Map.of(
      "other", "value",
      "TILESERVE_KEY1", "ignored",
      "tileserve.key3", "value4"
    );
    Arguments args = Arguments.fromJvmProperties(jvm::get, jvm::keySet)
      .orElse(Arguments.fromEnvironment(env::get, env::keySet));
    assertEquals(Map.of(
      "key1", "value1",
      "key3", "value4"
    ), args.toMap());
  }
}

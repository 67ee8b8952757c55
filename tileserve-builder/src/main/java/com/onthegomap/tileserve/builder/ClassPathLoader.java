package com.onthegomap.tileserve.builder;

import com.google.common.annotations.VisibleForTesting;
import com.onthegomap.tileserve.config.ConfigurationException;
import com.onthegomap.tileserve.plugin.PluginSymbol;
import com.onthegomap.tileserve.util.Try;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves plugin specifiers from a configuration to classes or objects on the classpath.
 * <p>
 * A specifier looks like {@code "com.example.Tiles:Caches.Redis"}: a class to load, then a dotted expression of nested
 * classes and public fields evaluated against it. The older form {@code "com.example.Tiles.Redis"} is still accepted
 * and means either the top-level class {@code com.example.Tiles.Redis} or the member {@code Redis} of
 * {@code com.example.Tiles}.
 * <p>
 * Successful lookups are remembered for the life of the process, so the same specifier always resolves to the same
 * symbol. Failures are not remembered.
 */
public class ClassPathLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClassPathLoader.class);
  private static final Map<String, PluginSymbol> RESOLVED = new ConcurrentHashMap<>();

  private ClassPathLoader() {}

  /**
   * Returns the symbol {@code specifier} refers to.
   *
   * @throws ConfigurationException if the class can not be loaded, the expression does not evaluate, or it evaluates to
   *                                {@code null}
   */
  public static PluginSymbol resolve(String specifier) {
    PluginSymbol symbol = RESOLVED.get(specifier);
    if (symbol == null) {
      PluginSymbol loaded = load(specifier);
      symbol = RESOLVED.putIfAbsent(specifier, loaded);
      if (symbol == null) {
        LOGGER.debug("Resolved {} to {}", specifier, loaded.value());
        symbol = loaded;
      }
    }
    return symbol;
  }

  @VisibleForTesting
  static void reset() {
    RESOLVED.clear();
  }

  private static PluginSymbol load(String specifier) {
    Try<Object> result;
    int colon = specifier.indexOf(':');
    if (colon >= 0) {
      String className = specifier.substring(0, colon).strip();
      String expression = specifier.substring(colon + 1).strip();
      result = Try.<Object>apply(() -> loadClass(className))
        .map(owner -> evaluate(owner, expression))
        .map(value -> requireNonNull(value, expression, className));
    } else {
      LOGGER.warn("Plugin {} uses the deprecated \"package.Name\" form, use \"package.Class:Name\" instead", specifier);
      int dot = specifier.lastIndexOf('.');
      if (dot <= 0 || dot == specifier.length() - 1) {
        throw new ConfigurationException(
          "Tried to import %s, but: expected \"package.Class:Name\" or \"package.Name\"".formatted(specifier));
      }
      String className = specifier.substring(0, dot);
      String name = specifier.substring(dot + 1);
      result = Try.<Object>apply(() -> loadClass(specifier))
        .recover(notAClass -> Try.apply(() -> member(loadClass(className), name)))
        .map(value -> requireNonNull(value, name, className));
    }
    if (result.isFailure()) {
      Exception e = result.exception();
      throw new ConfigurationException("Tried to import %s, but: %s".formatted(specifier, e), e);
    }
    return new PluginSymbol(specifier, result.get());
  }

  private static Object requireNonNull(Object value, String expression, String className) {
    if (value == null) {
      throw new IllegalStateException("eval(%s) in %s came up null".formatted(expression, className));
    }
    return value;
  }

  private static Object evaluate(Object owner, String expression) throws ReflectiveOperationException {
    Object current = owner;
    for (String part : expression.split("\\.", -1)) {
      String name = part.strip();
      if (name.isEmpty()) {
        throw new IllegalArgumentException("invalid expression \"" + expression + "\"");
      } else if (current == null) {
        throw new IllegalStateException("can not read " + name + " from null in \"" + expression + "\"");
      } else if (current instanceof Class<?> clazz) {
        current = member(clazz, name);
      } else {
        current = current.getClass().getField(name).get(current);
      }
    }
    return current;
  }

  /** Returns the nested class or public static field of {@code owner} called {@code name}. */
  private static Object member(Class<?> owner, String name) throws ReflectiveOperationException {
    try {
      return loadClass(owner.getName() + "$" + name);
    } catch (ClassNotFoundException e) {
      Field field;
      try {
        field = owner.getField(name);
      } catch (NoSuchFieldException noField) {
        throw new NoSuchFieldException(owner.getName() + " has no nested class or public field named " + name);
      }
      if (!Modifier.isStatic(field.getModifiers())) {
        throw new NoSuchFieldException(owner.getName() + "." + name + " is not static");
      }
      return field.get(null);
    }
  }

  private static Class<?> loadClass(String name) throws ClassNotFoundException {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = ClassPathLoader.class.getClassLoader();
    }
    try {
      return Class.forName(name, true, classLoader);
    } catch (LinkageError e) {
      throw new ClassNotFoundException("failed to load " + name + ": " + e, e);
    }
  }
}

package com.onthegomap.tileserve.util;

/**
 * A function that can throw checked exceptions, for use with {@link Try#map(FunctionThatThrows)}.
 */
@FunctionalInterface
public interface FunctionThatThrows<I, O> {

  @SuppressWarnings("java:S112")
  O apply(I value) throws Exception;
}

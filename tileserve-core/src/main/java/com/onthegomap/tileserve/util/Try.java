package com.onthegomap.tileserve.util;

import static com.onthegomap.tileserve.util.Exceptions.throwFatalException;

import java.util.function.Function;

/**
 * A container for the result of an operation that may succeed or fail.
 *
 * @param <T> Type of the result value, if success
 */
public interface Try<T> {
  /**
   * Calls {@code supplier} and wraps the result in {@link Success} if successful, or {@link Failure} if it throws an
   * exception.
   */
  static <T> Try<T> apply(SupplierThatThrows<T> supplier) {
    try {
      return success(supplier.get());
    } catch (Exception e) {
      return failure(e);
    }
  }

  static <T> Success<T> success(T item) {
    return new Success<>(item);
  }

  static <T> Failure<T> failure(Exception throwable) {
    return new Failure<>(throwable);
  }

  /** Returns the result if success, or re-throws the exception if failure. */
  T get();

  default boolean isSuccess() {
    return !isFailure();
  }

  default boolean isFailure() {
    return exception() != null;
  }

  default Exception exception() {
    return null;
  }

  /**
   * If this is a success, then maps the value through {@code fn}, returning the new value in a {@link Success} if
   * successful, or {@link Failure} if the mapping function threw an exception.
   */
  <O> Try<O> map(FunctionThatThrows<T, O> fn);

  /** Returns this if success, otherwise the result of calling {@code fallback} with the exception. */
  Try<T> recover(Function<Exception, Try<T>> fallback);

  record Success<T>(T get) implements Try<T> {

    @Override
    public <O> Try<O> map(FunctionThatThrows<T, O> fn) {
      return Try.apply(() -> fn.apply(get));
    }

    @Override
    public Try<T> recover(Function<Exception, Try<T>> fallback) {
      return this;
    }
  }
  record Failure<T>(@Override Exception exception) implements Try<T> {

    @Override
    public T get() {
      return throwFatalException(exception);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <O> Try<O> map(FunctionThatThrows<T, O> fn) {
      return (Try<O>) this;
    }

    @Override
    public Try<T> recover(Function<Exception, Try<T>> fallback) {
      return fallback.apply(exception);
    }
  }

  @FunctionalInterface
  interface SupplierThatThrows<T> {
    @SuppressWarnings("java:S112")
    T get() throws Exception;
  }
}

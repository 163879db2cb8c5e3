package com.onthegomap.geoscene.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Returns the exception that caused a future to fail, stripping the {@link CompletionException} and
   * {@link ExecutionException} layers that {@link java.util.concurrent.CompletableFuture} adds around it.
   */
  public static Throwable unwrap(Throwable exception) {
    Throwable result = exception;
    while ((result instanceof CompletionException || result instanceof ExecutionException) &&
      result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }
}

package io.b2mash.credstore.resilience;

import io.b2mash.credstore.exception.TransientBackendException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/** Classifies backend failures. Only transient failures are retried or counted by a breaker. */
final class TransientFailures {

  private TransientFailures() {}

  static boolean isTransient(Throwable error) {
    var cause = unwrap(error);
    return cause instanceof TransientBackendException
        || cause instanceof TimeoutException
        || cause instanceof IOException;
  }

  static Throwable unwrap(Throwable error) {
    var current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}

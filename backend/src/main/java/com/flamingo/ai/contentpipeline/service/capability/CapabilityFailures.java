package com.flamingo.ai.contentpipeline.service.capability;

import com.flamingo.ai.contentpipeline.exception.FatalCapabilityException;
import com.flamingo.ai.contentpipeline.exception.TransientCapabilityException;
import dev.langchain4j.exception.HttpException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/** Sorts failures of external capabilities into transient and fatal. */
public final class CapabilityFailures {

  private static final int MAX_CAUSE_DEPTH = 10;

  private CapabilityFailures() {}

  /**
   * Wraps a raw failure of a capability call into {@link TransientCapabilityException} or {@link
   * FatalCapabilityException}. Already classified exceptions are returned unchanged.
   */
  public static RuntimeException classify(String capability, RuntimeException failure) {
    if (failure instanceof TransientCapabilityException
        || failure instanceof FatalCapabilityException) {
      return failure;
    }
    String message = capability + " call failed: " + failure.getMessage();
    if (isTransient(failure)) {
      return new TransientCapabilityException(capability, message, failure);
    }
    return new FatalCapabilityException(capability, message, failure);
  }

  /** Rate limits, server errors, timeouts and I/O errors anywhere in the cause chain. */
  public static boolean isTransient(Throwable failure) {
    Throwable current = failure;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof HttpException http) {
        int status = http.statusCode();
        return status == 408 || status == 429 || status >= 500;
      }
      if (current instanceof TimeoutException
          || current instanceof IOException
          || current instanceof UncheckedIOException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}

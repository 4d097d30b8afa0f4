package com.flamingo.ai.contentpipeline.exception;

/** Exception thrown when an external capability fails in a way that may succeed on retry. */
public class TransientCapabilityException extends RuntimeException {

  private final String capability;

  public TransientCapabilityException(String capability, String message) {
    super(message);
    this.capability = capability;
  }

  public TransientCapabilityException(String capability, String message, Throwable cause) {
    super(message, cause);
    this.capability = capability;
  }

  public String getCapability() {
    return capability;
  }
}

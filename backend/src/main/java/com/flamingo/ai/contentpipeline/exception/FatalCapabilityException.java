package com.flamingo.ai.contentpipeline.exception;

/**
 * Exception thrown when an external capability is permanently unavailable, has exhausted its
 * retries, or returned output that cannot be used.
 */
public class FatalCapabilityException extends RuntimeException {

  private final String capability;
  private final String userMessage;

  public FatalCapabilityException(String capability, String message) {
    super(message);
    this.capability = capability;
    this.userMessage = "AI service is unavailable. Please try again later.";
  }

  public FatalCapabilityException(String capability, String message, Throwable cause) {
    super(message, cause);
    this.capability = capability;
    this.userMessage = "AI service is unavailable. Please try again later.";
  }

  public String getCapability() {
    return capability;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

package com.flamingo.ai.chatarchive.exception;

/**
 * Base of the fatal error taxonomy. Record-level problems never surface as exceptions; they are
 * reported through the stream listener instead.
 */
public abstract class ArchiveException extends RuntimeException {

  private final String userMessage;

  protected ArchiveException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  protected ArchiveException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

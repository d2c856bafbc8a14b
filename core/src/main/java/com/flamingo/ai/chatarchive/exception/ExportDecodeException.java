package com.flamingo.ai.chatarchive.exception;

/** Exception thrown when an export is not a well-formed top-level JSON array. */
public class ExportDecodeException extends ArchiveException {

  private static final String USER_MESSAGE = "Export file is not a valid JSON array";

  public ExportDecodeException(String message) {
    super(message, USER_MESSAGE);
  }

  public ExportDecodeException(String message, Throwable cause) {
    super(message, USER_MESSAGE, cause);
  }
}

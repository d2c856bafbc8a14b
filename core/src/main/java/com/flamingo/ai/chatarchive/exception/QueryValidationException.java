package com.flamingo.ai.chatarchive.exception;

/** Exception thrown when search parameters are inconsistent. */
public class QueryValidationException extends ArchiveException {

  private final String field;

  public QueryValidationException(String field, String message) {
    super("Invalid search query, " + field + ": " + message, "Invalid " + field + ": " + message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}

package com.flamingo.ai.chatarchive.exception;

/** Exception thrown when no provider recognizes the structure of an export. */
public class UnsupportedSchemaException extends ArchiveException {

  public UnsupportedSchemaException(String message) {
    super(
        message,
        "Unsupported export format. Expected an OpenAI export (\"mapping\") "
            + "or a Claude export (\"chat_messages\").");
  }
}

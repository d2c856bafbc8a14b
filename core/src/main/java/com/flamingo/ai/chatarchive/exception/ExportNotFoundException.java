package com.flamingo.ai.chatarchive.exception;

import java.nio.file.Path;

/** Exception thrown when an export file does not exist. */
public class ExportNotFoundException extends ArchiveException {

  private final Path path;

  public ExportNotFoundException(Path path, Throwable cause) {
    super("Export file not found: " + path, "Export file not found: " + path, cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}

package com.flamingo.ai.chatarchive.exception;

import java.nio.file.Path;

/** Exception thrown when an export file exists but cannot be read. */
public class ExportAccessDeniedException extends ArchiveException {

  private final Path path;

  public ExportAccessDeniedException(Path path, String reason) {
    super(
        String.format("Cannot read export file %s: %s", path, reason),
        "Permission denied: " + path);
    this.path = path;
  }

  public ExportAccessDeniedException(Path path, Throwable cause) {
    super(
        String.format("Cannot read export file %s: %s", path, cause.getMessage()),
        "Permission denied: " + path,
        cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}

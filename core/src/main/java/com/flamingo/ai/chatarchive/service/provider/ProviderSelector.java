package com.flamingo.ai.chatarchive.service.provider;

import com.flamingo.ai.chatarchive.domain.enums.ProviderType;
import java.io.IOException;
import java.nio.file.Path;

/** Chooses the provider that understands an export. */
public interface ProviderSelector {

  /**
   * Detects the export format from the structure of its first record.
   *
   * @param source export file
   * @return the matching provider
   * @throws com.flamingo.ai.chatarchive.exception.UnsupportedSchemaException if no provider
   *     recognizes the record
   * @throws IOException if the file cannot be opened for a reason other than absence or access
   */
  ConversationProvider select(Path source) throws IOException;

  /**
   * Returns the provider registered for {@code type}, without reading any file.
   *
   * @throws com.flamingo.ai.chatarchive.exception.UnsupportedSchemaException if none is registered
   */
  ConversationProvider select(ProviderType type);
}

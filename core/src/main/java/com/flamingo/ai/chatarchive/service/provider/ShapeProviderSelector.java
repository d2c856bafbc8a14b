package com.flamingo.ai.chatarchive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.chatarchive.domain.enums.ProviderType;
import com.flamingo.ai.chatarchive.exception.UnsupportedSchemaException;
import com.flamingo.ai.chatarchive.service.decoder.JsonArrayRecordDecoder;
import com.flamingo.ai.chatarchive.service.decoder.RecordCursor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ProviderSelector} that peeks at the first array element and asks each provider, in
 * {@code @Order} order, whether it supports that shape. An empty export is treated as an OpenAI
 * export.
 */
@Service
@Slf4j
public class ShapeProviderSelector implements ProviderSelector {

  private final JsonArrayRecordDecoder decoder;
  private final List<ConversationProvider> providers;

  public ShapeProviderSelector(
      JsonArrayRecordDecoder decoder, List<ConversationProvider> providers) {
    this.decoder = decoder;
    this.providers = List.copyOf(providers);
  }

  @Override
  public ConversationProvider select(Path source) throws IOException {
    JsonNode firstRecord;
    try (RecordCursor<JsonNode> records = decoder.open(source)) {
      firstRecord = records.hasNext() ? records.next() : null;
    }
    if (firstRecord == null) {
      log.info("Export {} is empty, defaulting to {}", source, ProviderType.OPENAI.getTag());
      return select(ProviderType.OPENAI);
    }
    for (ConversationProvider provider : providers) {
      if (provider.supports(firstRecord)) {
        log.info("Detected {} export format for {}", provider.type().getTag(), source);
        return provider;
      }
    }
    throw new UnsupportedSchemaException(
        "Unrecognized export format in "
            + source
            + ": first record has neither 'chat_messages' nor 'mapping'");
  }

  @Override
  public ConversationProvider select(ProviderType type) {
    return providers.stream()
        .filter(provider -> provider.type() == type)
        .findFirst()
        .orElseThrow(
            () -> new UnsupportedSchemaException("No provider registered for " + type.getTag()));
  }
}

package com.flamingo.ai.chatarchive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.domain.enums.MessageRole;
import com.flamingo.ai.chatarchive.domain.enums.ProviderType;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.Message;
import com.flamingo.ai.chatarchive.service.decoder.JsonArrayRecordDecoder;
import com.flamingo.ai.chatarchive.service.search.RankingEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Reads claude.ai exports.
 *
 * <p>Messages come as a flat {@code chat_messages} array, so {@code parentId} is always {@code
 * null}. Text is taken from {@code text} content blocks; tool invocations and results are left
 * out.
 */
@Service
@Order(1)
@Slf4j
public class ClaudeConversationProvider extends AbstractConversationProvider {

  static final String UNTITLED = "(No title)";
  static final String EMPTY_CONVERSATION = "(Empty conversation)";

  public ClaudeConversationProvider(
      JsonArrayRecordDecoder decoder,
      RankingEngine rankingEngine,
      ArchiveProperties properties,
      MeterRegistry meterRegistry) {
    super(ProviderType.CLAUDE, decoder, rankingEngine, properties, meterRegistry);
  }

  @Override
  public boolean supports(JsonNode firstRecord) {
    return firstRecord != null && firstRecord.isObject() && firstRecord.has("chat_messages");
  }

  @Override
  protected String idField() {
    return "uuid";
  }

  @Override
  protected Conversation parseConversation(JsonNode record, ParseContext context) {
    String id = JsonValues.requiredText(record, "uuid");
    Instant createdAt = JsonValues.isoInstant(JsonValues.requiredText(record, "created_at"));
    context.fallbackTimestamp(createdAt);
    Instant updatedAt = null;
    String updated = JsonValues.text(record, "updated_at");
    if (updated != null && !updated.isBlank()) {
      try {
        updatedAt = JsonValues.isoInstant(updated);
      } catch (DateTimeException e) {
        context.warn(id, "ignoring unparsable updated_at '" + updated + "'");
      }
    }

    String name = JsonValues.text(record, "name");
    List<Message> messages = parseMessages(record.get("chat_messages"), id, context);
    if (messages.isEmpty()) {
      log.debug("Conversation {} has no usable messages, adding placeholder", id);
      messages =
          List.of(
              Message.builder()
                  .id(id + "-placeholder")
                  .role(MessageRole.SYSTEM)
                  .content(EMPTY_CONVERSATION)
                  .timestamp(createdAt)
                  .metadata(Map.of("is_placeholder", true))
                  .build());
    }

    return Conversation.builder()
        .id(id)
        .title(name == null || name.isEmpty() ? UNTITLED : name)
        .createdAt(createdAt)
        .updatedAt(updatedAt)
        .messages(messages)
        .build();
  }

  private List<Message> parseMessages(
      JsonNode chatMessages, String conversationId, ParseContext context) {
    if (chatMessages == null || !chatMessages.isArray()) {
      return List.of();
    }
    List<Message> messages = new ArrayList<>(chatMessages.size());
    Set<String> seen = new HashSet<>();
    int index = 0;
    for (JsonNode raw : chatMessages) {
      String position = conversationId + "#" + index++;
      if (!raw.isObject()) {
        context.skipMessage(position, "message is not a JSON object");
        continue;
      }
      String id = JsonValues.text(raw, "uuid");
      if (id == null || id.isBlank()) {
        context.skipMessage(position, "missing message uuid");
        continue;
      }
      if (!seen.add(id)) {
        context.skipMessage(id, "duplicate message id");
        continue;
      }
      messages.add(parseMessage(id, raw, context));
    }
    return messages;
  }

  private Message parseMessage(String id, JsonNode raw, ParseContext context) {
    String sender = JsonValues.text(raw, "sender");
    MessageRole role;
    Map<String, Object> metadata = Map.of();
    if ("human".equals(sender)) {
      role = MessageRole.USER;
    } else if ("assistant".equals(sender)) {
      role = MessageRole.ASSISTANT;
    } else {
      role = MessageRole.ASSISTANT;
      if (sender == null) {
        context.warn(id, "missing sender mapped to assistant");
      } else {
        metadata = Map.of("original_sender", sender);
        context.warn(id, "unknown sender '" + sender + "' mapped to assistant");
      }
    }

    return Message.builder()
        .id(id)
        .role(role)
        .content(extractContent(raw))
        .timestamp(messageTimestamp(raw, id, context))
        .metadata(metadata)
        .build();
  }

  /** Joins text blocks with newlines, falling back to the plain {@code text} field. */
  private static String extractContent(JsonNode raw) {
    List<String> texts = new ArrayList<>();
    JsonNode blocks = raw.get("content");
    if (blocks != null && blocks.isArray()) {
      for (JsonNode block : blocks) {
        if (block.isObject() && "text".equals(JsonValues.text(block, "type"))) {
          String text = JsonValues.text(block, "text");
          if (text != null && !text.isEmpty()) {
            texts.add(text);
          }
        }
      }
    }
    if (!texts.isEmpty()) {
      return String.join("\n", texts);
    }
    String fallback = JsonValues.text(raw, "text");
    return fallback == null ? "" : fallback;
  }

  private static Instant messageTimestamp(JsonNode raw, String id, ParseContext context) {
    String createdAt = JsonValues.text(raw, "created_at");
    if (createdAt == null || createdAt.isBlank()) {
      return context.fallbackTimestamp(id, "missing message timestamp");
    }
    try {
      return JsonValues.isoInstant(createdAt);
    } catch (DateTimeException e) {
      return context.fallbackTimestamp(id, "unparsable message timestamp '" + createdAt + "'");
    }
  }
}

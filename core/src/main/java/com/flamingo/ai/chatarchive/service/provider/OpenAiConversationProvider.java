package com.flamingo.ai.chatarchive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.domain.enums.MessageRole;
import com.flamingo.ai.chatarchive.domain.enums.ProviderType;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.ImageRef;
import com.flamingo.ai.chatarchive.domain.model.Message;
import com.flamingo.ai.chatarchive.service.decoder.JsonArrayRecordDecoder;
import com.flamingo.ai.chatarchive.service.search.RankingEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Reads ChatGPT exports ({@code conversations.json}).
 *
 * <p>Each record stores its messages as a tree in {@code mapping}: node id to {@code {message,
 * parent, children}}. Nodes without a message are structural and are not returned; a message's
 * parent is the nearest ancestor node that carries one. Messages are returned in chronological
 * order.
 */
@Service
@Order(2)
@Slf4j
public class OpenAiConversationProvider extends AbstractConversationProvider {

  private static final String CONTENT_TEXT = "text";
  private static final String CONTENT_MULTIMODAL = "multimodal_text";
  private static final String IMAGE_POINTER = "image_asset_pointer";

  public OpenAiConversationProvider(
      JsonArrayRecordDecoder decoder,
      RankingEngine rankingEngine,
      ArchiveProperties properties,
      MeterRegistry meterRegistry) {
    super(ProviderType.OPENAI, decoder, rankingEngine, properties, meterRegistry);
  }

  @Override
  public boolean supports(JsonNode firstRecord) {
    return firstRecord != null && firstRecord.isObject() && firstRecord.has("mapping");
  }

  @Override
  protected String idField() {
    return "id";
  }

  @Override
  protected Conversation parseConversation(JsonNode record, ParseContext context) {
    String id = JsonValues.requiredText(record, "id");
    if (!JsonValues.isPresent(record, "create_time")) {
      throw new RecordRejectedException("missing required field 'create_time'");
    }
    Instant createdAt = JsonValues.epochSeconds(record.get("create_time"));
    context.fallbackTimestamp(createdAt);
    Instant updatedAt = optionalTimestamp(record, "update_time", id, context);

    JsonNode mapping = record.get("mapping");
    if (mapping == null || !mapping.isObject()) {
      throw new RecordRejectedException("missing or malformed 'mapping'");
    }
    List<Message> messages = parseMapping(mapping, context);
    if (messages.isEmpty()) {
      throw new RecordRejectedException("no messages");
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    putIfPresent(metadata, "current_node", JsonValues.text(record, "current_node"));
    putIfPresent(metadata, "default_model_slug", JsonValues.text(record, "default_model_slug"));

    return Conversation.builder()
        .id(id)
        .title(JsonValues.text(record, "title"))
        .createdAt(createdAt)
        .updatedAt(updatedAt)
        .messages(messages)
        .metadata(metadata)
        .build();
  }

  private List<Message> parseMapping(JsonNode mapping, ParseContext context) {
    Map<String, String> parents = new HashMap<>();
    Map<String, Message> byNode = new LinkedHashMap<>();
    Set<String> messageIds = new HashSet<>();

    Iterator<Map.Entry<String, JsonNode>> nodes = mapping.fields();
    while (nodes.hasNext()) {
      Map.Entry<String, JsonNode> entry = nodes.next();
      String nodeId = entry.getKey();
      JsonNode node = entry.getValue();
      if (!node.isObject()) {
        continue;
      }
      parents.put(nodeId, JsonValues.text(node, "parent"));
      JsonNode messageNode = node.get("message");
      if (messageNode == null || !messageNode.isObject()) {
        continue;
      }
      Message message = parseMessage(nodeId, messageNode, context);
      if (message == null) {
        continue;
      }
      if (!messageIds.add(message.id())) {
        context.skipMessage(message.id(), "duplicate message id");
        continue;
      }
      byNode.put(nodeId, message);
    }

    List<Message> messages = new ArrayList<>(byNode.size());
    for (Map.Entry<String, Message> entry : byNode.entrySet()) {
      String parentNode = nearestMessageAncestor(entry.getKey(), parents, byNode);
      String parentId = parentNode == null ? null : byNode.get(parentNode).id();
      messages.add(entry.getValue().toBuilder().parentId(parentId).build());
    }
    messages.sort(Comparator.comparing(Message::timestamp));
    return messages;
  }

  /** Walks up structural nodes; returns {@code null} for roots and on cycles. */
  private static String nearestMessageAncestor(
      String nodeId, Map<String, String> parents, Map<String, Message> byNode) {
    Set<String> visited = new HashSet<>();
    visited.add(nodeId);
    String current = parents.get(nodeId);
    while (current != null && visited.add(current)) {
      if (byNode.containsKey(current)) {
        return current;
      }
      current = parents.get(current);
    }
    return null;
  }

  private Message parseMessage(String nodeId, JsonNode node, ParseContext context) {
    String id = JsonValues.text(node, "id");
    if (id == null || id.isBlank()) {
      id = nodeId;
    }
    JsonNode author = node.get("author");
    String rawRole = author == null ? null : JsonValues.text(author, "role");
    if (rawRole == null) {
      context.skipMessage(id, "missing author role");
      return null;
    }

    Instant timestamp = messageTimestamp(node, id, context);
    JsonNode content = node.get("content");
    String contentType =
        content != null && content.isObject() && content.hasNonNull("content_type")
            ? content.get("content_type").asText()
            : CONTENT_TEXT;

    List<ImageRef> images = new ArrayList<>();
    String text =
        CONTENT_TEXT.equals(contentType) || CONTENT_MULTIMODAL.equals(contentType)
            ? extractParts(content, images, id)
            : "";

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("original_role", rawRole);
    metadata.put("content_type", contentType);
    if (JsonValues.isPresent(node, "update_time")) {
      try {
        metadata.put("update_time", JsonValues.epochSeconds(node.get("update_time")));
      } catch (DateTimeException e) {
        log.debug("Ignoring unparsable update_time on message {}: {}", id, e.getMessage());
      }
    }

    return Message.builder()
        .id(id)
        .role(mapRole(rawRole, id, context))
        .content(text)
        .timestamp(timestamp)
        .images(images)
        .metadata(metadata)
        .build();
  }

  private static String extractParts(JsonNode content, List<ImageRef> images, String messageId) {
    JsonNode parts = content == null ? null : content.get("parts");
    if (parts == null || !parts.isArray()) {
      return "";
    }
    List<String> texts = new ArrayList<>();
    for (JsonNode part : parts) {
      if (part.isTextual()) {
        texts.add(part.asText());
      } else if (part.isObject() && IMAGE_POINTER.equals(JsonValues.text(part, "content_type"))) {
        String pointer = JsonValues.text(part, "asset_pointer");
        if (pointer == null || pointer.isBlank()) {
          log.debug("Ignoring image part without asset pointer in message {}", messageId);
          continue;
        }
        images.add(
            new ImageRef(
                pointer,
                part.hasNonNull("size_bytes") ? part.get("size_bytes").asLong() : null,
                part.hasNonNull("width") ? part.get("width").asInt() : null,
                part.hasNonNull("height") ? part.get("height").asInt() : null));
      }
    }
    return String.join("\n", texts);
  }

  private static MessageRole mapRole(String rawRole, String messageId, ParseContext context) {
    switch (rawRole) {
      case "user":
        return MessageRole.USER;
      case "assistant":
      case "tool":
        return MessageRole.ASSISTANT;
      case "system":
        return MessageRole.SYSTEM;
      default:
        context.warn(messageId, "unknown role '" + rawRole + "' mapped to assistant");
        return MessageRole.ASSISTANT;
    }
  }

  private static Instant messageTimestamp(JsonNode node, String messageId, ParseContext context) {
    if (!JsonValues.isPresent(node, "create_time")) {
      return context.fallbackTimestamp(messageId, "missing message timestamp");
    }
    try {
      return JsonValues.epochSeconds(node.get("create_time"));
    } catch (DateTimeException e) {
      return context.fallbackTimestamp(
          messageId, "unparsable message timestamp (" + e.getMessage() + ")");
    }
  }

  private static Instant optionalTimestamp(
      JsonNode record, String field, String id, ParseContext context) {
    if (!JsonValues.isPresent(record, field)) {
      return null;
    }
    try {
      return JsonValues.epochSeconds(record.get(field));
    } catch (DateTimeException e) {
      context.warn(id, "ignoring unparsable " + field + " (" + e.getMessage() + ")");
      return null;
    }
  }

  private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
    if (value != null) {
      metadata.put(key, value);
    }
  }
}

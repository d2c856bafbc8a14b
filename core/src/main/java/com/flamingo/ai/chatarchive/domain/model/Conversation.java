package com.flamingo.ai.chatarchive.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;

/**
 * A complete conversation read from an export file.
 *
 * <p>Immutable and therefore safe to share between threads. Provider adapters create one instance
 * per record during a streaming pass; nothing caches them across passes.
 *
 * @param id stable identifier within the source file
 * @param title conversation title, may be empty
 * @param createdAt creation instant (UTC)
 * @param updatedAt last update instant, or {@code null}; never before {@code createdAt}
 * @param messages messages in provider order, never empty
 * @param metadata provider-specific values, never interpreted by the core
 */
@Builder(toBuilder = true)
public record Conversation(
    String id,
    String title,
    Instant createdAt,
    Instant updatedAt,
    List<Message> messages,
    Map<String, Object> metadata) {

  public Conversation {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Conversation id must not be blank");
    }
    if (createdAt == null) {
      throw new IllegalArgumentException("Conversation " + id + " has no creation time");
    }
    if (updatedAt != null && updatedAt.isBefore(createdAt)) {
      throw new IllegalArgumentException(
          "Conversation " + id + " updated at " + updatedAt + " before creation at " + createdAt);
    }
    if (messages == null || messages.isEmpty()) {
      throw new IllegalArgumentException("Conversation " + id + " has no messages");
    }
    title = title == null ? "" : title;
    messages = List.copyOf(messages);
    Set<String> seen = new HashSet<>();
    for (Message message : messages) {
      if (!seen.add(message.id())) {
        throw new IllegalArgumentException(
            "Conversation " + id + " contains duplicate message id " + message.id());
      }
    }
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public int messageCount() {
    return messages.size();
  }

  /** Most recent activity: {@code updatedAt} when known, else {@code createdAt}. */
  public Instant lastActivity() {
    return updatedAt != null ? updatedAt : createdAt;
  }

  /**
   * Finds a message by exact id.
   *
   * @param messageId the id to look up
   * @return the message, or empty when absent
   */
  public Optional<Message> findMessage(String messageId) {
    return messages.stream().filter(m -> m.id().equals(messageId)).findFirst();
  }
}

package com.flamingo.ai.chatarchive.domain.model;

import com.flamingo.ai.chatarchive.domain.enums.MessageRole;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * A single message of a conversation, normalized from any provider.
 *
 * <p>Instances are immutable; use {@link #toBuilder()} to derive a changed copy. {@code content}
 * is kept verbatim (an empty string marks a deleted, redacted or tool-only message). {@code
 * parentId} is {@code null} for roots and for providers without branching; when set it should
 * name another message of the same conversation, which {@link
 * com.flamingo.ai.chatarchive.service.thread.ThreadReconstructor} checks lazily.
 *
 * @param id identifier, unique within its conversation
 * @param role normalized sender role
 * @param content text content, never {@code null}
 * @param timestamp creation instant (UTC)
 * @param parentId parent message id, or {@code null}
 * @param images image attachments, empty for text-only messages
 * @param metadata provider-specific values, never interpreted by the core
 */
@Builder(toBuilder = true)
public record Message(
    String id,
    MessageRole role,
    String content,
    Instant timestamp,
    String parentId,
    List<ImageRef> images,
    Map<String, Object> metadata) {

  public Message {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Message id must not be blank");
    }
    if (role == null) {
      throw new IllegalArgumentException("Message " + id + " has no role");
    }
    if (timestamp == null) {
      throw new IllegalArgumentException("Message " + id + " has no timestamp");
    }
    content = content == null ? "" : content;
    images = images == null ? List.of() : List.copyOf(images);
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Returns {@code true} when this message starts a thread. */
  public boolean isRoot() {
    return parentId == null;
  }
}

package com.flamingo.ai.chatarchive.domain.model;

import static com.flamingo.ai.chatarchive.ArchiveFixtures.T0;
import static com.flamingo.ai.chatarchive.ArchiveFixtures.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.chatarchive.domain.enums.MessageRole;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Conversation and Message Tests")
class ConversationTest {

  @Nested
  @DisplayName("Conversation invariants")
  class ConversationInvariants {

    @Test
    @DisplayName("should reject update before creation")
    void shouldRejectUpdateBeforeCreation() {
      assertThatThrownBy(
              () ->
                  Conversation.builder()
                      .id("c1")
                      .createdAt(T0)
                      .updatedAt(T0.minusSeconds(1))
                      .messages(List.of(message("m1", MessageRole.USER, "hi")))
                      .build())
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("before creation");
    }

    @Test
    @DisplayName("should reject an empty message list")
    void shouldRejectEmptyMessages() {
      assertThatThrownBy(
              () -> Conversation.builder().id("c1").createdAt(T0).messages(List.of()).build())
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject duplicate message ids")
    void shouldRejectDuplicateMessageIds() {
      assertThatThrownBy(
              () ->
                  Conversation.builder()
                      .id("c1")
                      .createdAt(T0)
                      .messages(
                          List.of(
                              message("m1", MessageRole.USER, "a"),
                              message("m1", MessageRole.ASSISTANT, "b")))
                      .build())
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("duplicate message id m1");
    }

    @Test
    @DisplayName("should copy collections so later changes do not leak in")
    void shouldCopyCollections() {
      List<Message> messages = new ArrayList<>(List.of(message("m1", MessageRole.USER, "a")));
      Map<String, Object> metadata = new HashMap<>(Map.of("k", "v"));

      Conversation conversation =
          Conversation.builder()
              .id("c1")
              .createdAt(T0)
              .messages(messages)
              .metadata(metadata)
              .build();
      messages.clear();
      metadata.clear();

      assertThat(conversation.messages()).hasSize(1);
      assertThat(conversation.metadata()).containsEntry("k", "v");
    }

    @Test
    @DisplayName("toBuilder should produce a new value and leave the original untouched")
    void shouldDeriveCopies() {
      Conversation original =
          Conversation.builder()
              .id("c1")
              .title("Old")
              .createdAt(T0)
              .messages(List.of(message("m1", MessageRole.USER, "a")))
              .build();

      Conversation renamed = original.toBuilder().title("New").build();

      assertThat(original.title()).isEqualTo("Old");
      assertThat(renamed.title()).isEqualTo("New");
      assertThat(renamed.lastActivity()).isEqualTo(T0);
    }
  }

  @Nested
  @DisplayName("Message invariants")
  class MessageInvariants {

    @Test
    @DisplayName("should keep empty content as is")
    void shouldKeepEmptyContent() {
      Message message = Message.builder().id("m1").role(MessageRole.USER).timestamp(T0).build();

      assertThat(message.content()).isEmpty();
      assertThat(message.images()).isEmpty();
      assertThat(message.isRoot()).isTrue();
    }

    @Test
    @DisplayName("should not trim content")
    void shouldNotTrimContent() {
      Message message = message("m1", MessageRole.USER, "  spaced  ");

      assertThat(message.content()).isEqualTo("  spaced  ");
    }

    @Test
    @DisplayName("should require a timestamp")
    void shouldRequireTimestamp() {
      assertThatThrownBy(() -> Message.builder().id("m1").role(MessageRole.USER).build())
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}

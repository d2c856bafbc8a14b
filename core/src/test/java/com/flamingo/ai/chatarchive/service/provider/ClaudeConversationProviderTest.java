package com.flamingo.ai.chatarchive.service.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.flamingo.ai.chatarchive.ArchiveFixtures;
import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.domain.enums.MessageRole;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.Message;
import com.flamingo.ai.chatarchive.domain.model.SearchQuery;
import com.flamingo.ai.chatarchive.domain.model.SearchResult;
import com.flamingo.ai.chatarchive.service.decoder.JsonArrayRecordDecoder;
import com.flamingo.ai.chatarchive.service.search.RankingEngine;
import com.flamingo.ai.chatarchive.service.search.SnippetExtractor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClaudeConversationProvider Tests")
class ClaudeConversationProviderTest {

  private static final Path EXPORT = ArchiveFixtures.fixture("claude/conversations.json");

  @TempDir Path tempDir;
  @Mock private StreamListener listener;

  private ClaudeConversationProvider provider;

  @BeforeEach
  void setUp() {
    ArchiveProperties properties = ArchiveFixtures.defaultProperties();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    provider =
        new ClaudeConversationProvider(
            new JsonArrayRecordDecoder(properties),
            new RankingEngine(properties, new SnippetExtractor(properties), meterRegistry),
            properties,
            meterRegistry);
  }

  private List<Conversation> readAll(Path file) throws IOException {
    try (Stream<Conversation> stream = provider.streamConversations(file, listener)) {
      return stream.collect(Collectors.toList());
    }
  }

  @Nested
  @DisplayName("reference export")
  class ReferenceExport {

    private List<Conversation> conversations;

    @BeforeEach
    void load() throws IOException {
      conversations = readAll(EXPORT);
    }

    @Test
    @DisplayName("should read conversations in file order without skipping")
    void shouldReadAll() {
      assertThat(conversations)
          .extracting(Conversation::id)
          .containsExactly("claude-conv-0001", "claude-conv-0002", "claude-conv-0003");
      verify(listener, never()).onSkip(anyString(), anyString());
    }

    @Test
    @DisplayName("should parse ISO timestamps with offsets and fractions")
    void shouldParseTimestamps() {
      Conversation first = conversations.get(0);

      assertThat(first.createdAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
      assertThat(first.updatedAt()).isEqualTo(Instant.parse("2024-03-01T11:00:00.123456Z"));
      assertThat(first.findMessage("cm-3"))
          .map(Message::timestamp)
          .contains(Instant.parse("2024-03-01T10:02:00Z"));
    }

    @Test
    @DisplayName("should map senders and keep a flat message list")
    void shouldMapSenders() {
      Conversation first = conversations.get(0);

      assertThat(first.messages())
          .extracting(Message::role)
          .containsExactly(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.ASSISTANT);
      assertThat(first.messages()).allSatisfy(m -> assertThat(m.parentId()).isNull());
    }

    @Test
    @DisplayName("should join text blocks and ignore tool blocks")
    void shouldExtractText() {
      Conversation first = conversations.get(0);

      assertThat(first.findMessage("cm-2")).map(Message::content).contains("");
      assertThat(first.findMessage("cm-3"))
          .map(Message::content)
          .contains("First part.\nSecond part.");
    }

    @Test
    @DisplayName("should give an untitled empty conversation a placeholder message")
    void shouldAddPlaceholder() {
      Conversation empty = conversations.get(1);

      assertThat(empty.title()).isEqualTo(ClaudeConversationProvider.UNTITLED);
      assertThat(empty.messages()).hasSize(1);
      Message placeholder = empty.messages().get(0);
      assertThat(placeholder.id()).isEqualTo("claude-conv-0002-placeholder");
      assertThat(placeholder.role()).isEqualTo(MessageRole.SYSTEM);
      assertThat(placeholder.content()).isEqualTo(ClaudeConversationProvider.EMPTY_CONVERSATION);
      assertThat(placeholder.timestamp()).isEqualTo(empty.createdAt());
      assertThat(placeholder.metadata()).containsEntry("is_placeholder", true);
    }

    @Test
    @DisplayName("should keep messages from unknown senders with fallbacks and warnings")
    void shouldHandleOddSender() {
      Conversation odd = conversations.get(2);
      Message message = odd.messages().get(0);

      assertThat(message.role()).isEqualTo(MessageRole.ASSISTANT);
      assertThat(message.metadata()).containsEntry("original_sender", "moderator");
      assertThat(message.content()).isEqualTo("Plain text fallback");
      assertThat(message.timestamp()).isEqualTo(odd.createdAt());
      verify(listener).onWarning(eq("cm-9"), contains("moderator"));
      verify(listener).onWarning(eq("cm-9"), contains("unparsable message timestamp"));
      verify(listener, times(2)).onWarning(anyString(), anyString());
    }
  }

  @Test
  @DisplayName("should not count tool-only messages as keyword matches")
  void shouldIgnoreToolOnlyMessagesInSearch() throws IOException {
    List<SearchResult> results =
        provider.search(EXPORT, SearchQuery.ofKeywords("refactor"), listener);

    assertThat(results).hasSize(1);
    SearchResult result = results.get(0);
    assertThat(result.conversation().id()).isEqualTo("claude-conv-0001");
    assertThat(result.matchedMessageIds()).containsExactly("cm-1");
    assertThat(result.snippet()).contains("refactor the billing module");
  }

  @Test
  @DisplayName("should skip a conversation whose creation time has no offset")
  void shouldSkipNaiveTimestamp() throws IOException {
    Path file = tempDir.resolve("conversations.json");
    Files.writeString(
        file,
        "[{\"uuid\":\"naive\",\"name\":\"n\",\"created_at\":\"2024-03-01T10:00:00\","
            + "\"chat_messages\":[]},"
            + "{\"uuid\":\"ok\",\"name\":\"o\",\"created_at\":\"2024-03-01T10:00:00Z\","
            + "\"chat_messages\":[{\"uuid\":\"m\",\"sender\":\"human\","
            + "\"created_at\":\"2024-03-01T10:00:00Z\",\"text\":\"hi\"}]}]");

    assertThat(readAll(file)).extracting(Conversation::id).containsExactly("ok");
    verify(listener).onSkip(eq("naive"), anyString());
  }

  @Test
  @DisplayName("should warn and ignore an unparsable updated_at")
  void shouldIgnoreBadUpdatedAt() throws IOException {
    Path file = tempDir.resolve("conversations.json");
    Files.writeString(
        file,
        "[{\"uuid\":\"c\",\"name\":\"n\",\"created_at\":\"2024-03-01T10:00:00Z\","
            + "\"updated_at\":\"later\",\"chat_messages\":[]}]");

    List<Conversation> conversations = readAll(file);

    assertThat(conversations).hasSize(1);
    assertThat(conversations.get(0).updatedAt()).isNull();
    verify(listener).onWarning(eq("c"), contains("updated_at"));
  }
}

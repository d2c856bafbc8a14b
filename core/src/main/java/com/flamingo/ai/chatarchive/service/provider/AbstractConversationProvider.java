package com.flamingo.ai.chatarchive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.domain.enums.ProviderType;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.Message;
import com.flamingo.ai.chatarchive.domain.model.MessageMatch;
import com.flamingo.ai.chatarchive.domain.model.SearchQuery;
import com.flamingo.ai.chatarchive.domain.model.SearchResult;
import com.flamingo.ai.chatarchive.exception.QueryValidationException;
import com.flamingo.ai.chatarchive.service.decoder.JsonArrayRecordDecoder;
import com.flamingo.ai.chatarchive.service.decoder.RecordCursor;
import com.flamingo.ai.chatarchive.service.search.RankingEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for providers that read a top-level JSON array of conversation records.
 *
 * <p>Handles streaming, the skip policy, progress reporting, metrics and id lookup. Subclasses
 * only turn one raw record into a {@link Conversation}, throwing when the record is unusable.
 */
@Slf4j
public abstract class AbstractConversationProvider implements ConversationProvider {

  protected final JsonArrayRecordDecoder decoder;
  protected final RankingEngine rankingEngine;
  protected final ArchiveProperties properties;
  protected final MeterRegistry meterRegistry;
  private final ProviderType type;

  protected AbstractConversationProvider(
      ProviderType type,
      JsonArrayRecordDecoder decoder,
      RankingEngine rankingEngine,
      ArchiveProperties properties,
      MeterRegistry meterRegistry) {
    this.type = type;
    this.decoder = decoder;
    this.rankingEngine = rankingEngine;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public ProviderType type() {
    return type;
  }

  /**
   * Name of the field holding a record's id, used to identify skipped records.
   *
   * @return the id field name
   */
  protected abstract String idField();

  /**
   * Converts one raw record into a conversation.
   *
   * @param record a JSON object from the export array
   * @param context per-record state; reports message-level skips and substitutions
   * @return the conversation
   * @throws RecordRejectedException when required data is missing; {@link IllegalArgumentException}
   *     and {@link DateTimeException} also cause the record to be skipped
   */
  protected abstract Conversation parseConversation(JsonNode record, ParseContext context);

  @Override
  public Stream<Conversation> streamConversations(Path source, StreamListener listener)
      throws IOException {
    RecordCursor<JsonNode> records = decoder.open(source);
    ProgressTracker progress =
        new ProgressTracker(
            listener,
            properties.getProgress().getItemInterval(),
            properties.getProgress().getTimeInterval());
    RecordCursor<Conversation> conversations =
        new RecordCursor<>(new ConversationSource(records, listener, progress), records);
    return conversations.stream();
  }

  @Override
  public List<SearchResult> search(Path source, SearchQuery query, StreamListener listener)
      throws IOException {
    try (Stream<Conversation> conversations = streamConversations(source, listener)) {
      return rankingEngine.rank(conversations, query);
    }
  }

  @Override
  public Optional<Conversation> findConversationById(
      Path source, String conversationId, StreamListener listener) throws IOException {
    IdMatcher matcher = idMatcher("conversationId", conversationId);
    Conversation prefixMatch = null;
    try (Stream<Conversation> conversations = streamConversations(source, listener)) {
      Iterator<Conversation> iterator = conversations.iterator();
      while (iterator.hasNext()) {
        Conversation conversation = iterator.next();
        if (matcher.isExact(conversation.id())) {
          return Optional.of(conversation);
        }
        if (prefixMatch == null && matcher.isPrefix(conversation.id())) {
          prefixMatch = conversation;
        }
      }
    }
    return Optional.ofNullable(prefixMatch);
  }

  @Override
  public Optional<MessageMatch> findMessageById(
      Path source, String messageId, String conversationIdHint, StreamListener listener)
      throws IOException {
    IdMatcher matcher = idMatcher("messageId", messageId);
    IdMatcher conversationMatcher =
        conversationIdHint == null ? null : idMatcher("conversationIdHint", conversationIdHint);
    MessageMatch prefixMatch = null;
    try (Stream<Conversation> conversations = streamConversations(source, listener)) {
      Iterator<Conversation> iterator = conversations.iterator();
      while (iterator.hasNext()) {
        Conversation conversation = iterator.next();
        if (conversationMatcher != null && !conversationMatcher.matches(conversation.id())) {
          continue;
        }
        for (Message message : conversation.messages()) {
          if (matcher.isExact(message.id())) {
            return Optional.of(new MessageMatch(message, conversation));
          }
          if (prefixMatch == null && matcher.isPrefix(message.id())) {
            prefixMatch = new MessageMatch(message, conversation);
          }
        }
        if (conversationMatcher != null && conversationMatcher.isExact(conversation.id())) {
          break;
        }
      }
    }
    return Optional.ofNullable(prefixMatch);
  }

  private IdMatcher idMatcher(String field, String id) {
    if (id == null || id.isBlank()) {
      throw new QueryValidationException(field, "must not be blank");
    }
    return new IdMatcher(id.strip(), properties.getLookup().getMinPrefixLength());
  }

  private Conversation parseOrSkip(JsonNode record, long position, StreamListener listener) {
    if (!record.isObject()) {
      skip("#" + position, "record is not a JSON object but " + record.getNodeType(), listener);
      return null;
    }
    String id = JsonValues.text(record, idField());
    String identifier = id == null || id.isBlank() ? "#" + position : id;
    try {
      return parseConversation(record, new ParseContext(identifier, listener));
    } catch (RecordRejectedException | IllegalArgumentException | DateTimeException e) {
      skip(identifier, e.getMessage(), listener);
      return null;
    }
  }

  private void skip(String identifier, String reason, StreamListener listener) {
    log.warn("Skipping {} conversation {}: {}", type.getTag(), identifier, reason);
    meterRegistry.counter("archive.records.skipped", "provider", type.getTag()).increment();
    listener.onSkip(identifier, reason);
  }

  /** Pulls records until one parses; holds no reference to the cursor that wraps it. */
  private final class ConversationSource implements RecordCursor.Source<Conversation> {

    private final RecordCursor<JsonNode> records;
    private final StreamListener listener;
    private final ProgressTracker progress;
    private long position;

    private ConversationSource(
        RecordCursor<JsonNode> records, StreamListener listener, ProgressTracker progress) {
      this.records = records;
      this.listener = listener;
      this.progress = progress;
    }

    @Override
    public Conversation read() {
      while (records.hasNext()) {
        JsonNode record = records.next();
        long current = position++;
        progress.increment();
        Conversation conversation = parseOrSkip(record, current, listener);
        if (conversation != null) {
          meterRegistry.counter("archive.conversations.streamed", "provider", type.getTag())
              .increment();
          return conversation;
        }
      }
      progress.finish();
      log.debug("Read {} {} records", progress.count(), type.getTag());
      return null;
    }
  }
}

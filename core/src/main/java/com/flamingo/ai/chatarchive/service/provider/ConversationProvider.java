package com.flamingo.ai.chatarchive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.chatarchive.domain.enums.ProviderType;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.MessageMatch;
import com.flamingo.ai.chatarchive.domain.model.SearchQuery;
import com.flamingo.ai.chatarchive.domain.model.SearchResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads one export format into the canonical model.
 *
 * <p>Every operation re-reads the source; nothing is cached between calls. Implementations are
 * stateless and may be shared between threads, but each returned stream belongs to the thread that
 * asked for it.
 *
 * <p>Fatal problems with the source (missing, unreadable, not a JSON array) raise {@link
 * com.flamingo.ai.chatarchive.exception.ArchiveException} subtypes. Other I/O failures while
 * opening the source surface as the {@link IOException} itself; once streaming has started they
 * arrive as {@link java.io.UncheckedIOException}. Malformed records are skipped and reported
 * through {@link StreamListener#onSkip}.
 *
 * <p>To support a new export format, implement this interface (usually by extending {@link
 * AbstractConversationProvider}) and register it as a Spring bean with an {@code @Order}.
 */
public interface ConversationProvider {

  ProviderType type();

  /**
   * Returns {@code true} if this provider understands records shaped like {@code firstRecord}.
   *
   * @param firstRecord first element of the export array
   * @return {@code true} if supported
   */
  boolean supports(JsonNode firstRecord);

  /**
   * Lazily parses the conversations of {@code source} in file order. The stream holds the file
   * open until it is exhausted or closed; use it in a try-with-resources block when stopping early.
   */
  Stream<Conversation> streamConversations(Path source, StreamListener listener)
      throws IOException;

  default Stream<Conversation> streamConversations(Path source) throws IOException {
    return streamConversations(source, StreamListener.NONE);
  }

  /**
   * Filters and ranks the conversations of {@code source}. Ranking needs every match, so the
   * result is fully computed before it is returned.
   */
  List<SearchResult> search(Path source, SearchQuery query, StreamListener listener)
      throws IOException;

  default List<SearchResult> search(Path source, SearchQuery query) throws IOException {
    return search(source, query, StreamListener.NONE);
  }

  /**
   * Finds a conversation by exact id or by an id prefix.
   *
   * @param conversationId full id, or a case-insensitive prefix of at least four characters
   * @return the exact match if any, else the first prefix match in file order
   */
  Optional<Conversation> findConversationById(
      Path source, String conversationId, StreamListener listener) throws IOException;

  default Optional<Conversation> findConversationById(Path source, String conversationId)
      throws IOException {
    return findConversationById(source, conversationId, StreamListener.NONE);
  }

  /**
   * Finds a message, with the conversation that holds it, by exact id or id prefix.
   *
   * @param conversationIdHint when not {@code null}, only the conversation it identifies is
   *     searched
   */
  Optional<MessageMatch> findMessageById(
      Path source, String messageId, String conversationIdHint, StreamListener listener)
      throws IOException;

  default Optional<MessageMatch> findMessageById(
      Path source, String messageId, String conversationIdHint) throws IOException {
    return findMessageById(source, messageId, conversationIdHint, StreamListener.NONE);
  }
}

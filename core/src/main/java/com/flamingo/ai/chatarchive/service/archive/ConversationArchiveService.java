package com.flamingo.ai.chatarchive.service.archive;

import com.flamingo.ai.chatarchive.domain.enums.ProviderType;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.MessageMatch;
import com.flamingo.ai.chatarchive.domain.model.SearchQuery;
import com.flamingo.ai.chatarchive.domain.model.SearchResult;
import com.flamingo.ai.chatarchive.domain.model.statistics.ConversationStatistics;
import com.flamingo.ai.chatarchive.domain.model.statistics.ExportStatistics;
import com.flamingo.ai.chatarchive.service.provider.ConversationProvider;
import com.flamingo.ai.chatarchive.service.provider.ProviderSelector;
import com.flamingo.ai.chatarchive.service.provider.StreamListener;
import com.flamingo.ai.chatarchive.service.statistics.ExportStatisticsService;
import com.flamingo.ai.chatarchive.service.thread.ThreadReconstructor;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for hosts: resolves the provider for an export, either the explicitly requested one
 * or the one detected from the file, and delegates to it.
 *
 * <p>A {@code null} {@link ProviderType} means "detect".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationArchiveService {

  private final ProviderSelector providerSelector;
  private final ExportStatisticsService statisticsService;

  public ConversationProvider resolveProvider(Path source, ProviderType type)
      throws IOException {
    ConversationProvider provider =
        type == null ? providerSelector.select(source) : providerSelector.select(type);
    log.debug("Using {} provider for {}", provider.type().getTag(), source);
    return provider;
  }

  public Stream<Conversation> streamConversations(
      Path source, ProviderType type, StreamListener listener) throws IOException {
    return resolveProvider(source, type).streamConversations(source, listener);
  }

  @Timed(value = "archive.search", description = "Time to search an export")
  public List<SearchResult> search(
      Path source, SearchQuery query, ProviderType type, StreamListener listener)
      throws IOException {
    return resolveProvider(source, type).search(source, query, listener);
  }

  /** Searches with the detected provider and no listener. */
  @Timed(value = "archive.search", description = "Time to search an export")
  public List<SearchResult> search(Path source, SearchQuery query) throws IOException {
    return resolveProvider(source, null).search(source, query, StreamListener.NONE);
  }

  public Optional<Conversation> findConversationById(
      Path source, String conversationId, ProviderType type, StreamListener listener)
      throws IOException {
    return resolveProvider(source, type).findConversationById(source, conversationId, listener);
  }

  public Optional<MessageMatch> findMessageById(
      Path source,
      String messageId,
      String conversationIdHint,
      ProviderType type,
      StreamListener listener)
      throws IOException {
    return resolveProvider(source, type)
        .findMessageById(source, messageId, conversationIdHint, listener);
  }

  public ExportStatistics statistics(Path source, ProviderType type, StreamListener listener)
      throws IOException {
    return statisticsService.calculate(resolveProvider(source, type), source, listener);
  }

  public ConversationStatistics statistics(Conversation conversation) {
    return statisticsService.forConversation(conversation);
  }

  public ThreadReconstructor threads(Conversation conversation) {
    return ThreadReconstructor.of(conversation);
  }
}

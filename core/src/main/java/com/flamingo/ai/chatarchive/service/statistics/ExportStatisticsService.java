package com.flamingo.ai.chatarchive.service.statistics;

import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.Message;
import com.flamingo.ai.chatarchive.domain.model.statistics.ConversationStatistics;
import com.flamingo.ai.chatarchive.domain.model.statistics.ConversationSummary;
import com.flamingo.ai.chatarchive.domain.model.statistics.ExportStatistics;
import com.flamingo.ai.chatarchive.domain.model.statistics.RoleCount;
import com.flamingo.ai.chatarchive.service.provider.ConversationProvider;
import com.flamingo.ai.chatarchive.service.provider.StreamListener;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Computes export-wide and per-conversation statistics. */
@Service
@Slf4j
public class ExportStatisticsService {

  /**
   * Streams {@code source} once and aggregates it. Memory use does not depend on the export size.
   *
   * @param provider provider able to read {@code source}
   * @param source export file
   * @param listener receives progress and skip events while streaming
   * @return aggregate statistics
   * @throws IOException if the export cannot be opened
   */
  @Timed(value = "archive.statistics", description = "Time to compute export statistics")
  public ExportStatistics calculate(
      ConversationProvider provider, Path source, StreamListener listener) throws IOException {
    RecordCountingListener counting = new RecordCountingListener(listener);
    long conversations = 0;
    long messages = 0;
    Instant earliest = null;
    Instant latest = null;
    Conversation largest = null;
    Conversation smallest = null;

    try (Stream<Conversation> stream = provider.streamConversations(source, counting)) {
      Iterator<Conversation> iterator = stream.iterator();
      while (iterator.hasNext()) {
        Conversation conversation = iterator.next();
        conversations++;
        messages += conversation.messageCount();
        if (earliest == null || conversation.createdAt().isBefore(earliest)) {
          earliest = conversation.createdAt();
        }
        if (latest == null || conversation.lastActivity().isAfter(latest)) {
          latest = conversation.lastActivity();
        }
        if (largest == null || conversation.messageCount() > largest.messageCount()) {
          largest = conversation;
        }
        if (smallest == null || conversation.messageCount() < smallest.messageCount()) {
          smallest = conversation;
        }
      }
    }

    ExportStatistics statistics =
        ExportStatistics.builder()
            .totalConversations(conversations)
            .totalMessages(messages)
            .earliestDate(earliest)
            .latestDate(latest)
            .averageMessages(conversations == 0 ? 0.0 : (double) messages / conversations)
            .largestConversation(largest == null ? null : ConversationSummary.of(largest))
            .smallestConversation(smallest == null ? null : ConversationSummary.of(smallest))
            .skippedCount(Math.max(0, counting.recordsRead() - conversations))
            .build();
    log.info(
        "Computed statistics for {}: {} conversations, {} messages, {} skipped",
        source,
        conversations,
        messages,
        statistics.skippedCount());
    return statistics;
  }

  /** Role breakdown and timing of a single conversation. */
  public ConversationStatistics forConversation(Conversation conversation) {
    RoleCount roles = RoleCount.EMPTY;
    List<Instant> timestamps = new ArrayList<>(conversation.messageCount());
    for (Message message : conversation.messages()) {
      roles = roles.plus(message.role());
      timestamps.add(message.timestamp());
    }
    timestamps.sort(null);

    Instant first = timestamps.get(0);
    Instant last = timestamps.get(timestamps.size() - 1);
    double duration = seconds(Duration.between(first, last));
    Double averageGap = timestamps.size() < 2 ? null : duration / (timestamps.size() - 1);

    return ConversationStatistics.builder()
        .conversationId(conversation.id())
        .title(conversation.title())
        .createdAt(conversation.createdAt())
        .updatedAt(conversation.updatedAt())
        .messageCount(conversation.messageCount())
        .messageCountByRole(roles)
        .firstMessage(first)
        .lastMessage(last)
        .durationSeconds(duration)
        .averageGapSeconds(averageGap)
        .build();
  }

  private static double seconds(Duration duration) {
    return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
  }

  /** Remembers the last progress count, which includes records that were skipped. */
  private static final class RecordCountingListener implements StreamListener {

    private final StreamListener delegate;
    private long recordsRead;

    private RecordCountingListener(StreamListener delegate) {
      this.delegate = delegate;
    }

    @Override
    public void onProgress(long itemCount) {
      recordsRead = Math.max(recordsRead, itemCount);
      delegate.onProgress(itemCount);
    }

    @Override
    public void onSkip(String identifier, String reason) {
      delegate.onSkip(identifier, reason);
    }

    @Override
    public void onWarning(String identifier, String reason) {
      delegate.onWarning(identifier, reason);
    }

    long recordsRead() {
      return recordsRead;
    }
  }
}

package com.flamingo.ai.chatarchive.domain.model.statistics;

import java.time.Instant;
import lombok.Builder;

/**
 * Aggregate figures for a whole export, computed in a single streaming pass.
 *
 * @param totalConversations conversations that parsed successfully
 * @param totalMessages messages across those conversations
 * @param earliestDate earliest conversation creation time, {@code null} for an empty export
 * @param latestDate latest conversation activity (update, else creation), {@code null} if empty
 * @param averageMessages mean messages per conversation, {@code 0.0} if empty
 * @param largestConversation conversation with the most messages (first in stream order on ties)
 * @param smallestConversation conversation with the fewest messages (first in stream order on ties)
 * @param skippedCount records dropped while streaming
 */
@Builder
public record ExportStatistics(
    long totalConversations,
    long totalMessages,
    Instant earliestDate,
    Instant latestDate,
    double averageMessages,
    ConversationSummary largestConversation,
    ConversationSummary smallestConversation,
    long skippedCount) {}

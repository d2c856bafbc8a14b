package com.flamingo.ai.chatarchive.domain.model.statistics;

import java.time.Instant;
import lombok.Builder;

/**
 * Per-conversation figures.
 *
 * @param durationSeconds seconds between the first and last message, {@code 0.0} for one message
 * @param averageGapSeconds mean seconds between consecutive messages in timestamp order, {@code
 *     null} with fewer than two messages
 */
@Builder
public record ConversationStatistics(
    String conversationId,
    String title,
    Instant createdAt,
    Instant updatedAt,
    int messageCount,
    RoleCount messageCountByRole,
    Instant firstMessage,
    Instant lastMessage,
    double durationSeconds,
    Double averageGapSeconds) {}

package com.flamingo.ai.chatarchive.domain.model.statistics;

import com.flamingo.ai.chatarchive.domain.model.Conversation;

/** Lightweight reference to a conversation, kept instead of the full value in export statistics. */
public record ConversationSummary(String id, String title, int messageCount) {

  public static ConversationSummary of(Conversation conversation) {
    return new ConversationSummary(
        conversation.id(), conversation.title(), conversation.messageCount());
  }
}

package com.flamingo.ai.chatarchive.domain.enums;

/** Primary ordering key for search results. */
public enum SortField {
  /** Normalized BM25 relevance. */
  SCORE,

  /** Last activity: {@code updatedAt} when present, else {@code createdAt}. */
  DATE,

  /** Conversation title, case-insensitive. */
  TITLE,

  /** Number of messages in the conversation. */
  MESSAGES
}

package com.flamingo.ai.chatarchive.domain.model;

import java.util.List;

/**
 * A conversation that matched a query, with its normalized relevance.
 *
 * @param conversation the matched conversation
 * @param score normalized relevance in {@code [0.0, 1.0)}
 * @param matchedMessageIds ids of messages containing at least one query term, in message order
 * @param snippet short excerpt around the first match
 */
public record SearchResult(
    Conversation conversation, double score, List<String> matchedMessageIds, String snippet) {

  public SearchResult {
    if (conversation == null) {
      throw new IllegalArgumentException("Search result requires a conversation");
    }
    if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("Score must be within [0, 1]: " + score);
    }
    matchedMessageIds = matchedMessageIds == null ? List.of() : List.copyOf(matchedMessageIds);
    snippet = snippet == null ? "" : snippet;
  }
}

package com.flamingo.ai.chatarchive.domain.model;

import com.flamingo.ai.chatarchive.domain.enums.MatchMode;
import com.flamingo.ai.chatarchive.domain.enums.MessageRole;
import com.flamingo.ai.chatarchive.domain.enums.SortField;
import com.flamingo.ai.chatarchive.domain.enums.SortOrder;
import com.flamingo.ai.chatarchive.exception.QueryValidationException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * Immutable search parameters, built once per query.
 *
 * <p>All filters are optional. Blank and duplicate terms are dropped while building; {@code
 * matchMode}, {@code sortBy} and {@code sortOrder} default to {@link MatchMode#ANY}, {@link
 * SortField#SCORE} and {@link SortOrder#DESC}. A {@code null} limit means "all matches".
 *
 * <p>Construction fails with {@link QueryValidationException} on inverted date or message-count
 * bounds, negative counts, or a non-positive limit.
 *
 * @param keywords terms scored with BM25, combined per {@code matchMode}
 * @param phrases literal substrings (case-insensitive)
 * @param excludeKeywords terms that disqualify a conversation anywhere in it
 * @param titleFilter case-insensitive substring of the title
 * @param fromDate inclusive lower bound on the creation date (UTC)
 * @param toDate inclusive upper bound on the creation date (UTC)
 * @param minMessages inclusive lower bound on the message count
 * @param maxMessages inclusive upper bound on the message count
 * @param roleFilter restricts keyword and phrase matching to one role
 * @param matchMode how keywords and phrases combine
 * @param sortBy primary ordering key
 * @param sortOrder direction of the primary key
 * @param limit maximum number of results, applied after ranking
 */
@Builder(toBuilder = true)
public record SearchQuery(
    List<String> keywords,
    List<String> phrases,
    List<String> excludeKeywords,
    String titleFilter,
    LocalDate fromDate,
    LocalDate toDate,
    Integer minMessages,
    Integer maxMessages,
    MessageRole roleFilter,
    MatchMode matchMode,
    SortField sortBy,
    SortOrder sortOrder,
    Integer limit) {

  public SearchQuery {
    keywords = cleanTerms(keywords);
    phrases = cleanTerms(phrases);
    excludeKeywords = cleanTerms(excludeKeywords);
    titleFilter = titleFilter == null || titleFilter.isBlank() ? null : titleFilter.strip();
    matchMode = matchMode == null ? MatchMode.ANY : matchMode;
    sortBy = sortBy == null ? SortField.SCORE : sortBy;
    sortOrder = sortOrder == null ? SortOrder.DESC : sortOrder;

    if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
      throw new QueryValidationException(
          "fromDate", "from date " + fromDate + " is after to date " + toDate);
    }
    if (minMessages != null && minMessages < 0) {
      throw new QueryValidationException("minMessages", "must not be negative: " + minMessages);
    }
    if (maxMessages != null && maxMessages < 0) {
      throw new QueryValidationException("maxMessages", "must not be negative: " + maxMessages);
    }
    if (minMessages != null && maxMessages != null && minMessages > maxMessages) {
      throw new QueryValidationException(
          "minMessages",
          "min messages " + minMessages + " is greater than max messages " + maxMessages);
    }
    if (limit != null && limit < 1) {
      throw new QueryValidationException("limit", "must be positive: " + limit);
    }
  }

  /** A query with no filters at all: every conversation matches with the same score. */
  public static SearchQuery matchAll() {
    return SearchQuery.builder().build();
  }

  /** Convenience factory for a plain keyword search. */
  public static SearchQuery ofKeywords(String... keywords) {
    return SearchQuery.builder().keywords(List.of(keywords)).build();
  }

  public boolean hasKeywords() {
    return !keywords.isEmpty();
  }

  public boolean hasPhrases() {
    return !phrases.isEmpty();
  }

  public boolean hasExclusions() {
    return !excludeKeywords.isEmpty();
  }

  public boolean hasTitleFilter() {
    return titleFilter != null;
  }

  public boolean hasDateFilter() {
    return fromDate != null || toDate != null;
  }

  public boolean hasMessageCountFilter() {
    return minMessages != null || maxMessages != null;
  }

  public boolean hasRoleFilter() {
    return roleFilter != null;
  }

  /** Returns {@code true} when the query carries terms that need relevance scoring. */
  public boolean hasTextCriteria() {
    return hasKeywords() || hasPhrases();
  }

  private static List<String> cleanTerms(List<String> terms) {
    if (terms == null || terms.isEmpty()) {
      return List.of();
    }
    Set<String> cleaned = new LinkedHashSet<>();
    for (String term : terms) {
      if (term != null && !term.isBlank()) {
        cleaned.add(term.strip());
      }
    }
    return List.copyOf(new ArrayList<>(cleaned));
  }
}

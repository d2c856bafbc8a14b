package com.flamingo.ai.chatarchive.service.search;

import com.flamingo.ai.chatarchive.domain.enums.MatchMode;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.Message;
import com.flamingo.ai.chatarchive.domain.model.SearchQuery;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a {@link SearchQuery} against one conversation at a time.
 *
 * <p>Metadata filters (title, creation date, message count, role) decide whether a conversation
 * joins the scoring corpus at all. Every corpus member contributes its term frequencies and length
 * to the corpus statistics; only members that also match the text criteria and contain no
 * excluded term become results.
 */
final class QueryMatcher {

  private final SearchQuery query;
  private final List<String> keywordTerms;
  private final List<String> phrases;
  private final Set<String> excludedTerms;
  private final String titleFilter;

  private QueryMatcher(SearchQuery query) {
    this.query = query;
    Set<String> terms = new LinkedHashSet<>();
    query.keywords().forEach(keyword -> terms.addAll(TextTokenizer.tokenize(keyword)));
    this.keywordTerms = List.copyOf(terms);
    this.phrases = query.phrases().stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    Set<String> excluded = new HashSet<>();
    query.excludeKeywords().forEach(term -> excluded.addAll(TextTokenizer.tokenize(term)));
    this.excludedTerms = excluded;
    this.titleFilter = query.hasTitleFilter() ? query.titleFilter().toLowerCase(Locale.ROOT) : null;
  }

  static QueryMatcher of(SearchQuery query) {
    return new QueryMatcher(query);
  }

  /** Distinct keyword tokens, in query order. */
  List<String> keywordTerms() {
    return keywordTerms;
  }

  /** Lowercased phrases, in query order. */
  List<String> phrases() {
    return phrases;
  }

  /**
   * Applies the query to one conversation.
   *
   * @return the corpus entry, or empty when a metadata filter rejects the conversation
   */
  Optional<Evaluation> evaluate(Conversation conversation) {
    if (!passesMetadataFilters(conversation)) {
      return Optional.empty();
    }

    List<Message> allowed = allowedMessages(conversation);
    if (query.hasRoleFilter() && allowed.isEmpty()) {
      return Optional.empty();
    }

    StringBuilder text = new StringBuilder();
    if (!query.hasRoleFilter()) {
      text.append(conversation.title());
    }
    for (Message message : allowed) {
      if (text.length() > 0) {
        text.append(' ');
      }
      text.append(message.content());
    }
    String documentText = text.toString();
    List<String> tokens = TextTokenizer.tokenize(documentText);

    Map<String, Integer> frequencies = new HashMap<>();
    if (!keywordTerms.isEmpty()) {
      Set<String> wanted = new HashSet<>(keywordTerms);
      for (String token : tokens) {
        if (wanted.contains(token)) {
          frequencies.merge(token, 1, Integer::sum);
        }
      }
    }
    Document document = new Document(Collections.unmodifiableMap(frequencies), tokens.size());

    boolean keywordMatched = keywordsMatch(frequencies);
    boolean phraseMatched = phraseMatches(documentText.toLowerCase(Locale.ROOT));
    if (query.hasTextCriteria() && !keywordMatched && !phraseMatched) {
      return Optional.of(new Evaluation(document, null));
    }
    if (query.hasExclusions() && tokens.stream().anyMatch(excludedTerms::contains)) {
      return Optional.of(new Evaluation(document, null));
    }

    Candidate candidate =
        new Candidate(
            conversation,
            document,
            matchedMessageIds(allowed, keywordMatched, phraseMatched),
            keywordMatched);
    return Optional.of(new Evaluation(document, candidate));
  }

  private boolean passesMetadataFilters(Conversation conversation) {
    if (titleFilter != null
        && !conversation.title().toLowerCase(Locale.ROOT).contains(titleFilter)) {
      return false;
    }
    if (query.hasDateFilter()) {
      LocalDate created = LocalDate.ofInstant(conversation.createdAt(), ZoneOffset.UTC);
      if (query.fromDate() != null && created.isBefore(query.fromDate())) {
        return false;
      }
      if (query.toDate() != null && created.isAfter(query.toDate())) {
        return false;
      }
    }
    if (!query.hasMessageCountFilter()) {
      return true;
    }
    int count = conversation.messageCount();
    if (query.minMessages() != null && count < query.minMessages()) {
      return false;
    }
    return query.maxMessages() == null || count <= query.maxMessages();
  }

  private List<Message> allowedMessages(Conversation conversation) {
    if (!query.hasRoleFilter()) {
      return conversation.messages();
    }
    List<Message> allowed = new ArrayList<>();
    for (Message message : conversation.messages()) {
      if (message.role() == query.roleFilter()) {
        allowed.add(message);
      }
    }
    return allowed;
  }

  /** ALL needs every keyword token, ANY at least one. */
  private boolean keywordsMatch(Map<String, Integer> frequencies) {
    if (keywordTerms.isEmpty()) {
      return false;
    }
    return query.matchMode() == MatchMode.ALL
        ? frequencies.keySet().containsAll(keywordTerms)
        : !frequencies.isEmpty();
  }

  /** Phrases always combine with OR, whatever the match mode. */
  private boolean phraseMatches(String loweredText) {
    for (String phrase : phrases) {
      if (loweredText.contains(phrase)) {
        return true;
      }
    }
    return false;
  }

  private List<String> matchedMessageIds(
      List<Message> allowed, boolean keywordMatched, boolean phraseMatched) {
    if (!keywordMatched && !phraseMatched) {
      return List.of();
    }
    Set<String> terms = new HashSet<>(keywordTerms);
    List<String> matched = new ArrayList<>();
    for (Message message : allowed) {
      if (message.content().isEmpty()) {
        continue;
      }
      boolean hit =
          (keywordMatched
                  && TextTokenizer.tokenize(message.content()).stream().anyMatch(terms::contains))
              || (phraseMatched && phraseMatches(message.content().toLowerCase(Locale.ROOT)));
      if (hit) {
        matched.add(message.id());
      }
    }
    return matched;
  }

  /**
   * Term statistics of one corpus member.
   *
   * @param termFrequencies occurrences of each keyword term
   * @param length number of tokens
   */
  record Document(Map<String, Integer> termFrequencies, int length) {}

  /**
   * A corpus member that also satisfied the text criteria and no exclusion.
   *
   * @param keywordMatched whether the keywords, combined per match mode, matched; only then do
   *     they contribute a BM25 score
   */
  record Candidate(
      Conversation conversation,
      Document document,
      List<String> matchedMessageIds,
      boolean keywordMatched) {}

  /** Corpus entry plus the result candidate, {@code null} when the conversation is no result. */
  record Evaluation(Document document, Candidate candidate) {

    boolean isMatch() {
      return candidate != null;
    }
  }
}

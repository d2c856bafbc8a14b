package com.flamingo.ai.chatarchive.service.search;

import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.domain.enums.SortOrder;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.SearchQuery;
import com.flamingo.ai.chatarchive.domain.model.SearchResult;
import com.flamingo.ai.chatarchive.service.search.QueryMatcher.Candidate;
import com.flamingo.ai.chatarchive.service.search.QueryMatcher.Document;
import com.flamingo.ai.chatarchive.service.search.QueryMatcher.Evaluation;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Filters, scores and orders conversations for a query.
 *
 * <p>The input stream is consumed once. Every conversation passing the metadata filters joins the
 * BM25 corpus as a term-frequency summary, so IDF and average length describe the whole filtered
 * archive; only conversations matching the text criteria are scored and kept. Ordering and the
 * limit are applied after every match has been scored, which makes the result the true top N.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingEngine {

  private final ArchiveProperties properties;
  private final SnippetExtractor snippetExtractor;
  private final MeterRegistry meterRegistry;

  /**
   * Ranks the conversations of {@code conversations} against {@code query}. The caller keeps
   * ownership of the stream and closes it.
   *
   * @return ordered results, at most {@code query.limit()} of them
   */
  public List<SearchResult> rank(Stream<Conversation> conversations, SearchQuery query) {
    QueryMatcher matcher = QueryMatcher.of(query);
    List<Document> corpus = new ArrayList<>();
    List<Candidate> matches = new ArrayList<>();
    conversations.forEach(
        conversation -> {
          Optional<Evaluation> evaluation = matcher.evaluate(conversation);
          if (evaluation.isEmpty()) {
            return;
          }
          corpus.add(evaluation.get().document());
          if (evaluation.get().isMatch()) {
            matches.add(evaluation.get().candidate());
          }
        });

    if (matches.isEmpty()) {
      log.debug("No conversation matched the query among {} filtered", corpus.size());
      return List.of();
    }

    List<Scored> scored = score(corpus, matches, matcher.keywordTerms());
    scored.sort(ordering(query));
    List<Scored> selected =
        query.limit() != null && scored.size() > query.limit()
            ? scored.subList(0, query.limit())
            : scored;

    List<SearchResult> results = new ArrayList<>(selected.size());
    for (Scored entry : selected) {
      Candidate candidate = entry.candidate();
      results.add(
          new SearchResult(
              candidate.conversation(),
              entry.score(),
              candidate.matchedMessageIds(),
              snippetExtractor.extract(
                  candidate.conversation(),
                  candidate.matchedMessageIds(),
                  matcher.phrases(),
                  matcher.keywordTerms())));
    }

    meterRegistry.counter("archive.search.results").increment(results.size());
    log.debug(
        "Ranked {} of {} filtered conversations, returning {}",
        matches.size(),
        corpus.size(),
        results.size());
    return results;
  }

  private List<Scored> score(List<Document> corpus, List<Candidate> matches, List<String> terms) {
    Bm25Scorer scorer =
        new Bm25Scorer(properties.getRanking().getK1(), properties.getRanking().getB());
    int corpusSize = corpus.size();
    double avgLength = corpus.stream().mapToInt(Document::length).average().orElse(0.0);

    Map<String, Double> idf = new HashMap<>();
    for (String term : terms) {
      long documentFrequency =
          corpus.stream().filter(d -> d.termFrequencies().containsKey(term)).count();
      idf.put(term, scorer.idf(corpusSize, documentFrequency));
    }

    List<Scored> scored = new ArrayList<>(matches.size());
    for (Candidate candidate : matches) {
      Document document = candidate.document();
      double raw = 0.0;
      if (candidate.keywordMatched()) {
        for (String term : terms) {
          raw +=
              scorer.termScore(
                  idf.get(term),
                  document.termFrequencies().getOrDefault(term, 0),
                  document.length(),
                  avgLength);
        }
      }
      // phrase-only and filter-only matches carry no term weight
      if (raw == 0.0) {
        raw = 1.0;
      }
      scored.add(new Scored(candidate, Bm25Scorer.normalize(raw)));
    }
    return scored;
  }

  private static Comparator<Scored> ordering(SearchQuery query) {
    Comparator<Scored> primary =
        switch (query.sortBy()) {
          case SCORE -> Comparator.comparingDouble(Scored::score);
          case DATE -> Comparator.comparing((Scored s) -> s.conversation().lastActivity());
          case TITLE -> Comparator.comparing(
              (Scored s) -> s.conversation().title().toLowerCase(Locale.ROOT));
          case MESSAGES -> Comparator.comparingInt((Scored s) -> s.conversation().messageCount());
        };
    if (query.sortOrder() == SortOrder.DESC) {
      primary = primary.reversed();
    }
    return primary.thenComparing((Scored s) -> s.conversation().id());
  }

  private record Scored(Candidate candidate, double score) {
    Conversation conversation() {
      return candidate.conversation();
    }
  }
}

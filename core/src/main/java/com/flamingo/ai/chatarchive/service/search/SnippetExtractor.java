package com.flamingo.ai.chatarchive.service.search;

import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.domain.model.Conversation;
import com.flamingo.ai.chatarchive.domain.model.Message;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the short excerpt shown with a search result. */
@Component
@RequiredArgsConstructor
public class SnippetExtractor {

  static final String CONTENT_UNAVAILABLE = "[Content unavailable]";
  static final String NO_CONTENT_MATCHED = "[No content matched]";
  private static final String ELLIPSIS = "...";

  private final ArchiveProperties properties;

  /**
   * Extracts a snippet from the first matched message.
   *
   * @param conversation the matched conversation
   * @param matchedMessageIds ids of matched messages, in message order
   * @param phrases lowercase phrases, matched anywhere in the text
   * @param keywordTerms keyword tokens, matched on token boundaries only
   * @return the snippet, or a bracketed fallback when there is nothing to show
   */
  public String extract(
      Conversation conversation,
      List<String> matchedMessageIds,
      List<String> phrases,
      Collection<String> keywordTerms) {
    if (matchedMessageIds.isEmpty()) {
      return NO_CONTENT_MATCHED;
    }
    Optional<Message> first = conversation.findMessage(matchedMessageIds.get(0));
    if (first.isEmpty()) {
      return NO_CONTENT_MATCHED;
    }
    String snippet = extract(first.get().content(), phrases, keywordTerms);
    int more = matchedMessageIds.size() - 1;
    return more > 0 ? snippet + " (+" + more + " more)" : snippet;
  }

  /** Windowed excerpt of {@code content} around the earliest phrase or keyword occurrence. */
  public String extract(String content, List<String> phrases, Collection<String> keywordTerms) {
    if (content == null || content.isBlank()) {
      return CONTENT_UNAVAILABLE;
    }
    String text = content.strip();
    int maxLength = properties.getSnippet().getMaxLength();
    int leadingContext = properties.getSnippet().getLeadingContext();

    int matchPosition = firstOccurrence(text, phrases, Set.copyOf(keywordTerms));
    // lowercasing can lengthen some characters, so clamp the position to the original text
    int start =
        matchPosition > 0
            ? Math.min(Math.max(0, matchPosition - leadingContext), text.length())
            : 0;
    int end = Math.min(text.length(), start + maxLength);

    String snippet = text.substring(start, end);
    if (end < text.length()) {
      snippet = snippet.stripTrailing() + ELLIPSIS;
    }
    if (start > 0) {
      int space = snippet.indexOf(' ');
      snippet =
          space > 0 && space < leadingContext
              ? ELLIPSIS + snippet.substring(space + 1)
              : ELLIPSIS + snippet;
    }
    return snippet;
  }

  private static int firstOccurrence(String text, List<String> phrases, Set<String> keywordTerms) {
    int earliest = TextTokenizer.firstTokenPosition(text, keywordTerms);
    String loweredText = text.toLowerCase(Locale.ROOT);
    for (String phrase : phrases) {
      if (phrase.isEmpty()) {
        continue;
      }
      int position = loweredText.indexOf(phrase);
      if (position >= 0 && (earliest < 0 || position < earliest)) {
        earliest = position;
      }
    }
    return earliest;
  }
}

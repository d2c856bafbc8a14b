package com.flamingo.ai.chatarchive.service.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into lowercase search terms.
 *
 * <p>A term is either a run of ASCII letters and digits, or a single letter outside {@code a-z}
 * (accented Latin, Cyrillic, CJK...), so ideographic text is searchable character by character.
 * Documents, keywords and exclusions all go through the same rule.
 */
public final class TextTokenizer {

  private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+|[\\p{L}&&[^a-z]]");

  private TextTokenizer() {}

  public static List<String> tokenize(String text) {
    if (text == null || text.isEmpty()) {
      return Collections.emptyList();
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    List<String> tokens = new ArrayList<>();
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  /**
   * Position, in the lowercased {@code text}, of the first whole token contained in {@code terms}.
   *
   * @return the offset, or -1 when no token of the text is one of the terms
   */
  public static int firstTokenPosition(String text, Set<String> terms) {
    if (text == null || text.isEmpty() || terms.isEmpty()) {
      return -1;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      if (terms.contains(matcher.group())) {
        return matcher.start();
      }
    }
    return -1;
  }
}

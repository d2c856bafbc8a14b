package com.flamingo.ai.chatarchive.service.provider;

import java.util.Locale;

/**
 * Identifier lookup rule: exact match, or case-insensitive prefix of at least the configured
 * length. Callers prefer an exact match anywhere over the first prefix match.
 */
final class IdMatcher {

  private final String wanted;
  private final String loweredPrefix;

  IdMatcher(String wanted, int minPrefixLength) {
    this.wanted = wanted;
    this.loweredPrefix =
        wanted.length() >= minPrefixLength ? wanted.toLowerCase(Locale.ROOT) : null;
  }

  boolean isExact(String id) {
    return wanted.equals(id);
  }

  boolean isPrefix(String id) {
    return loweredPrefix != null && id.toLowerCase(Locale.ROOT).startsWith(loweredPrefix);
  }

  boolean matches(String id) {
    return isExact(id) || isPrefix(id);
  }
}

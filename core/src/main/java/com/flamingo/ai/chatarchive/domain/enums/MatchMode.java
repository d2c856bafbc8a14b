package com.flamingo.ai.chatarchive.domain.enums;

/** How multiple keywords and phrases of a query combine. */
public enum MatchMode {
  /** Every keyword term and every phrase must be present. */
  ALL,

  /** At least one keyword term or phrase must be present. */
  ANY
}

package com.flamingo.ai.chatarchive.domain.enums;

/** Direction applied to the primary sort key. */
public enum SortOrder {
  ASC,
  DESC
}

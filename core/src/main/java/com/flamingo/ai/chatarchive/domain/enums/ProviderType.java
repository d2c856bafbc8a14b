package com.flamingo.ai.chatarchive.domain.enums;

/** Export formats understood by the archive reader. */
public enum ProviderType {
  /** ChatGPT export: {@code mapping} tree of message nodes, epoch-second timestamps. */
  OPENAI("openai"),

  /** Claude export: linear {@code chat_messages}, ISO-8601 timestamps, typed content blocks. */
  CLAUDE("claude");

  private final String tag;

  ProviderType(String tag) {
    this.tag = tag;
  }

  /** Lower-case identifier used in metric tags and log lines. */
  public String getTag() {
    return tag;
  }
}

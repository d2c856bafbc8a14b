package com.flamingo.ai.chatarchive.domain.enums;

/** Normalized role of a message sender, shared by every export provider. */
public enum MessageRole {
  /** Message typed by the human participant. */
  USER,

  /** Message produced by the AI assistant (including tool activity). */
  ASSISTANT,

  /** System message (instructions, context). */
  SYSTEM
}

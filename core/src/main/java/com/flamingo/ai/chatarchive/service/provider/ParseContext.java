package com.flamingo.ai.chatarchive.service.provider;

import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/** Per-record state shared by the parsing helpers of one provider. */
@Slf4j
public final class ParseContext {

  private final String recordIdentifier;
  private final StreamListener listener;
  private Instant fallbackTimestamp;

  ParseContext(String recordIdentifier, StreamListener listener) {
    this.recordIdentifier = recordIdentifier;
    this.listener = listener;
  }

  public String recordIdentifier() {
    return recordIdentifier;
  }

  /** Sets the instant substituted for missing or unparsable message timestamps. */
  public void fallbackTimestamp(Instant conversationCreatedAt) {
    this.fallbackTimestamp = conversationCreatedAt;
  }

  public Instant fallbackTimestamp(String messageId, String reason) {
    warn(messageId, reason + "; using conversation creation time " + fallbackTimestamp);
    return fallbackTimestamp;
  }

  public void warn(String identifier, String reason) {
    log.warn("Record {}: {} ({})", recordIdentifier, reason, identifier);
    listener.onWarning(identifier, reason);
  }

  public void skipMessage(String identifier, String reason) {
    log.warn("Skipping message {} in conversation {}: {}", identifier, recordIdentifier, reason);
    listener.onSkip(identifier, reason);
  }
}

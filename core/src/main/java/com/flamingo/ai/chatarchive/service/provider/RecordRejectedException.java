package com.flamingo.ai.chatarchive.service.provider;

/**
 * Signals that a raw record cannot become a conversation. Caught by {@link
 * AbstractConversationProvider}, which skips the record.
 */
public class RecordRejectedException extends RuntimeException {

  public RecordRejectedException(String reason) {
    super(reason);
  }
}

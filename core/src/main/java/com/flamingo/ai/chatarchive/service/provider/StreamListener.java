package com.flamingo.ai.chatarchive.service.provider;

/**
 * Host callbacks for a streaming pass. Record-level problems are reported here instead of being
 * thrown, so a scan always runs to the end of the file.
 *
 * <p>Callbacks run on the consuming thread, between two records.
 */
public interface StreamListener {

  /** Listener that ignores every event. */
  StreamListener NONE = new StreamListener() {};

  /**
   * Running count of records read so far. Fired periodically and once when the scan ends.
   *
   * @param itemCount records read, including skipped ones
   */
  default void onProgress(long itemCount) {}

  /**
   * A conversation, or a message inside one, was dropped.
   *
   * @param identifier record id when known, else {@code #<position>}
   * @param reason human-readable cause
   */
  default void onSkip(String identifier, String reason) {}

  /**
   * A value was substituted but the record was kept.
   *
   * @param identifier id of the affected record
   * @param reason human-readable description of the substitution
   */
  default void onWarning(String identifier, String reason) {}
}

package com.flamingo.ai.chatarchive.service.provider;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Fires {@link StreamListener#onProgress} every N items or every time interval, whichever comes
 * first.
 */
final class ProgressTracker {

  private final StreamListener listener;
  private final int itemInterval;
  private final long intervalNanos;
  private final LongSupplier nanoClock;

  private long count;
  private long reportedCount;
  private long lastReportNanos;
  private boolean finished;

  ProgressTracker(StreamListener listener, int itemInterval, Duration timeInterval) {
    this(listener, itemInterval, timeInterval, System::nanoTime);
  }

  ProgressTracker(
      StreamListener listener, int itemInterval, Duration timeInterval, LongSupplier nanoClock) {
    this.listener = listener;
    this.itemInterval = itemInterval;
    this.intervalNanos = timeInterval.toNanos();
    this.nanoClock = nanoClock;
    this.lastReportNanos = nanoClock.getAsLong();
  }

  void increment() {
    count++;
    long now = nanoClock.getAsLong();
    if (count - reportedCount >= itemInterval || now - lastReportNanos >= intervalNanos) {
      report(now);
    }
  }

  /** Reports the final count once. */
  void finish() {
    if (finished) {
      return;
    }
    finished = true;
    report(nanoClock.getAsLong());
  }

  long count() {
    return count;
  }

  private void report(long now) {
    reportedCount = count;
    lastReportNanos = now;
    listener.onProgress(count);
  }
}

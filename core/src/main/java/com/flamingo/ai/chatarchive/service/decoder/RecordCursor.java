package com.flamingo.ai.chatarchive.service.decoder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.ref.Cleaner;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;

/**
 * Forward-only, single-use sequence of records pulled from an underlying resource.
 *
 * <p>The resource is closed exactly once: when the source reports the end, when reading throws,
 * when {@link #close()} is called, or, for cursors that are dropped without any of these, when the
 * cursor becomes unreachable. A cursor must be consumed by one thread only.
 *
 * @param <T> record type
 */
@Slf4j
public final class RecordCursor<T> implements Iterator<T>, AutoCloseable {

  private static final Cleaner CLEANER = Cleaner.create();

  /** Produces the next record, or {@code null} once the input is exhausted. */
  @FunctionalInterface
  public interface Source<T> {
    T read() throws IOException;
  }

  private final Source<T> source;
  private final ResourceGuard guard;
  private final Cleaner.Cleanable cleanable;
  private T next;
  private boolean finished;

  public RecordCursor(Source<T> source, AutoCloseable resource) {
    this.source = source;
    this.guard = new ResourceGuard(resource);
    this.cleanable = CLEANER.register(this, guard);
  }

  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (finished) {
      return false;
    }
    T read;
    try {
      read = source.read();
    } catch (IOException e) {
      closeAfterFailure(e);
      throw new UncheckedIOException(e);
    } catch (RuntimeException | Error e) {
      closeAfterFailure(e);
      throw e;
    }
    if (read == null) {
      close();
      return false;
    }
    next = read;
    return true;
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    T current = next;
    next = null;
    return current;
  }

  /**
   * Releases the underlying resource. Idempotent.
   *
   * @throws UncheckedIOException if closing the resource failed
   */
  @Override
  public void close() {
    finished = true;
    next = null;
    cleanable.clean();
    Exception failure = guard.takeFailure();
    if (failure != null) {
      throw failure instanceof IOException io
          ? new UncheckedIOException(io)
          : new IllegalStateException("Failed to close record source", failure);
    }
  }

  public boolean isClosed() {
    return guard.isClosed();
  }

  /** Ordered stream over the remaining records; closing the stream closes the cursor. */
  public Stream<T> stream() {
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(this::close);
  }

  private void closeAfterFailure(Throwable primary) {
    finished = true;
    next = null;
    cleanable.clean();
    Exception failure = guard.takeFailure();
    if (failure != null) {
      primary.addSuppressed(failure);
    }
  }

  /** Must not reference the cursor, otherwise the cleaner could never run. */
  private static final class ResourceGuard implements Runnable {

    private final AutoCloseable resource;
    private volatile boolean closed;
    private Exception failure;

    private ResourceGuard(AutoCloseable resource) {
      this.resource = resource;
    }

    @Override
    public void run() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        resource.close();
      } catch (Exception e) {
        log.warn("Failed to close record source: {}", e.getMessage());
        failure = e;
      }
    }

    private boolean isClosed() {
      return closed;
    }

    private Exception takeFailure() {
      Exception taken = failure;
      failure = null;
      return taken;
    }
  }
}

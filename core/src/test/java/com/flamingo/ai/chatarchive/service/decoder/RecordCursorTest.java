package com.flamingo.ai.chatarchive.service.decoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RecordCursor Tests")
class RecordCursorTest {

  private AtomicInteger closeCount;

  @BeforeEach
  void setUp() {
    closeCount = new AtomicInteger();
  }

  private RecordCursor<String> cursorOver(String... values) {
    Deque<String> remaining = new ArrayDeque<>(List.of(values));
    return new RecordCursor<>(remaining::poll, closeCount::incrementAndGet);
  }

  @Test
  @DisplayName("should yield records in order and close the resource at the end")
  void shouldCloseOnExhaustion() {
    RecordCursor<String> cursor = cursorOver("a", "b");

    assertThat(cursor.next()).isEqualTo("a");
    assertThat(cursor.next()).isEqualTo("b");
    assertThat(closeCount).hasValue(0);
    assertThat(cursor.hasNext()).isFalse();
    assertThat(closeCount).hasValue(1);
    assertThat(cursor.isClosed()).isTrue();
    assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  @DisplayName("should close exactly once when closed repeatedly")
  void shouldCloseOnce() {
    RecordCursor<String> cursor = cursorOver("a", "b");
    cursor.next();

    cursor.close();
    cursor.close();

    assertThat(closeCount).hasValue(1);
    assertThat(cursor.hasNext()).isFalse();
  }

  @Test
  @DisplayName("should close the resource when reading fails")
  void shouldCloseOnFailure() {
    RecordCursor<String> cursor =
        new RecordCursor<>(
            () -> {
              throw new IOException("disk gone");
            },
            closeCount::incrementAndGet);

    assertThatThrownBy(cursor::hasNext)
        .isInstanceOf(UncheckedIOException.class)
        .hasRootCauseMessage("disk gone");
    assertThat(closeCount).hasValue(1);
  }

  @Test
  @DisplayName("should propagate runtime failures unchanged and close")
  void shouldPropagateRuntimeFailures() {
    RecordCursor<String> cursor =
        new RecordCursor<>(
            () -> {
              throw new IllegalStateException("broken");
            },
            closeCount::incrementAndGet);

    assertThatThrownBy(cursor::hasNext).isInstanceOf(IllegalStateException.class);
    assertThat(closeCount).hasValue(1);
  }

  @Test
  @DisplayName("closing a partially consumed stream should release the resource")
  void shouldCloseWhenStreamClosedEarly() {
    RecordCursor<String> cursor = cursorOver("a", "b", "c");

    try (Stream<String> stream = cursor.stream()) {
      assertThat(stream.limit(1).collect(Collectors.toList())).containsExactly("a");
    }

    assertThat(closeCount).hasValue(1);
  }

  @Test
  @DisplayName("should report a failure to close")
  void shouldReportCloseFailure() {
    RecordCursor<String> cursor =
        new RecordCursor<>(
            () -> "x",
            () -> {
              throw new IOException("cannot close");
            });

    assertThatThrownBy(cursor::close)
        .isInstanceOf(UncheckedIOException.class)
        .hasRootCauseMessage("cannot close");
  }
}

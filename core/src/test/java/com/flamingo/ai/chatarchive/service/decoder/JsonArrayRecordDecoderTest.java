package com.flamingo.ai.chatarchive.service.decoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.chatarchive.ArchiveFixtures;
import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.exception.ExportAccessDeniedException;
import com.flamingo.ai.chatarchive.exception.ExportDecodeException;
import com.flamingo.ai.chatarchive.exception.ExportNotFoundException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("JsonArrayRecordDecoder Tests")
class JsonArrayRecordDecoderTest {

  @TempDir Path tempDir;

  private JsonArrayRecordDecoder decoder;

  @BeforeEach
  void setUp() {
    decoder = new JsonArrayRecordDecoder(ArchiveFixtures.defaultProperties());
  }

  private Path write(String json) throws IOException {
    Path file = tempDir.resolve("export.json");
    Files.writeString(file, json, StandardCharsets.UTF_8);
    return file;
  }

  /** Serves {@code prefix}, then fails every further read. */
  private static InputStream failingAfter(String prefix, AtomicBoolean closed) {
    ByteArrayInputStream served = new ByteArrayInputStream(prefix.getBytes(StandardCharsets.UTF_8));
    return new InputStream() {
      @Override
      public int read() throws IOException {
        byte[] single = new byte[1];
        return read(single, 0, 1) < 0 ? -1 : single[0] & 0xFF;
      }

      @Override
      public int read(byte[] buffer, int offset, int length) throws IOException {
        if (served.available() == 0) {
          throw new IOException("device unplugged");
        }
        return served.read(buffer, offset, length);
      }

      @Override
      public void close() {
        closed.set(true);
      }
    };
  }

  private static List<JsonNode> drain(RecordCursor<JsonNode> cursor) {
    List<JsonNode> nodes = new ArrayList<>();
    cursor.forEachRemaining(nodes::add);
    return nodes;
  }

  @Nested
  @DisplayName("well-formed input")
  class WellFormed {

    @Test
    @DisplayName("should yield each element in order")
    void shouldYieldElements() throws IOException {
      Path file = write("[{\"id\":\"a\"},{\"id\":\"b\",\"nested\":{\"x\":[1,2]}}]");

      try (RecordCursor<JsonNode> cursor = decoder.open(file)) {
        List<JsonNode> nodes = drain(cursor);

        assertThat(nodes).hasSize(2);
        assertThat(nodes.get(0).get("id").asText()).isEqualTo("a");
        assertThat(nodes.get(1).at("/nested/x/1").asInt()).isEqualTo(2);
      }
    }

    @Test
    @DisplayName("should yield nothing for an empty array")
    void shouldHandleEmptyArray() throws IOException {
      Path file = write("  [ ]  \n");

      try (RecordCursor<JsonNode> cursor = decoder.open(file)) {
        assertThat(cursor.hasNext()).isFalse();
      }
    }

    @Test
    @DisplayName("should surface non-object elements unchanged")
    void shouldSurfaceNonObjects() throws IOException {
      Path file = write("[1, \"two\", null, [3]]");

      try (RecordCursor<JsonNode> cursor = decoder.open(file)) {
        List<JsonNode> nodes = drain(cursor);

        assertThat(nodes).hasSize(4);
        assertThat(nodes.get(0).isInt()).isTrue();
        assertThat(nodes.get(1).isTextual()).isTrue();
        assertThat(nodes.get(2).isNull()).isTrue();
        assertThat(nodes.get(3).isArray()).isTrue();
      }
    }

    @Test
    @DisplayName("should keep fractional numbers exact")
    void shouldKeepDecimalsExact() throws IOException {
      Path file = write("[{\"t\":1700000000.123456}]");

      try (RecordCursor<JsonNode> cursor = decoder.open(file)) {
        assertThat(cursor.next().get("t").decimalValue())
            .isEqualByComparingTo("1700000000.123456");
      }
    }

    @Test
    @DisplayName("should close the input stream once exhausted")
    void shouldCloseInputWhenExhausted() throws IOException {
      AtomicBoolean closed = new AtomicBoolean();
      InputStream input =
          new ByteArrayInputStream("[{}]".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public void close() throws IOException {
              closed.set(true);
              super.close();
            }
          };

      RecordCursor<JsonNode> cursor = decoder.open(input, "memory");
      drain(cursor);

      assertThat(closed).isTrue();
    }
  }

  @Nested
  @DisplayName("fatal errors")
  class FatalErrors {

    @Test
    @DisplayName("should raise not-found for a missing file")
    void shouldRaiseNotFound() {
      Path missing = tempDir.resolve("missing.json");

      assertThatThrownBy(() -> decoder.open(missing))
          .isInstanceOf(ExportNotFoundException.class)
          .hasFieldOrPropertyWithValue("path", missing);
    }

    @Test
    @DisplayName("should raise access-denied for a directory")
    void shouldRaiseAccessDeniedForDirectory() {
      assertThatThrownBy(() -> decoder.open(tempDir))
          .isInstanceOf(ExportAccessDeniedException.class);
    }

    @Test
    @DisplayName("should reject a top-level object before yielding anything")
    void shouldRejectObject() throws IOException {
      Path file = write("{\"conversations\": []}");

      assertThatThrownBy(() -> decoder.open(file))
          .isInstanceOf(ExportDecodeException.class)
          .hasMessageContaining("Expected a top-level JSON array");
    }

    @Test
    @DisplayName("should reject an empty file")
    void shouldRejectEmptyFile() throws IOException {
      Path file = write("");

      assertThatThrownBy(() -> decoder.open(file)).isInstanceOf(ExportDecodeException.class);
    }

    @Test
    @DisplayName("should reject invalid JSON at the start")
    void shouldRejectGarbage() throws IOException {
      Path file = write("not json at all");

      assertThatThrownBy(() -> decoder.open(file)).isInstanceOf(ExportDecodeException.class);
    }

    @Test
    @DisplayName("should fail when the array is truncated")
    void shouldFailOnTruncation() throws IOException {
      Path file = write("[{\"id\":\"a\"},{\"id\":");
      RecordCursor<JsonNode> cursor = decoder.open(file);

      assertThat(cursor.next().get("id").asText()).isEqualTo("a");
      assertThatThrownBy(cursor::hasNext).isInstanceOf(ExportDecodeException.class);
      assertThat(cursor.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should fail when the closing bracket is missing")
    void shouldFailOnUnterminatedArray() throws IOException {
      Path file = write("[{\"id\":\"a\"}");
      RecordCursor<JsonNode> cursor = decoder.open(file);

      cursor.next();
      assertThatThrownBy(cursor::hasNext).isInstanceOf(ExportDecodeException.class);
    }

    @Test
    @DisplayName("should fail on content after the array")
    void shouldFailOnTrailingContent() throws IOException {
      Path file = write("[] {}");
      RecordCursor<JsonNode> cursor = decoder.open(file);

      assertThatThrownBy(cursor::hasNext).isInstanceOf(ExportDecodeException.class);
    }

    @Test
    @DisplayName("should enforce the configured string length limit")
    void shouldEnforceStringLimit() throws IOException {
      ArchiveProperties properties = new ArchiveProperties();
      properties.getDecoder().setMaxStringLength(10);
      JsonArrayRecordDecoder strict = new JsonArrayRecordDecoder(properties);
      Path file = write("[{\"text\":\"" + "x".repeat(50) + "\"}]");
      RecordCursor<JsonNode> cursor = strict.open(file);

      assertThatThrownBy(cursor::hasNext).isInstanceOf(ExportDecodeException.class);
    }

    @Test
    @DisplayName("should pass an I/O failure on open through unwrapped and close the input")
    void shouldPassThroughIoFailureOnOpen() {
      AtomicBoolean closed = new AtomicBoolean();
      InputStream input = failingAfter("", closed);

      assertThatThrownBy(() -> decoder.open(input, "memory"))
          .isExactlyInstanceOf(IOException.class)
          .hasMessage("device unplugged");
      assertThat(closed).isTrue();
    }

    @Test
    @DisplayName("should report an I/O failure while iterating as unchecked")
    void shouldWrapIoFailureWhileIterating() throws IOException {
      AtomicBoolean closed = new AtomicBoolean();
      RecordCursor<JsonNode> cursor =
          decoder.open(failingAfter("[{\"id\":\"a\"},", closed), "memory");

      assertThat(cursor.next().get("id").asText()).isEqualTo("a");
      assertThatThrownBy(cursor::hasNext)
          .isInstanceOf(UncheckedIOException.class)
          .hasCauseExactlyInstanceOf(IOException.class);
      assertThat(closed).isTrue();
    }
  }
}

package com.flamingo.ai.chatarchive.service.decoder;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.flamingo.ai.chatarchive.config.ArchiveProperties;
import com.flamingo.ai.chatarchive.exception.ExportAccessDeniedException;
import com.flamingo.ai.chatarchive.exception.ExportDecodeException;
import com.flamingo.ai.chatarchive.exception.ExportNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Incremental reader for a file holding one top-level JSON array.
 *
 * <p>Elements are materialized one at a time as {@link JsonNode} trees, so memory is bounded by
 * the largest element. The opening bracket is consumed eagerly, which makes a missing file, an
 * unreadable file, or a non-array document fail on {@link #open(Path)} itself. Elements are
 * returned as they are, including non-objects; deciding what is a valid record is up to the
 * caller.
 */
@Slf4j
@Component
public class JsonArrayRecordDecoder {

  private final JsonFactory jsonFactory;
  private final ObjectMapper objectMapper;

  public JsonArrayRecordDecoder(ArchiveProperties properties) {
    this.jsonFactory =
        JsonFactory.builder()
            .streamReadConstraints(
                StreamReadConstraints.builder()
                    .maxStringLength(properties.getDecoder().getMaxStringLength())
                    .build())
            .build();
    // keeps fractional epoch timestamps exact
    this.objectMapper =
        new ObjectMapper(jsonFactory).enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
  }

  /**
   * Opens a cursor over the elements of the array stored at {@code path}.
   *
   * @throws ExportNotFoundException if the file does not exist
   * @throws ExportAccessDeniedException if the file cannot be read
   * @throws ExportDecodeException if the document does not start with a JSON array
   * @throws IOException if any other I/O error occurs while opening the file
   */
  public RecordCursor<JsonNode> open(Path path) throws IOException {
    return open(openFile(path), path.toString());
  }

  /**
   * Opens a cursor over an array read from {@code input}. The stream is owned by the cursor from
   * here on.
   *
   * @throws IOException if reading the opening bracket fails
   */
  public RecordCursor<JsonNode> open(InputStream input, String sourceName) throws IOException {
    JsonParser parser;
    try {
      parser = jsonFactory.createParser(input);
    } catch (IOException e) {
      closeAfterFailure(input, e);
      throw e;
    }
    try {
      JsonToken first = parser.nextToken();
      if (first == null) {
        throw new ExportDecodeException("Export is empty: " + sourceName);
      }
      if (first != JsonToken.START_ARRAY) {
        throw new ExportDecodeException(
            "Expected a top-level JSON array in " + sourceName + " but found " + first);
      }
    } catch (JsonProcessingException e) {
      closeAfterFailure(parser, e);
      throw new ExportDecodeException(
          "Malformed JSON in " + sourceName + ": " + e.getOriginalMessage(), e);
    } catch (IOException | RuntimeException e) {
      closeAfterFailure(parser, e);
      throw e;
    }
    log.debug("Opened JSON array export {}", sourceName);
    return new RecordCursor<>(() -> readElement(parser, sourceName), parser);
  }

  private JsonNode readElement(JsonParser parser, String sourceName) throws IOException {
    try {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new ExportDecodeException("Unterminated JSON array in " + sourceName);
      }
      if (token == JsonToken.END_ARRAY) {
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
          throw new ExportDecodeException(
              "Unexpected content after the top-level array in " + sourceName + ": " + trailing);
        }
        return null;
      }
      JsonNode element = objectMapper.readTree(parser);
      return element == null ? NullNode.getInstance() : element;
    } catch (JsonProcessingException e) {
      throw new ExportDecodeException(
          "Malformed JSON in " + sourceName + ": " + e.getOriginalMessage(), e);
    }
  }

  private static InputStream openFile(Path path) throws IOException {
    if (Files.isDirectory(path)) {
      throw new ExportAccessDeniedException(path, "is a directory");
    }
    try {
      return Files.newInputStream(path);
    } catch (NoSuchFileException e) {
      throw new ExportNotFoundException(path, e);
    } catch (AccessDeniedException e) {
      throw new ExportAccessDeniedException(path, e);
    }
  }

  private static void closeAfterFailure(AutoCloseable resource, Exception primary) {
    try {
      resource.close();
    } catch (Exception closeFailure) {
      primary.addSuppressed(closeFailure);
    }
  }
}

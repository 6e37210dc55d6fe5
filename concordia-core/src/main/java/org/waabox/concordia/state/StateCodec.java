package org.waabox.concordia.state;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson-based codec for the {@link StateDocument}.
 *
 * <p>Writes pretty-printed JSON with every object's keys sorted. Instants
 * are written as epoch seconds with a fractional part, which is also what
 * the reader accepts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class StateCodec {

  /** The Jackson object mapper configured for the state document. */
  private final ObjectMapper mapper;

  /** Creates a new codec with a pre-configured {@link ObjectMapper}. */
  StateCodec() {
    mapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .visibility(PropertyAccessor.FIELD, Visibility.ANY)
        .build();
  }

  /**
   * Serializes the document.
   *
   * @param document the document to serialize, never null
   * @return the JSON bytes, never null
   * @throws UncheckedIOException if serialization fails
   */
  byte[] encode(final StateDocument document) {
    Objects.requireNonNull(document, "document cannot be null");
    try {
      return mapper.writeValueAsBytes(document);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to serialize state", e);
    }
  }

  /**
   * Deserializes a document.
   *
   * @param data the JSON bytes, never null
   * @return the document, never null
   * @throws UncheckedIOException if the bytes are not a valid document
   */
  StateDocument decode(final byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    try {
      final StateDocument document = mapper.readValue(data,
          StateDocument.class);
      if (document == null) {
        throw new IOException("State document is the JSON null literal");
      }
      return document;
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to deserialize state", e);
    }
  }
}

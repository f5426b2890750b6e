package io.jobq.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobq.PayloadCodecException;
import io.jobq.spi.PayloadCodec;

import java.util.Objects;

/**
 * {@link PayloadCodec} that stores payloads as JSON text using a Jackson {@link ObjectMapper}.
 *
 * <p>The mapper is shared and must not be reconfigured after the codec is created. Generic
 * payload types are described with a {@link TypeReference}:
 * <pre>{@code
 * PayloadCodec<List<String>> codec =
 *     JacksonPayloadCodec.of(new TypeReference<List<String>>() {});
 * }</pre>
 *
 * @param <T> payload type
 */
public final class JacksonPayloadCodec<T> implements PayloadCodec<T> {

  private final ObjectMapper objectMapper;
  private final JavaType type;

  private JacksonPayloadCodec(ObjectMapper objectMapper, JavaType type) {
    this.objectMapper = objectMapper;
    this.type = type;
  }

  /** Codec for {@code type} with a default {@link ObjectMapper}. */
  public static <T> JacksonPayloadCodec<T> of(Class<T> type) {
    return of(new ObjectMapper(), type);
  }

  public static <T> JacksonPayloadCodec<T> of(ObjectMapper objectMapper, Class<T> type) {
    Objects.requireNonNull(objectMapper, "objectMapper");
    Objects.requireNonNull(type, "type");
    return new JacksonPayloadCodec<>(objectMapper, objectMapper.constructType(type));
  }

  /** Codec for a generic type with a default {@link ObjectMapper}. */
  public static <T> JacksonPayloadCodec<T> of(TypeReference<T> type) {
    return of(new ObjectMapper(), type);
  }

  public static <T> JacksonPayloadCodec<T> of(ObjectMapper objectMapper, TypeReference<T> type) {
    Objects.requireNonNull(objectMapper, "objectMapper");
    Objects.requireNonNull(type, "type");
    return new JacksonPayloadCodec<>(objectMapper, objectMapper.constructType(type));
  }

  @Override
  public String encode(T value) {
    if (value == null) {
      throw new PayloadCodecException("payload must not be null");
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new PayloadCodecException("Failed to encode payload as " + type, e);
    }
  }

  @Override
  public T decode(String payload) {
    if (payload == null) {
      throw new PayloadCodecException("stored payload is null");
    }
    try {
      return objectMapper.readValue(payload, type);
    } catch (JsonProcessingException e) {
      throw new PayloadCodecException("Failed to decode payload as " + type, e);
    }
  }
}

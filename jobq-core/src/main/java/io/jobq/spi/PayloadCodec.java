package io.jobq.spi;

import io.jobq.PayloadCodecException;

/**
 * Converts typed job payloads to and from the text stored in the {@code payload} column.
 *
 * <p>The store treats payloads as opaque; the codec is supplied by the caller.
 * {@link #string()} passes text through unchanged. The {@code jobq-jackson} module provides a
 * JSON codec.
 *
 * @param <T> payload type
 */
public interface PayloadCodec<T> {

  /**
   * @throws PayloadCodecException if the value cannot be encoded
   */
  String encode(T value);

  /**
   * @throws PayloadCodecException if the stored text cannot be decoded
   */
  T decode(String payload);

  /** Identity codec for plain text payloads. */
  static PayloadCodec<String> string() {
    return StringCodec.INSTANCE;
  }

  /** Identity codec backing {@link #string()}. */
  final class StringCodec implements PayloadCodec<String> {
    static final StringCodec INSTANCE = new StringCodec();

    private StringCodec() {
    }

    @Override
    public String encode(String value) {
      if (value == null) {
        throw new PayloadCodecException("payload must not be null");
      }
      return value;
    }

    @Override
    public String decode(String payload) {
      if (payload == null) {
        throw new PayloadCodecException("stored payload is null");
      }
      return payload;
    }
  }
}

package io.jobq.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobq.PayloadCodecException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonPayloadCodecTest {

  record Email(String to, String subject, int retries) {
  }

  @Test
  void encodesRecordAsJson() throws Exception {
    JacksonPayloadCodec<Email> codec = JacksonPayloadCodec.of(Email.class);

    String json = codec.encode(new Email("a@example.com", "hi", 2));

    ObjectMapper mapper = new ObjectMapper();
    assertEquals(mapper.readTree("{\"to\":\"a@example.com\",\"subject\":\"hi\",\"retries\":2}"),
        mapper.readTree(json));
    assertEquals(new Email("a@example.com", "hi", 2), codec.decode(json));
  }

  @Test
  void decodesGenericTypes() {
    JacksonPayloadCodec<List<Map<String, Integer>>> codec =
        JacksonPayloadCodec.of(new TypeReference<List<Map<String, Integer>>>() {});

    List<Map<String, Integer>> value = codec.decode("[{\"a\":1},{\"b\":2}]");

    assertEquals(2, value.size());
    assertEquals(2, value.get(1).get("b"));
  }

  @Test
  void malformedJsonRaisesCodecError() {
    JacksonPayloadCodec<Email> codec = JacksonPayloadCodec.of(Email.class);

    PayloadCodecException e = assertThrows(PayloadCodecException.class, () -> codec.decode("{not json"));
    assertInstanceOf(JsonProcessingException.class, e.getCause());
  }

  @Test
  void mapperConfigurationIsHonoured() {
    ObjectMapper strict = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    ObjectMapper lenient = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    String json = "{\"to\":\"x\",\"subject\":\"y\",\"retries\":0,\"extra\":true}";

    assertThrows(PayloadCodecException.class,
        () -> JacksonPayloadCodec.of(strict, Email.class).decode(json));
    assertEquals("x", JacksonPayloadCodec.of(lenient, Email.class).decode(json).to());
  }

  @Test
  void nullValuesAreRejected() {
    JacksonPayloadCodec<Email> codec = JacksonPayloadCodec.of(Email.class);

    assertThrows(PayloadCodecException.class, () -> codec.encode(null));
    assertThrows(PayloadCodecException.class, () -> codec.decode(null));
    assertThrows(NullPointerException.class, () -> JacksonPayloadCodec.of((Class<Email>) null));
  }
}

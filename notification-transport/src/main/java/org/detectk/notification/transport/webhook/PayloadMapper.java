package org.detectk.notification.transport.webhook;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared Jackson mapper for webhook bodies. Null fields are omitted and non-finite doubles are
 * written as strings rather than producing invalid JSON.
 */
public final class PayloadMapper {
  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .serializationInclusion(Include.NON_NULL)
          .enable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
          .build();

  private PayloadMapper() {}

  public static String toJson(Object payload) throws JsonProcessingException {
    return MAPPER.writeValueAsString(payload);
  }

  public static JsonNode readTree(String json) throws JsonProcessingException {
    return MAPPER.readTree(json);
  }
}

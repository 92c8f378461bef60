package com.acme.fleetlink.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared JSON codec for wire messages. Timestamps are written as ISO-8601 strings; unknown fields
 * are ignored so that newer senders stay readable by older consumers.
 */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new MessageFormatException("Failed to serialize " + o.getClass().getSimpleName(), e);
    }
  }

  /**
   * Decode {@code json} into {@code clazz}.
   *
   * @throws MessageFormatException if the input is malformed, does not match the type, or is the
   *     JSON literal {@code null}
   */
  public static <T> T fromJson(String json, Class<T> clazz) {
    T value;
    try {
      value = M.readValue(json, clazz);
    } catch (Exception e) {
      throw new MessageFormatException(
          "Failed to parse " + clazz.getSimpleName() + ": " + e.getMessage(), e);
    }
    if (value == null) {
      throw new MessageFormatException(
          "Failed to parse " + clazz.getSimpleName() + ": empty document", null);
    }
    return value;
  }
}

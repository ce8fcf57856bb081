package com.acme.retry.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;

public final class Jsons {
  private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());
  private static final TypeReference<List<Long>> LONG_LIST = new TypeReference<>() {};

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot serialize " + o.getClass().getName(), e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot parse JSON as " + clazz.getSimpleName(), e);
    }
  }

  /** Parse a JSON array of integers, e.g. {@code [1000,5000,30000]}. */
  public static List<Long> longList(String json) {
    try {
      return M.readValue(json, LONG_LIST);
    } catch (Exception e) {
      throw new IllegalArgumentException("Not a JSON array of integers: " + json, e);
    }
  }
}

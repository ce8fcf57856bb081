package com.acme.retry.core;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Jsons - JSON helpers")
class JsonsTest {

  @Test
  @DisplayName("toJson - should write integer arrays without spaces")
  void testToJsonIntegerArray() {
    assertThat(Jsons.toJson(List.of(100L, 200L, 300L))).isEqualTo("[100,200,300]");
  }

  @Test
  @DisplayName("longList - should parse integer arrays")
  void testLongList() {
    assertThat(Jsons.longList("[1, 2, 3]")).containsExactly(1L, 2L, 3L);
  }

  @Test
  @DisplayName("longList - should reject anything that is not an integer array")
  void testLongListRejectsGarbage() {
    assertThatThrownBy(() -> Jsons.longList("not-json"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Jsons.longList("{\"a\":1}"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

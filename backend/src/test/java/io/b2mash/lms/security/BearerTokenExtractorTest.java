package io.b2mash.lms.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BearerTokenExtractorTest {

  @Test
  void extract_returnsToken() {
    assertThat(BearerTokenExtractor.extract("Bearer abc.def.ghi")).isEqualTo("abc.def.ghi");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "Bearer", "Bearer ", "Basic abc", "bearer abc", "Bearer a b", "abc"})
  void extract_rejectsOtherShapes(String header) {
    assertThat(BearerTokenExtractor.extract(header)).isNull();
  }
}

package com.consullo.bridge.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for code-fence language detection.
 *
 * @since 1.0
 */
public class LanguageDetectorTest {

  @Test
  @DisplayName("Should detect common languages")
  void detect_KnownLanguages() throws Exception {
    assertThat(LanguageDetector.detect("def main():\n    pass")).isEqualTo("python");
    assertThat(LanguageDetector.detect("from os import path")).isEqualTo("python");
    assertThat(LanguageDetector.detect("const x = 1;")).isEqualTo("javascript");
    assertThat(LanguageDetector.detect("#!/bin/bash\necho hi")).isEqualTo("bash");
    assertThat(LanguageDetector.detect("{\"name\": \"bridge\"}")).isEqualTo("json");
    assertThat(LanguageDetector.detect("name: bridge\nversion: 1")).isEqualTo("yaml");
    assertThat(LanguageDetector.detect("<root><item/></root>")).isEqualTo("xml");
    assertThat(LanguageDetector.detect("SELECT * FROM users")).isEqualTo("sql");
  }

  @Test
  @DisplayName("Should return an empty tag for prose")
  void detect_Prose_Empty() throws Exception {
    assertThat(LanguageDetector.detect("hello there")).isEmpty();
    assertThat(LanguageDetector.detect("Note: this is prose")).isEmpty();
    assertThat(LanguageDetector.detect(null)).isEmpty();
  }

  @Test
  @DisplayName("Should recognize code-like text")
  void looksLikeCode_CodeAndProse() throws Exception {
    assertThat(LanguageDetector.looksLikeCode("function run() {")).isTrue();
    assertThat(LanguageDetector.looksLikeCode("System.out.println(x);")).isTrue();
    assertThat(LanguageDetector.looksLikeCode("import java.util.List;")).isTrue();
    assertThat(LanguageDetector.looksLikeCode("The build finished quickly")).isFalse();
  }
}

package com.consullo.bridge.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the default line classification heuristics.
 *
 * @since 1.0
 */
public class DefaultLineClassifierTest {

  private final DefaultLineClassifier classifier = new DefaultLineClassifier();

  @Test
  @DisplayName("Should classify error lines before anything else")
  void classify_ErrorKeywords_Error() throws Exception {
    assertThat(classifier.classify("Error: disk full")).isEqualTo(LineType.ERROR);
    assertThat(classifier.classify("Build 50% failed")).isEqualTo(LineType.ERROR);
    assertThat(classifier.classify("java.lang.IllegalStateException: boom")).isEqualTo(LineType.ERROR);
  }

  @Test
  @DisplayName("Should classify warning and success lines")
  void classify_WarningAndSuccess() throws Exception {
    assertThat(classifier.classify("WARNING: deprecated flag")).isEqualTo(LineType.WARNING);
    assertThat(classifier.classify("[warn] slow disk")).isEqualTo(LineType.WARNING);
    assertThat(classifier.classify("Task completed")).isEqualTo(LineType.SUCCESS);
    assertThat(classifier.classify("Done.")).isEqualTo(LineType.SUCCESS);
    assertThat(classifier.classify("abandoned plan")).isEqualTo(LineType.NORMAL);
  }

  @Test
  @DisplayName("Should classify spinner and progress-like lines")
  void classify_ProgressLike_Progress() throws Exception {
    assertThat(classifier.classify("[==========     ] 50")).isEqualTo(LineType.PROGRESS);
    assertThat(classifier.classify("Downloading 42%")).isEqualTo(LineType.PROGRESS);
    assertThat(classifier.classify("Thinking...")).isEqualTo(LineType.PROGRESS);
    assertThat(classifier.classify("Working |")).isEqualTo(LineType.PROGRESS);
    assertThat(classifier.classify("|")).isEqualTo(LineType.PROGRESS);
    assertThat(classifier.classify("⠋ Reading files")).isEqualTo(LineType.PROGRESS);
  }

  @Test
  @DisplayName("Should classify file operations as info and source lines as code")
  void classify_InfoAndCode() throws Exception {
    assertThat(classifier.classify("Created file src/Main.java")).isEqualTo(LineType.INFO);
    assertThat(classifier.classify("Running: mvn test")).isEqualTo(LineType.INFO);
    assertThat(classifier.classify("def main():")).isEqualTo(LineType.CODE);
    assertThat(classifier.classify("public void run() {")).isEqualTo(LineType.CODE);
    assertThat(classifier.classify("}")).isEqualTo(LineType.CODE);
  }

  @Test
  @DisplayName("Should leave ordinary content lines normal")
  void classify_NormalText_Normal() throws Exception {
    assertThat(classifier.classify("Hello world")).isEqualTo(LineType.NORMAL);
    assertThat(classifier.classify("")).isEqualTo(LineType.NORMAL);
    assertThat(classifier.classify(null)).isEqualTo(LineType.NORMAL);
  }

  @Test
  @DisplayName("Should detect interactive prompts")
  void isInteractivePrompt_QuestionsAndConfirmations() throws Exception {
    assertThat(classifier.isInteractivePrompt("Continue? (y/n)")).isTrue();
    assertThat(classifier.isInteractivePrompt("Press Enter to proceed")).isTrue();
    assertThat(classifier.isInteractivePrompt("Overwrite [y/N]")).isTrue();
    assertThat(classifier.isInteractivePrompt("Entering directory /tmp")).isFalse();
    assertThat(classifier.isInteractivePrompt("plain output")).isFalse();
  }
}

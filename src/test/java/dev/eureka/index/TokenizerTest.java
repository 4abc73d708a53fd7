package dev.eureka.index;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TokenizerTest {

  @Test
  void lowerCasesAndSplitsOnPunctuationAndWhitespace() {
    assertThat(Tokenizer.tokenize("Hello, World!  Search\tengine"))
        .containsExactly("hello", "world", "search", "engine");
  }

  @Test
  void keepsHyphensUnderscoresAndDigits() {
    assertThat(Tokenizer.tokenize("state-of-art snake_case web2"))
        .containsExactly("state-of-art", "snake_case", "web2");
  }

  @Test
  void dropsStopwordsAndSingleLetters() {
    assertThat(Tokenizer.tokenize("The cat is on a mat and it sat"))
        .containsExactly("cat", "mat", "sat");
  }

  @Test
  void keepsDuplicatesInOrder() {
    assertThat(Tokenizer.tokenize("java JAVA Java")).containsExactly("java", "java", "java");
  }

  @Test
  void nullAndEmptyYieldNoTerms() {
    assertThat(Tokenizer.tokenize(null)).isEmpty();
    assertThat(Tokenizer.tokenize("")).isEmpty();
    assertThat(Tokenizer.tokenize("  ... !!! ")).isEmpty();
  }

  @Test
  void nonAsciiLettersActAsSeparators() {
    assertThat(Tokenizer.tokenize("café")).containsExactly("caf");
  }

  @Test
  void upperCaseStopwordsAreDropped() {
    assertThat(Tokenizer.tokenize("THE Search OF")).containsExactly("search");
  }
}

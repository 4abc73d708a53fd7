package dev.eureka.index;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TagCategoryTest {

  @ParameterizedTest
  @CsvSource({
    "title,7", "h1,7", "h2,6", "h3,5", "h4,4", "h5,3", "h6,2",
    "b,2", "strong,2", "i,1", "em,1", "p,0", "div,0", "a,0"
  })
  void weightDeltaPerTag(String tag, int expected) {
    assertThat(TagCategory.of(tag).weightDelta()).isEqualTo(expected);
  }

  @Test
  void lookupIsCaseInsensitive() {
    assertThat(TagCategory.of("H2")).isEqualTo(TagCategory.HEADING_2);
    assertThat(TagCategory.of("SCRIPT")).isEqualTo(TagCategory.SKIPPED);
  }

  @Test
  void unknownAndNullTagsAreNeutral() {
    assertThat(TagCategory.of("article")).isEqualTo(TagCategory.NEUTRAL);
    assertThat(TagCategory.of(null)).isEqualTo(TagCategory.NEUTRAL);
  }

  @Test
  void nonContentTagsAreSkipped() {
    for (String tag : new String[] {"meta", "script", "style", "iframe", "svg", "textarea"}) {
      assertThat(TagCategory.of(tag)).as(tag).isEqualTo(TagCategory.SKIPPED);
    }
  }
}

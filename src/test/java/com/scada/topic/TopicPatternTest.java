package com.scada.topic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicPatternTest {

  @Test
  @DisplayName("'+' совпадает ровно с одним сегментом")
  void singleLevelWildcardMatchesOneSegment() {
    TopicPattern pattern = TopicPattern.parse("ai_scada/data/+");

    assertThat(pattern.matches("ai_scada/data/pressure-1")).isTrue();
    assertThat(pattern.matches("ai_scada/data")).isFalse();
    assertThat(pattern.matches("ai_scada/data/pressure-1/confirmation")).isFalse();
    assertThat(pattern.matches("other/data/pressure-1")).isFalse();
  }

  @Test
  @DisplayName("'#' совпадает с любым хвостом, включая родительский уровень")
  void multiLevelWildcardMatchesAnySuffix() {
    TopicPattern pattern = TopicPattern.parse("ai_scada/#");

    assertThat(pattern.matches("ai_scada")).isTrue();
    assertThat(pattern.matches("ai_scada/data/flow-1")).isTrue();
    assertThat(pattern.matches("ai_scada/data/flow-1/confirmation")).isTrue();
    assertThat(pattern.matches("scada/data")).isFalse();
  }

  @Test
  @DisplayName("Шаблон покрывает более узкий шаблон, но не наоборот")
  void coversNarrowerPatterns() {
    TopicPattern everything = TopicPattern.parse("ai_scada/#");
    TopicPattern data = TopicPattern.parse("ai_scada/data/+");
    TopicPattern confirmations = TopicPattern.parse("ai_scada/data/+/confirmation");

    assertThat(everything.covers(data)).isTrue();
    assertThat(everything.covers(confirmations)).isTrue();
    assertThat(data.covers(TopicPattern.parse("ai_scada/data/flow-1"))).isTrue();
    assertThat(data.covers(confirmations)).isFalse();
    assertThat(data.covers(everything)).isFalse();
    assertThat(TopicPattern.parse("ai_scada/data/flow-1").covers(data)).isFalse();
  }

  @Test
  @DisplayName("'#' не в конце и '+' внутри сегмента — ошибка разбора")
  void rejectsMisplacedWildcards() {
    assertThatThrownBy(() -> TopicPattern.parse("ai_scada/#/data"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TopicPattern.parse("ai_scada/data+"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TopicPattern.parse(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Шаблоны с одинаковым текстом равны")
  void equalityByText() {
    assertThat(TopicPattern.parse("a/+/b")).isEqualTo(TopicPattern.parse("a/+/b"));
    assertThat(TopicPattern.parse("a/+/b").isWildcard()).isTrue();
    assertThat(TopicPattern.parse("a/c/b").isWildcard()).isFalse();
  }
}

package com.scada.topic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicContractTest {

  private final TopicContract contract = new TopicContract(TopicContract.DEFAULT_NAMESPACE);

  @Test
  @DisplayName("Топики строятся от пространства имён ai_scada")
  void buildsTopicsUnderNamespace() {
    assertThat(contract.readingTopic("pressure-1")).isEqualTo("ai_scada/data/pressure-1");
    assertThat(contract.confirmationTopic("pressure-1")).isEqualTo("ai_scada/data/pressure-1/confirmation");
    assertThat(contract.predictionTopic("flow-1")).isEqualTo("ai_scada/predictions/flow-1");
    assertThat(contract.alarmTopic("flow-1")).isEqualTo("ai_scada/alarms/flow-1");
    assertThat(contract.recommendationTopic("flow-1")).isEqualTo("ai_scada/recommendations/flow-1");
    assertThat(contract.controlTopic("valve-oil")).isEqualTo("ai_scada/control/valve-oil");
  }

  @Test
  @DisplayName("Подписка приёма не захватывает топики подтверждений")
  void readingSubscriptionExcludesConfirmations() {
    TopicPattern subscription = contract.readingSubscription();

    assertThat(subscription.matches(contract.readingTopic("temp-1"))).isTrue();
    assertThat(subscription.matches(contract.confirmationTopic("temp-1"))).isFalse();
    assertThat(contract.confirmationPattern().matches(contract.confirmationTopic("temp-1"))).isTrue();
  }

  @Test
  @DisplayName("Датчик извлекается из суффикса топика")
  void extractsEntityFromTopic() {
    assertThat(contract.entityFromReadingTopic("ai_scada/data/vibration-1")).isEqualTo("vibration-1");
  }

  @Test
  @DisplayName("Пустой или пробельный суффикс, лишние сегменты и чужой префикс → MalformedTopic")
  void rejectsMalformedTopics() {
    assertThatThrownBy(() -> contract.entityFromReadingTopic("ai_scada/data/"))
        .isInstanceOf(MalformedTopicException.class);
    assertThatThrownBy(() -> contract.entityFromReadingTopic("ai_scada/data/ "))
        .isInstanceOf(MalformedTopicException.class);
    assertThatThrownBy(() -> contract.entityFromReadingTopic("ai_scada/data/\t"))
        .isInstanceOf(MalformedTopicException.class);
    assertThatThrownBy(() -> contract.entityFromReadingTopic("ai_scada/data/flow-1/extra"))
        .isInstanceOf(MalformedTopicException.class);
    assertThatThrownBy(() -> contract.entityFromReadingTopic("other/data/flow-1"))
        .isInstanceOf(MalformedTopicException.class)
        .extracting(e -> ((MalformedTopicException) e).reason())
        .isEqualTo("MalformedTopic");
  }

  @Test
  @DisplayName("%ns% в шаблоне заменяется пространством имён")
  void resolvesNamespacePlaceholder() {
    TopicContract custom = new TopicContract("plant_7");

    assertThat(custom.resolve("%ns%/data/+")).isEqualTo(TopicPattern.parse("plant_7/data/+"));
    assertThat(custom.readingTopic("flow-1")).isEqualTo("plant_7/data/flow-1");
  }

  @Test
  @DisplayName("Идентификатор датчика с '/' не превращается в топик")
  void refusesMultiSegmentEntity() {
    assertThatThrownBy(() -> contract.predictionTopic("flow/1"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> contract.readingTopic("  "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

package com.scada.acl;

import com.scada.topic.TopicPattern;

import java.util.Objects;
import java.util.Set;

/**
 * Объявленный трафик компонента: на что он подписывается и куда публикует.
 *
 * @param component  Имя компонента для сообщений об ошибках.
 * @param principal  Принципал, под которым компонент подключается к брокеру.
 * @param subscribes Шаблоны подписок.
 * @param publishes  Шаблоны публикаций.
 */
public record ComponentTraffic(String component, String principal, Set<TopicPattern> subscribes, Set<TopicPattern> publishes) {

  public ComponentTraffic {
    Objects.requireNonNull(component, "component cannot be null");
    Objects.requireNonNull(principal, "principal cannot be null");
    subscribes = Set.copyOf(subscribes);
    publishes = Set.copyOf(publishes);
  }
}

package com.scada.acl;

import com.scada.topic.TopicPattern;

import java.util.Objects;

/**
 * Право принципала: направление и шаблон топика.
 */
public record Grant(Direction direction, TopicPattern pattern) {

  public Grant {
    Objects.requireNonNull(direction, "direction cannot be null");
    Objects.requireNonNull(pattern, "pattern cannot be null");
  }

  public boolean permits(Direction requested, String topic) {
    return direction.allows(requested) && pattern.matches(topic);
  }

  public boolean covers(Direction requested, TopicPattern requestedPattern) {
    return direction.allows(requested) && pattern.covers(requestedPattern);
  }
}

package com.scada.acl;

import com.scada.topic.TopicPattern;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Статическая таблица прав: принципал → набор (направление, шаблон топика).
 * <p>
 * Права применяет брокер; конвейер использует ту же таблицу, чтобы при старте
 * убедиться, что трафик каждого компонента укладывается в права его принципала,
 * и чтобы не отправлять публикации, которые брокер всё равно отвергнет.
 */
public final class AccessPolicy {

  private final Map<String, List<Grant>> grants;

  public AccessPolicy(Map<String, List<Grant>> grants) {
    Map<String, List<Grant>> copy = new LinkedHashMap<>();
    grants.forEach((principal, list) -> copy.put(principal, List.copyOf(list)));
    this.grants = Collections.unmodifiableMap(copy);
  }

  public Set<String> principals() {
    return grants.keySet();
  }

  public boolean hasPrincipal(String principal) {
    return grants.containsKey(principal);
  }

  public List<Grant> grants(String principal) {
    return Optional.ofNullable(grants.get(principal)).orElse(List.of());
  }

  public boolean isAllowed(String principal, Direction direction, String topic) {
    return grants(principal).stream().anyMatch(g -> g.permits(direction, topic));
  }

  /**
   * Покрывают ли права принципала весь шаблон целиком (а не отдельный топик).
   */
  public boolean covers(String principal, Direction direction, TopicPattern pattern) {
    return grants(principal).stream().anyMatch(g -> g.covers(direction, pattern));
  }

  /**
   * @throws AccessDeniedException если принципалу нельзя писать в топик.
   */
  public void checkPublish(String principal, String topic) {
    if (!isAllowed(principal, Direction.WRITE, topic)) {
      throw new AccessDeniedException(principal, Direction.WRITE, topic);
    }
  }
}

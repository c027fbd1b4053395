package com.scada.acl;

import com.scada.config.ConfigurationException;
import com.scada.topic.TopicPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверяет при старте, что трафик каждого компонента — подмножество прав его принципала.
 * Нарушение обнаруживается здесь, а не отказом брокера посреди работы.
 */
public final class AccessPolicyValidator {

  private static final Logger logger = LoggerFactory.getLogger(AccessPolicyValidator.class);

  private AccessPolicyValidator() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * @throws ConfigurationException со списком всех нарушений.
   */
  public static void validate(AccessPolicy policy, List<ComponentTraffic> components) {
    List<String> problems = new ArrayList<>();
    for (ComponentTraffic component : components) {
      if (!policy.hasPrincipal(component.principal())) {
        problems.add("компонент '" + component.component() + "': принципал '"
            + component.principal() + "' отсутствует в политике доступа");
        continue;
      }
      for (TopicPattern pattern : component.subscribes()) {
        if (!policy.covers(component.principal(), Direction.READ, pattern)) {
          problems.add("компонент '" + component.component() + "': принципалу '" + component.principal()
              + "' не выдано право read на '" + pattern + "'");
        }
      }
      for (TopicPattern pattern : component.publishes()) {
        if (!policy.covers(component.principal(), Direction.WRITE, pattern)) {
          problems.add("компонент '" + component.component() + "': принципалу '" + component.principal()
              + "' не выдано право write на '" + pattern + "'");
        }
      }
    }
    if (!problems.isEmpty()) {
      throw new ConfigurationException(problems);
    }
    logger.info("✅ Политика доступа согласована с трафиком {} компонентов", components.size());
  }
}

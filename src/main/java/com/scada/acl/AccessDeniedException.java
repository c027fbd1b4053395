package com.scada.acl;

import com.scada.PipelineException;

/**
 * Компонент попытался обратиться к топику, не разрешённому его принципалу.
 */
public class AccessDeniedException extends PipelineException {

  public static final String REASON = "AccessDenied";

  public AccessDeniedException(String principal, Direction direction, String topic) {
    super("Принципал '" + principal + "' не имеет права " + direction.wireName() + " на топик '" + topic + "'");
  }

  @Override
  public String reason() {
    return REASON;
  }
}

package com.scada.prediction;

import com.scada.model.ModelHandle;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Держатель активной модели. Замена атомарна: читатель видит либо старую, либо новую модель.
 */
public class ModelHolder {

  private final AtomicReference<ModelHandle> current = new AtomicReference<>();

  public Optional<ModelHandle> current() {
    return Optional.ofNullable(current.get());
  }

  /**
   * Делает {@code handle} активной моделью.
   *
   * @return Предыдущая модель, если была.
   */
  public Optional<ModelHandle> swap(ModelHandle handle) {
    if (handle == null) {
      throw new IllegalArgumentException("handle cannot be null");
    }
    return Optional.ofNullable(current.getAndSet(handle));
  }
}

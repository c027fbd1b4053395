package com.scada.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Подтверждение приёма измерения, публикуется в {@code data/{entity_id}/confirmation}.
 * <p>
 * {@code reason} присутствует тогда и только тогда, когда статус — {@link ConfirmationStatus#REJECTED}.
 * {@code originalTimestamp} может отсутствовать, если полезную нагрузку не удалось разобрать.
 */
public record Confirmation(
    String entityId,
    Optional<Instant> originalTimestamp,
    ConfirmationStatus status,
    Optional<String> reason
) {

  public Confirmation {
    Objects.requireNonNull(entityId, "entityId cannot be null");
    Objects.requireNonNull(originalTimestamp, "originalTimestamp cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    Objects.requireNonNull(reason, "reason cannot be null");
    if (status == ConfirmationStatus.REJECTED && reason.filter(r -> !r.isBlank()).isEmpty()) {
      throw new IllegalArgumentException("rejected confirmation requires a non-empty reason");
    }
    if (status == ConfirmationStatus.ACCEPTED && reason.isPresent()) {
      throw new IllegalArgumentException("accepted confirmation cannot carry a reason");
    }
  }

  public static Confirmation accepted(Reading reading) {
    return new Confirmation(reading.entityId(), Optional.of(reading.timestamp()),
        ConfirmationStatus.ACCEPTED, Optional.empty());
  }

  public static Confirmation rejected(String entityId, Instant originalTimestamp, String reason) {
    return new Confirmation(entityId, Optional.ofNullable(originalTimestamp),
        ConfirmationStatus.REJECTED, Optional.of(reason));
  }

  public boolean isAccepted() {
    return status == ConfirmationStatus.ACCEPTED;
  }
}

package mailqueue.delivery;

import mailqueue.model.DeliveryInfo;

import java.util.Objects;

/**
 * Result of one delivery attempt, recorded by {@link DeliveryStateMachine#complete}.
 */
public sealed interface DeliveryOutcome {

  /**
   * The transport accepted the message.
   */
  record Delivered(DeliveryInfo info) implements DeliveryOutcome {
    public Delivered {
      Objects.requireNonNull(info, "info");
    }
  }

  /**
   * Preparing or sending the message failed.
   *
   * @param error description stored as {@code delivery.error}
   */
  record Failed(String error) implements DeliveryOutcome {
    public Failed {
      Objects.requireNonNull(error, "error");
    }

    /**
     * Describes a failure by its message, or by its type when it has none.
     */
    public static Failed of(Throwable failure) {
      String message = failure.getMessage();
      return new Failed(message != null && !message.isEmpty()
          ? message : failure.getClass().getSimpleName());
    }
  }
}

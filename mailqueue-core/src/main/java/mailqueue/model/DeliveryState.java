package mailqueue.model;

/**
 * Lifecycle of a message document's {@code delivery} record.
 *
 * <p>A document without a {@code delivery.state} has not been seen by the queue yet.
 *
 * <pre>
 *   (unclaimed) --create--> PENDING --claim--> PROCESSING --complete--> SUCCESS | ERROR
 *                           RETRY   --claim--> PROCESSING --lease expired--> ERROR
 * </pre>
 *
 * <p>{@code RETRY} is only ever written by an operator or external automation.
 */
public enum DeliveryState {
  PENDING,
  PROCESSING,
  RETRY,
  SUCCESS,
  ERROR;

  /**
   * Returns {@code true} for states that no automatic transition leaves.
   */
  public boolean isTerminal() {
    return this == SUCCESS || this == ERROR;
  }

  /**
   * Returns {@code true} for states a claim may move to {@link #PROCESSING}.
   */
  public boolean isClaimable() {
    return this == PENDING || this == RETRY;
  }

  /**
   * Parses a stored state value.
   *
   * @param value the raw field value
   * @return the state, or {@code null} if the value is absent or not a known state name
   */
  public static DeliveryState parse(Object value) {
    if (!(value instanceof String name)) {
      return null;
    }
    for (DeliveryState state : values()) {
      if (state.name().equals(name)) {
        return state;
      }
    }
    return null;
  }
}

package mailqueue.model;

import mailqueue.spi.SendResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transport acceptance detail stored as {@code delivery.info} after a successful attempt.
 */
public record DeliveryInfo(
    String messageId,
    List<String> accepted,
    List<String> rejected,
    List<String> pending,
    String response
) {

  public DeliveryInfo {
    accepted = accepted == null ? List.of() : List.copyOf(accepted);
    rejected = rejected == null ? List.of() : List.copyOf(rejected);
    pending = pending == null ? List.of() : List.copyOf(pending);
  }

  public static DeliveryInfo from(SendResult result) {
    return new DeliveryInfo(result.messageId(), result.accepted(), result.rejected(),
        result.pending(), result.response());
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("messageId", messageId);
    map.put("accepted", new ArrayList<>(accepted));
    map.put("rejected", new ArrayList<>(rejected));
    map.put("pending", new ArrayList<>(pending));
    map.put("response", response);
    return map;
  }

  /**
   * Reads a stored info map; unexpected value types are treated as absent.
   */
  public static DeliveryInfo fromMap(Map<?, ?> map) {
    return new DeliveryInfo(
        asString(map.get("messageId")),
        asStrings(map.get("accepted")),
        asStrings(map.get("rejected")),
        asStrings(map.get("pending")),
        asString(map.get("response")));
  }

  private static String asString(Object value) {
    return value instanceof String s ? s : null;
  }

  private static List<String> asStrings(Object value) {
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    List<String> result = new ArrayList<>(list.size());
    for (Object item : list) {
      if (item != null) {
        result.add(item.toString());
      }
    }
    return result;
  }
}

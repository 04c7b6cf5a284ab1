package mailqueue.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FieldPathsTest {

  @Test
  void getReadsNestedValue() {
    Map<String, Object> data = Map.of("delivery", Map.of("state", "PENDING"));

    assertEquals("PENDING", FieldPaths.get(data, "delivery.state"));
    assertEquals(Map.of("state", "PENDING"), FieldPaths.get(data, "delivery"));
  }

  @Test
  void getReturnsNullForMissingOrNonMapSegment() {
    Map<String, Object> data = Map.of("delivery", "oops");

    assertNull(FieldPaths.get(data, "delivery.state"));
    assertNull(FieldPaths.get(data, "message.to"));
  }

  @Test
  void setCreatesIntermediateMaps() {
    Map<String, Object> data = new LinkedHashMap<>();

    FieldPaths.set(data, "delivery.info.messageId", "<1@x>");

    assertEquals("<1@x>", FieldPaths.get(data, "delivery.info.messageId"));
  }

  @Test
  void setKeepsSiblingFields() {
    Map<String, Object> delivery = new LinkedHashMap<>();
    delivery.put("state", "PENDING");
    delivery.put("attempts", 0);
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("delivery", delivery);

    FieldPaths.set(data, "delivery.state", "PROCESSING");

    assertEquals("PROCESSING", FieldPaths.get(data, "delivery.state"));
    assertEquals(0, FieldPaths.get(data, "delivery.attempts"));
  }

  @Test
  void setStoresExplicitNull() {
    Map<String, Object> data = new LinkedHashMap<>();

    FieldPaths.set(data, "delivery.error", null);

    @SuppressWarnings("unchecked")
    Map<String, Object> delivery = (Map<String, Object>) data.get("delivery");
    assertTrue(delivery.containsKey("error"));
    assertNull(delivery.get("error"));
  }

  @Test
  void deepCopyDetachesNestedCollections() {
    List<Object> to = new ArrayList<>(List.of("a@x.com"));
    Map<String, Object> message = new LinkedHashMap<>();
    message.put("to", to);
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("message", message);

    Map<String, Object> copy = FieldPaths.deepCopy(data);
    to.add("b@x.com");
    message.put("subject", "changed");

    assertEquals(List.of("a@x.com"), FieldPaths.get(copy, "message.to"));
    assertNull(FieldPaths.get(copy, "message.subject"));
  }

  @Test
  void projectKeepsOnlyMaskedFields() {
    Map<String, Object> data = Map.of("email", "a@x.com", "name", "A");

    assertEquals(Map.of("email", "a@x.com"), FieldPaths.project(data, Set.of("email")));
    assertSame(data, FieldPaths.project(data, null));
  }

  @Test
  void rejectsMalformedPath() {
    assertThrows(IllegalArgumentException.class, () -> FieldPaths.get(Map.of(), ""));
    assertThrows(IllegalArgumentException.class, () -> FieldPaths.get(Map.of(), "a..b"));
    assertThrows(IllegalArgumentException.class, () -> FieldPaths.set(new LinkedHashMap<>(), ".a", 1));
  }
}

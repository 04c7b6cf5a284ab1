package mailqueue.payload;

import mailqueue.InvalidMessageException;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.TemplateException;
import mailqueue.spi.TemplateRenderer;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TemplateExpanderTest {
  private static final DocumentRef REF = new DocumentRef("mail", "m1");

  @Test
  void messageWithoutTemplateIsCopiedUnchanged() throws Exception {
    Map<String, Object> message = Map.of("to", "a@x.com", "subject", "s");

    Map<String, Object> expanded = new TemplateExpander(null).expand(REF, message);

    assertEquals(message, expanded);
  }

  @Test
  void renderedFieldsAreAddedWithTemplateData() throws Exception {
    AtomicReference<Map<String, Object>> seenData = new AtomicReference<>();
    TemplateRenderer renderer = (name, data) -> {
      seenData.set(data);
      return Map.of("subject", "Hi " + data.get("user"), "html", "<p>" + name + "</p>");
    };

    Map<String, Object> expanded = new TemplateExpander(renderer).expand(REF,
        Map.of("to", "a@x.com", "template", Map.of("name", "welcome", "data", Map.of("user", "Ada"))));

    assertEquals(Map.of("user", "Ada"), seenData.get());
    assertEquals("Hi Ada", expanded.get("subject"));
    assertEquals("<p>welcome</p>", expanded.get("html"));
    assertEquals("a@x.com", expanded.get("to"));
  }

  @Test
  void explicitMessageFieldsWinOverRenderedOnes() throws Exception {
    TemplateRenderer renderer = (name, data) -> Map.of("subject", "Hi", "text", "rendered");

    Map<String, Object> expanded = new TemplateExpander(renderer).expand(REF,
        Map.of("subject", "Bye", "template", Map.of("name", "welcome")));

    assertEquals("Bye", expanded.get("subject"));
    assertEquals("rendered", expanded.get("text"));
  }

  @Test
  void explicitNullDoesNotHideRenderedField() throws Exception {
    TemplateRenderer renderer = (name, data) -> Map.of("subject", "Hi");
    Map<String, Object> message = new HashMap<>();
    message.put("subject", null);
    message.put("template", Map.of("name", "welcome"));

    assertEquals("Hi", new TemplateExpander(renderer).expand(REF, message).get("subject"));
  }

  @Test
  void templateWithoutNameIsRejected() {
    TemplateRenderer renderer = (name, data) -> Map.of();

    assertThrows(InvalidMessageException.class, () -> new TemplateExpander(renderer).expand(REF,
        Map.of("template", Map.of("data", Map.of()))));
  }

  @Test
  void renderFailurePropagates() {
    TemplateRenderer renderer = (name, data) -> {
      throw new TemplateException("Template not found: " + name);
    };

    TemplateException e = assertThrows(TemplateException.class, () -> new TemplateExpander(renderer).expand(REF,
        Map.of("template", Map.of("name", "nope"))));
    assertEquals("Template not found: nope", e.getMessage());
  }

  @Test
  void templateIsLeftUnrenderedWithoutRenderer() throws Exception {
    Map<String, Object> expanded = new TemplateExpander(null).expand(REF,
        Map.of("subject", "s", "template", Map.of("name", "welcome")));

    assertEquals("s", expanded.get("subject"));
    assertFalse(expanded.containsKey("html"));
  }
}

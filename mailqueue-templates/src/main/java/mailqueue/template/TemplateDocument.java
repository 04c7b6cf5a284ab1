package mailqueue.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One document of the templates collection.
 *
 * @param name        document id, used as the template name
 * @param fields      template sources by field: {@code subject}, {@code html}, {@code text}, {@code amp}
 * @param attachments attachment descriptors whose string values are templates themselves
 * @param partial     whether this document is a partial, includable from other templates but not
 *                    renderable on its own
 */
record TemplateDocument(String name, Map<String, String> fields, List<Map<String, Object>> attachments,
                        boolean partial) {

  static final List<String> FIELDS = List.of("subject", "html", "text", "amp");

  static TemplateDocument from(String name, Map<String, Object> data) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (String field : FIELDS) {
      if (data.get(field) instanceof String source) {
        fields.put(field, source);
      }
    }
    List<Map<String, Object>> attachments = new ArrayList<>();
    if (data.get("attachments") instanceof List<?> list) {
      for (Object item : list) {
        if (item instanceof Map<?, ?> map) {
          Map<String, Object> attachment = new LinkedHashMap<>();
          map.forEach((k, v) -> attachment.put(String.valueOf(k), v));
          attachments.add(Collections.unmodifiableMap(attachment));
        }
      }
    }
    return new TemplateDocument(name, Collections.unmodifiableMap(fields),
        Collections.unmodifiableList(attachments), Boolean.TRUE.equals(data.get("partial")));
  }

  /**
   * Looks up a template source by path relative to this document: a field name, or
   * {@code attachments/<index>/<key>}.
   *
   * @return the source, or {@code null} if the path names nothing renderable
   */
  String source(String path) {
    if (!path.startsWith("attachments/")) {
      return fields.get(path);
    }
    String[] parts = path.split("/", 3);
    if (parts.length != 3) {
      return null;
    }
    if (parts[1].isEmpty() || parts[1].length() > 9 || !parts[1].chars().allMatch(Character::isDigit)) {
      return null;
    }
    int index = Integer.parseInt(parts[1]);
    if (index >= attachments.size()) {
      return null;
    }
    return attachments.get(index).get(parts[2]) instanceof String source ? source : null;
  }
}

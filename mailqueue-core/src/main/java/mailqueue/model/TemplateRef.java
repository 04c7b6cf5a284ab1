package mailqueue.model;

import mailqueue.InvalidMessageException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code message.template} field: which template to render and with what variables.
 *
 * @param name template name
 * @param data template variables, empty if none were given
 */
public record TemplateRef(String name, Map<String, Object> data) {
  public static final String MISSING_NAME = "Template object is missing a 'name' parameter.";

  public TemplateRef {
    Objects.requireNonNull(name, "name");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  /**
   * Decodes a raw {@code template} field.
   *
   * @throws InvalidMessageException if the value is not a map with a non-empty string name
   */
  public static TemplateRef parse(Object value) throws InvalidMessageException {
    if (!(value instanceof Map<?, ?> map)
        || !(map.get("name") instanceof String name)
        || name.isEmpty()) {
      throw new InvalidMessageException(MISSING_NAME);
    }
    Map<String, Object> data = new LinkedHashMap<>();
    if (map.get("data") instanceof Map<?, ?> raw) {
      for (Map.Entry<?, ?> entry : raw.entrySet()) {
        if (entry.getValue() != null) {
          data.put(String.valueOf(entry.getKey()), entry.getValue());
        }
      }
    }
    return new TemplateRef(name, data);
  }
}

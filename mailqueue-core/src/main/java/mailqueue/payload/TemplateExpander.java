package mailqueue.payload;

import mailqueue.DeliveryException;
import mailqueue.model.MessageFields;
import mailqueue.model.TemplateRef;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.TemplateRenderer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders {@code message.template} and merges the result into the message.
 *
 * <p>Fields set on the message itself take precedence over rendered fields, so a caller can
 * override e.g. the subject of a shared template.
 */
public final class TemplateExpander {
  private static final Logger logger = Logger.getLogger(TemplateExpander.class.getName());

  private final TemplateRenderer renderer;

  /**
   * @param renderer template renderer, or {@code null} if no templates source is configured
   */
  public TemplateExpander(TemplateRenderer renderer) {
    this.renderer = renderer;
  }

  /**
   * @return a new map holding the merged fields; the input is not modified
   * @throws mailqueue.InvalidMessageException if {@code template} has no name
   * @throws mailqueue.spi.TemplateException   if rendering fails
   */
  public Map<String, Object> expand(DocumentRef ref, Map<String, Object> message) throws DeliveryException {
    Object templateValue = message.get(MessageFields.TEMPLATE);
    if (templateValue == null) {
      return new LinkedHashMap<>(message);
    }
    TemplateRef template = TemplateRef.parse(templateValue);
    if (renderer == null) {
      logger.log(Level.WARNING, "Message " + ref + " uses template '" + template.name()
          + "' but no templates collection is configured; sending it unrendered");
      return new LinkedHashMap<>(message);
    }

    Map<String, Object> merged = new LinkedHashMap<>(renderer.render(template.name(), template.data()));
    for (Map.Entry<String, Object> entry : message.entrySet()) {
      if (entry.getValue() != null) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    return merged;
  }
}

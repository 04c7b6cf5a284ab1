package mailqueue.spi;

import java.util.Map;

/**
 * Renders a named template into message fields ({@code subject}, {@code text}, {@code html}, ...).
 *
 * <p>Shared across deliveries; implementations must be thread-safe.
 */
@FunctionalInterface
public interface TemplateRenderer {

  /**
   * @param name template name
   * @param data template variables, never {@code null}
   * @return rendered fields; only fields the template defines are present
   * @throws TemplateException if the template does not exist or fails to render
   */
  Map<String, Object> render(String name, Map<String, Object> data) throws TemplateException;
}

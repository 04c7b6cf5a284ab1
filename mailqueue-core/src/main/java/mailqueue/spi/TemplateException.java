package mailqueue.spi;

import mailqueue.DeliveryException;

/**
 * Thrown by a {@link TemplateRenderer} when a template is unknown or fails to render.
 */
public class TemplateException extends DeliveryException {

  public TemplateException(String message) {
    super(message);
  }

  public TemplateException(String message, Throwable cause) {
    super(message, cause);
  }
}

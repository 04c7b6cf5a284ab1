package mailqueue.spring.boot;

import mailqueue.trigger.ChangeListener;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects beans annotated with {@link MailQueueListener}, keyed by collection.
 */
final class MailQueueListeners {

  private MailQueueListeners() {
  }

  static Map<String, ChangeListener> scan(ListableBeanFactory beanFactory) {
    Map<String, ChangeListener> listeners = new LinkedHashMap<>();
    Map<String, String> owners = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : beanFactory.getBeansWithAnnotation(MailQueueListener.class).entrySet()) {
      String beanName = entry.getKey();
      Object bean = entry.getValue();

      if (!(bean instanceof ChangeListener listener)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with @MailQueueListener must implement ChangeListener, "
                + "but " + bean.getClass().getName() + " does not");
      }
      // Proxies may hide the annotation
      MailQueueListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), MailQueueListener.class);
      if (annotation == null) {
        throw new BeanCreationException(beanName,
            "Could not find @MailQueueListener annotation on " + bean.getClass().getName());
      }
      String collection = annotation.value();
      if (collection.isEmpty()) {
        throw new BeanCreationException(beanName, "@MailQueueListener must name a collection");
      }
      String previous = owners.putIfAbsent(collection, beanName);
      if (previous != null) {
        throw new BeanCreationException(beanName,
            "Collection '" + collection + "' already has a listener: " + previous);
      }
      listeners.put(collection, listener);
    }
    return listeners;
  }
}

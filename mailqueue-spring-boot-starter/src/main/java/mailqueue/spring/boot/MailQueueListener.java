package mailqueue.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a listener for committed changes of one collection.
 *
 * <p>The annotated bean must implement {@link mailqueue.trigger.ChangeListener}. It runs on the
 * mail queue's trigger workers alongside delivery.
 *
 * <pre>{@code
 * @Component
 * @MailQueueListener("mail")
 * public class DeliveryAudit implements ChangeListener {
 *   public void onChange(DocumentChange change) { ... }
 * }
 * }</pre>
 *
 * <p>The collection must not be one the queue itself listens to; {@link MailQueueListeners}
 * rejects duplicates.
 *
 * @see MailQueueListeners
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MailQueueListener {

    /**
     * Collection whose changes the listener receives.
     */
    String value();
}

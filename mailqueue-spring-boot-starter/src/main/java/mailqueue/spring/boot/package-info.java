/**
 * Spring Boot auto-configuration for the mail queue, bound to {@code mailqueue.*} properties.
 *
 * @see mailqueue.spring.boot.MailQueueAutoConfiguration
 * @see mailqueue.spring.boot.MailQueueProperties
 */
package mailqueue.spring.boot;

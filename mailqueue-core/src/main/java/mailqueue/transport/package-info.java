/**
 * Built-in {@link mailqueue.spi.MailTransport} for testing mode.
 */
package mailqueue.transport;

/**
 * Payload preparation: template expansion, recipient resolution and the final
 * {@link mailqueue.spi.OutgoingMail}.
 */
package mailqueue.payload;

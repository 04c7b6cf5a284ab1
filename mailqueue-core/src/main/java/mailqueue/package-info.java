/**
 * Mail queue: delivers message documents written to a document store.
 *
 * <p>{@link mailqueue.MailQueue} is the entry point. Failures of a single attempt are modelled
 * by the checked {@link mailqueue.DeliveryException} hierarchy and end up on the document as
 * {@code delivery.error}.
 */
package mailqueue;

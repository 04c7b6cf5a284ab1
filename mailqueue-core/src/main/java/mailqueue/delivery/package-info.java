/**
 * The delivery lifecycle: {@link mailqueue.delivery.DeliveryStateMachine} owns the transitions
 * of the {@code delivery} record, {@link mailqueue.delivery.DeliveryDispatcher} decides which
 * one a change calls for and runs the attempt between claim and completion.
 */
package mailqueue.delivery;

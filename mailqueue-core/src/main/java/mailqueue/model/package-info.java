/**
 * Message document model: the {@code message} field names and the {@code delivery}
 * status record with its states.
 */
package mailqueue.model;

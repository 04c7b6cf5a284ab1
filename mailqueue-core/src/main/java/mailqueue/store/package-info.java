/**
 * Document store building blocks: dotted field paths, buffered transactions with optimistic
 * commit and conflict retry, and the in-memory store.
 */
package mailqueue.store;

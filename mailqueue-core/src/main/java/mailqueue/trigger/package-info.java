/**
 * Change notification plumbing: after-commit hook, bounded worker pool, and per-collection
 * listener routing.
 */
package mailqueue.trigger;

/**
 * Small concurrency helpers.
 */
package mailqueue.util;

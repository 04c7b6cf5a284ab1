/**
 * Uid-to-address lookup over a users collection.
 */
package mailqueue.directory;

package mailqueue.spi;

import java.util.List;
import java.util.Map;

/**
 * Batch lookup of email addresses by user identifier.
 *
 * @see mailqueue.directory.DocumentUserDirectory
 */
@FunctionalInterface
public interface UserDirectory {

  /**
   * Resolves identifiers in a single batch.
   *
   * @param uids distinct user identifiers
   * @return email address per identifier; identifiers without an address are absent
   */
  Map<String, String> lookupEmails(List<String> uids);
}

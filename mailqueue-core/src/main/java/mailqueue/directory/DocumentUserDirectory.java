package mailqueue.directory;

import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.DocumentStore;
import mailqueue.spi.UserDirectory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link UserDirectory} over a users collection whose documents carry an {@code email} field.
 *
 * <p>Each lookup is one batched read that fetches only the {@code email} field.
 */
public final class DocumentUserDirectory implements UserDirectory {
  public static final String EMAIL_FIELD = "email";

  private final DocumentStore store;
  private final String usersCollection;

  public DocumentUserDirectory(DocumentStore store, String usersCollection) {
    this.store = Objects.requireNonNull(store, "store");
    this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
  }

  public String usersCollection() {
    return usersCollection;
  }

  @Override
  public Map<String, String> lookupEmails(List<String> uids) {
    Map<String, String> emails = new LinkedHashMap<>();
    if (uids.isEmpty()) {
      return emails;
    }
    for (DocumentSnapshot user : store.getAll(usersCollection, uids, Set.of(EMAIL_FIELD))) {
      if (user.get(EMAIL_FIELD) instanceof String email && !email.isEmpty()) {
        emails.put(user.ref().id(), email);
      }
    }
    return emails;
  }
}

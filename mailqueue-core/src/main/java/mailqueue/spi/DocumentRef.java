package mailqueue.spi;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * Address of a single document: the collection it lives in plus its id.
 *
 * <p>Collection names may contain {@code /} to express nested paths
 * (e.g. {@code tenants/acme/mail}); ids may not.
 */
public record DocumentRef(String collection, String id) {

  public DocumentRef {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(id, "id");
    if (collection.isEmpty()) {
      throw new IllegalArgumentException("collection must not be empty");
    }
    if (id.isEmpty() || id.indexOf('/') >= 0) {
      throw new IllegalArgumentException("Invalid document id: " + id);
    }
  }

  /**
   * Creates a reference with a new id in the given collection. Ids are monotonic ULIDs, so
   * documents created later sort after earlier ones.
   *
   * @param collection the collection path
   * @return a new reference
   */
  public static DocumentRef newRef(String collection) {
    return new DocumentRef(collection, UlidCreator.getMonotonicUlid().toString());
  }

  /**
   * Returns {@code collection/id}.
   */
  public String path() {
    return collection + "/" + id;
  }

  @Override
  public String toString() {
    return path();
  }
}

package mailqueue.spi;

import java.util.Objects;

/**
 * A committed write to one document, described by its state before and after the commit.
 *
 * <p>Creation has a non-existent {@code before}; deletion has a non-existent {@code after}.
 * Notifications carrying a change may be delivered more than once.
 */
public record DocumentChange(DocumentSnapshot before, DocumentSnapshot after) {

  public DocumentChange {
    Objects.requireNonNull(before, "before");
    Objects.requireNonNull(after, "after");
    if (!before.ref().equals(after.ref())) {
      throw new IllegalArgumentException("before and after refer to different documents: "
          + before.ref() + " vs " + after.ref());
    }
  }

  public DocumentRef ref() {
    return after.ref();
  }

  public boolean isCreate() {
    return !before.exists() && after.exists();
  }

  public boolean isDelete() {
    return !after.exists();
  }
}

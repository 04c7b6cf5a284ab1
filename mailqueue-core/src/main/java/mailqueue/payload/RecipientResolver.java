package mailqueue.payload;

import mailqueue.DeliveryException;
import mailqueue.InvalidMessageException;
import mailqueue.MissingConfigurationException;
import mailqueue.model.MessageFields;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.UserDirectory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the recipient fields of a {@code message} map into address lists.
 *
 * <p>{@code to}, {@code cc} and {@code bcc} may each be a single address or a list of
 * addresses. If any of {@code toUids}, {@code ccUids} or {@code bccUids} is present, the
 * message is addressed by user id instead: all ids are looked up in one batch, and the direct
 * address fields are ignored. Ids without an address are logged and left out.
 */
public final class RecipientResolver {
  private static final Logger logger = Logger.getLogger(RecipientResolver.class.getName());

  public static final String USERS_COLLECTION_REQUIRED = "Must specify a users collection to send using uids.";

  private final UserDirectory userDirectory;

  /**
   * @param userDirectory id lookup, or {@code null} if no users collection is configured
   */
  public RecipientResolver(UserDirectory userDirectory) {
    this.userDirectory = userDirectory;
  }

  /**
   * @param ref     the message document, for logging
   * @param message the {@code message} map
   * @throws InvalidMessageException       if a recipient field is neither a string nor a list of strings
   * @throws MissingConfigurationException if ids are used but no user directory is configured
   */
  public Recipients resolve(DocumentRef ref, Map<String, Object> message) throws DeliveryException {
    List<String> to = addresses(MessageFields.TO, message.get(MessageFields.TO));
    List<String> cc = addresses(MessageFields.CC, message.get(MessageFields.CC));
    List<String> bcc = addresses(MessageFields.BCC, message.get(MessageFields.BCC));

    Object toUidsValue = message.get(MessageFields.TO_UIDS);
    Object ccUidsValue = message.get(MessageFields.CC_UIDS);
    Object bccUidsValue = message.get(MessageFields.BCC_UIDS);
    if (toUidsValue == null && ccUidsValue == null && bccUidsValue == null) {
      return new Recipients(to, cc, bcc, List.of());
    }
    if (userDirectory == null) {
      throw new MissingConfigurationException(USERS_COLLECTION_REQUIRED);
    }

    List<String> toUids = stringList(MessageFields.TO_UIDS, toUidsValue);
    List<String> ccUids = stringList(MessageFields.CC_UIDS, ccUidsValue);
    List<String> bccUids = stringList(MessageFields.BCC_UIDS, bccUidsValue);

    LinkedHashSet<String> distinct = new LinkedHashSet<>();
    distinct.addAll(toUids);
    distinct.addAll(ccUids);
    distinct.addAll(bccUids);
    Map<String, String> emails = userDirectory.lookupEmails(new ArrayList<>(distinct));

    List<String> missing = new ArrayList<>();
    for (String uid : distinct) {
      if (!emails.containsKey(uid)) {
        missing.add(uid);
      }
    }
    if (!missing.isEmpty()) {
      logger.log(Level.WARNING, "The following uids were provided, however a document does not exist "
          + "or has no 'email' field: " + String.join(",", missing) + " (message " + ref + ")");
    }

    return new Recipients(lookup(toUids, emails), lookup(ccUids, emails), lookup(bccUids, emails), missing);
  }

  private static List<String> lookup(List<String> uids, Map<String, String> emails) {
    List<String> result = new ArrayList<>(uids.size());
    for (String uid : uids) {
      String email = emails.get(uid);
      if (email != null) {
        result.add(email);
      }
    }
    return result;
  }

  private static List<String> addresses(String field, Object value) throws InvalidMessageException {
    if (value instanceof String address) {
      return List.of(address);
    }
    return stringList(field, value);
  }

  private static List<String> stringList(String field, Object value) throws InvalidMessageException {
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw invalidField(field);
    }
    List<String> result = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof String s)) {
        throw invalidField(field);
      }
      result.add(s);
    }
    return result;
  }

  private static InvalidMessageException invalidField(String field) {
    return new InvalidMessageException("Invalid field \"" + field + "\". Expected an array of strings.");
  }
}

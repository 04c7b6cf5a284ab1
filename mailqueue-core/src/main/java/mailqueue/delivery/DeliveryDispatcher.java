package mailqueue.delivery;

import mailqueue.model.Delivery;
import mailqueue.model.DeliveryInfo;
import mailqueue.payload.PayloadPreparer;
import mailqueue.spi.DocumentChange;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.MailTransport;
import mailqueue.spi.MetricsExporter;
import mailqueue.spi.OutgoingMail;
import mailqueue.spi.SendResult;
import mailqueue.trigger.ChangeListener;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles changes of message documents.
 *
 * <ul>
 *   <li>deletion: ignored</li>
 *   <li>creation: the document is initialized to {@code PENDING}; the resulting update is what
 *       triggers the attempt</li>
 *   <li>update in {@code PENDING} or {@code RETRY}: claim, prepare, send, record the outcome</li>
 *   <li>update in {@code PROCESSING}: a stale claim is moved to {@code ERROR}, a live one is left
 *       to its owner</li>
 *   <li>update in {@code SUCCESS} or {@code ERROR}: ignored</li>
 * </ul>
 *
 * <p>Nothing is thrown back to the caller. Attempt failures end up on the document; anything
 * else is logged.
 */
public final class DeliveryDispatcher implements ChangeListener {
  private static final Logger logger = Logger.getLogger(DeliveryDispatcher.class.getName());

  private final DeliveryStateMachine stateMachine;
  private final PayloadPreparer payloadPreparer;
  private final Supplier<MailTransport> transport;
  private final MetricsExporter metrics;

  /**
   * @param transport supplies the shared transport; called once per attempt, after the claim
   */
  public DeliveryDispatcher(DeliveryStateMachine stateMachine, PayloadPreparer payloadPreparer,
      Supplier<MailTransport> transport, MetricsExporter metrics) {
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
    this.payloadPreparer = Objects.requireNonNull(payloadPreparer, "payloadPreparer");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  @Override
  public void onChange(DocumentChange change) {
    logger.log(Level.FINE, "Started processing change of " + change.ref());
    try {
      process(change);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Unhandled error processing change of " + change.ref(), e);
      return;
    }
    logger.log(Level.FINE, "Completed processing change of " + change.ref());
  }

  private void process(DocumentChange change) {
    if (change.isDelete()) {
      return;
    }
    DocumentRef ref = change.ref();
    if (change.isCreate()) {
      stateMachine.initialize(ref);
      return;
    }

    Optional<Delivery> delivery = Delivery.fromDocument(change.after());
    if (delivery.isEmpty()) {
      logger.log(Level.WARNING, "Message " + ref + " is missing 'delivery' field");
      return;
    }
    if (delivery.get().state() == null) {
      logger.log(Level.WARNING, "Message " + ref + " has an unrecognized delivery state: "
          + change.after().get(Delivery.STATE));
      return;
    }

    switch (delivery.get().state()) {
      case SUCCESS, ERROR -> { }
      case PROCESSING -> {
        if (delivery.get().leaseExpired(stateMachine.clock().instant())) {
          stateMachine.expireLease(ref);
        }
      }
      case PENDING, RETRY -> stateMachine.claim(ref).ifPresent(this::attempt);
    }
  }

  private void attempt(Claim claim) {
    logger.log(Level.INFO, "Attempting delivery for message: " + claim.ref());
    long start = System.nanoTime();
    DeliveryOutcome outcome;
    try {
      OutgoingMail mail = payloadPreparer.prepare(claim.ref(), claim.message());
      SendResult result = transport.get().send(mail);
      DeliveryInfo info = DeliveryInfo.from(result);
      outcome = new DeliveryOutcome.Delivered(info);
      logger.log(Level.INFO, "Delivered message: " + claim.ref() + " successfully. messageId: "
          + info.messageId() + " accepted: " + info.accepted() + " rejected: " + info.rejected()
          + " pending: " + info.pending() + " response: " + info.response());
    } catch (Exception e) {
      outcome = DeliveryOutcome.Failed.of(e);
      logger.log(Level.WARNING, "Error when delivering message=" + claim.ref() + ": " + e, e);
    }
    stateMachine.complete(claim, outcome);
    metrics.recordAttemptDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
  }
}

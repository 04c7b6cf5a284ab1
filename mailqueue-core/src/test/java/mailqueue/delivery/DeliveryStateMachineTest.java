package mailqueue.delivery;

import mailqueue.LeaseExpiredException;
import mailqueue.MutableClock;
import mailqueue.model.DeliveryInfo;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryStateMachineTest {
  private static final DocumentRef REF = new DocumentRef("mail", "m1");
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final MutableClock clock = new MutableClock(T0);
  private final InMemoryDocumentStore store = new InMemoryDocumentStore(clock);
  private final CountingMetrics metrics = new CountingMetrics();
  private DeliveryStateMachine machine;

  @BeforeEach
  void setUp() {
    machine = new DeliveryStateMachine(store, clock, Duration.ofSeconds(60), metrics);
    store.create(REF, Map.of("message", Map.of("to", "a@x.com")));
  }

  // ── initialize ──────────────────────────────────────────────────

  @Test
  void initializeSetsPendingWithZeroAttempts() {
    assertTrue(machine.initialize(REF));

    DocumentSnapshot doc = store.get(REF);
    assertEquals("PENDING", doc.get("delivery.state"));
    assertEquals(0, doc.get("delivery.attempts"));
    assertEquals(T0, doc.get("delivery.startTime"));
    assertTrue(((Map<?, ?>) doc.get("delivery")).containsKey("error"));
    assertNull(doc.get("delivery.error"));
    assertEquals(1, metrics.initialized.get());
  }

  @Test
  void repeatedInitializeKeepsTheFirstRecord() {
    machine.initialize(REF);
    long version = store.get(REF).version();
    clock.advance(Duration.ofSeconds(1));

    assertFalse(machine.initialize(REF));
    assertEquals(version, store.get(REF).version());
    assertEquals(T0, store.get(REF).get("delivery.startTime"));
  }

  @Test
  void initializeReplacesRecordWrittenByTheCreator() {
    InMemoryDocumentStore fresh = new InMemoryDocumentStore(clock);
    DeliveryStateMachine freshMachine = new DeliveryStateMachine(fresh, clock, Duration.ofSeconds(60), metrics);
    fresh.create(REF, Map.of("message", Map.of("to", "a@x.com"),
        "delivery", Map.of("state", "PENDING", "attempts", 7, "error", "copied")));

    assertTrue(freshMachine.initialize(REF));

    DocumentSnapshot doc = fresh.get(REF);
    assertEquals("PENDING", doc.get("delivery.state"));
    assertEquals(0, doc.get("delivery.attempts"));
    assertNull(doc.get("delivery.error"));
    assertEquals(T0, doc.get("delivery.startTime"));
  }

  @Test
  void initializeIgnoresMissingDocument() {
    assertFalse(machine.initialize(new DocumentRef("mail", "gone")));
    assertEquals(1, store.size());
  }

  // ── claim ───────────────────────────────────────────────────────

  @Test
  void claimGrantsLeaseOfExactlyLeaseDuration() {
    machine.initialize(REF);
    clock.advance(Duration.ofSeconds(3));

    Claim claim = machine.claim(REF).orElseThrow();

    DocumentSnapshot doc = store.get(REF);
    assertEquals("PROCESSING", doc.get("delivery.state"));
    assertEquals(T0.plusSeconds(63), doc.get("delivery.leaseExpireTime"));
    assertEquals(T0.plusSeconds(3), claim.claimTime());
    assertEquals(Duration.ofSeconds(60), Duration.between(claim.claimTime(), claim.leaseExpireTime()));
    assertEquals(Map.of("to", "a@x.com"), claim.message());
  }

  @Test
  void secondClaimIsRefused() {
    machine.initialize(REF);

    assertTrue(machine.claim(REF).isPresent());
    assertTrue(machine.claim(REF).isEmpty());
    assertEquals(1, metrics.claimed.get());
    assertEquals(1, metrics.claimSkipped.get());
  }

  @Test
  void retryStateIsClaimable() {
    store.update(REF, Map.of("delivery", Map.of("state", "RETRY", "attempts", 1)));

    assertTrue(machine.claim(REF).isPresent());
  }

  @Test
  void terminalAndUnknownStatesAreNotClaimable() {
    store.update(REF, Map.of("delivery.state", "SUCCESS"));
    assertTrue(machine.claim(REF).isEmpty());

    store.update(REF, Map.of("delivery.state", "ERROR"));
    assertTrue(machine.claim(REF).isEmpty());

    store.update(REF, Map.of("delivery.state", "PAUSED"));
    assertTrue(machine.claim(REF).isEmpty());
  }

  @Test
  void concurrentClaimsOfOnePendingMessageHaveOneWinner() throws Exception {
    machine.initialize(REF);
    int contenders = 8;
    ExecutorService pool = Executors.newFixedThreadPool(contenders);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Optional<Claim>>> results = new ArrayList<>();
      for (int i = 0; i < contenders; i++) {
        results.add(pool.submit(() -> {
          start.await();
          return machine.claim(REF);
        }));
      }
      start.countDown();

      int winners = 0;
      for (Future<Optional<Claim>> result : results) {
        if (result.get(5, TimeUnit.SECONDS).isPresent()) {
          winners++;
        }
      }
      assertEquals(1, winners);
      assertEquals(1, metrics.claimed.get());
      assertEquals(contenders - 1, metrics.claimSkipped.get());
    } finally {
      pool.shutdownNow();
    }
  }

  // ── complete ────────────────────────────────────────────────────

  @Test
  void successIncrementsAttemptsAndRecordsInfo() {
    machine.initialize(REF);
    Claim claim = machine.claim(REF).orElseThrow();
    clock.advance(Duration.ofSeconds(2));

    machine.complete(claim, new DeliveryOutcome.Delivered(
        new DeliveryInfo("<1@x>", List.of("a@x.com"), List.of(), List.of(), "250 OK")));

    DocumentSnapshot doc = store.get(REF);
    assertEquals("SUCCESS", doc.get("delivery.state"));
    assertEquals(1, doc.get("delivery.attempts"));
    assertEquals(T0.plusSeconds(2), doc.get("delivery.endTime"));
    assertNull(doc.get("delivery.leaseExpireTime"));
    assertNull(doc.get("delivery.error"));
    assertEquals(List.of("a@x.com"), doc.get("delivery.info.accepted"));
    assertEquals("<1@x>", doc.get("delivery.info.messageId"));
  }

  @Test
  void failureRecordsErrorDescription() {
    store.update(REF, Map.of("delivery", Map.of("state", "RETRY", "attempts", 2, "error", "old")));
    Claim claim = machine.claim(REF).orElseThrow();

    machine.complete(claim, new DeliveryOutcome.Failed("Connection refused"));

    DocumentSnapshot doc = store.get(REF);
    assertEquals("ERROR", doc.get("delivery.state"));
    assertEquals(3, doc.get("delivery.attempts"));
    assertEquals("Connection refused", doc.get("delivery.error"));
    assertNull(doc.get("delivery.leaseExpireTime"));
    assertEquals(1, metrics.failed.get());
  }

  @Test
  void lateCompletionReplacesLeaseExpiryError() {
    machine.initialize(REF);
    Claim claim = machine.claim(REF).orElseThrow();
    clock.advance(Duration.ofSeconds(90));
    assertTrue(machine.expireLease(REF));

    assertTrue(machine.complete(claim, new DeliveryOutcome.Delivered(
        new DeliveryInfo("<1@x>", List.of("a@x.com"), List.of(), List.of(), "250 OK"))));

    DocumentSnapshot doc = store.get(REF);
    assertEquals("SUCCESS", doc.get("delivery.state"));
    assertEquals(1, doc.get("delivery.attempts"));
    assertNull(doc.get("delivery.error"));
  }

  @Test
  void completionOfDeletedDocumentIsDropped() {
    machine.initialize(REF);
    Claim claim = machine.claim(REF).orElseThrow();
    store.delete(REF);

    assertFalse(machine.complete(claim, new DeliveryOutcome.Failed("x")));
    assertFalse(store.get(REF).exists());
  }

  @Test
  void failedOutcomeFallsBackToExceptionType() {
    assertEquals("IllegalStateException", DeliveryOutcome.Failed.of(new IllegalStateException()).error());
    assertEquals("boom", DeliveryOutcome.Failed.of(new RuntimeException("boom")).error());
  }

  // ── expireLease ─────────────────────────────────────────────────

  @Test
  void expiredLeaseMovesToErrorWithoutCountingAnAttempt() {
    machine.initialize(REF);
    machine.claim(REF).orElseThrow();
    clock.advance(Duration.ofSeconds(61));

    assertTrue(machine.expireLease(REF));

    DocumentSnapshot doc = store.get(REF);
    assertEquals("ERROR", doc.get("delivery.state"));
    assertEquals(LeaseExpiredException.MESSAGE, doc.get("delivery.error"));
    assertEquals(0, doc.get("delivery.attempts"));
    assertNull(doc.get("delivery.leaseExpireTime"));
    assertEquals(1, metrics.leaseExpired.get());
  }

  @Test
  void liveLeaseIsLeftAlone() {
    machine.initialize(REF);
    machine.claim(REF).orElseThrow();
    clock.advance(Duration.ofSeconds(60));

    assertFalse(machine.expireLease(REF));
    assertEquals("PROCESSING", store.get(REF).get("delivery.state"));
  }

  @Test
  void processingWithoutLeaseIsExpired() {
    Map<String, Object> delivery = new HashMap<>();
    delivery.put("state", "PROCESSING");
    delivery.put("leaseExpireTime", null);
    store.update(REF, Map.of("delivery", delivery));

    assertTrue(machine.expireLease(REF));
  }

  @Test
  void expireLeaseIgnoresOtherStates() {
    machine.initialize(REF);

    assertFalse(machine.expireLease(REF));
    assertEquals("PENDING", store.get(REF).get("delivery.state"));
  }

  @Test
  void rejectsNonPositiveLease() {
    assertThrows(IllegalArgumentException.class,
        () -> new DeliveryStateMachine(store, clock, Duration.ZERO, null));
  }

  @Test
  void emptyClaimForMissingDocument() {
    Optional<Claim> claim = machine.claim(new DocumentRef("mail", "gone"));

    assertTrue(claim.isEmpty());
  }
}

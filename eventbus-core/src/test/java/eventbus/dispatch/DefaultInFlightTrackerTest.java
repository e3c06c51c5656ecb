package eventbus.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultInFlightTrackerTest {

  @Test
  void secondClaimOfSameKeyFailsUntilReleased() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker();

    assertTrue(tracker.tryAcquire("h", "k"));
    assertFalse(tracker.tryAcquire("h", "k"));
    assertTrue(tracker.isInFlight("h", "k"));

    tracker.release("h", "k");

    assertFalse(tracker.isInFlight("h", "k"));
    assertTrue(tracker.tryAcquire("h", "k"));
  }

  @Test
  void claimsAreScopedPerHandler() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker();

    assertTrue(tracker.tryAcquire("h1", "k"));
    assertTrue(tracker.tryAcquire("h2", "k"));
    assertEquals(2, tracker.size());
  }

  @Test
  void releasingUnknownKeyIsHarmless() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker();

    assertDoesNotThrow(() -> tracker.release("h", "missing"));
    assertEquals(0, tracker.size());
  }
}

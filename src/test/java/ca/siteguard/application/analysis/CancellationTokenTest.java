package ca.siteguard.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationTokenTest {

  @Test
  void firstCancelWinsAndKeepsReason() {
    CancellationToken token = new CancellationToken();
    assertFalse(token.isCancelled());
    assertNull(token.reason());

    assertTrue(token.cancel("preempted by photo"));
    assertFalse(token.cancel("second"));

    assertTrue(token.isCancelled());
    assertEquals("preempted by photo", token.reason());
    CancellationException ex = assertThrows(CancellationException.class, token::throwIfCancelled);
    assertEquals("preempted by photo", ex.getMessage());
  }

  @Test
  void callbacksRunOnceIncludingLateRegistrations() {
    CancellationToken token = new CancellationToken();
    AtomicInteger early = new AtomicInteger();
    AtomicInteger late = new AtomicInteger();
    token.onCancel(early::incrementAndGet);

    token.cancel(null);
    token.cancel("again");
    token.onCancel(late::incrementAndGet);

    assertEquals(1, early.get());
    assertEquals(1, late.get());
    assertEquals("cancelled", token.reason());
  }

  @Test
  void closedRegistrationIsNotInvoked() {
    CancellationToken token = new CancellationToken();
    AtomicInteger calls = new AtomicInteger();
    CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);

    registration.close();
    token.cancel("done");

    assertEquals(0, calls.get());
  }

  @Test
  void failingCallbackDoesNotBlockOthers() {
    CancellationToken token = new CancellationToken();
    AtomicInteger calls = new AtomicInteger();
    token.onCancel(() -> {
      throw new IllegalStateException("boom");
    });
    token.onCancel(calls::incrementAndGet);

    assertTrue(token.cancel("stop"));
    assertEquals(1, calls.get());
  }
}

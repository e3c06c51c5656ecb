package eventbus;

import eventbus.dispatch.CircuitBreaker;
import eventbus.dispatch.HandlerInterceptor;
import eventbus.registry.DefaultHandlerRegistry;
import eventbus.spi.IdempotencyStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {
  private static final String PROJECT_CREATED = "projects:project.created";

  record ProjectCreated(String projectId, String name, String ownerId) {
  }

  private DefaultHandlerRegistry registry;
  private RecordingMetricsExporter metrics;
  private EventBus bus;

  @BeforeEach
  void setUp() {
    registry = new DefaultHandlerRegistry();
    metrics = new RecordingMetricsExporter();
  }

  @AfterEach
  void tearDown() {
    if (bus != null) {
      bus.close();
    }
  }

  private EventBus newBus() {
    bus = EventBus.builder().registry(registry).metrics(metrics).build();
    return bus;
  }

  private void awaitIdle() throws InterruptedException {
    assertTrue(bus.awaitIdle(5, TimeUnit.SECONDS), "dispatches did not finish");
  }

  private static HandlerDescriptor.Builder handler(String module, String handlerId) {
    return HandlerDescriptor.builder(PROJECT_CREATED).module(module).handlerId(handlerId);
  }

  private static IdempotencyKeyFunction projectKey() {
    return event -> "task-created-for-project-" + event.dataAs(ProjectCreated.class).projectId();
  }

  // ── Publishing ──────────────────────────────────────────────────

  @Test
  void deliversToEveryRegisteredHandler() throws Exception {
    newBus();
    CountDownLatch delivered = new CountDownLatch(2);
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    registry.register(handler("tasks", "a").handler(event -> {
      seen.add("tasks:" + event.sourceModule());
      delivered.countDown();
    }).build());
    registry.register(handler("billing", "b").handler(event -> {
      seen.add("billing:" + event.sourceModule());
      delivered.countDown();
    }).build());

    Event event = bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "Apollo", "u1"), "projects");

    assertTrue(delivered.await(5, TimeUnit.SECONDS));
    assertEquals(PROJECT_CREATED, event.name());
    assertTrue(seen.containsAll(List.of("tasks:projects", "billing:projects")));
    assertEquals(1, metrics.published.get());
  }

  @Test
  void publishDoesNotWaitForHandlers() throws Exception {
    newBus();
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch done = new CountDownLatch(1);
    registry.register(handler("tasks", "slow").handler(event -> {
      release.await();
      done.countDown();
    }).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    assertEquals(1, bus.inFlightDispatches());
    release.countDown();
    assertTrue(done.await(5, TimeUnit.SECONDS));
    awaitIdle();
    assertEquals(0, bus.inFlightDispatches());
  }

  @Test
  void publishWithoutHandlersIsNoOp() {
    newBus();

    Event event = bus.publish("unknown:event", "data", "projects");

    assertNotNull(event);
    assertEquals(1, metrics.noSubscriber.get());
    assertEquals(0, bus.inFlightDispatches());
  }

  @Test
  void carriesCorrelationId() throws Exception {
    newBus();
    CountDownLatch delivered = new CountDownLatch(1);
    List<String> correlationIds = Collections.synchronizedList(new ArrayList<>());
    registry.register(handler("tasks", "a").handler(event -> {
      correlationIds.add(event.correlationId());
      delivered.countDown();
    }).build());

    bus.publish(PROJECT_CREATED, null, "projects", "request-42");

    assertTrue(delivered.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("request-42"), correlationIds);
  }

  @Test
  void rejectsInvalidArguments() {
    newBus();

    assertThrows(NullPointerException.class, () -> bus.publish(null, "x", "projects"));
    assertThrows(IllegalArgumentException.class, () -> bus.publish("", "x", "projects"));
    assertThrows(NullPointerException.class, () -> bus.publish(PROJECT_CREATED, "x", null));
    assertThrows(IllegalArgumentException.class, () -> bus.publish(PROJECT_CREATED, "x", ""));
  }

  @Test
  void disabledBusDropsEvents() throws Exception {
    bus = EventBus.builder().registry(registry).metrics(metrics).enabled(false).build();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "a").handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(0, calls.get());
    assertEquals(0, metrics.published.get());
    assertFalse(bus.isEnabled());
  }

  @Test
  void closedBusRejectsPublish() {
    newBus();
    bus.close();

    assertThrows(IllegalStateException.class, () -> bus.publish(PROJECT_CREATED, null, "projects"));
  }

  @Test
  void closeDrainsInFlightDispatches() {
    newBus();
    AtomicInteger completed = new AtomicInteger();
    registry.register(handler("tasks", "a").handler(event -> {
      Thread.sleep(200);
      completed.incrementAndGet();
    }).build());

    bus.publish(PROJECT_CREATED, null, "projects");
    bus.close();

    assertEquals(1, completed.get());
    assertEquals(0, bus.inFlightDispatches());
  }

  // ── Failure isolation and retries ───────────────────────────────

  @Test
  void failingHandlerDoesNotAffectOthers() throws Exception {
    newBus();
    CountDownLatch healthy = new CountDownLatch(1);
    registry.register(handler("analytics", "broken").retryPolicy(RetryPolicy.none())
        .handler(event -> {
          throw new IllegalStateException("boom");
        }).build());
    registry.register(handler("tasks", "healthy").handler(event -> healthy.countDown()).build());

    assertDoesNotThrow(() -> bus.publish(PROJECT_CREATED, null, "projects"));

    assertTrue(healthy.await(5, TimeUnit.SECONDS));
    awaitIdle();
    assertEquals(1, metrics.success.get());
    assertEquals(1, metrics.exhausted.get());
  }

  @Test
  void retriesUntilSuccess() throws Exception {
    newBus();
    AtomicInteger attempts = new AtomicInteger();
    registry.register(handler("tasks", "flaky").retryPolicy(new RetryPolicy(3, 10, false))
        .handler(event -> {
          if (attempts.incrementAndGet() < 3) {
            throw new IllegalStateException("not yet");
          }
        }).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(3, attempts.get());
    assertEquals(2, metrics.failure.get());
    assertEquals(2, metrics.retryScheduled.get());
    assertEquals(1, metrics.success.get());
    assertEquals(0, metrics.exhausted.get());
  }

  @Test
  void givesUpAfterMaxAttempts() throws Exception {
    newBus();
    AtomicInteger attempts = new AtomicInteger();
    registry.register(handler("tasks", "broken").retryPolicy(new RetryPolicy(2, 10, false))
        .handler(event -> {
          attempts.incrementAndGet();
          throw new IllegalStateException("always");
        }).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(2, attempts.get());
    assertEquals(1, metrics.exhausted.get());
    assertEquals(1, metrics.retryScheduled.get());
  }

  @Test
  void exponentialBackoffSpacesAttempts() throws Exception {
    newBus();
    List<Long> startedAt = Collections.synchronizedList(new ArrayList<>());
    registry.register(handler("tasks", "broken").retryPolicy(new RetryPolicy(3, 100, true))
        .handler(event -> {
          startedAt.add(System.nanoTime());
          throw new IllegalStateException("always");
        }).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(3, startedAt.size());
    long firstGapMs = TimeUnit.NANOSECONDS.toMillis(startedAt.get(1) - startedAt.get(0));
    long secondGapMs = TimeUnit.NANOSECONDS.toMillis(startedAt.get(2) - startedAt.get(1));
    assertTrue(firstGapMs >= 95, "first gap too short: " + firstGapMs);
    assertTrue(secondGapMs >= 195, "second gap too short: " + secondGapMs);
    assertEquals(1, metrics.exhausted.get());
    assertEquals(2, metrics.retryScheduled.get());
  }

  @Test
  void timedOutAttemptIsInterruptedAndCounted() throws Exception {
    newBus();
    CountDownLatch interrupted = new CountDownLatch(1);
    registry.register(handler("tasks", "hanging").retryPolicy(RetryPolicy.none()).timeoutMs(100)
        .handler(event -> {
          try {
            Thread.sleep(5_000);
          } catch (InterruptedException e) {
            interrupted.countDown();
            throw e;
          }
        }).build());

    long start = System.nanoTime();
    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2_000);
    assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    assertEquals(1, metrics.timeout.get());
    assertEquals(1, metrics.exhausted.get());
    assertEquals(0, metrics.success.get());
  }

  @Test
  void handlerWithoutTimeoutUsesBusDefault() throws Exception {
    bus = EventBus.builder().registry(registry).metrics(metrics).defaultTimeoutMs(100).build();
    registry.register(handler("tasks", "hanging").retryPolicy(RetryPolicy.none())
        .handler(event -> Thread.sleep(5_000)).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(1, metrics.timeout.get());
  }

  @Test
  void timeoutIsRetried() throws Exception {
    newBus();
    AtomicInteger attempts = new AtomicInteger();
    registry.register(handler("tasks", "slow-once").retryPolicy(new RetryPolicy(2, 10, false))
        .timeoutMs(100)
        .handler(event -> {
          if (attempts.incrementAndGet() == 1) {
            Thread.sleep(5_000);
          }
        }).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(2, attempts.get());
    assertEquals(1, metrics.timeout.get());
    assertEquals(1, metrics.success.get());
  }

  // ── Idempotency ─────────────────────────────────────────────────

  @Test
  void duplicatePublishCreatesOneTask() throws Exception {
    newBus();
    List<String> tasks = Collections.synchronizedList(new ArrayList<>());
    registry.register(handler("tasks", "tasks-project-created-handler")
        .retryPolicy(new RetryPolicy(3, 1000, true))
        .timeoutMs(10_000)
        .idempotencyKey(projectKey())
        .handler(event -> {
          Thread.sleep(20);
          tasks.add(event.dataAs(ProjectCreated.class).projectId());
        }).build());

    ProjectCreated project = new ProjectCreated("p1", "Apollo", "u1");
    bus.publish(PROJECT_CREATED, project, "projects");
    bus.publish(PROJECT_CREATED, project, "projects");

    awaitIdle();
    assertEquals(List.of("p1"), tasks);
    assertEquals(1, metrics.success.get());
    assertEquals(1, metrics.skipped.get());
  }

  @Test
  void differentKeysBothRun() throws Exception {
    newBus();
    List<String> tasks = Collections.synchronizedList(new ArrayList<>());
    registry.register(handler("tasks", "h").idempotencyKey(projectKey())
        .handler(event -> tasks.add(event.dataAs(ProjectCreated.class).projectId())).build());

    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");
    bus.publish(PROJECT_CREATED, new ProjectCreated("p2", "B", "u"), "projects");

    awaitIdle();
    assertEquals(2, tasks.size());
    assertTrue(tasks.containsAll(List.of("p1", "p2")));
  }

  @Test
  void sameKeyIsTrackedPerHandler() throws Exception {
    newBus();
    AtomicInteger tasks = new AtomicInteger();
    AtomicInteger billing = new AtomicInteger();
    registry.register(handler("tasks", "tasks-h").idempotencyKey(projectKey())
        .handler(event -> tasks.incrementAndGet()).build());
    registry.register(handler("billing", "billing-h").idempotencyKey(projectKey())
        .handler(event -> billing.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");
    awaitIdle();
    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");
    awaitIdle();

    assertEquals(1, tasks.get());
    assertEquals(1, billing.get());
    assertEquals(2, metrics.skipped.get());
  }

  @Test
  void exhaustedHandlerDoesNotRecordKey() throws Exception {
    newBus();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(RetryPolicy.none())
        .idempotencyKey(projectKey())
        .handler(event -> {
          if (calls.incrementAndGet() == 1) {
            throw new IllegalStateException("first delivery fails");
          }
        }).build());

    ProjectCreated project = new ProjectCreated("p1", "A", "u");
    bus.publish(PROJECT_CREATED, project, "projects");
    awaitIdle();
    bus.publish(PROJECT_CREATED, project, "projects");
    awaitIdle();

    assertEquals(2, calls.get());
    assertEquals(1, metrics.success.get());
    assertTrue(bus.dispatcher().idempotencyStore().hasCompleted("h", "task-created-for-project-p1"));
  }

  @Test
  void concurrentSameKeyWaitsForFirstDispatch() throws Exception {
    newBus();
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").idempotencyKey(projectKey())
        .handler(event -> {
          calls.incrementAndGet();
          release.await();
        }).build());

    ProjectCreated project = new ProjectCreated("p1", "A", "u");
    bus.publish(PROJECT_CREATED, project, "projects");
    bus.publish(PROJECT_CREATED, project, "projects");
    Thread.sleep(200);

    assertEquals(1, calls.get());
    assertTrue(metrics.deferred.get() > 0);
    release.countDown();
    awaitIdle();
    assertEquals(1, calls.get());
    assertEquals(1, metrics.skipped.get());
  }

  @Test
  void deferredDispatchRunsWhenFirstGivesUp() throws Exception {
    newBus();
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(RetryPolicy.none())
        .idempotencyKey(projectKey())
        .handler(event -> {
          if (calls.incrementAndGet() == 1) {
            release.await();
            throw new IllegalStateException("first delivery fails");
          }
        }).build());

    ProjectCreated project = new ProjectCreated("p1", "A", "u");
    bus.publish(PROJECT_CREATED, project, "projects");
    bus.publish(PROJECT_CREATED, project, "projects");
    Thread.sleep(100);
    release.countDown();

    awaitIdle();
    assertEquals(2, calls.get());
    assertEquals(1, metrics.exhausted.get());
    assertEquals(1, metrics.success.get());
  }

  @Test
  void failingKeyFunctionSkipsHandler() throws Exception {
    newBus();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h")
        .idempotencyKey(event -> {
          throw new IllegalArgumentException("no project id");
        })
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(0, calls.get());
    assertEquals(1, metrics.exhausted.get());
  }

  @Test
  void nullKeyAlwaysRuns() throws Exception {
    newBus();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").idempotencyKey(event -> null)
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, null, "projects");
    awaitIdle();
    bus.publish(PROJECT_CREATED, null, "projects");
    awaitIdle();

    assertEquals(2, calls.get());
  }

  @Test
  void storeFailureOnMarkDoesNotRetry() throws Exception {
    IdempotencyStore failingStore = new IdempotencyStore() {
      @Override
      public boolean hasCompleted(String handlerId, String key) {
        return false;
      }

      @Override
      public boolean markCompleted(String handlerId, String key) {
        throw new IllegalStateException("database down");
      }
    };
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .idempotencyStore(failingStore).build();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").idempotencyKey(projectKey())
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");

    awaitIdle();
    assertEquals(1, calls.get());
    assertEquals(1, metrics.success.get());
    assertEquals(0, metrics.retryScheduled.get());
  }

  @Test
  void storeFailureOnCheckCountsAsFailedAttempt() throws Exception {
    AtomicInteger checks = new AtomicInteger();
    IdempotencyStore flakyStore = new IdempotencyStore() {
      @Override
      public boolean hasCompleted(String handlerId, String key) {
        if (checks.incrementAndGet() == 1) {
          throw new IllegalStateException("connection reset");
        }
        return false;
      }

      @Override
      public boolean markCompleted(String handlerId, String key) {
        return true;
      }
    };
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .idempotencyStore(flakyStore).build();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(new RetryPolicy(2, 10, false))
        .idempotencyKey(projectKey())
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");

    awaitIdle();
    assertEquals(1, calls.get());
    assertEquals(1, metrics.failure.get());
    assertEquals(1, metrics.success.get());
  }

  // ── Payload validation ──────────────────────────────────────────

  @Test
  void rejectedPayloadSkipsHandlerWithoutRetry() throws Exception {
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .circuitBreaker(new CircuitBreaker(1, 60_000)).build();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(new RetryPolicy(3, 10, false))
        .validator(PayloadValidator.instanceOf(ProjectCreated.class))
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, "not a project", "projects");
    awaitIdle();

    assertEquals(0, calls.get());
    assertEquals(1, metrics.failure.get());
    assertEquals(1, metrics.exhausted.get());
    assertEquals(0, metrics.retryScheduled.get());

    // Bad payloads say nothing about the handler's health
    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");
    awaitIdle();
    assertEquals(1, calls.get());
    assertEquals(0, metrics.circuitOpen.get());
  }

  @Test
  void validatorSeesEveryAttempt() throws Exception {
    newBus();
    AtomicInteger validations = new AtomicInteger();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(new RetryPolicy(2, 10, false))
        .validator(event -> validations.incrementAndGet())
        .handler(event -> {
          if (calls.incrementAndGet() == 1) {
            throw new IllegalStateException("transient");
          }
        }).build());

    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");
    awaitIdle();

    assertEquals(2, validations.get());
    assertEquals(2, calls.get());
    assertEquals(1, metrics.success.get());
  }

  // ── Circuit breaker and interceptors ────────────────────────────

  @Test
  void openCircuitRejectsAttempts() throws Exception {
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .circuitBreaker(new CircuitBreaker(2, 60_000)).build();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(RetryPolicy.none())
        .handler(event -> {
          calls.incrementAndGet();
          throw new IllegalStateException("down");
        }).build());

    for (int i = 0; i < 3; i++) {
      bus.publish(PROJECT_CREATED, null, "projects");
      awaitIdle();
    }

    assertEquals(2, calls.get());
    assertEquals(1, metrics.circuitOpen.get());
    assertEquals(3, metrics.exhausted.get());
  }

  @Test
  void abandonedAttemptLeavesCircuitUsable() throws Exception {
    CountDownLatch slowCheckDone = new CountDownLatch(1);
    AtomicInteger checks = new AtomicInteger();
    IdempotencyStore slowStore = new IdempotencyStore() {
      @Override
      public boolean hasCompleted(String handlerId, String key) {
        if (checks.incrementAndGet() == 1) {
          busyWait(300);
          slowCheckDone.countDown();
        }
        return false;
      }

      @Override
      public boolean markCompleted(String handlerId, String key) {
        return true;
      }
    };
    bus = EventBus.builder().registry(registry).metrics(metrics).idempotencyStore(slowStore)
        .circuitBreaker(new CircuitBreaker(1, 0)).build();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(RetryPolicy.none()).timeoutMs(100)
        .idempotencyKey(projectKey())
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, new ProjectCreated("p1", "A", "u"), "projects");
    awaitIdle();
    assertTrue(slowCheckDone.await(5, TimeUnit.SECONDS));
    Thread.sleep(100);

    assertEquals(1, metrics.timeout.get());
    assertEquals(1, metrics.exhausted.get());
    assertEquals(0, calls.get(), "handler ran after its dispatch gave up");

    for (int i = 2; i <= 4; i++) {
      bus.publish(PROJECT_CREATED, new ProjectCreated("p" + i, "A", "u"), "projects");
      awaitIdle();
    }
    assertEquals(3, calls.get());
    assertEquals(0, metrics.circuitOpen.get());
  }

  @Test
  void slowInterceptorPastTimeoutSkipsHandler() throws Exception {
    CountDownLatch slowBeforeDone = new CountDownLatch(1);
    AtomicInteger befores = new AtomicInteger();
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .interceptor(HandlerInterceptor.before((event, h, attempt) -> {
          if (befores.incrementAndGet() == 1) {
            busyWait(300);
            slowBeforeDone.countDown();
          }
        })).build();
    AtomicInteger calls = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(RetryPolicy.none()).timeoutMs(100)
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, null, "projects");
    awaitIdle();
    assertTrue(slowBeforeDone.await(5, TimeUnit.SECONDS));
    Thread.sleep(100);

    assertEquals(0, calls.get());
    assertEquals(1, metrics.exhausted.get());
  }

  /** Spins without honouring interrupts, like a blocking driver call would. */
  private static void busyWait(long millis) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    while (System.nanoTime() < deadline) {
      Thread.onSpinWait();
    }
  }

  @Test
  void interceptorsWrapEachAttempt() throws Exception {
    List<String> calls = Collections.synchronizedList(new ArrayList<>());
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .interceptor(HandlerInterceptor.before((event, h, attempt) -> calls.add("before1:" + attempt)))
        .interceptor(new HandlerInterceptor() {
          @Override
          public void beforeAttempt(Event event, HandlerDescriptor h, int attempt) {
            calls.add("before2:" + attempt);
          }

          @Override
          public void afterAttempt(eventbus.dispatch.DeliveryAttempt attempt,
              eventbus.dispatch.HandlerException error) {
            calls.add("after2:" + attempt.outcome() + ":" + (error == null ? "ok" : "error"));
          }
        })
        .interceptor(HandlerInterceptor.after((attempt, error) ->
            calls.add("after3:" + attempt.attemptNumber())))
        .build();
    AtomicInteger attempts = new AtomicInteger();
    registry.register(handler("tasks", "h").retryPolicy(new RetryPolicy(2, 10, false))
        .handler(event -> {
          calls.add("handler");
          if (attempts.incrementAndGet() == 1) {
            throw new IllegalStateException("first");
          }
        }).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(List.of(
        "before1:1", "before2:1", "handler", "after3:1", "after2:FAILURE:error",
        "before1:2", "before2:2", "handler", "after3:2", "after2:SUCCESS:ok"), calls);
  }

  @Test
  void throwingBeforeInterceptorFailsAttempt() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .interceptor(HandlerInterceptor.before((event, h, attempt) -> {
          throw new IllegalStateException("rejected");
        }))
        .build();
    registry.register(handler("tasks", "h").retryPolicy(RetryPolicy.none())
        .handler(event -> calls.incrementAndGet()).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(0, calls.get());
    assertEquals(1, metrics.failure.get());
    assertEquals(1, metrics.exhausted.get());
  }

  @Test
  void throwingAfterInterceptorIsIgnored() throws Exception {
    bus = EventBus.builder().registry(registry).metrics(metrics)
        .interceptor(HandlerInterceptor.after((attempt, error) -> {
          throw new IllegalStateException("ignored");
        }))
        .build();
    registry.register(handler("tasks", "h").handler(event -> { }).build());

    bus.publish(PROJECT_CREATED, null, "projects");

    awaitIdle();
    assertEquals(1, metrics.success.get());
    assertEquals(0, metrics.retryScheduled.get());
  }

  @Test
  void builderCannotBeReused() {
    EventBus.Builder builder = EventBus.builder();
    bus = builder.build();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void rejectsNonPositiveDefaultTimeout() {
    assertThrows(IllegalArgumentException.class,
        () -> EventBus.builder().defaultTimeoutMs(0).build());
  }
}

package eventbus.registry;

import eventbus.HandlerDescriptor;
import eventbus.InvalidPolicyException;
import eventbus.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DefaultHandlerRegistryTest {

  private static HandlerDescriptor descriptor(String eventName, String module, String handlerId) {
    return HandlerDescriptor.builder(eventName)
        .module(module)
        .handlerId(handlerId)
        .handler(event -> { })
        .build();
  }

  @Test
  void returnsEmptyListForUnknownEvent() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertTrue(registry.lookup("Unknown").isEmpty());
    assertTrue(registry.lookup(null).isEmpty());
    assertFalse(registry.hasHandlers("Unknown"));
  }

  @Test
  void keepsRegistrationOrder() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    registry.register(descriptor("projects:project.created", "tasks", "a"));
    registry.register(descriptor("projects:project.created", "billing", "b"));
    registry.register(descriptor("projects:project.created", "audit", "c"));

    List<HandlerDescriptor> handlers = registry.lookup("projects:project.created");
    assertEquals(List.of("a", "b", "c"), handlers.stream().map(HandlerDescriptor::handlerId).toList());
    assertEquals(3, registry.handlerCount("projects:project.created"));
  }

  @Test
  void reRegisteringSameIdentityReplacesInPlace() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(descriptor("e", "tasks", "first"));
    registry.register(descriptor("e", "tasks", "second"));

    HandlerDescriptor replacement = HandlerDescriptor.builder("e")
        .module("tasks")
        .handlerId("first")
        .handler(event -> { })
        .timeoutMs(500)
        .build();
    registry.register(replacement);

    List<HandlerDescriptor> handlers = registry.lookup("e");
    assertEquals(2, handlers.size());
    assertSame(replacement, handlers.get(0));
  }

  @Test
  void sameHandlerIdInAnotherModuleIsSeparate() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    registry.register(descriptor("e", "tasks", "h"));
    registry.register(descriptor("e", "billing", "h"));

    assertEquals(2, registry.handlerCount("e"));
  }

  @Test
  void generatedHandlerIdsNeverCollide() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    String first = registry.register(descriptor("e", "tasks", null));
    String second = registry.register(descriptor("e", "tasks", null));

    assertNotEquals(first, second);
    assertTrue(first.startsWith("tasks-"));
    assertEquals(2, registry.handlerCount("e"));
  }

  @Test
  void lookupSnapshotIsImmutable() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(descriptor("e", "tasks", "h"));

    List<HandlerDescriptor> snapshot = registry.lookup("e");
    registry.register(descriptor("e", "tasks", "h2"));

    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class,
        () -> snapshot.add(descriptor("e", "x", "y")));
  }

  @Test
  void rejectsInvalidPolicies() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertThrows(InvalidPolicyException.class, () -> registry.register(
        HandlerDescriptor.builder("e").module("m").handler(event -> { })
            .retryPolicy(new RetryPolicy(0, 100, false)).build()));
    assertThrows(InvalidPolicyException.class, () -> registry.register(
        HandlerDescriptor.builder("e").module("m").handler(event -> { })
            .retryPolicy(new RetryPolicy(3, -1, false)).build()));
    assertThrows(InvalidPolicyException.class, () -> registry.register(
        HandlerDescriptor.builder("e").module("m").handler(event -> { })
            .timeoutMs(0).build()));
    assertFalse(registry.hasHandlers("e"));
  }

  @Test
  void unregisterRemovesOnlyTheMatchingHandler() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(descriptor("e", "tasks", "a"));
    registry.register(descriptor("e", "tasks", "b"));

    assertTrue(registry.unregister("e", "a"));
    assertFalse(registry.unregister("e", "a"));
    assertEquals(1, registry.handlerCount("e"));

    assertTrue(registry.unregister("e", "b"));
    assertEquals(Set.of(), registry.eventNames());
  }

  @Test
  void eventNamesAreSortedAndClearEmptiesRegistry() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(descriptor("users:user.created", "m", "a"));
    registry.register(descriptor("projects:project.created", "m", "b"));

    assertEquals(List.of("projects:project.created", "users:user.created"),
        new ArrayList<>(registry.eventNames()));

    registry.clear();
    assertTrue(registry.eventNames().isEmpty());
  }

  @Test
  void concurrentRegistrationsAreAllKept() throws Exception {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int i = 0; i < 200; i++) {
        String id = "h" + i;
        pool.execute(() -> {
          try {
            start.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          registry.register(descriptor("e", "m", id));
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    }

    assertEquals(200, registry.handlerCount("e"));
  }
}

package eventbus.registry;

import eventbus.HandlerDescriptor;
import eventbus.InvalidPolicyException;
import eventbus.RetryPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, read-copy-update handler registry.
 *
 * <p>Each event name maps to an immutable list. A registration builds a new list and swaps it
 * in atomically through {@link ConcurrentHashMap#compute}, so {@link #lookup} never blocks and
 * never observes a partially applied write.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry();
 * registry.register(HandlerDescriptor.builder("projects:project.created")
 *     .module("tasks")
 *     .handlerId("tasks-project-created-handler")
 *     .handler(event -> tasks.createInitialTask(event))
 *     .build());
 * }</pre>
 *
 * <h2>Replacement</h2>
 * <p>Registering a descriptor whose {@code (eventName, module, handlerId)} is already present
 * replaces it in place, keeping its position. This keeps a repeated bootstrap or a test that
 * re-registers from producing duplicate deliveries.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final Map<String, List<HandlerDescriptor>> handlers = new ConcurrentHashMap<>();

  @Override
  public String register(HandlerDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    validate(descriptor);
    handlers.compute(descriptor.eventName(), (name, current) -> {
      List<HandlerDescriptor> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
      int existing = indexOf(next, descriptor);
      if (existing >= 0) {
        next.set(existing, descriptor);
      } else {
        next.add(descriptor);
      }
      return Collections.unmodifiableList(next);
    });
    return descriptor.handlerId();
  }

  @Override
  public List<HandlerDescriptor> lookup(String eventName) {
    if (eventName == null) {
      return List.of();
    }
    List<HandlerDescriptor> registered = handlers.get(eventName);
    return registered == null ? List.of() : registered;
  }

  @Override
  public boolean unregister(String eventName, String handlerId) {
    if (eventName == null || handlerId == null) {
      return false;
    }
    boolean[] removed = new boolean[1];
    handlers.computeIfPresent(eventName, (name, current) -> {
      List<HandlerDescriptor> next = new ArrayList<>(current);
      removed[0] = next.removeIf(d -> d.handlerId().equals(handlerId));
      // Returning null drops the entry once the last handler is gone
      return next.isEmpty() ? null : Collections.unmodifiableList(next);
    });
    return removed[0];
  }

  @Override
  public Set<String> eventNames() {
    return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
  }

  @Override
  public void clear() {
    handlers.clear();
  }

  private static int indexOf(List<HandlerDescriptor> list, HandlerDescriptor descriptor) {
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i).sameRegistrationAs(descriptor)) {
        return i;
      }
    }
    return -1;
  }

  private static void validate(HandlerDescriptor descriptor) {
    RetryPolicy policy = descriptor.retryPolicy();
    if (policy != null) {
      if (policy.maxAttempts() < 1) {
        throw new InvalidPolicyException("maxAttempts must be >= 1, got: " + policy.maxAttempts()
            + " for handler " + descriptor.handlerId());
      }
      if (policy.backoffMs() < 0) {
        throw new InvalidPolicyException("backoffMs must be >= 0, got: " + policy.backoffMs()
            + " for handler " + descriptor.handlerId());
      }
    }
    Long timeoutMs = descriptor.timeoutMs();
    if (timeoutMs != null && timeoutMs <= 0) {
      throw new InvalidPolicyException("timeoutMs must be > 0, got: " + timeoutMs
          + " for handler " + descriptor.handlerId());
    }
  }
}

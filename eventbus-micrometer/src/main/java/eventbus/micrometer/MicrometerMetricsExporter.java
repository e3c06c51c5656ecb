package eventbus.micrometer;

import eventbus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} backed by a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventbus.events.published}</li>
 *   <li>{@code eventbus.events.unhandled}: published with no registered handler</li>
 *   <li>{@code eventbus.handler.success}</li>
 *   <li>{@code eventbus.handler.failure}</li>
 *   <li>{@code eventbus.handler.timeout}</li>
 *   <li>{@code eventbus.handler.exhausted}</li>
 *   <li>{@code eventbus.handler.retries}</li>
 *   <li>{@code eventbus.handler.skipped}: idempotency key already completed</li>
 *   <li>{@code eventbus.handler.deferred}: same key already in flight</li>
 *   <li>{@code eventbus.handler.circuit.open}</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code eventbus.dispatch.in.flight}</li>
 *   <li>{@code eventbus.handler.duration}</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "eventbus";

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter unhandled;
  private final Counter success;
  private final Counter failure;
  private final Counter timeout;
  private final Counter exhausted;
  private final Counter retries;
  private final Counter skipped;
  private final Counter deferred;
  private final Counter circuitOpen;
  private final Timer handlerDuration;
  private final Gauge inFlightGauge;

  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names, e.g. {@code "billing.eventbus"}
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.published = counter(namePrefix + ".events.published", "Events published");
    this.unhandled = counter(namePrefix + ".events.unhandled", "Events published with no handler");
    this.success = counter(namePrefix + ".handler.success", "Handler attempts that succeeded");
    this.failure = counter(namePrefix + ".handler.failure", "Handler attempts that failed");
    this.timeout = counter(namePrefix + ".handler.timeout", "Handler attempts that timed out");
    this.exhausted = counter(namePrefix + ".handler.exhausted", "Handlers that used up every attempt");
    this.retries = counter(namePrefix + ".handler.retries", "Retries scheduled");
    this.skipped = counter(namePrefix + ".handler.skipped", "Dispatches skipped as already completed");
    this.deferred = counter(namePrefix + ".handler.deferred", "Dispatches deferred behind the same key");
    this.circuitOpen = counter(namePrefix + ".handler.circuit.open", "Attempts rejected by an open circuit");
    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Handler execution time per attempt")
        .register(registry);
    this.inFlightGauge = Gauge.builder(namePrefix + ".dispatch.in.flight", inFlight, AtomicInteger::get)
        .description("Dispatches started and not yet finished")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementNoSubscriber() {
    if (closed) return;
    unhandled.increment();
  }

  @Override
  public void incrementHandlerSuccess() {
    if (closed) return;
    success.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    failure.increment();
  }

  @Override
  public void incrementHandlerTimeout() {
    if (closed) return;
    timeout.increment();
  }

  @Override
  public void incrementHandlerExhausted() {
    if (closed) return;
    exhausted.increment();
  }

  @Override
  public void incrementRetryScheduled() {
    if (closed) return;
    retries.increment();
  }

  @Override
  public void incrementHandlerSkipped() {
    if (closed) return;
    skipped.increment();
  }

  @Override
  public void incrementDispatchDeferred() {
    if (closed) return;
    deferred.increment();
  }

  @Override
  public void incrementCircuitOpen() {
    if (closed) return;
    circuitOpen.increment();
  }

  @Override
  public void recordInFlight(int inFlight) {
    if (closed) return;
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes this exporter's meters from the registry. Called by {@code EventBus.close()}.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, unhandled, success, failure, timeout, exhausted,
        retries, skipped, deferred, circuitOpen, handlerDuration, inFlightGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

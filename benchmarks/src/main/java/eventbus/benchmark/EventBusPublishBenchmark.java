package eventbus.benchmark;

import eventbus.EventBus;
import eventbus.HandlerDescriptor;
import eventbus.RetryPolicy;
import eventbus.registry.DefaultHandlerRegistry;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures publish-to-handler latency with {@code handlerCount} subscribers on one event.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar EventBusPublishBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class EventBusPublishBenchmark {

  @Param({"1", "4", "16"})
  private int handlerCount;

  @Param({"false", "true"})
  private boolean keyed;

  private EventBus bus;
  private long sequence;
  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    for (int i = 0; i < handlerCount; i++) {
      HandlerDescriptor.Builder builder = HandlerDescriptor.builder("bench:event.published")
          .module("bench")
          .handlerId("bench-handler-" + i)
          .retryPolicy(RetryPolicy.none())
          .handler(event -> {
            CountDownLatch latch = latchRef.get();
            if (latch != null) latch.countDown();
          });
      if (keyed) {
        builder.idempotencyKey(event -> event.eventId());
      }
      registry.register(builder.build());
    }
    bus = EventBus.builder().registry(registry).build();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    bus.close();
  }

  @Benchmark
  public void publishAndDeliver() throws Exception {
    CountDownLatch latch = new CountDownLatch(handlerCount);
    latchRef.set(latch);
    bus.publish("bench:event.published", ++sequence, "bench");
    latch.await(5, TimeUnit.SECONDS);
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.NANOSECONDS)
  public Object publishWithoutSubscribers() {
    return bus.publish("bench:event.ignored", sequence, "bench");
  }
}

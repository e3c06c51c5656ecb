package eventbus.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eventbus.EventBus;
import eventbus.HandlerDescriptor;
import eventbus.RetryPolicy;
import eventbus.jdbc.JdbcIdempotencyStore;
import eventbus.registry.DefaultHandlerRegistry;
import org.openjdk.jmh.annotations.*;

import java.sql.Connection;
import java.sql.Statement;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures the cost of a durable idempotency check and completion record per delivery, and of a
 * duplicate delivery that is skipped.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar JdbcIdempotencyBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class JdbcIdempotencyBenchmark {

  private HikariDataSource dataSource;
  private JdbcIdempotencyStore store;
  private EventBus bus;
  private long sequence;
  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:bench_idempotency;DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(8);
    dataSource = new HikariDataSource(config);
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE IF NOT EXISTS event_processing_log ("
          + "handler_id VARCHAR(255) NOT NULL,"
          + "idempotency_key VARCHAR(512) NOT NULL,"
          + "completed_at TIMESTAMP NOT NULL,"
          + "PRIMARY KEY (handler_id, idempotency_key))");
    }
    store = JdbcIdempotencyStore.forDataSource(dataSource);

    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.register(HandlerDescriptor.builder("bench:order.placed")
        .module("bench")
        .handlerId("bench-order-handler")
        .retryPolicy(RetryPolicy.none())
        .idempotencyKey(event -> "order-" + event.data())
        .handler(event -> {
          CountDownLatch latch = latchRef.get();
          if (latch != null) latch.countDown();
        })
        .build());
    bus = EventBus.builder().registry(registry).idempotencyStore(store).build();
    store.markCompleted("bench-order-handler", "order-0");
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    bus.close();
    dataSource.close();
  }

  @Benchmark
  public void firstDelivery() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    latchRef.set(latch);
    bus.publish("bench:order.placed", ++sequence, "bench");
    latch.await(5, TimeUnit.SECONDS);
  }

  @Benchmark
  public boolean duplicateCheck() {
    return store.hasCompleted("bench-order-handler", "order-0");
  }
}

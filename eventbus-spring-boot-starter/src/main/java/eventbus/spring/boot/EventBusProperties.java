package eventbus.spring.boot;

import eventbus.RetryPolicy;
import eventbus.dispatch.CircuitBreaker;
import eventbus.dispatch.HandlerDispatcher;
import eventbus.dispatch.RetryScheduler;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event bus.
 *
 * @see EventBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventbus")
public class EventBusProperties {

    /**
     * When false, publishes are logged and dropped.
     */
    private boolean enabled = true;

    /**
     * Timeout per handler attempt for handlers that do not declare one.
     */
    private long defaultTimeoutMs = HandlerDispatcher.DEFAULT_TIMEOUT_MS;

    private final Retry defaultRetry = new Retry();
    private final CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Idempotency idempotency = new Idempotency();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public Retry getDefaultRetry() {
        return defaultRetry;
    }

    public CircuitBreakerSettings getCircuitBreaker() {
        return circuitBreaker;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Idempotency getIdempotency() {
        return idempotency;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Store {
        MEMORY,
        JDBC
    }

    public static class Retry {
        private int maxAttempts = RetryPolicy.DEFAULT.maxAttempts();
        private long backoffMs = RetryPolicy.DEFAULT.backoffMs();
        private boolean exponentialBackoff = RetryPolicy.DEFAULT.exponentialBackoff();
        private boolean jitter = RetryPolicy.DEFAULT.jitter();
        private long maxDelayMs = RetryScheduler.DEFAULT_MAX_DELAY_MS;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }

        public boolean isExponentialBackoff() {
            return exponentialBackoff;
        }

        public void setExponentialBackoff(boolean exponentialBackoff) {
            this.exponentialBackoff = exponentialBackoff;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, backoffMs, exponentialBackoff, jitter);
        }
    }

    public static class CircuitBreakerSettings {
        /**
         * Consecutive failed attempts that open a handler's circuit; 0 disables the breaker.
         */
        private int failureThreshold = CircuitBreaker.DEFAULT_FAILURE_THRESHOLD;
        private long recoveryTimeoutMs = CircuitBreaker.DEFAULT_RECOVERY_TIMEOUT_MS;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getRecoveryTimeoutMs() {
            return recoveryTimeoutMs;
        }

        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) {
            this.recoveryTimeoutMs = recoveryTimeoutMs;
        }
    }

    public static class Dispatcher {
        private long inFlightRecheckMs = HandlerDispatcher.DEFAULT_IN_FLIGHT_RECHECK_MS;
        private long drainTimeoutMs = HandlerDispatcher.DEFAULT_DRAIN_TIMEOUT_MS;

        public long getInFlightRecheckMs() {
            return inFlightRecheckMs;
        }

        public void setInFlightRecheckMs(long inFlightRecheckMs) {
            this.inFlightRecheckMs = inFlightRecheckMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Idempotency {
        /**
         * Where completion records live. JDBC needs eventbus-jdbc and a DataSource.
         */
        private Store store = Store.MEMORY;
        private String tableName = "event_processing_log";

        public Store getStore() {
            return store;
        }

        public void setStore(Store store) {
            this.store = store;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventbus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

package eventbus.spring.boot;

import eventbus.IdempotencyKeyFunction;
import eventbus.PayloadValidator;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as an event bus handler.
 *
 * <p>The annotated bean must implement {@link eventbus.EventHandler}. Subscribers are grouped
 * into one {@link eventbus.bootstrap.HandlerModule} per {@link #module()} and registered when
 * the application context has finished creating singletons.
 *
 * <pre>{@code
 * @Component
 * @EventSubscriber(eventName = "projects:project.created", module = "tasks",
 *     maxAttempts = 3, backoffMs = 1000, timeoutMs = 10_000,
 *     idempotencyKey = ProjectIdKey.class)
 * public class CreateInitialTask implements EventHandler {
 *   public void handle(Event event) { ... }
 * }
 * }</pre>
 *
 * <p>Idempotency key resolution:
 * <ul>
 *   <li>an {@link #idempotencyKey()} class is looked up as a bean, else instantiated through its
 *       no-arg constructor</li>
 *   <li>otherwise a bean that also implements {@link IdempotencyKeyFunction} is its own key
 *       function</li>
 *   <li>otherwise the handler has no key and is never de-duplicated</li>
 * </ul>
 *
 * <p>A {@link #validator()} class is resolved the same way, and a bean implementing
 * {@link PayloadValidator} validates its own payloads. {@link #validatePayload()} adds Jakarta
 * Bean Validation of the payload object, checked before any custom validator.
 *
 * @see EventSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventSubscriber {

    /**
     * Event name, conventionally {@code "<module>:<event>"}.
     */
    String eventName();

    /**
     * Name of the module owning the handler.
     */
    String module();

    /**
     * Stable handler id. Generated when empty; set it when the idempotency store is durable.
     */
    String handlerId() default "";

    /**
     * Total attempts. Zero or less uses the bus default retry policy and ignores the other retry
     * attributes.
     */
    int maxAttempts() default 0;

    long backoffMs() default 1000;

    boolean exponentialBackoff() default true;

    boolean jitter() default false;

    /**
     * Per-attempt timeout. Zero or less uses the bus default.
     */
    long timeoutMs() default 0;

    Class<? extends IdempotencyKeyFunction> idempotencyKey() default IdempotencyKeyFunction.class;

    Class<? extends PayloadValidator> validator() default PayloadValidator.class;

    /**
     * Validate the payload's Bean Validation constraints before each attempt. Needs a provider
     * such as Hibernate Validator ({@code spring-boot-starter-validation}).
     */
    boolean validatePayload() default false;
}

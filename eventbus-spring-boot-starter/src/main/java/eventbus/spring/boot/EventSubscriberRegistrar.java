package eventbus.spring.boot;

import eventbus.EventHandler;
import eventbus.HandlerDescriptor;
import eventbus.IdempotencyKeyFunction;
import eventbus.PayloadValidator;
import eventbus.RetryPolicy;
import eventbus.bootstrap.BootstrapLoader;
import eventbus.bootstrap.BootstrapReport;
import eventbus.bootstrap.HandlerModule;
import eventbus.registry.HandlerRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bootstraps the handler registry once every singleton exists.
 *
 * <p>Beans annotated with {@link EventSubscriber} become one {@link HandlerModule} per module
 * name; {@link HandlerModule} beans are taken as they are. All of them go through a single
 * {@link BootstrapLoader} run.
 *
 * @see EventSubscriber
 */
public class EventSubscriberRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final HandlerRegistry registry;
    private volatile BootstrapReport report;

    public EventSubscriberRegistrar(ListableBeanFactory beanFactory, HandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        List<HandlerModule> modules = new ArrayList<>(beanFactory.getBeansOfType(HandlerModule.class).values());
        subscriberModules().forEach((module, handlers) -> modules.add(new SubscriberModule(module, handlers)));
        report = new BootstrapLoader(registry, modules).bootstrapEventHandlers();
    }

    /**
     * @return the bootstrap outcome, or {@code null} before the context finished starting
     */
    public BootstrapReport report() {
        return report;
    }

    private Map<String, List<HandlerDescriptor>> subscriberModules() {
        Map<String, List<HandlerDescriptor>> byModule = new TreeMap<>();
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventSubscriber must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            EventSubscriber annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventSubscriber.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventSubscriber annotation on " + bean.getClass().getName());
            }

            HandlerDescriptor descriptor = describe(beanName, bean, handler, annotation);
            byModule.computeIfAbsent(descriptor.module(), m -> new ArrayList<>()).add(descriptor);
        }
        return byModule;
    }

    private HandlerDescriptor describe(String beanName, Object bean, EventHandler handler,
            EventSubscriber annotation) {
        HandlerDescriptor.Builder builder = HandlerDescriptor.builder(annotation.eventName())
                .module(annotation.module())
                .handler(handler)
                .idempotencyKey(resolveKeyFunction(beanName, bean, annotation))
                .validator(resolveValidator(beanName, bean, annotation));
        if (!annotation.handlerId().isEmpty()) {
            builder.handlerId(annotation.handlerId());
        }
        if (annotation.maxAttempts() > 0) {
            builder.retryPolicy(new RetryPolicy(annotation.maxAttempts(), annotation.backoffMs(),
                    annotation.exponentialBackoff(), annotation.jitter()));
        }
        if (annotation.timeoutMs() > 0) {
            builder.timeoutMs(annotation.timeoutMs());
        }
        try {
            return builder.build();
        } catch (RuntimeException e) {
            throw new BeanCreationException(beanName, "Invalid @EventSubscriber: " + e.getMessage(), e);
        }
    }

    private IdempotencyKeyFunction resolveKeyFunction(String beanName, Object bean, EventSubscriber annotation) {
        Class<? extends IdempotencyKeyFunction> keyClass = annotation.idempotencyKey();
        if (keyClass != IdempotencyKeyFunction.class) {
            return beanOrNew(beanName, keyClass, "idempotencyKey");
        }
        if (bean instanceof IdempotencyKeyFunction keyFunction) {
            return keyFunction;
        }
        return null;
    }

    private PayloadValidator resolveValidator(String beanName, Object bean, EventSubscriber annotation) {
        PayloadValidator custom = null;
        Class<? extends PayloadValidator> validatorClass = annotation.validator();
        if (validatorClass != PayloadValidator.class) {
            custom = beanOrNew(beanName, validatorClass, "validator");
        } else if (bean instanceof PayloadValidator self) {
            custom = self;
        }
        if (!annotation.validatePayload()) {
            return custom;
        }
        if (!ClassUtils.isPresent("jakarta.validation.Validator", getClass().getClassLoader())) {
            throw new BeanCreationException(beanName,
                    "@EventSubscriber(validatePayload = true) needs Jakarta Bean Validation on the classpath");
        }
        PayloadValidator constraints;
        try {
            constraints = BeanValidationPayloadValidator.from(beanFactory);
        } catch (RuntimeException e) {
            throw new BeanCreationException(beanName, "No Bean Validation provider for @EventSubscriber", e);
        }
        if (custom == null) {
            return constraints;
        }
        PayloadValidator then = custom;
        return event -> {
            constraints.validate(event);
            then.validate(event);
        };
    }

    /** A bean of {@code type} when the context has one, else a new instance. */
    private <T> T beanOrNew(String beanName, Class<T> type, String attribute) {
        return beanFactory.getBeanProvider(type).getIfAvailable(() -> instantiate(beanName, type, attribute));
    }

    private static <T> T instantiate(String beanName, Class<T> type, String attribute) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (Exception e) {
            throw new BeanCreationException(beanName,
                    "Failed to instantiate @EventSubscriber " + attribute + ": " + type.getName(), e);
        }
    }

    private record SubscriberModule(String moduleName, List<HandlerDescriptor> handlers) implements HandlerModule {
    }
}

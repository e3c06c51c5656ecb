package eventbus.spring.boot;

import eventbus.Event;
import eventbus.PayloadValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.springframework.beans.factory.ListableBeanFactory;

import java.util.Set;

/**
 * Validates event payloads against their Jakarta Bean Validation constraints
 * ({@code @NotBlank}, {@code @NotNull}, ...). Used for {@code @EventSubscriber(validatePayload = true)}.
 *
 * <p>Only referenced once a subscriber asks for it, so the starter works without a Bean
 * Validation provider on the classpath.
 */
final class BeanValidationPayloadValidator implements PayloadValidator {

    private final Validator validator;

    BeanValidationPayloadValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Uses the context's {@link Validator} (Spring Boot's validation auto-configuration provides
     * one), else the provider's default factory.
     */
    static BeanValidationPayloadValidator from(ListableBeanFactory beanFactory) {
        Validator validator = beanFactory.getBeanProvider(Validator.class).getIfAvailable(() -> {
            ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
            return factory.getValidator();
        });
        return new BeanValidationPayloadValidator(validator);
    }

    @Override
    public void validate(Event event) {
        Object data = event.data();
        if (data == null) {
            throw new IllegalArgumentException("Event " + event.name() + " has no payload to validate");
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(data);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
    }
}

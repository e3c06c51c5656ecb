package eventbus;

/**
 * Thrown when a handler is registered with an unusable retry policy or timeout.
 *
 * @see eventbus.registry.HandlerRegistry#register(HandlerDescriptor)
 */
public final class InvalidPolicyException extends IllegalArgumentException {

  public InvalidPolicyException(String message) {
    super(message);
  }
}

package eventbus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PayloadValidatorTest {

  private static Event withData(Object data) {
    return Event.builder("projects:project.created").sourceModule("projects").data(data).build();
  }

  @Test
  void instanceOfAcceptsMatchingPayload() {
    PayloadValidator validator = PayloadValidator.instanceOf(CharSequence.class);

    assertDoesNotThrow(() -> validator.validate(withData("p1")));
  }

  @Test
  void instanceOfNamesBothTypesOnMismatch() {
    PayloadValidator validator = PayloadValidator.instanceOf(CharSequence.class);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> validator.validate(withData(42)));
    assertTrue(ex.getMessage().contains("java.lang.CharSequence"));
    assertTrue(ex.getMessage().contains("java.lang.Integer"));
    assertThrows(IllegalArgumentException.class, () -> validator.validate(withData(null)));
  }
}

package eventbus.model;

public enum CircuitState {
  CLOSED,
  OPEN,
  HALF_OPEN
}

/**
 * Value types shared by the dispatcher and the stores.
 *
 * @see eventbus.model.DeliveryOutcome
 * @see eventbus.model.IdempotencyRecord
 * @see eventbus.model.CircuitState
 */
package eventbus.model;

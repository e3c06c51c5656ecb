/**
 * Micrometer bridge for event bus metrics.
 *
 * @see eventbus.micrometer.MicrometerMetricsExporter
 */
package eventbus.micrometer;

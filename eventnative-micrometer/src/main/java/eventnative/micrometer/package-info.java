/**
 * Micrometer bridge for delivery metrics.
 *
 * @see eventnative.micrometer.MicrometerMetricsExporter
 */
package eventnative.micrometer;

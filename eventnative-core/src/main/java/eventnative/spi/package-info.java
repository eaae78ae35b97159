/**
 * Service Provider Interfaces (SPI) implemented by integrators: destination adapters,
 * cross-process write locks and metrics.
 *
 * @see eventnative.spi.DestinationAdapter
 * @see eventnative.spi.MonitorKeeper
 * @see eventnative.spi.MetricsExporter
 */
package eventnative.spi;

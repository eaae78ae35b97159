package eventnative.delivery;

import eventnative.outcome.OutcomeCache;
import eventnative.spi.MetricsExporter;
import eventnative.spi.MonitorKeeper;

import java.util.Objects;

/**
 * Collaborators shared by every storage proxy of a process.
 */
public record DeliveryContext(
    OutcomeCache outcomes,
    MonitorKeeper monitorKeeper,
    MetricsExporter metrics,
    DeliverySettings settings
) {
  public DeliveryContext {
    Objects.requireNonNull(outcomes, "outcomes");
    Objects.requireNonNull(monitorKeeper, "monitorKeeper");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(settings, "settings");
  }

  public static DeliveryContext of(OutcomeCache outcomes, DeliverySettings settings) {
    return new DeliveryContext(outcomes, MonitorKeeper.NOOP, MetricsExporter.NOOP, settings);
  }
}

package eventnative.storage;

import eventnative.spi.DestinationAdapter;

/**
 * Creates the adapter of one destination from its resolved spec.
 */
@FunctionalInterface
public interface AdapterFactory {

  /**
   * @throws Exception if the adapter cannot be created, e.g. a missing parameter or an
   *                   unreachable database
   */
  DestinationAdapter create(DestinationSpec spec) throws Exception;
}

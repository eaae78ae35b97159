/**
 * Storage proxies: per-destination delivery in batch or stream mode, with retry and backoff.
 *
 * @see eventnative.delivery.BatchStorageProxy
 * @see eventnative.delivery.StreamStorageProxy
 */
package eventnative.delivery;

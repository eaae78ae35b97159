package eventnative.delivery;

/**
 * Lifecycle of a storage proxy. Batch proxies move between {@code IDLE} and {@code FLUSHING};
 * stream proxies between {@code IDLE}, {@code CONSUMING} and {@code RETRYING}. {@code CLOSED}
 * is terminal.
 */
public enum ProxyState {
  IDLE,
  FLUSHING,
  CONSUMING,
  RETRYING,
  CLOSED
}

package eventnative.storage;

/**
 * {@link java.util.ServiceLoader} entry point contributing one destination type.
 *
 * <p>Register implementations in
 * {@code META-INF/services/eventnative.storage.DestinationProvider}.
 */
public interface DestinationProvider extends AdapterFactory {

  /** Type id matched against {@code type} in destination configuration. */
  String type();
}

package ca.gc.cra.rigging.spi;

/**
 * Resolves a worker class URI such as {@code sync} or {@code com.example.MyWorker} into a loaded
 * type.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TypeResolver {

  /**
   * Loads the type named by {@code uri}.
   *
   * @param uri alias or fully qualified class name
   * @return resolved type
   * @throws IllegalArgumentException if the URI cannot be resolved
   */
  Class<?> resolve(String uri);
}

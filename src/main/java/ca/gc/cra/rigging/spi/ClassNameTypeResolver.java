package ca.gc.cra.rigging.spi;

import ca.gc.cra.rigging.workers.SyncWorker;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TypeResolver} backed by a class loader and a table of short aliases.
 *
 * <p>An alias maps to a fully qualified class name; anything else is treated as a class name,
 * accepting both {@code pkg.Type} and {@code pkg:Type} spellings.</p>
 *
 * @since 0.1.0
 */
public final class ClassNameTypeResolver implements TypeResolver {
  private static final Map<String, String> BUILTIN_ALIASES =
      Map.of("sync", SyncWorker.class.getName());

  private final Map<String, String> aliases;
  private final ClassLoader loader;

  /**
   * Creates a resolver.
   *
   * @param aliases alias to class name table; copied
   * @param loader class loader used to load resolved names
   */
  public ClassNameTypeResolver(Map<String, String> aliases, ClassLoader loader) {
    this.aliases = Map.copyOf(Objects.requireNonNull(aliases, "aliases"));
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /**
   * Creates a resolver knowing the bundled worker aliases ({@code sync}) using the thread context
   * class loader.
   *
   * @return resolver
   */
  public static ClassNameTypeResolver standard() {
    return new ClassNameTypeResolver(BUILTIN_ALIASES, defaultLoader());
  }

  /**
   * Creates a resolver without aliases using the thread context class loader.
   *
   * @return resolver
   */
  public static ClassNameTypeResolver withoutAliases() {
    return new ClassNameTypeResolver(Map.of(), defaultLoader());
  }

  @Override
  public Class<?> resolve(String uri) {
    if (uri == null || uri.isBlank()) {
      throw new IllegalArgumentException("worker class must not be blank");
    }
    String trimmed = uri.strip();
    String className = aliases.getOrDefault(trimmed, trimmed.replace(':', '.'));
    try {
      return Class.forName(className, false, loader);
    } catch (ClassNotFoundException ex) {
      throw new IllegalArgumentException("Unable to load worker class '" + uri + "'", ex);
    }
  }

  private static ClassLoader defaultLoader() {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    return loader != null ? loader : ClassNameTypeResolver.class.getClassLoader();
  }
}

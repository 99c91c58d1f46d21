package ca.gc.cra.rigging.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Append-only, ordered catalog of setting declarations.
 * <p><strong>Role:</strong> Populated once during startup, then frozen; every {@link Configuration}
 * is built from a snapshot of it.</p>
 * <p><strong>Thread-safety:</strong> Registration is meant for a single startup thread. Once
 * {@link #freeze()} has been called the catalog is immutable and may be read concurrently.</p>
 *
 * @since 0.1.0
 */
public final class SettingRegistry {
  private final List<Setting> settings = new ArrayList<>();
  private final Set<String> names = new HashSet<>();
  private volatile List<Setting> frozen;

  /**
   * Appends {@code setting}, assigning it the next order index.
   *
   * @param setting unregistered declaration
   * @return registered copy whose order equals the catalog size before the call
   * @throws DuplicateSettingException if the name is already registered
   * @throws IllegalStateException if the registry has been frozen
   */
  public synchronized Setting register(Setting setting) {
    Objects.requireNonNull(setting, "setting");
    if (frozen != null) {
      throw new IllegalStateException(
          "Setting registry is frozen; cannot register " + setting.name());
    }
    if (names.contains(setting.name())) {
      throw new DuplicateSettingException(setting.name());
    }
    Setting registered = setting.withOrder(settings.size());
    settings.add(registered);
    names.add(registered.name());
    return registered;
  }

  /**
   * Ends the startup phase. Further registration fails.
   *
   * @return this registry
   */
  public synchronized SettingRegistry freeze() {
    if (frozen == null) {
      frozen = List.copyOf(settings);
    }
    return this;
  }

  /**
   * Reports whether {@link #freeze()} has been called.
   *
   * @return {@code true} once frozen
   */
  public boolean isFrozen() {
    return frozen != null;
  }

  /**
   * Returns the registered settings in registration order.
   *
   * @return immutable snapshot
   */
  public List<Setting> settings() {
    List<Setting> snapshot = frozen;
    if (snapshot != null) {
      return snapshot;
    }
    synchronized (this) {
      return List.copyOf(settings);
    }
  }

  /**
   * Returns the number of registered settings.
   *
   * @return catalog size
   */
  public int size() {
    return settings().size();
  }

  /**
   * Instantiates one fresh value cell per registered setting.
   *
   * <p>Settings are visited in registration order; names in {@code ignore} are skipped. A present
   * default is validated and stored immediately, so a broken default aborts the whole call.</p>
   *
   * @param ignore names to leave out; {@code null} means none
   * @return mutable map from name to value cell, in registration order
   * @throws ca.gc.cra.rigging.validation.ValidationException if a declared default is invalid
   */
  public Map<String, SettingValue> makeSettings(Set<String> ignore) {
    Set<String> skipped = ignore == null ? Collections.emptySet() : ignore;
    Map<String, SettingValue> values = new LinkedHashMap<>();
    for (Setting setting : settings()) {
      if (skipped.contains(setting.name())) {
        continue;
      }
      SettingValue value = new SettingValue(setting);
      if (setting.appliesDefault()) {
        value.set(setting.defaultValue());
      }
      values.put(setting.name(), value);
    }
    return values;
  }
}

package ca.gc.cra.rigging.config;

import ca.gc.cra.rigging.hooks.Hook;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable display view of a {@link Configuration}: setting name to printable value, in
 * registration order.
 *
 * <p>Hooks are rendered by the name of the hook interface they implement; absent values stay
 * {@code null}.</p>
 *
 * @param values rendered values keyed by setting name
 * @since 0.1.0
 */
public record ConfigurationSnapshot(Map<String, Object> values) {

  /**
   * Copies {@code values} preserving order.
   */
  public ConfigurationSnapshot {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Captures the current values of {@code configuration}.
   *
   * @param configuration source configuration
   * @return snapshot
   */
  public static ConfigurationSnapshot of(Configuration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    Map<String, Object> rendered = new LinkedHashMap<>();
    for (SettingValue value : configuration.values()) {
      rendered.put(value.setting().name(), render(value.get()));
    }
    return new ConfigurationSnapshot(rendered);
  }

  private static Object render(Object value) {
    if (value instanceof Hook hook) {
      for (Class<?> type : hook.getClass().getInterfaces()) {
        if (Hook.class.isAssignableFrom(type)) {
          return "<" + type.getSimpleName() + ">";
        }
      }
      return "<" + Hook.class.getSimpleName() + ">";
    }
    return value;
  }
}

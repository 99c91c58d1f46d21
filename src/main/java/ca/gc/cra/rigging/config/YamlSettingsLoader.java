package ca.gc.cra.rigging.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads setting values from a flat YAML document ({@code name: value} per line).
 *
 * <p>Values are returned raw; they are validated when applied through
 * {@link Configuration#set(String, Object)}.</p>
 */
public final class YamlSettingsLoader {

  private YamlSettingsLoader() {}

  /**
   * Reads {@code path}.
   *
   * @param path configuration file
   * @return setting values in document order, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a flat mapping of scalars
   */
  public static Optional<Map<String, Object>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      if (!(document instanceof Map<?, ?> root)) {
        throw new IllegalArgumentException("Configuration file " + path + " must be a mapping");
      }
      Map<String, Object> values = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : root.entrySet()) {
        if (!(entry.getKey() instanceof String key) || key.isBlank()) {
          throw new IllegalArgumentException("Configuration file " + path
              + " contains a non-string or blank key: " + entry.getKey());
        }
        Object value = entry.getValue();
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
          throw new IllegalArgumentException(
              "Setting " + key + " must be a scalar value in " + path);
        }
        values.put(key, value);
      }
      return Optional.of(values);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }
}

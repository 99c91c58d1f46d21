package ca.gc.cra.rigging.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Build version, filtered into {@code rigging-version.properties} at package time.
 */
public final class Version {
  private static final String RESOURCE = "/rigging-version.properties";
  private static final String FALLBACK = "dev";

  private Version() {}

  /**
   * Returns the project version.
   *
   * @return version string, or {@code dev} when the resource is missing or unfiltered
   */
  public static String current() {
    try (InputStream in = Version.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        return FALLBACK;
      }
      Properties properties = new Properties();
      properties.load(in);
      String version = properties.getProperty("version", FALLBACK).strip();
      return version.isEmpty() || version.startsWith("${") ? FALLBACK : version;
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read " + RESOURCE, ex);
    }
  }
}

package ca.gc.cra.rigging.spi;

import com.sun.security.auth.module.UnixSystem;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IdentityService} for POSIX hosts.
 *
 * <p>Effective ids are read from the owner of {@code /proc/self}, which the kernel reports as the
 * effective uid and gid of the process; hosts without procfs fall back to {@link UnixSystem}.
 * Names are resolved by scanning the colon-separated {@code passwd} and {@code group} databases,
 * where the id is the third field.</p>
 *
 * @since 0.1.0
 */
public final class SystemIdentityService implements IdentityService {
  private static final int NAME_FIELD = 0;
  private static final int ID_FIELD = 2;
  private static final Path PROC_SELF = Path.of("/proc/self");

  private static final Logger log = LoggerFactory.getLogger(SystemIdentityService.class);

  private final Path passwdFile;
  private final Path groupFile;
  private final Path procSelf;

  /**
   * Creates a service reading the given database files.
   *
   * @param passwdFile user database, usually {@code /etc/passwd}
   * @param groupFile group database, usually {@code /etc/group}
   */
  public SystemIdentityService(Path passwdFile, Path groupFile) {
    this(passwdFile, groupFile, PROC_SELF);
  }

  SystemIdentityService(Path passwdFile, Path groupFile, Path procSelf) {
    this.passwdFile = Objects.requireNonNull(passwdFile, "passwdFile");
    this.groupFile = Objects.requireNonNull(groupFile, "groupFile");
    this.procSelf = Objects.requireNonNull(procSelf, "procSelf");
  }

  /**
   * Creates a service reading {@code /etc/passwd} and {@code /etc/group}.
   *
   * @return service bound to the host databases
   */
  public static SystemIdentityService host() {
    return new SystemIdentityService(Path.of("/etc/passwd"), Path.of("/etc/group"));
  }

  @Override
  public long currentEffectiveUid() {
    return ownerId("unix:uid", () -> new UnixSystem().getUid());
  }

  @Override
  public long currentEffectiveGid() {
    return ownerId("unix:gid", () -> new UnixSystem().getGid());
  }

  @Override
  public OptionalLong lookupUserByName(String name) {
    return lookup(passwdFile, name);
  }

  @Override
  public OptionalLong lookupGroupByName(String name) {
    return lookup(groupFile, name);
  }

  private long ownerId(String attribute, LongSupplier fallback) {
    if (Files.exists(procSelf)) {
      try {
        return ((Number) Files.getAttribute(procSelf, attribute)).longValue();
      } catch (IOException | UnsupportedOperationException ex) {
        log.debug("Cannot read {} of {}; using process credentials", attribute, procSelf, ex);
      }
    }
    return fallback.getAsLong();
  }

  private static OptionalLong lookup(Path database, String name) {
    if (name == null || name.isEmpty() || !Files.isReadable(database)) {
      return OptionalLong.empty();
    }
    List<String> lines;
    try {
      lines = Files.readAllLines(database, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read " + database, ex);
    }
    for (String line : lines) {
      if (line.isBlank() || line.startsWith("#")) {
        continue;
      }
      String[] fields = line.split(":", -1);
      if (fields.length <= ID_FIELD || !fields[NAME_FIELD].equals(name)) {
        continue;
      }
      try {
        return OptionalLong.of(Long.parseLong(fields[ID_FIELD].trim()));
      } catch (NumberFormatException ex) {
        return OptionalLong.empty();
      }
    }
    return OptionalLong.empty();
  }
}

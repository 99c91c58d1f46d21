package ca.gc.cra.rigging.spi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.security.auth.module.UnixSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemIdentityServiceTest {
  @TempDir Path tempDir;

  private SystemIdentityService identities;

  @BeforeEach
  void setUp() throws Exception {
    Path passwd = tempDir.resolve("passwd");
    Files.writeString(passwd, """
        # local accounts
        root:x:0:0:root:/root:/bin/bash
        www:x:33:33:www:/var/www:/usr/sbin/nologin
        broken:x:notanumber:1::/:/bin/false
        short:x
        """);
    Path group = tempDir.resolve("group");
    Files.writeString(group, """
        wheel:x:0:
        www-data:x:33:www
        """);
    identities = new SystemIdentityService(passwd, group);
  }

  @Test
  void resolvesKnownNames() {
    assertEquals(OptionalLong.of(0), identities.lookupUserByName("root"));
    assertEquals(OptionalLong.of(33), identities.lookupUserByName("www"));
    assertEquals(OptionalLong.of(33), identities.lookupGroupByName("www-data"));
  }

  @Test
  void unknownOrMalformedEntriesAreEmpty() {
    assertTrue(identities.lookupUserByName("nobody-here").isEmpty());
    assertTrue(identities.lookupUserByName("broken").isEmpty());
    assertTrue(identities.lookupUserByName("short").isEmpty());
    assertTrue(identities.lookupUserByName("").isEmpty());
    assertTrue(identities.lookupGroupByName("root").isEmpty());
  }

  @Test
  void missingDatabaseYieldsEmpty() {
    SystemIdentityService missing =
        new SystemIdentityService(tempDir.resolve("none"), tempDir.resolve("none"));

    assertTrue(missing.lookupUserByName("root").isEmpty());
    assertTrue(missing.lookupGroupByName("wheel").isEmpty());
  }

  @Test
  void effectiveIdsComeFromOwnerOfProcessEntry() throws Exception {
    Path processEntry = Files.createDirectory(tempDir.resolve("self"));
    SystemIdentityService service = new SystemIdentityService(
        tempDir.resolve("passwd"), tempDir.resolve("group"), processEntry);

    long uid = ((Number) Files.getAttribute(processEntry, "unix:uid")).longValue();
    long gid = ((Number) Files.getAttribute(processEntry, "unix:gid")).longValue();

    assertEquals(uid, service.currentEffectiveUid());
    assertEquals(gid, service.currentEffectiveGid());
  }

  @Test
  void missingProcessEntryFallsBackToProcessCredentials() {
    SystemIdentityService service = new SystemIdentityService(
        tempDir.resolve("passwd"), tempDir.resolve("group"), tempDir.resolve("no-proc"));

    assertEquals(new UnixSystem().getUid(), service.currentEffectiveUid());
    assertEquals(new UnixSystem().getGid(), service.currentEffectiveGid());
  }

  @Test
  void reportsProcessIds() {
    assertTrue(identities.currentEffectiveUid() >= 0);
    assertTrue(identities.currentEffectiveGid() >= 0);
  }
}

package ca.gc.cra.rigging.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rigging.hooks.Hook;
import ca.gc.cra.rigging.testutil.FakeIdentities;
import ca.gc.cra.rigging.testutil.TestConfigurations;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class StandardSettingsTest {
  private static final Map<String, Setting> BY_NAME = TestConfigurations.standardRegistry()
      .settings().stream()
      .collect(Collectors.toMap(Setting::name, Function.identity()));

  @Test
  void commandLineFlagsMatchCatalog() {
    assertFlags("config", "FILE", "-c", "--config");
    assertFlags("bind", "ADDRESS", "-b", "--bind");
    assertFlags("backlog", "INT", "--backlog");
    assertFlags("workers", "INT", "-w", "--workers");
    assertFlags("worker_class", "STRING", "-k", "--worker-class");
    assertFlags("worker_connections", "INT", "--worker-connections");
    assertFlags("max_requests", "INT", "--max-requests");
    assertFlags("timeout", "INT", "-t", "--timeout");
    assertFlags("keepalive", "INT", "--keep-alive");
    assertFlags("debug", null, "--debug");
    assertFlags("spew", null, "--spew");
    assertFlags("preload_app", null, "--preload");
    assertFlags("daemon", null, "-D", "--daemon");
    assertFlags("pidfile", "FILE", "-p", "--pid");
    assertFlags("user", "USER", "-u", "--user");
    assertFlags("group", "GROUP", "-g", "--group");
    assertFlags("umask", "INT", "-m", "--umask");
    assertFlags("logfile", "FILE", "--log-file");
    assertFlags("loglevel", "LEVEL", "--log-level");
    assertFlags("logconfig", "FILE", "--log-config");
    assertFlags("proc_name", "STRING", "-n", "--name");
  }

  @Test
  void twentyOneSettingsAreExposedOnCommandLine() {
    long withCli = BY_NAME.values().stream().filter(Setting::hasCli).count();
    assertEquals(21, withCli);
    assertFalse(BY_NAME.get("tmp_upload_dir").hasCli());
    assertFalse(BY_NAME.get("default_proc_name").hasCli());
  }

  @Test
  void booleanFlagsStoreTrue() {
    for (String name : List.of("debug", "spew", "preload_app", "daemon")) {
      Setting setting = BY_NAME.get(name);
      assertEquals(ActionKind.STORE_TRUE, setting.action(), name);
      assertEquals(ValueType.BOOL, setting.type(), name);
      assertEquals(Boolean.FALSE, setting.defaultValue(), name);
    }
  }

  @Test
  void declaredDefaults() {
    assertEquals("127.0.0.1:8000", BY_NAME.get("bind").defaultValue());
    assertEquals(2048, BY_NAME.get("backlog").defaultValue());
    assertEquals(1, BY_NAME.get("workers").defaultValue());
    assertEquals("sync", BY_NAME.get("worker_class").defaultValue());
    assertEquals(1000, BY_NAME.get("worker_connections").defaultValue());
    assertEquals(0, BY_NAME.get("max_requests").defaultValue());
    assertEquals(30, BY_NAME.get("timeout").defaultValue());
    assertEquals(2, BY_NAME.get("keepalive").defaultValue());
    assertEquals(0, BY_NAME.get("umask").defaultValue());
    assertEquals("-", BY_NAME.get("logfile").defaultValue());
    assertEquals("info", BY_NAME.get("loglevel").defaultValue());
    assertEquals("gunicorn", BY_NAME.get("default_proc_name").defaultValue());
    assertNull(BY_NAME.get("pidfile").defaultValue());
    assertNull(BY_NAME.get("proc_name").defaultValue());
    assertNull(BY_NAME.get("user").defaultValue());
    assertTrue(BY_NAME.get("user").resolveAbsentDefault());
    assertTrue(BY_NAME.get("group").resolveAbsentDefault());
  }

  @Test
  void hooksAreNotExposedAndHaveMatchingArity() {
    Map<String, Integer> arities = Map.of(
        "when_ready", 1, "pre_fork", 2, "post_fork", 2, "pre_exec", 1,
        "pre_request", 2, "post_request", 2, "worker_exit", 2);
    arities.forEach((name, arity) -> {
      Setting setting = BY_NAME.get(name);
      assertFalse(setting.hasCli(), name);
      assertEquals(ValueType.CALLABLE, setting.type(), name);
      assertEquals(StandardSettings.SECTION_SERVER_HOOKS, setting.section(), name);
      assertEquals(arity, ((Hook) setting.defaultValue()).arity(), name);
    });
  }

  @Test
  void sectionsGroupRelatedSettings() {
    assertEquals(StandardSettings.SECTION_CONFIG_FILE, BY_NAME.get("config").section());
    assertEquals(StandardSettings.SECTION_SERVER_SOCKET, BY_NAME.get("backlog").section());
    assertEquals(StandardSettings.SECTION_WORKER_PROCESSES, BY_NAME.get("keepalive").section());
    assertEquals(StandardSettings.SECTION_DEBUGGING, BY_NAME.get("spew").section());
    assertEquals(StandardSettings.SECTION_SERVER_MECHANICS, BY_NAME.get("umask").section());
    assertEquals(StandardSettings.SECTION_LOGGING, BY_NAME.get("logconfig").section());
    assertEquals(StandardSettings.SECTION_PROCESS_NAMING, BY_NAME.get("proc_name").section());
  }

  @Test
  void shortDocIsFirstLineOfDescription() {
    assertEquals("The socket to bind.", BY_NAME.get("bind").shortDoc());
    assertEquals("The number of worker processes for handling requests.",
        BY_NAME.get("workers").shortDoc());
    assertTrue(BY_NAME.get("bind").longDoc().startsWith("The socket to bind.\n\n"));
  }

  @Test
  void processWideRegistryIsFrozenAndShared() {
    SettingRegistry registry = StandardSettings.registry();

    assertTrue(registry.isFrozen());
    assertSame(registry, StandardSettings.registry());
    assertEquals(BY_NAME.size(), registry.size());
  }

  @Test
  void declaringTwiceIntoSameRegistryFails() {
    SettingRegistry registry = new SettingRegistry();
    StandardSettings.registerAll(registry, FakeIdentities.standard());

    assertThrows(DuplicateSettingException.class,
        () -> StandardSettings.registerAll(registry, FakeIdentities.standard()));
  }

  private static void assertFlags(String name, String metavar, String... flags) {
    Setting setting = BY_NAME.get(name);
    assertEquals(List.of(flags), setting.cliFlags(), name);
    assertEquals(metavar, setting.metavar(), name);
  }
}

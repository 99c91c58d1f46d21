package ca.gc.cra.rigging.config;

import ca.gc.cra.rigging.hooks.DefaultHooks;
import ca.gc.cra.rigging.spi.IdentityService;
import ca.gc.cra.rigging.spi.SystemIdentityService;
import ca.gc.cra.rigging.validation.Validators;
import java.util.List;
import java.util.Objects;

/**
 * The server's setting catalog.
 *
 * <p>{@link #registerAll(SettingRegistry, IdentityService)} declares every setting in a fixed
 * order; {@link #registry()} holds the process-wide, frozen catalog backed by the host identity
 * databases.</p>
 *
 * @since 0.1.0
 */
public final class StandardSettings {
  public static final String CONFIG = "config";
  public static final String BIND = "bind";
  public static final String BACKLOG = "backlog";
  public static final String WORKERS = "workers";
  public static final String WORKER_CLASS = "worker_class";
  public static final String WORKER_CONNECTIONS = "worker_connections";
  public static final String MAX_REQUESTS = "max_requests";
  public static final String TIMEOUT = "timeout";
  public static final String KEEPALIVE = "keepalive";
  public static final String DEBUG = "debug";
  public static final String SPEW = "spew";
  public static final String PRELOAD_APP = "preload_app";
  public static final String DAEMON = "daemon";
  public static final String PIDFILE = "pidfile";
  public static final String USER = "user";
  public static final String GROUP = "group";
  public static final String UMASK = "umask";
  public static final String TMP_UPLOAD_DIR = "tmp_upload_dir";
  public static final String LOGFILE = "logfile";
  public static final String LOGLEVEL = "loglevel";
  public static final String LOGCONFIG = "logconfig";
  public static final String PROC_NAME = "proc_name";
  public static final String DEFAULT_PROC_NAME = "default_proc_name";
  public static final String WHEN_READY = "when_ready";
  public static final String PRE_FORK = "pre_fork";
  public static final String POST_FORK = "post_fork";
  public static final String PRE_EXEC = "pre_exec";
  public static final String PRE_REQUEST = "pre_request";
  public static final String POST_REQUEST = "post_request";
  public static final String WORKER_EXIT = "worker_exit";

  static final String SECTION_CONFIG_FILE = "Config File";
  static final String SECTION_SERVER_SOCKET = "Server Socket";
  static final String SECTION_WORKER_PROCESSES = "Worker Processes";
  static final String SECTION_DEBUGGING = "Debugging";
  static final String SECTION_SERVER_MECHANICS = "Server Mechanics";
  static final String SECTION_LOGGING = "Logging";
  static final String SECTION_PROCESS_NAMING = "Process Naming";
  static final String SECTION_SERVER_HOOKS = "Server Hooks";

  private StandardSettings() {}

  /**
   * Returns the process-wide catalog, declaring it on first use.
   *
   * @return frozen registry
   */
  public static SettingRegistry registry() {
    return Holder.REGISTRY;
  }

  /**
   * Declares every standard setting into {@code registry}, in catalog order.
   *
   * @param registry target registry, normally still open
   * @param identities identity service backing the {@code user} and {@code group} validators
   * @return the registered descriptors
   * @throws DuplicateSettingException if {@code registry} already holds one of the names
   */
  public static List<Setting> registerAll(SettingRegistry registry, IdentityService identities) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(identities, "identities");
    return declarations(identities).stream().map(registry::register).toList();
  }

  private static List<Setting> declarations(IdentityService identities) {
    return List.of(
        Setting.builder(CONFIG)
            .section(SECTION_CONFIG_FILE)
            .cli("-c", "--config")
            .meta("FILE")
            .validator(Validators.string())
            .desc("""
                The path to a configuration file.

                Only has an effect when specified on the command line or as part of an
                application specific configuration.
                """)
            .build(),
        Setting.builder(BIND)
            .section(SECTION_SERVER_SOCKET)
            .cli("-b", "--bind")
            .meta("ADDRESS")
            .validator(Validators.string())
            .defaultValue("127.0.0.1:8000")
            .desc("""
                The socket to bind.

                A string of the form: 'HOST', 'HOST:PORT', 'unix:PATH'. An IP is a valid
                HOST.
                """)
            .build(),
        Setting.builder(BACKLOG)
            .section(SECTION_SERVER_SOCKET)
            .cli("--backlog")
            .meta("INT")
            .validator(Validators.positiveInt())
            .type(ValueType.INT)
            .defaultValue(2048)
            .desc("""
                The maximum number of pending connections.

                This refers to the number of clients that can be waiting to be served.
                Exceeding this number results in the client getting an error when
                attempting to connect. It should only affect servers under significant
                load.

                Must be a positive integer. Generally set in the 64-2048 range.
                """)
            .build(),
        Setting.builder(WORKERS)
            .section(SECTION_WORKER_PROCESSES)
            .cli("-w", "--workers")
            .meta("INT")
            .validator(Validators.positiveInt())
            .type(ValueType.INT)
            .defaultValue(1)
            .desc("""
                The number of worker processes for handling requests.

                A positive integer generally in the 2-4 x $(NUM_CORES) range. You'll
                want to vary this a bit to find the best for your particular
                application's work load.
                """)
            .build(),
        Setting.builder(WORKER_CLASS)
            .section(SECTION_WORKER_PROCESSES)
            .cli("-k", "--worker-class")
            .meta("STRING")
            .validator(Validators.string())
            .defaultValue("sync")
            .desc("""
                The type of workers to use.

                The default class (sync) should handle most 'normal' types of workloads.

                A string naming one of the bundled worker aliases, or a fully qualified
                class name (PACKAGE.CLASS or PACKAGE:CLASS) of a custom worker type.
                """)
            .build(),
        Setting.builder(WORKER_CONNECTIONS)
            .section(SECTION_WORKER_PROCESSES)
            .cli("--worker-connections")
            .meta("INT")
            .validator(Validators.positiveInt())
            .type(ValueType.INT)
            .defaultValue(1000)
            .desc("""
                The maximum number of simultaneous clients.

                This setting only affects asynchronous worker types.
                """)
            .build(),
        Setting.builder(MAX_REQUESTS)
            .section(SECTION_WORKER_PROCESSES)
            .cli("--max-requests")
            .meta("INT")
            .validator(Validators.positiveInt())
            .type(ValueType.INT)
            .defaultValue(0)
            .desc("""
                The maximum number of requests a worker will process before restarting.

                Any value greater than zero will limit the number of requests a worker
                will process before automatically restarting. This is a simple method
                to help limit the damage of memory leaks.

                If this is set to zero (the default) then the automatic worker
                restarts are disabled.
                """)
            .build(),
        Setting.builder(TIMEOUT)
            .section(SECTION_WORKER_PROCESSES)
            .cli("-t", "--timeout")
            .meta("INT")
            .validator(Validators.positiveInt())
            .type(ValueType.INT)
            .defaultValue(30)
            .desc("""
                Workers silent for more than this many seconds are killed and restarted.

                Generally set to thirty seconds. Only set this noticeably higher if
                you're sure of the repercussions for sync workers. For the non sync
                workers it just means that the worker process is still communicating and
                is not tied to the length of time required to handle a single request.
                """)
            .build(),
        Setting.builder(KEEPALIVE)
            .section(SECTION_WORKER_PROCESSES)
            .cli("--keep-alive")
            .meta("INT")
            .validator(Validators.positiveInt())
            .type(ValueType.INT)
            .defaultValue(2)
            .desc("""
                The number of seconds to wait for requests on a Keep-Alive connection.

                Generally set in the 1-5 seconds range.
                """)
            .build(),
        Setting.builder(DEBUG)
            .section(SECTION_DEBUGGING)
            .cli("--debug")
            .validator(Validators.bool())
            .type(ValueType.BOOL)
            .action(ActionKind.STORE_TRUE)
            .defaultValue(false)
            .desc("""
                Turn on debugging in the server.

                This limits the number of worker processes to 1 and changes some error
                handling that's sent to clients.
                """)
            .build(),
        Setting.builder(SPEW)
            .section(SECTION_DEBUGGING)
            .cli("--spew")
            .validator(Validators.bool())
            .type(ValueType.BOOL)
            .action(ActionKind.STORE_TRUE)
            .defaultValue(false)
            .desc("""
                Install a trace function that spews every line executed by the server.

                This is the nuclear option.
                """)
            .build(),
        Setting.builder(PRELOAD_APP)
            .section(SECTION_SERVER_MECHANICS)
            .cli("--preload")
            .validator(Validators.bool())
            .type(ValueType.BOOL)
            .action(ActionKind.STORE_TRUE)
            .defaultValue(false)
            .desc("""
                Load application code before the worker processes are forked.

                By preloading an application you can save some RAM resources as well as
                speed up server boot times. Although, if you defer application loading
                to each worker process, you can reload your application code easily by
                restarting workers.
                """)
            .build(),
        Setting.builder(DAEMON)
            .section(SECTION_SERVER_MECHANICS)
            .cli("-D", "--daemon")
            .validator(Validators.bool())
            .type(ValueType.BOOL)
            .action(ActionKind.STORE_TRUE)
            .defaultValue(false)
            .desc("""
                Daemonize the server process.

                Detaches the server from the controlling terminal and enters the
                background.
                """)
            .build(),
        Setting.builder(PIDFILE)
            .section(SECTION_SERVER_MECHANICS)
            .cli("-p", "--pid")
            .meta("FILE")
            .validator(Validators.string())
            .desc("""
                A filename to use for the PID file.

                If not set, no PID file will be written.
                """)
            .build(),
        Setting.builder(USER)
            .section(SECTION_SERVER_MECHANICS)
            .cli("-u", "--user")
            .meta("USER")
            .validator(Validators.user(identities))
            .resolveAbsentDefault()
            .desc("""
                Switch worker processes to run as this user.

                A valid user id (as an integer) or the name of a user that can be
                found in the system user database. When unset the effective user id of
                the server process is used.
                """)
            .build(),
        Setting.builder(GROUP)
            .section(SECTION_SERVER_MECHANICS)
            .cli("-g", "--group")
            .meta("GROUP")
            .validator(Validators.group(identities))
            .resolveAbsentDefault()
            .desc("""
                Switch worker processes to run as this group.

                A valid group id (as an integer) or the name of a group that can be
                found in the system group database. When unset the effective group id of
                the server process is used.
                """)
            .build(),
        Setting.builder(UMASK)
            .section(SECTION_SERVER_MECHANICS)
            .cli("-m", "--umask")
            .meta("INT")
            .validator(Validators.positiveInt())
            .type(ValueType.INT)
            .defaultValue(0)
            .desc("""
                A bit mask for the file mode on files written by the server.

                Note that this affects unix socket permissions.

                A valid value for a umask call or a string literal whose base is taken
                from its prefix, so values like "0", "0xFF" and "0022" are valid for
                decimal, hex, and octal representations.
                """)
            .build(),
        Setting.builder(TMP_UPLOAD_DIR)
            .section(SECTION_SERVER_MECHANICS)
            .meta("DIR")
            .validator(Validators.string())
            .desc("""
                Directory to store temporary request data as they are read.

                This path should be writable by the process permissions set for the
                workers. If not specified, a system generated temporary directory is
                used.
                """)
            .build(),
        Setting.builder(LOGFILE)
            .section(SECTION_LOGGING)
            .cli("--log-file")
            .meta("FILE")
            .validator(Validators.string())
            .defaultValue("-")
            .desc("""
                The log file to write to.

                "-" means log to stdout.
                """)
            .build(),
        Setting.builder(LOGLEVEL)
            .section(SECTION_LOGGING)
            .cli("--log-level")
            .meta("LEVEL")
            .validator(Validators.string())
            .defaultValue("info")
            .desc("""
                The granularity of log outputs.

                Valid level names are:

                * debug
                * info
                * warning
                * error
                * critical
                """)
            .build(),
        Setting.builder(LOGCONFIG)
            .section(SECTION_LOGGING)
            .cli("--log-config")
            .meta("FILE")
            .validator(Validators.string())
            .desc("""
                The log config file to use.

                Points at a Logback XML configuration that replaces the bundled one.
                """)
            .build(),
        Setting.builder(PROC_NAME)
            .section(SECTION_PROCESS_NAMING)
            .cli("-n", "--name")
            .meta("STRING")
            .validator(Validators.string())
            .desc("""
                A base to use for process naming.

                This affects things like ``ps`` and ``top``. If you're going to be
                running more than one instance of the server you'll probably want to set
                a name to tell them apart.

                It defaults to 'gunicorn'.
                """)
            .build(),
        Setting.builder(DEFAULT_PROC_NAME)
            .section(SECTION_PROCESS_NAMING)
            .validator(Validators.string())
            .defaultValue("gunicorn")
            .desc("""
                Internal setting that is adjusted for each type of application.
                """)
            .build(),
        Setting.builder(WHEN_READY)
            .section(SECTION_SERVER_HOOKS)
            .validator(Validators.callable(1))
            .type(ValueType.CALLABLE)
            .defaultValue(DefaultHooks.WHEN_READY)
            .desc("""
                Called just after the server is started.

                The callable needs to accept a single instance variable for the Arbiter.
                """)
            .build(),
        Setting.builder(PRE_FORK)
            .section(SECTION_SERVER_HOOKS)
            .validator(Validators.callable(2))
            .type(ValueType.CALLABLE)
            .defaultValue(DefaultHooks.PRE_FORK)
            .desc("""
                Called just before a worker is forked.

                The callable needs to accept two instance variables for the Arbiter and
                new Worker.
                """)
            .build(),
        Setting.builder(POST_FORK)
            .section(SECTION_SERVER_HOOKS)
            .validator(Validators.callable(2))
            .type(ValueType.CALLABLE)
            .defaultValue(DefaultHooks.POST_FORK)
            .desc("""
                Called just after a worker has been forked.

                The callable needs to accept two instance variables for the Arbiter and
                new Worker.
                """)
            .build(),
        Setting.builder(PRE_EXEC)
            .section(SECTION_SERVER_HOOKS)
            .validator(Validators.callable(1))
            .type(ValueType.CALLABLE)
            .defaultValue(DefaultHooks.PRE_EXEC)
            .desc("""
                Called just before a new master process is forked.

                The callable needs to accept a single instance variable for the Arbiter.
                """)
            .build(),
        Setting.builder(PRE_REQUEST)
            .section(SECTION_SERVER_HOOKS)
            .validator(Validators.callable(2))
            .type(ValueType.CALLABLE)
            .defaultValue(DefaultHooks.PRE_REQUEST)
            .desc("""
                Called just before a worker processes the request.

                The callable needs to accept two instance variables for the Worker and
                the Request.
                """)
            .build(),
        Setting.builder(POST_REQUEST)
            .section(SECTION_SERVER_HOOKS)
            .validator(Validators.callable(2))
            .type(ValueType.CALLABLE)
            .defaultValue(DefaultHooks.POST_REQUEST)
            .desc("""
                Called after a worker processes the request.

                The callable needs to accept two instance variables for the Worker and
                the Request.
                """)
            .build(),
        Setting.builder(WORKER_EXIT)
            .section(SECTION_SERVER_HOOKS)
            .validator(Validators.callable(2))
            .type(ValueType.CALLABLE)
            .defaultValue(DefaultHooks.WORKER_EXIT)
            .desc("""
                Called just after a worker has been exited.

                The callable needs to accept two instance variables for the Arbiter and
                the just-exited Worker.
                """)
            .build());
  }

  private static final class Holder {
    private static final SettingRegistry REGISTRY = create();

    private static SettingRegistry create() {
      SettingRegistry registry = new SettingRegistry();
      registerAll(registry, SystemIdentityService.host());
      return registry.freeze();
    }
  }
}

package ca.gc.cra.rigging.config;

import ca.gc.cra.rigging.hooks.Hook;
import ca.gc.cra.rigging.hooks.RequestHook;
import ca.gc.cra.rigging.hooks.ServerHook;
import ca.gc.cra.rigging.hooks.WorkerHook;
import ca.gc.cra.rigging.spi.ClassNameTypeResolver;
import ca.gc.cra.rigging.spi.TypeResolver;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Live configuration of one server process.
 * <p><strong>Role:</strong> Holds one {@link SettingValue} per registered setting, built from a
 * snapshot of a {@link SettingRegistry}. All mutation of registered settings goes through
 * {@link #set(String, Object)}, which validates before it stores.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Calls to {@code set} must be serialized by the
 * owner, typically the thread that loads configuration during startup.</p>
 * <p><strong>Derived values:</strong> {@link #workerClass()}, {@link #address()},
 * {@link #procName()} and friends are recomputed on every call and always reflect the latest
 * {@code set}.</p>
 *
 * @since 0.1.0
 */
public final class Configuration {
  private final Map<String, SettingValue> settings;
  private final Map<String, Object> attributes = new HashMap<>();
  private final TypeResolver typeResolver;
  private final String usage;

  private Configuration(
      Map<String, SettingValue> settings, TypeResolver typeResolver, String usage) {
    this.settings = settings;
    this.typeResolver = typeResolver;
    this.usage = usage;
  }

  /**
   * Builds a configuration from the process-wide catalog, resolving {@code worker_class} through
   * {@link ClassNameTypeResolver#standard()}.
   *
   * @param usage usage line shown in CLI help, may be {@code null}
   * @return configuration holding every standard setting at its default
   */
  public static Configuration create(String usage) {
    return create(StandardSettings.registry(), Set.of(), usage,
        ClassNameTypeResolver.standard());
  }

  /**
   * Builds a configuration from {@code registry}.
   *
   * @param registry catalog to instantiate
   * @param ignore setting names to leave out
   * @param usage usage line shown in CLI help, may be {@code null}
   * @param typeResolver resolver used by {@link #workerClass()}
   * @return configuration holding the selected settings at their defaults
   * @throws ca.gc.cra.rigging.validation.ValidationException if a declared default is invalid; no
   *     configuration is returned in that case
   */
  public static Configuration create(
      SettingRegistry registry, Set<String> ignore, String usage, TypeResolver typeResolver) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(typeResolver, "typeResolver");
    return new Configuration(registry.makeSettings(ignore), typeResolver, usage);
  }

  /**
   * Returns the usage line passed at construction.
   *
   * @return usage text, may be {@code null}
   */
  public String usage() {
    return usage;
  }

  /**
   * Returns the current typed value of a setting.
   *
   * @param name setting name
   * @return current value, {@code null} when the setting has no value
   * @throws UnknownSettingException if {@code name} is not registered
   */
  public Object get(String name) {
    return cell(name).get();
  }

  /**
   * Validates {@code raw} and stores it as the value of {@code name}.
   *
   * @param name setting name
   * @param raw raw value
   * @throws UnknownSettingException if {@code name} is not registered
   * @throws ca.gc.cra.rigging.validation.ValidationException naming the setting if {@code raw} is
   *     rejected; the previous value is kept
   */
  public void set(String name, Object raw) {
    cell(name).set(raw);
  }

  /**
   * Reports whether {@code name} is a registered setting of this configuration.
   *
   * @param name candidate name
   * @return {@code true} when registered
   */
  public boolean contains(String name) {
    return settings.containsKey(name);
  }

  /**
   * Returns the descriptors of this configuration in registration order.
   *
   * @return immutable list of descriptors
   */
  public List<Setting> descriptors() {
    return settings.values().stream().map(SettingValue::setting).toList();
  }

  /**
   * Returns the value cells in registration order.
   *
   * @return read-only view of the cells
   */
  public Collection<SettingValue> values() {
    return Collections.unmodifiableCollection(settings.values());
  }

  /**
   * Attribute-style read.
   *
   * <p>Registered names read the setting value; other names read a bookkeeping attribute stored
   * with {@link #setAttribute(String, Object)}.</p>
   *
   * @param name attribute or setting name
   * @return value
   * @throws UnknownSettingException if {@code name} is neither a setting nor a stored attribute
   */
  public Object getAttribute(String name) {
    SettingValue value = settings.get(name);
    if (value != null) {
      return value.get();
    }
    if (attributes.containsKey(name)) {
      return attributes.get(name);
    }
    throw new UnknownSettingException(name);
  }

  /**
   * Attribute-style write, allowed only for names that are not settings.
   *
   * @param name attribute name
   * @param value attribute value
   * @throws IllegalMutationException if {@code name} is a registered setting
   */
  public void setAttribute(String name, Object value) {
    if (settings.containsKey(name)) {
      throw new IllegalMutationException(name);
    }
    attributes.put(name, value);
  }

  /**
   * Resolves {@code worker_class} and runs the resolved type's static {@code setup()} when it
   * declares one.
   *
   * @return resolved worker type
   * @throws IllegalArgumentException if the type cannot be resolved
   * @throws IllegalStateException if {@code setup()} fails
   */
  public Class<?> workerClass() {
    String uri = (String) get(StandardSettings.WORKER_CLASS);
    Class<?> workerClass = typeResolver.resolve(uri);
    Method setup = findSetup(workerClass);
    if (setup != null) {
      try {
        setup.invoke(null);
      } catch (IllegalAccessException ex) {
        throw new IllegalStateException("Cannot access setup() of " + workerClass.getName(), ex);
      } catch (InvocationTargetException ex) {
        throw new IllegalStateException(
            "setup() of " + workerClass.getName() + " failed", ex.getCause());
      }
    }
    return workerClass;
  }

  /**
   * Returns the number of workers.
   *
   * @return {@code workers}
   */
  public int workers() {
    return intValue(StandardSettings.WORKERS);
  }

  /**
   * Parses {@code bind} into a structured address.
   *
   * @return bind address
   * @throws ca.gc.cra.rigging.validation.ValidationException if the bind string is malformed
   */
  public BindAddress address() {
    return BindAddress.parse(bind());
  }

  /**
   * Returns the resolved user id workers switch to.
   *
   * @return {@code user}
   */
  public long uid() {
    return (Long) get(StandardSettings.USER);
  }

  /**
   * Returns the resolved group id workers switch to.
   *
   * @return {@code group}
   */
  public long gid() {
    return (Long) get(StandardSettings.GROUP);
  }

  /**
   * Returns {@code proc_name} when set, {@code default_proc_name} otherwise.
   *
   * @return process name
   */
  public String procName() {
    String explicit = (String) get(StandardSettings.PROC_NAME);
    return explicit != null ? explicit : (String) get(StandardSettings.DEFAULT_PROC_NAME);
  }

  /** Returns {@code config}, the configuration file path. */
  public String configFile() {
    return (String) get(StandardSettings.CONFIG);
  }

  /** Returns the raw {@code bind} string. */
  public String bind() {
    return (String) get(StandardSettings.BIND);
  }

  /** Returns {@code backlog}, the pending connection limit. */
  public int backlog() {
    return intValue(StandardSettings.BACKLOG);
  }

  /** Returns {@code worker_connections}. */
  public int workerConnections() {
    return intValue(StandardSettings.WORKER_CONNECTIONS);
  }

  /** Returns {@code max_requests}; {@code 0} disables worker recycling. */
  public int maxRequests() {
    return intValue(StandardSettings.MAX_REQUESTS);
  }

  /** Returns {@code timeout} in seconds. */
  public int timeout() {
    return intValue(StandardSettings.TIMEOUT);
  }

  /** Returns {@code keepalive} in seconds. */
  public int keepalive() {
    return intValue(StandardSettings.KEEPALIVE);
  }

  /** Returns {@code debug}. */
  public boolean debug() {
    return boolValue(StandardSettings.DEBUG);
  }

  /** Returns {@code spew}. */
  public boolean spew() {
    return boolValue(StandardSettings.SPEW);
  }

  /** Returns {@code preload_app}. */
  public boolean preloadApp() {
    return boolValue(StandardSettings.PRELOAD_APP);
  }

  /** Returns {@code daemon}. */
  public boolean daemon() {
    return boolValue(StandardSettings.DAEMON);
  }

  /** Returns {@code pidfile}, {@code null} when no PID file is written. */
  public String pidfile() {
    return (String) get(StandardSettings.PIDFILE);
  }

  /** Returns {@code umask}. */
  public int umask() {
    return intValue(StandardSettings.UMASK);
  }

  /** Returns {@code tmp_upload_dir}, {@code null} for the system default. */
  public String tmpUploadDir() {
    return (String) get(StandardSettings.TMP_UPLOAD_DIR);
  }

  /** Returns {@code logfile}; {@code -} means stdout. */
  public String logfile() {
    return (String) get(StandardSettings.LOGFILE);
  }

  /** Returns the {@code loglevel} name. */
  public String loglevel() {
    return (String) get(StandardSettings.LOGLEVEL);
  }

  /** Returns {@code logconfig}, {@code null} when the bundled logging setup is used. */
  public String logconfig() {
    return (String) get(StandardSettings.LOGCONFIG);
  }

  /**
   * Returns the {@code when_ready} hook.
   *
   * @return hook
   * @throws IllegalStateException if the stored hook is of another kind
   */
  public ServerHook whenReady() {
    return hook(StandardSettings.WHEN_READY, ServerHook.class);
  }

  /**
   * Returns the {@code pre_fork} hook.
   *
   * @return hook
   * @throws IllegalStateException if the stored hook is of another kind
   */
  public WorkerHook preFork() {
    return hook(StandardSettings.PRE_FORK, WorkerHook.class);
  }

  /**
   * Returns the {@code post_fork} hook.
   *
   * @return hook
   * @throws IllegalStateException if the stored hook is of another kind
   */
  public WorkerHook postFork() {
    return hook(StandardSettings.POST_FORK, WorkerHook.class);
  }

  /**
   * Returns the {@code pre_exec} hook.
   *
   * @return hook
   * @throws IllegalStateException if the stored hook is of another kind
   */
  public ServerHook preExec() {
    return hook(StandardSettings.PRE_EXEC, ServerHook.class);
  }

  /**
   * Returns the {@code pre_request} hook.
   *
   * @return hook
   * @throws IllegalStateException if the stored hook is of another kind
   */
  public RequestHook preRequest() {
    return hook(StandardSettings.PRE_REQUEST, RequestHook.class);
  }

  /**
   * Returns the {@code post_request} hook.
   *
   * @return hook
   * @throws IllegalStateException if the stored hook is of another kind
   */
  public RequestHook postRequest() {
    return hook(StandardSettings.POST_REQUEST, RequestHook.class);
  }

  /**
   * Returns the {@code worker_exit} hook.
   *
   * @return hook
   * @throws IllegalStateException if the stored hook is of another kind
   */
  public WorkerHook workerExit() {
    return hook(StandardSettings.WORKER_EXIT, WorkerHook.class);
  }

  private SettingValue cell(String name) {
    SettingValue value = settings.get(name);
    if (value == null) {
      throw new UnknownSettingException(name);
    }
    return value;
  }

  private int intValue(String name) {
    return (Integer) get(name);
  }

  private boolean boolValue(String name) {
    return (Boolean) get(name);
  }

  private <H extends Hook> H hook(String name, Class<H> kind) {
    Object value = get(name);
    if (!kind.isInstance(value)) {
      throw new IllegalStateException(
          "Setting " + name + " holds a hook that is not a " + kind.getSimpleName());
    }
    return kind.cast(value);
  }

  private static Method findSetup(Class<?> type) {
    Method method;
    try {
      method = type.getMethod("setup");
    } catch (NoSuchMethodException ex) {
      return null;
    }
    return Modifier.isStatic(method.getModifiers()) ? method : null;
  }
}

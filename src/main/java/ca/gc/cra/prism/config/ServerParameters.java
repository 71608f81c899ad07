package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Process-level startup parameters gathered from the command line.
 * <p><strong>Why:</strong> Carries the bind target, descriptor hint and credential sources from the CLI
 * into validation and the lifecycle manager without mutation between stages.</p>
 * <p><strong>Role:</strong> Immutable value object; validation produces a merged copy through
 * {@link #withValidation(String, Path)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param port TCP port (0 lets the OS pick one)
 * @param ip bind address
 * @param fd inherited descriptor hint: {@code null}/blank, a decimal descriptor number or a path
 * @param configPath configuration file, or {@code null} to use defaults
 * @param keyfile file the security key was read from, or {@code null}
 * @param logLevel root log level name
 * @param debug whether debug mode was requested
 * @param appClass catalog name of the application to build
 * @param securityKey credential supplied outside the configuration file, or {@code null}
 * @param gifsiclePath resolved {@code gifsicle} binary, {@code null} until validated
 * @param useEnvironment whether environment overrides apply to the configuration
 * @since 0.1.0
 */
public record ServerParameters(
    int port,
    String ip,
    String fd,
    Path configPath,
    Path keyfile,
    String logLevel,
    boolean debug,
    String appClass,
    String securityKey,
    Path gifsiclePath,
    boolean useEnvironment) {

  public static final int DEFAULT_PORT = 8888;
  public static final String DEFAULT_IP = "0.0.0.0";
  public static final String DEFAULT_LOG_LEVEL = "warning";
  public static final String DEFAULT_APP = "prism.app.imaging";

  public ServerParameters {
    Numbers.requireRange("port", port, 0, 65_535);
    ip = (ip == null || ip.isBlank()) ? DEFAULT_IP : ip.trim();
    fd = (fd == null || fd.isBlank()) ? null : fd.trim();
    logLevel = (logLevel == null || logLevel.isBlank())
        ? DEFAULT_LOG_LEVEL
        : logLevel.trim().toLowerCase(Locale.ROOT);
    appClass = (appClass == null || appClass.isBlank()) ? DEFAULT_APP : appClass.trim();
  }

  /**
   * Returns parameters populated with defaults.
   *
   * @return default parameters
   */
  public static ServerParameters defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .port(port)
        .ip(ip)
        .fd(fd)
        .configPath(configPath)
        .keyfile(keyfile)
        .logLevel(logLevel)
        .debug(debug)
        .appClass(appClass)
        .securityKey(securityKey)
        .gifsiclePath(gifsiclePath)
        .useEnvironment(useEnvironment);
  }

  /**
   * Returns a copy carrying the validated credential and binary location.
   *
   * @param resolvedKey credential chosen by validation
   * @param resolvedGifsicle located binary, or {@code null} when not required
   * @return merged parameters
   */
  public ServerParameters withValidation(String resolvedKey, Path resolvedGifsicle) {
    return toBuilder().securityKey(resolvedKey).gifsiclePath(resolvedGifsicle).build();
  }

  /**
   * Returns the descriptor hint.
   *
   * @return descriptor hint, or empty when the server binds an address
   */
  public Optional<String> fdHint() {
    return Optional.ofNullable(fd);
  }

  @Override
  public String toString() {
    return "ServerParameters[port=" + port
        + ", ip=" + ip
        + ", fd=" + fd
        + ", configPath=" + configPath
        + ", keyfile=" + keyfile
        + ", logLevel=" + logLevel
        + ", debug=" + debug
        + ", appClass=" + appClass
        + ", securityKey=" + (securityKey == null || securityKey.isEmpty() ? "<unset>" : "<redacted>")
        + ", gifsiclePath=" + gifsiclePath
        + ", useEnvironment=" + useEnvironment
        + "]";
  }

  /** Mutable builder for {@link ServerParameters}. */
  public static final class Builder {
    private int port = DEFAULT_PORT;
    private String ip = DEFAULT_IP;
    private String fd;
    private Path configPath;
    private Path keyfile;
    private String logLevel = DEFAULT_LOG_LEVEL;
    private boolean debug;
    private String appClass = DEFAULT_APP;
    private String securityKey;
    private Path gifsiclePath;
    private boolean useEnvironment;

    private Builder() {}

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder ip(String ip) {
      this.ip = ip;
      return this;
    }

    public Builder fd(String fd) {
      this.fd = fd;
      return this;
    }

    public Builder configPath(Path configPath) {
      this.configPath = configPath;
      return this;
    }

    public Builder keyfile(Path keyfile) {
      this.keyfile = keyfile;
      return this;
    }

    public Builder logLevel(String logLevel) {
      this.logLevel = logLevel;
      return this;
    }

    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public Builder appClass(String appClass) {
      this.appClass = appClass;
      return this;
    }

    public Builder securityKey(String securityKey) {
      this.securityKey = securityKey;
      return this;
    }

    public Builder gifsiclePath(Path gifsiclePath) {
      this.gifsiclePath = gifsiclePath;
      return this;
    }

    public Builder useEnvironment(boolean useEnvironment) {
      this.useEnvironment = useEnvironment;
      return this;
    }

    public ServerParameters build() {
      return new ServerParameters(
          port, ip, fd, configPath, keyfile, logLevel, debug, appClass, securityKey, gifsiclePath,
          useEnvironment);
    }
  }
}

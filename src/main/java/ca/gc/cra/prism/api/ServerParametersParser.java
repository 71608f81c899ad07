package ca.gc.cra.prism.api;

import ca.gc.cra.prism.config.ServerParameters;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import ca.gc.cra.prism.validation.Net;
import ca.gc.cra.prism.validation.Numbers;
import ca.gc.cra.prism.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Builds {@link ServerParameters} from parsed CLI input.
 * <p><strong>Why:</strong> Keeps argument validation in one place so {@link Main} only maps failures to
 * exit codes.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
final class ServerParametersParser {
  static final Set<String> KEYS = Set.of("port", "ip", "fd", "conf", "keyfile", "log-level", "app");
  private static final int MAX_KEY_LENGTH = 4_096;

  private ServerParametersParser() {}

  /**
   * Parses the remaining {@code key=value} arguments and flags.
   *
   * @param args mutable argument map with telemetry keys already removed
   * @param input flag view of the same command line
   * @return server parameters; the credential is set when {@code keyfile} is given
   * @throws IllegalArgumentException if a key is unknown or a value is invalid
   */
  static ServerParameters parse(Map<String, String> args, CliInput input) {
    Set<String> unknown = new TreeSet<>(args.keySet());
    unknown.removeAll(KEYS);
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("Unknown argument(s): " + unknown);
    }

    ServerParameters.Builder builder = ServerParameters.builder()
        .debug(input.debug())
        .useEnvironment(input.useEnvironment());

    String port = args.get("port");
    if (port != null) {
      builder.port(Numbers.parseInRange("port", port, 0, 65_535));
    }
    String ip = args.get("ip");
    if (ip != null) {
      builder.ip(Net.validateBindAddress(ip));
    }
    String fd = args.get("fd");
    if (fd != null) {
      builder.fd(fd);
    }
    String conf = args.get("conf");
    if (conf != null) {
      builder.configPath(Paths.get(conf));
    }
    String keyfile = args.get("keyfile");
    if (keyfile != null) {
      Path path = Paths.get(keyfile);
      builder.keyfile(path).securityKey(readKey(path));
    }
    String level = args.get("log-level");
    if (level != null) {
      LoggingConfigurator.toLevel(level);
      builder.logLevel(level);
    }
    String app = args.get("app");
    if (app != null) {
      builder.appClass(Strings.requireNonBlank("app", app));
    }
    return builder.build();
  }

  static String readKey(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Security key file not found: " + path);
    }
    String key;
    try {
      key = Files.readString(path).strip();
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to read security key file " + path, ex);
    }
    if (key.isEmpty()) {
      throw new IllegalArgumentException("Security key file is empty: " + path);
    }
    if (key.length() > MAX_KEY_LENGTH) {
      throw new IllegalArgumentException("Security key file exceeds " + MAX_KEY_LENGTH + " characters: " + path);
    }
    return key;
  }
}

package ca.gc.cra.courier.api;

import ca.gc.cra.courier.config.ConfigMerger;
import ca.gc.cra.courier.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines a command's CLI arguments with its optional YAML file.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=PATH} from {@code args}, loads that file's {@code common} and {@code command}
   * sections, and overlays the remaining CLI arguments.
   *
   * @param command command name selecting the YAML section
   * @param args mutable CLI map
   * @return effective settings
   * @throws IOException if the configuration file cannot be read
   * @throws IllegalArgumentException if the YAML is malformed or the file is missing
   */
  static Map<String, String> effectiveSettings(String command, Map<String, String> args) throws IOException {
    String configPath = extractConfigPath(args);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      yaml = YamlConfigLoader.load(path, command);
      if (yaml.isEmpty()) {
        throw new IllegalArgumentException("config file not found: " + path);
      }
      log.debug("Loaded {} settings from {}", yaml.get().size(), path);
    }
    return ConfigMerger.buildEffectiveConfig(yaml, args, Map.of(), log::warn);
  }

  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }
}

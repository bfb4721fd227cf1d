package ca.gc.cra.rdt.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a {@link TransportConfig} for an endpoint profile.
 * <p><strong>Why:</strong> Applies one precedence rule (overrides, then YAML, then defaults) for every caller.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the source file and every override that replaces a YAML value.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private ConfigLoader() {}

  /**
   * Loads the effective settings for a profile.
   *
   * @param yamlPath optional YAML file; {@code null} or a missing file means defaults only
   * @param profile endpoint profile (sender, receiver, client, server)
   * @param overrides programmatic overrides; may be {@code null}
   * @return flattened effective settings, including non-transport keys such as {@code verbose}
   * @throws IOException if the YAML file exists but cannot be read
   * @throws IllegalArgumentException when the YAML or a value is invalid
   */
  public static Map<String, String> effectiveSettings(Path yamlPath, String profile, Map<String, String> overrides)
      throws IOException {
    String normalized = DefaultsForProfile.normalize(profile);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (yamlPath != null) {
      yaml = YamlConfigLoader.load(yamlPath, normalized);
      if (yaml.isEmpty()) {
        log.info("Config file {} not found; using defaults for profile {}", yamlPath, normalized);
      } else {
        log.debug("Loaded {} keys for profile {} from {}", yaml.get().size(), normalized, yamlPath);
      }
    }
    return ConfigMerger.buildEffectiveConfig(
        normalized, yaml, overrides, DefaultsForProfile.asFlatMap(normalized), log::warn);
  }

  /**
   * Loads and parses the transport configuration for a profile.
   *
   * @param yamlPath optional YAML file
   * @param profile endpoint profile
   * @param overrides programmatic overrides; may be {@code null}
   * @return validated configuration
   * @throws IOException if the YAML file exists but cannot be read
   * @throws IllegalArgumentException when the YAML or a value is invalid
   */
  public static TransportConfig load(Path yamlPath, String profile, Map<String, String> overrides) throws IOException {
    return TransportConfig.fromMap(effectiveSettings(yamlPath, profile, overrides));
  }
}

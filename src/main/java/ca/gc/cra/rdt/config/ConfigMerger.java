package ca.gc.cra.rdt.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and programmatic overrides while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides > YAML > defaults.
   *
   * @param profile active endpoint profile
   * @param yaml optional YAML-derived settings for the profile
   * @param overrides key/value overrides (may be empty)
   * @param defaults embedded defaults for the profile
   * @param warn consumer invoked when an override replaces a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String profile,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("Override replaces YAML value for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(profile, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String profile, Map<String, String> effective) {
    String normalized = DefaultsForProfile.normalize(profile);
    if ("sender".equals(normalized) || "client".equals(normalized)) {
      String peer = effective.get("peer");
      if (peer == null || peer.isBlank()) {
        throw new IllegalArgumentException("peer is required for the " + normalized + " profile");
      }
    }
    for (String key : effective.keySet()) {
      if (key.isBlank()) {
        throw new IllegalArgumentException("configuration contains a blank key");
      }
    }
  }
}

package ca.gc.cra.rdt.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each endpoint profile.
 *
 * <p>Every profile shares the transport defaults of {@link TransportConfig#defaults()}; the
 * profiles differ only in which keys are meaningful to them.</p>
 */
public final class DefaultsForProfile {
  /** Profiles accepted by the loaders. */
  public static final Set<String> PROFILES = Set.of("sender", "receiver", "client", "server");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForProfile() {}

  /**
   * Returns a flattened map of defaults for the requested profile.
   *
   * @param profile endpoint profile (sender, receiver, client, server)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when the profile is unknown
   */
  public static Map<String, String> asFlatMap(String profile) {
    String normalized = normalize(profile);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(TransportConfig.defaults().asFlatMap());
    if ("receiver".equals(normalized) || "server".equals(normalized)) {
      defaults.put("bind", "0.0.0.0:9000");
    }
    return Map.copyOf(defaults);
  }

  /**
   * Validates and normalizes a profile name.
   *
   * @param profile candidate profile
   * @return lower-case profile name
   * @throws IllegalArgumentException when the profile is unknown
   */
  public static String normalize(String profile) {
    Objects.requireNonNull(profile, "profile");
    String normalized = profile.trim().toLowerCase(Locale.ROOT);
    if (!PROFILES.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported profile: " + profile);
    }
    return normalized;
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}

package ca.gc.cra.rdt.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads endpoint settings from YAML. The {@code common} section applies to every profile; the section named
 * after the profile is layered on top. Nested mappings become dotted keys.
 *
 * <pre>
 * common:
 *   maxRetries: 8
 *   rto:
 *     initialMillis: 500
 * sender:
 *   ackPolicy: SELECTIVE_REPEAT
 *   peer: 127.0.0.1:9000
 * </pre>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Reads the settings that apply to {@code profile}.
   *
   * @param path YAML file
   * @param profile endpoint profile (sender, receiver, client, server)
   * @return flattened settings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping of sections or contains lists
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = DefaultsForProfile.normalize(profile);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Map<String, Object> sections = readSections(path);
    Map<String, String> settings = new LinkedHashMap<>();
    Object common = sections.remove(COMMON);
    if (common != null) {
      flattenInto(settings, COMMON, "", section(common, COMMON));
    }
    Object selected = sections.remove(wanted);
    if (selected != null) {
      flattenInto(settings, wanted, "", section(selected, wanted));
    }
    for (String other : sections.keySet()) {
      if (!DefaultsForProfile.PROFILES.contains(other)) {
        log.warn("Ignoring unknown section '{}' in {}", other, path);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Object> readSections(Path path) throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    Map<String, Object> sections = new LinkedHashMap<>();
    if (document == null) {
      return sections;
    }
    for (Map.Entry<String, Object> entry : section(document, "root").entrySet()) {
      sections.put(entry.getKey().trim().toLowerCase(Locale.ROOT), entry.getValue());
    }
    return sections;
  }

  private static Map<String, Object> section(Object node, String name) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(name + " section must be a mapping");
    }
    Map<String, Object> typed = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String text) || text.isBlank()) {
        throw new IllegalArgumentException(name + " section has a blank or non-string key");
      }
      typed.put(text.trim(), value);
    });
    return typed;
  }

  private static void flattenInto(Map<String, String> target, String origin, String prefix, Map<String, Object> node) {
    node.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?>) {
        flattenInto(target, origin, dotted, section(value, dotted));
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported (key " + dotted + ")");
      } else {
        String previous = target.put(dotted, value == null ? "" : value.toString().trim());
        if (previous != null && log.isDebugEnabled()) {
          log.debug("Section {} overrides {}", origin, dotted);
        }
      }
    });
  }
}

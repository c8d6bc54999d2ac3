package io.intellixity.varplan.variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plugin reference of a computed variable.
 * <p>
 * The spec is owned by the plugin and kept as a JSON-like tree (maps, lists, strings, numbers, booleans).
 */
public record Plugin(String kind, Map<String, Object> spec) {
  public Plugin {
    if (kind == null || kind.isBlank()) throw new IllegalArgumentException("plugin kind is required");
    // plugin specs may legitimately hold null values, so no Map.copyOf here
    spec = spec == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(spec));
  }
}

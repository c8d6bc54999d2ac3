package io.intellixity.varplan.variable;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical JSON deserializer for {@link VariableDefinition}.\n
 *
 * Accepted shape:\n
 * <pre>
 * { "kind": "ListVariable",
 *   "spec": { "name": "job", "plugin": { "kind": "...", "spec": { ... } } } }
 * </pre>
 * List settings are read from camelCase keys, falling back to the older snake_case ones
 * ({@code allow_all_value}, {@code capturing_regexp}, ...). Unknown keys are ignored.
 */
public final class VariableDefinitionJsonDeserializer extends JsonDeserializer<VariableDefinition> {
  @Override
  public VariableDefinition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    return read(root, codec);
  }

  static VariableDefinition read(JsonNode root, ObjectCodec codec) throws IOException {
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Variable JSON must be an object");

    VariableKind kind = VariableKind.fromWire(textOrNull(root.get("kind")));
    JsonNode spec = root.get("spec");
    if (spec == null || !spec.isObject()) {
      throw new IllegalArgumentException(kind.wireKind() + " requires a spec object");
    }

    String name = textOrNull(spec.get("name"));
    Display display = parseDisplay(spec.get("display"));

    if (kind == VariableKind.TEXT) {
      String value = textOrNull(spec.get("value"));
      boolean constant = boolOrDefault(spec.get("constant"), false);
      return new VariableDefinition(kind, new TextVariableSpec(name, display, value, constant));
    }

    JsonNode pluginNode = spec.get("plugin");
    if (pluginNode == null || !pluginNode.isObject()) {
      throw new IllegalArgumentException("ListVariable '" + name + "' requires a plugin object");
    }
    Plugin plugin = new Plugin(textOrNull(pluginNode.get("kind")), pluginSpec(pluginNode.get("spec"), codec));

    Object defaultValue = null;
    JsonNode dv = field(spec, "defaultValue", "default_value");
    if (dv != null && !dv.isNull()) defaultValue = codec.treeToValue(dv, Object.class);

    return new VariableDefinition(kind, new ListVariableSpec(
        name,
        display,
        defaultValue,
        boolOrDefault(field(spec, "allowAllValue", "allow_all_value"), false),
        boolOrDefault(field(spec, "allowMultiple", "allow_multiple"), false),
        textOrNull(field(spec, "customAllValue", "custom_all_value")),
        textOrNull(field(spec, "capturingRegexp", "capturing_regexp")),
        textOrNull(spec.get("sort")),
        plugin
    ));
  }

  private static Map<String, Object> pluginSpec(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return Map.of();
    if (!n.isObject()) throw new IllegalArgumentException("plugin spec must be an object");
    @SuppressWarnings("unchecked")
    Map<String, Object> m = codec.treeToValue(n, LinkedHashMap.class);
    return m;
  }

  private static Display parseDisplay(JsonNode n) {
    if (n == null || !n.isObject()) return null;
    return new Display(textOrNull(n.get("name")), textOrNull(n.get("description")), boolOrDefault(n.get("hidden"), false));
  }

  private static JsonNode field(JsonNode obj, String key, String legacyKey) {
    JsonNode n = obj.get(key);
    return (n != null) ? n : obj.get(legacyKey);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}

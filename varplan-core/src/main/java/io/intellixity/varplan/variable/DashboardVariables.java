package io.intellixity.varplan.variable;

import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the declared variables out of a dashboard JSON tree.\n
 *
 * Accepted roots, in lookup order:\n
 * - a dashboard document: {@code {"kind": "Dashboard", "spec": {"variables": [...]}}}\n
 * - an object with a top-level {@code variables} array\n
 * - a bare array of variables\n
 *
 * A root without variables yields an empty list.
 */
public final class DashboardVariables {
  private DashboardVariables() {}

  public static List<VariableDefinition> read(JsonNode root, ObjectCodec codec) throws IOException {
    Objects.requireNonNull(codec, "codec");
    JsonNode arr = variablesNode(root);
    if (arr == null) return List.of();
    if (!arr.isArray()) throw new IllegalArgumentException("variables must be an array");

    List<VariableDefinition> out = new ArrayList<>(arr.size());
    for (int i = 0; i < arr.size(); i++) {
      JsonNode n = arr.get(i);
      if (n == null || n.isNull()) throw new IllegalArgumentException("variables[" + i + "] is null");
      out.add(VariableDefinitionJsonDeserializer.read(n, codec));
    }
    return out;
  }

  private static JsonNode variablesNode(JsonNode root) {
    if (root == null || root.isNull()) return null;
    if (root.isArray()) return root;
    if (!root.isObject()) throw new IllegalArgumentException("Dashboard JSON must be an object or an array");

    JsonNode spec = root.get("spec");
    if (spec != null && spec.isObject() && spec.has("variables")) return nullToMissing(spec.get("variables"));
    return nullToMissing(root.get("variables"));
  }

  private static JsonNode nullToMissing(JsonNode n) {
    return (n == null || n.isNull()) ? null : n;
  }
}

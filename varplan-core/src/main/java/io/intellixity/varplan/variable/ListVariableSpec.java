package io.intellixity.varplan.variable;

import java.util.Objects;

/**
 * Payload of a {@link VariableKind#LIST} variable.
 * <p>
 * Only {@link #plugin()} spec is scanned for references; {@code capturingRegexp} commonly holds
 * {@code $1}-style group references and is left alone.
 */
public record ListVariableSpec(String name,
                               Display display,
                               Object defaultValue,
                               boolean allowAllValue,
                               boolean allowMultiple,
                               String customAllValue,
                               String capturingRegexp,
                               String sort,
                               Plugin plugin) implements VariableSpec {
  public ListVariableSpec {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("variable name is required");
    Objects.requireNonNull(plugin, "plugin");
  }

  public static ListVariableSpec of(String name, Plugin plugin) {
    return new ListVariableSpec(name, null, null, false, false, null, null, null, plugin);
  }
}

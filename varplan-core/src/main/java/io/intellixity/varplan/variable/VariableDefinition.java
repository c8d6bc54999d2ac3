package io.intellixity.varplan.variable;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Map;
import java.util.Objects;

/**
 * A variable declared by a dashboard: its kind plus the kind-specific payload.
 */
@JsonSerialize(using = VariableDefinitionJsonSerializer.class)
@JsonDeserialize(using = VariableDefinitionJsonDeserializer.class)
public final class VariableDefinition {
  private final VariableKind kind;
  private final VariableSpec spec;

  public VariableDefinition(VariableKind kind, VariableSpec spec) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.spec = Objects.requireNonNull(spec, "spec");
    if (kind == VariableKind.TEXT && !(spec instanceof TextVariableSpec)) {
      throw new IllegalArgumentException("TEXT variable '" + spec.name() + "' requires a TextVariableSpec");
    }
    if (kind == VariableKind.LIST && !(spec instanceof ListVariableSpec)) {
      throw new IllegalArgumentException("LIST variable '" + spec.name() + "' requires a ListVariableSpec");
    }
  }

  public VariableKind kind() { return kind; }
  public VariableSpec spec() { return spec; }
  public String name() { return spec.name(); }

  /**
   * Payload scanned for references: the plugin spec of a computed variable, {@code null} for constants.
   */
  public Object referencePayload() {
    if (!kind.computed()) return null;
    return ((ListVariableSpec) spec).plugin().spec();
  }

  public static VariableDefinition text(String name, String value) {
    return new VariableDefinition(VariableKind.TEXT, new TextVariableSpec(name, null, value, false));
  }

  public static VariableDefinition list(String name, String pluginKind, Map<String, Object> pluginSpec) {
    return new VariableDefinition(VariableKind.LIST, ListVariableSpec.of(name, new Plugin(pluginKind, pluginSpec)));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof VariableDefinition that)) return false;
    return kind == that.kind && spec.equals(that.spec);
  }

  @Override
  public int hashCode() { return Objects.hash(kind, spec); }

  @Override
  public String toString() { return kind.wireKind() + "(" + name() + ")"; }
}

package io.intellixity.varplan.variable;

public record TextVariableSpec(String name, Display display, String value, boolean constant) implements VariableSpec {
  public TextVariableSpec {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("variable name is required");
  }
}

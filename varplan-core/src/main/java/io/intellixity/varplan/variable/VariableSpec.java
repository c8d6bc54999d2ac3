package io.intellixity.varplan.variable;

/** Kind-specific payload of a {@link VariableDefinition}. */
public interface VariableSpec {
  String name();

  /** Optional presentation settings; may be null. */
  Display display();
}

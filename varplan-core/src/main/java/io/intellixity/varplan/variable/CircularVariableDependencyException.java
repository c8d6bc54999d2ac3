package io.intellixity.varplan.variable;

/** The dependency graph holds at least one cycle (self-references included). */
public final class CircularVariableDependencyException extends VariableOrderException {
  public CircularVariableDependencyException() {
    super("circular dependency detected");
  }
}

package io.intellixity.varplan.variable;

/** A variable references a name that no declaration defines. */
public final class UndefinedVariableReferenceException extends VariableOrderException {
  private final String variable;
  private final String referencedBy;

  public UndefinedVariableReferenceException(String variable, String referencedBy) {
    super(String.format("variable \"%s\" is used in the variable \"%s\" but not defined", variable, referencedBy));
    this.variable = variable;
    this.referencedBy = referencedBy;
  }

  /** The referenced name that has no declaration. */
  public String variable() { return variable; }

  /** The declared variable whose spec holds the reference. */
  public String referencedBy() { return referencedBy; }
}

package io.intellixity.varplan.variable;

/**
 * Raised when the declared variables cannot be put in a build order.
 * <p>
 * Validation failures are derived from the input alone; retrying the same declarations fails the same way.
 */
public abstract class VariableOrderException extends RuntimeException {
  protected VariableOrderException(String message) {
    super(message);
  }
}

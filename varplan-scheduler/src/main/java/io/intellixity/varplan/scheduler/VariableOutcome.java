package io.intellixity.varplan.scheduler;

import java.util.Objects;

/**
 * Result of one variable in a scheduler run.
 *
 * @param name variable name
 * @param stage index of the stage the variable belongs to
 * @param status what happened
 * @param error evaluator failure, only set for {@link Status#FAILED}
 */
public record VariableOutcome(String name, int stage, Status status, Throwable error) {
  public enum Status { SUCCEEDED, FAILED, CANCELLED }

  public VariableOutcome {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(status, "status");
    if (status == Status.FAILED && error == null) throw new IllegalArgumentException("FAILED outcome requires an error");
  }

  static VariableOutcome succeeded(String name, int stage) { return new VariableOutcome(name, stage, Status.SUCCEEDED, null); }
  static VariableOutcome failed(String name, int stage, Throwable error) { return new VariableOutcome(name, stage, Status.FAILED, error); }
  static VariableOutcome cancelled(String name, int stage) { return new VariableOutcome(name, stage, Status.CANCELLED, null); }
}

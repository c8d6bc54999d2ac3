package io.intellixity.varplan.scheduler;

import io.intellixity.varplan.variable.VariableDefinition;

/**
 * SPI: evaluates one variable (for instance by running its plugin query).
 * <p>
 * Called at most once per variable and run, from executor threads. Implementations keep their results
 * wherever they see fit; the scheduler only records whether evaluation succeeded.
 */
@FunctionalInterface
public interface VariableEvaluator {
  void evaluate(VariableDefinition variable) throws Exception;
}

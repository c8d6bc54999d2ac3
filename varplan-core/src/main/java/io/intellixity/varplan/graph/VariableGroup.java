package io.intellixity.varplan.graph;

import java.util.List;

/**
 * One stage of a build order: variables that may be evaluated concurrently.
 * <p>
 * Membership is what matters; names are listed in declaration order so plans diff cleanly.
 */
public record VariableGroup(List<String> variables) {
  public VariableGroup {
    variables = List.copyOf(variables == null ? List.of() : variables);
  }

  public int size() { return variables.size(); }
}

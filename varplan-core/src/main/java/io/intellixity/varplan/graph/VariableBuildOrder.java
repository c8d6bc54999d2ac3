package io.intellixity.varplan.graph;

import io.intellixity.varplan.reference.VariableReferences;
import io.intellixity.varplan.variable.CircularVariableDependencyException;
import io.intellixity.varplan.variable.UndefinedVariableReferenceException;
import io.intellixity.varplan.variable.VariableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point: declared variables in, ordered stages out.\n
 *
 * Extracts the references of every computed variable, builds the {@link VariableGraph} and sorts it.
 * Stateless; concurrent calls are safe as long as each caller owns its input list.
 */
public final class VariableBuildOrder {
  private static final Logger log = LoggerFactory.getLogger(VariableBuildOrder.class);

  private VariableBuildOrder() {}

  /**
   * @throws UndefinedVariableReferenceException when a computed variable references an undeclared name
   * @throws CircularVariableDependencyException when references form a cycle
   * @throws IllegalArgumentException when two declarations share a name
   */
  public static List<VariableGroup> resolve(List<VariableDefinition> variables) {
    Objects.requireNonNull(variables, "variables");
    List<String> names = new ArrayList<>(variables.size());
    Set<String> seen = new HashSet<>();
    for (VariableDefinition v : variables) {
      Objects.requireNonNull(v, "variable");
      if (!seen.add(v.name())) throw new IllegalArgumentException("Duplicate variable name: " + v.name());
      names.add(v.name());
    }

    Map<String, Set<String>> deps = VariableReferences.dependenciesOf(variables);
    List<VariableGroup> order = VariableGraph.of(names, deps).buildOrder();

    if (log.isDebugEnabled()) {
      log.debug("varplan.order variables={} edges={} stages={} order={}",
          names.size(), deps.values().stream().mapToInt(Set::size).sum(), order.size(), order);
    }
    return order;
  }
}

package io.intellixity.varplan.reference;

import io.intellixity.varplan.variable.UndefinedVariableReferenceException;
import io.intellixity.varplan.variable.VariableDefinition;

import java.util.*;

/**
 * Reference sets of declared variables.
 * <p>
 * Constant variables never reference anything, whatever their value holds.
 */
public final class VariableReferences {
  private VariableReferences() {}

  public static Set<String> referencesOf(VariableDefinition variable) {
    Objects.requireNonNull(variable, "variable");
    if (!variable.kind().computed()) return Set.of();
    return VariableReferenceExtractor.extractReferences(variable.referencePayload());
  }

  /**
   * name -> referenced names, for every variable that references at least one other.\n
   *
   * Each referenced name must be declared; the first offending reference (declaration order, then
   * first-seen order inside the spec) raises {@link UndefinedVariableReferenceException}.
   */
  public static Map<String, Set<String>> dependenciesOf(List<VariableDefinition> variables) {
    Objects.requireNonNull(variables, "variables");
    Set<String> declared = new HashSet<>();
    for (VariableDefinition v : variables) declared.add(v.name());

    Map<String, Set<String>> out = new LinkedHashMap<>();
    for (VariableDefinition v : variables) {
      Set<String> refs = referencesOf(v);
      if (refs.isEmpty()) continue;
      for (String ref : refs) {
        if (!declared.contains(ref)) throw new UndefinedVariableReferenceException(ref, v.name());
      }
      out.put(v.name(), refs);
    }
    return out;
  }
}

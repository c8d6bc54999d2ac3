package io.intellixity.varplan.scheduler;

import io.intellixity.varplan.graph.VariableGroup;

import java.util.*;

/** Outcome of a {@link StagedVariableScheduler} run: the plan that was followed plus one outcome per variable. */
public final class EvaluationReport {
  private final List<VariableGroup> plan;
  private final Map<String, VariableOutcome> outcomes;

  EvaluationReport(List<VariableGroup> plan, Map<String, VariableOutcome> outcomes) {
    this.plan = List.copyOf(plan);
    this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
  }

  public List<VariableGroup> plan() { return plan; }

  /** Outcomes in stage order. */
  public Map<String, VariableOutcome> outcomes() { return outcomes; }

  public VariableOutcome outcome(String name) {
    VariableOutcome o = outcomes.get(name);
    if (o == null) throw new IllegalArgumentException("Unknown variable: " + name);
    return o;
  }

  public boolean succeeded() {
    for (VariableOutcome o : outcomes.values()) {
      if (o.status() != VariableOutcome.Status.SUCCEEDED) return false;
    }
    return true;
  }

  public List<VariableOutcome> failures() {
    List<VariableOutcome> out = new ArrayList<>();
    for (VariableOutcome o : outcomes.values()) {
      if (o.status() == VariableOutcome.Status.FAILED) out.add(o);
    }
    return out;
  }

  @Override
  public String toString() { return "EvaluationReport" + outcomes.values(); }
}

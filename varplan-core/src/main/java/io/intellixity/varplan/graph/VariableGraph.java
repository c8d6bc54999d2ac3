package io.intellixity.varplan.graph;

import io.intellixity.varplan.variable.CircularVariableDependencyException;
import io.intellixity.varplan.variable.UndefinedVariableReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Dependency graph of declared variables, kept as a flat name -> dependency-names map.\n
 *
 * An edge {@code v -> d} means v references d, so d has to be evaluated first.\n
 *
 * Instances are immutable and built fresh for every resolution.
 */
public final class VariableGraph {
  private static final Logger log = LoggerFactory.getLogger(VariableGraph.class);

  // declaration order is preserved by the LinkedHashMap and the LinkedHashSets
  private final Map<String, Set<String>> dependencies;

  private VariableGraph(Map<String, Set<String>> dependencies) {
    this.dependencies = dependencies;
  }

  /**
   * @param names declared variable names, in declaration order; must be unique and non-blank
   * @param dependencies referenced names per variable; variables without an entry have no dependency
   * @throws UndefinedVariableReferenceException when a referenced name is not declared
   */
  public static VariableGraph of(List<String> names, Map<String, ? extends Collection<String>> dependencies) {
    Objects.requireNonNull(names, "names");
    Map<String, ? extends Collection<String>> deps = dependencies == null ? Map.of() : dependencies;

    Map<String, Set<String>> out = new LinkedHashMap<>();
    for (String name : names) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("Variable name is required");
      if (out.containsKey(name)) throw new IllegalArgumentException("Duplicate variable name: " + name);
      out.put(name, new LinkedHashSet<>());
    }

    for (String key : deps.keySet()) {
      if (!out.containsKey(key)) {
        throw new IllegalArgumentException("Dependencies given for undeclared variable: " + key);
      }
    }

    for (Map.Entry<String, Set<String>> e : out.entrySet()) {
      Collection<String> refs = deps.get(e.getKey());
      if (refs == null) continue;
      for (String ref : refs) {
        if (!out.containsKey(ref)) throw new UndefinedVariableReferenceException(ref, e.getKey());
        e.getValue().add(ref);
      }
    }

    for (Map.Entry<String, Set<String>> e : out.entrySet()) {
      e.setValue(Collections.unmodifiableSet(e.getValue()));
    }
    return new VariableGraph(Collections.unmodifiableMap(out));
  }

  /** Declared names in declaration order. */
  public List<String> names() { return List.copyOf(dependencies.keySet()); }

  public Set<String> dependenciesOf(String name) {
    Set<String> d = dependencies.get(name);
    if (d == null) throw new IllegalArgumentException("Unknown variable: " + name);
    return d;
  }

  /**
   * Level-synchronous topological sort.\n
   *
   * Each pass stages every remaining variable whose dependencies were all staged by earlier passes, so a
   * variable lands at {@code 1 + max(stage of its dependencies)} (stage 0 without dependencies). A pass that
   * stages nothing while variables remain means a cycle.
   *
   * @throws CircularVariableDependencyException when the graph holds a cycle
   */
  public List<VariableGroup> buildOrder() {
    List<VariableGroup> groups = new ArrayList<>();
    Set<String> staged = new HashSet<>();
    List<String> remaining = new ArrayList<>(dependencies.keySet());

    while (!remaining.isEmpty()) {
      List<String> stage = new ArrayList<>();
      for (String name : remaining) {
        if (staged.containsAll(dependencies.get(name))) stage.add(name);
      }
      if (stage.isEmpty()) {
        log.debug("varplan.order cycle stage={} unresolved={}", groups.size(), remaining);
        throw new CircularVariableDependencyException();
      }
      // commit after the pass so nothing staged in this pass unblocks a sibling
      staged.addAll(stage);
      Set<String> done = new HashSet<>(stage);
      remaining.removeIf(done::contains);
      groups.add(new VariableGroup(stage));
    }
    return groups;
  }

  @Override
  public String toString() { return "VariableGraph" + dependencies; }
}

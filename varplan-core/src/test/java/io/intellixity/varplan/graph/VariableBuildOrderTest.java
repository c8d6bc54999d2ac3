package io.intellixity.varplan.graph;

import io.intellixity.varplan.variable.CircularVariableDependencyException;
import io.intellixity.varplan.variable.UndefinedVariableReferenceException;
import io.intellixity.varplan.variable.VariableDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class VariableBuildOrderTest {

  private static VariableDefinition promql(String name, String expr) {
    return VariableDefinition.list(name, "PrometheusPromQLVariable", Map.of("expr", expr));
  }

  @Test
  void noVariable() {
    assertTrue(VariableBuildOrder.resolve(List.of()).isEmpty());
  }

  @Test
  void constantVariable_singleStage() {
    List<VariableGroup> groups = VariableBuildOrder.resolve(List.of(VariableDefinition.text("myVariable", "myConstant")));
    assertEquals(List.of(new VariableGroup(List.of("myVariable"))), groups);
  }

  @Test
  void constantValueMentioningVariables_isStillALeaf() {
    List<VariableGroup> groups = VariableBuildOrder.resolve(List.of(
        VariableDefinition.text("a", "$b"),
        promql("b", "up")
    ));
    assertEquals(List.of(new VariableGroup(List.of("a", "b"))), groups);
  }

  @Test
  void multipleUsageOfSameVariable() {
    List<VariableGroup> groups = VariableBuildOrder.resolve(List.of(
        promql("myVariable", "sum by($doe, $bar) (rate($foo{label='$bar'}))"),
        promql("foo", "test"),
        promql("bar", "vector($foo)"),
        VariableDefinition.text("doe", "myConstant")
    ));

    assertEquals(List.of(
        new VariableGroup(List.of("foo", "doe")),
        new VariableGroup(List.of("bar")),
        new VariableGroup(List.of("myVariable"))
    ), groups);
  }

  @Test
  void noEdges_oneStageWithEveryVariable() {
    List<VariableGroup> groups = VariableBuildOrder.resolve(List.of(
        promql("a", "up"),
        promql("b", "label_replace(up, \"x\", \"$1\", \"y\", \"(.*)\")"),
        VariableDefinition.text("c", "$a")
    ));
    assertEquals(1, groups.size());
    assertEquals(List.of("a", "b", "c"), groups.get(0).variables());
  }

  @Test
  void selfReference_isCircular() {
    assertThrows(CircularVariableDependencyException.class,
        () -> VariableBuildOrder.resolve(List.of(promql("a", "up{a=\"$a\"}"))));
  }

  @Test
  void mutualReference_isCircular() {
    assertThrows(CircularVariableDependencyException.class,
        () -> VariableBuildOrder.resolve(List.of(promql("a", "$b"), promql("b", "${a}"))));
  }

  @Test
  void undefinedReference_namesBothSides() {
    UndefinedVariableReferenceException ex = assertThrows(UndefinedVariableReferenceException.class,
        () -> VariableBuildOrder.resolve(List.of(promql("a", "up"), promql("b", "vector($a) + $nope"))));
    assertEquals("nope", ex.variable());
    assertEquals("b", ex.referencedBy());
  }

  @Test
  void duplicateNames_rejected() {
    assertThrows(IllegalArgumentException.class,
        () -> VariableBuildOrder.resolve(List.of(promql("a", "up"), VariableDefinition.text("a", "x"))));
  }

  @Test
  void sameInput_sameOrder() {
    List<VariableDefinition> vars = List.of(
        promql("e", "$a + $b"),
        promql("a", "$c + $f + $b"),
        promql("h", "$b"),
        promql("g", "$d"),
        promql("c", "$f"),
        promql("b", "$f"),
        promql("f", "up"),
        promql("d", "up")
    );
    List<VariableGroup> first = VariableBuildOrder.resolve(vars);
    assertEquals(first, VariableBuildOrder.resolve(vars));
    assertEquals(List.of(
        new VariableGroup(List.of("f", "d")),
        new VariableGroup(List.of("g", "c", "b")),
        new VariableGroup(List.of("a", "h")),
        new VariableGroup(List.of("e"))
    ), first);
  }
}

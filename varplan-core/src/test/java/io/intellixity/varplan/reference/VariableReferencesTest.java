package io.intellixity.varplan.reference;

import io.intellixity.varplan.variable.UndefinedVariableReferenceException;
import io.intellixity.varplan.variable.VariableDefinition;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class VariableReferencesTest {

  private static VariableDefinition promql(String name, String expr) {
    return VariableDefinition.list(name, "PrometheusPromQLVariable", Map.of("expr", expr));
  }

  private static VariableDefinition constant(String name) {
    return VariableDefinition.text(name, "myConstant");
  }

  @Test
  void noVariables_noDependencies() {
    assertTrue(VariableReferences.dependenciesOf(List.of()).isEmpty());
  }

  @Test
  void constantVariable_isNeverScanned() {
    VariableDefinition v = VariableDefinition.text("myVariable", "value with $other inside");
    assertTrue(VariableReferences.referencesOf(v).isEmpty());
    assertTrue(VariableReferences.dependenciesOf(List.of(v)).isEmpty());
  }

  @Test
  void queryVariableWithoutReferences_isLeftOut() {
    assertTrue(VariableReferences.dependenciesOf(List.of(promql("myVariable", "vector(1)"))).isEmpty());
  }

  @Test
  void queryVariableWithReferences() {
    Map<String, Set<String>> deps = VariableReferences.dependenciesOf(List.of(
        promql("myVariable", "sum by($doe) (rate($foo{label='$bar'}))"),
        promql("foo", "test"),
        promql("bar", "vector($foo)"),
        constant("doe")
    ));

    assertEquals(2, deps.size());
    assertEquals(List.of("doe", "foo", "bar"), new ArrayList<>(deps.get("myVariable")));
    assertEquals(Set.of("foo"), deps.get("bar"));
  }

  @Test
  void labelValuesVariable_scansEveryStringField() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("label_name", "$foo");
    spec.put("matchers", List.of("$foo{$bar='test'}"));

    Map<String, Set<String>> deps = VariableReferences.dependenciesOf(List.of(
        VariableDefinition.list("myVariable", "PrometheusLabelValuesVariable", spec),
        promql("foo", "test"),
        promql("bar", "vector($foo)"),
        constant("doe")
    ));

    assertEquals(2, deps.size());
    assertEquals(Set.of("foo", "bar"), deps.get("myVariable"));
    assertEquals(Set.of("foo"), deps.get("bar"));
  }

  @Test
  void numericOnlyTokens_areIgnored() {
    String expr = "group by(prometheus) (label_replace(kube_statefulset_labels{$filter_platform,stack=~\"$PaaS\","
        + "$filter_kube_sts,namespace=~\"$extlabels_prometheus_namespace\"},\"prometheus\",\"$1\",\"app\",\"([^-]+)-?.*\"))";

    Map<String, Set<String>> deps = VariableReferences.dependenciesOf(List.of(
        constant("filter_platform"),
        constant("PaaS"),
        constant("filter_kube_sts"),
        constant("extlabels_prometheus_namespace"),
        promql("foo", expr)
    ));

    assertEquals(1, deps.size());
    assertEquals(Set.of("filter_platform", "PaaS", "filter_kube_sts", "extlabels_prometheus_namespace"), deps.get("foo"));
  }

  @Test
  void undefinedReference_reportsFirstMissingNameAndReferrer() {
    UndefinedVariableReferenceException ex = assertThrows(
        UndefinedVariableReferenceException.class,
        () -> VariableReferences.dependenciesOf(List.of(promql("myVariable", "sum by($doe, $bar) (rate($foo{label='$bar'}))")))
    );
    assertEquals("doe", ex.variable());
    assertEquals("myVariable", ex.referencedBy());
    assertEquals("variable \"doe\" is used in the variable \"myVariable\" but not defined", ex.getMessage());
  }

  @Test
  void capturingRegexp_isNotScanned() {
    VariableDefinition v = new VariableDefinition(
        io.intellixity.varplan.variable.VariableKind.LIST,
        new io.intellixity.varplan.variable.ListVariableSpec(
            "pod", null, null, false, false, null, "$ns-(.*)", null,
            new io.intellixity.varplan.variable.Plugin("PrometheusPromQLVariable", Map.of("expr", "up")))
    );
    assertTrue(VariableReferences.referencesOf(v).isEmpty());
  }
}

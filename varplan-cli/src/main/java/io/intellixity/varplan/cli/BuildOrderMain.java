package io.intellixity.varplan.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.varplan.graph.VariableBuildOrder;
import io.intellixity.varplan.graph.VariableGroup;
import io.intellixity.varplan.variable.DashboardVariables;
import io.intellixity.varplan.variable.VariableDefinition;
import io.intellixity.varplan.variable.VariableOrderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.*;
import java.util.List;

/**
 * CLI:
 *   BuildOrderMain <dashboard.json | ->
 *
 * Prints the variable build order as JSON ({@code [{"variables": [...]}, ...]}).
 * Exit codes: 0 ok, 1 invalid dashboard or unresolvable variables, 2 usage.
 */
public final class BuildOrderMain {
  private static final Logger log = LoggerFactory.getLogger(BuildOrderMain.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private BuildOrderMain() {}

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
    if (args.length != 1) {
      err.println("Usage: BuildOrderMain <dashboard.json | ->");
      return 2;
    }

    String source = args[0];
    JsonNode root;
    try {
      root = readTree(source, stdin);
    } catch (IOException | InvalidPathException e) {
      err.println("Cannot read " + source + ": " + e.getMessage());
      return 1;
    }

    try {
      List<VariableDefinition> variables = DashboardVariables.read(root, JSON);
      List<VariableGroup> order = VariableBuildOrder.resolve(variables);
      log.debug("varplan.cli source={} variables={} stages={}", source, variables.size(), order.size());
      out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(order));
      return 0;
    } catch (VariableOrderException e) {
      err.println(e.getMessage());
      return 1;
    } catch (IllegalArgumentException | IOException e) {
      err.println("Invalid dashboard " + source + ": " + e.getMessage());
      return 1;
    }
  }

  private static JsonNode readTree(String source, InputStream stdin) throws IOException {
    if ("-".equals(source)) return JSON.readTree(stdin);
    try (InputStream in = Files.newInputStream(Paths.get(source))) {
      return JSON.readTree(in);
    }
  }
}

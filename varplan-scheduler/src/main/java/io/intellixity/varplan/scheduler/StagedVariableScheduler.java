package io.intellixity.varplan.scheduler;

import io.intellixity.varplan.graph.VariableBuildOrder;
import io.intellixity.varplan.graph.VariableGroup;
import io.intellixity.varplan.variable.VariableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives evaluation along a build order.\n
 *
 * - every member of a stage is submitted to the executor at once\n
 * - the next stage starts only when every member of the current one finished, successfully or not\n
 * - with {@code cancelOnFailure}, a failed stage cancels all later stages (their members are reported
 *   {@link VariableOutcome.Status#CANCELLED} and never evaluated)\n
 *
 * A member the executor rejects is reported {@link VariableOutcome.Status#FAILED}; the rest of its stage is
 * still awaited. {@link Error}s thrown by the evaluator propagate unwrapped once the stage has finished.\n
 *
 * Resolution errors (undefined references, cycles) are thrown before anything is evaluated.
 * The executor is owned by the caller and is not shut down here.
 */
public final class StagedVariableScheduler {
  private static final Logger log = LoggerFactory.getLogger(StagedVariableScheduler.class);

  private final VariableEvaluator evaluator;
  private final Executor executor;
  private final boolean cancelOnFailure;

  public StagedVariableScheduler(VariableEvaluator evaluator, Executor executor, boolean cancelOnFailure) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.cancelOnFailure = cancelOnFailure;
  }

  /** Cancels later stages on failure. */
  public StagedVariableScheduler(VariableEvaluator evaluator, Executor executor) {
    this(evaluator, executor, true);
  }

  public EvaluationReport run(List<VariableDefinition> variables) {
    List<VariableGroup> plan = VariableBuildOrder.resolve(variables);

    Map<String, VariableDefinition> byName = new HashMap<>();
    for (VariableDefinition v : variables) byName.put(v.name(), v);

    Map<String, VariableOutcome> outcomes = new LinkedHashMap<>();
    boolean failed = false;

    for (int stage = 0; stage < plan.size(); stage++) {
      VariableGroup group = plan.get(stage);

      if (failed && cancelOnFailure) {
        for (String name : group.variables()) outcomes.put(name, VariableOutcome.cancelled(name, stage));
        log.debug("varplan.scheduler stage={} cancelled={}", stage, group.variables());
        continue;
      }

      long started = System.nanoTime();
      List<CompletableFuture<VariableOutcome>> futures = new ArrayList<>(group.size());
      for (String name : group.variables()) {
        VariableDefinition v = byName.get(name);
        int s = stage;
        futures.add(submit(v, s));
      }
      // allOf completes only once every member is done, exceptionally or not
      await(CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])));

      int stageFailures = 0;
      for (CompletableFuture<VariableOutcome> f : futures) {
        VariableOutcome o = await(f);
        outcomes.put(o.name(), o);
        if (o.status() == VariableOutcome.Status.FAILED) stageFailures++;
      }
      failed |= stageFailures > 0;

      log.debug("varplan.scheduler stage={} size={} failures={} durationMs={}",
          stage, group.size(), stageFailures, (System.nanoTime() - started) / 1_000_000);
    }

    return new EvaluationReport(plan, outcomes);
  }

  private CompletableFuture<VariableOutcome> submit(VariableDefinition v, int stage) {
    try {
      return CompletableFuture.supplyAsync(() -> evaluate(v, stage), executor);
    } catch (RejectedExecutionException e) {
      log.warn("varplan.scheduler rejected variable={} stage={} error={}", v.name(), stage, e.toString());
      return CompletableFuture.completedFuture(VariableOutcome.failed(v.name(), stage, e));
    }
  }

  /** Joins, rethrowing what the evaluator threw instead of the {@link CompletionException} wrapper. */
  private static <T> T await(CompletableFuture<T> f) {
    try {
      return f.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Error err) throw err;
      if (cause instanceof RuntimeException re) throw re;
      throw e;
    }
  }

  private VariableOutcome evaluate(VariableDefinition v, int stage) {
    try {
      evaluator.evaluate(v);
      return VariableOutcome.succeeded(v.name(), stage);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("varplan.scheduler interrupted variable={} stage={}", v.name(), stage);
      return VariableOutcome.failed(v.name(), stage, e);
    } catch (Exception e) {
      log.warn("varplan.scheduler failed variable={} stage={} error={}", v.name(), stage, e.toString());
      return VariableOutcome.failed(v.name(), stage, e);
    }
  }
}

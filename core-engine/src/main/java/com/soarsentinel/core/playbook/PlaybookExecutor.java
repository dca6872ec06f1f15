package com.soarsentinel.core.playbook;

import com.soarsentinel.core.metrics.SoarMetrics;
import com.soarsentinel.core.model.Playbook;
import com.soarsentinel.core.model.PlaybookExecution;
import com.soarsentinel.core.model.PlaybookStep;
import com.soarsentinel.core.model.StepResult;
import com.soarsentinel.core.predicate.PredicateEvaluationException;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import com.soarsentinel.core.predicate.PredicateSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs playbooks step by step and produces their {@link PlaybookExecution}
 * records.
 *
 * <h3>Step Lifecycle</h3>
 * <ol>
 * <li>If cancellation was requested, the execution is finalised as
 * cancelled and no further step starts.</li>
 * <li>The step {@code condition}, if any, is evaluated against the execution
 * namespace; a false or unevaluable condition skips the step.</li>
 * <li>Inputs are rendered by the {@link TemplateRenderer} and the action is
 * invoked under the step deadline, retrying with backoff up to
 * {@code retries} times.</li>
 * <li>A failure is handled by the step's error policy: {@code abort} stops
 * the run, {@code continue} proceeds, {@code rollback} compensates every
 * previously succeeded step in reverse order and stops the run.</li>
 * </ol>
 *
 * <p>
 * The execution is finalised exactly once. It ends {@code completed} unless a
 * step stopped it; step failures never propagate to the caller.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * One executor serves all trigger workers. Actions run on an internal pool so
 * the caller can stop waiting at the deadline; an action that ignores its own
 * timeout keeps its pool thread until it returns.
 * </p>
 *
 * @since 1.0.0
 */
public final class PlaybookExecutor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PlaybookExecutor.class);

    private static final long DRY_RUN_EXECUTION_ID = 0L;

    private final PlaybookRepository playbooks;
    private final ActionRegistry actions;
    private final ExecutionStore executions;
    private final PredicateEvaluator predicates;
    private final ExecutorSettings settings;
    private final SoarMetrics metrics;
    private final Clock clock;
    private final TemplateRenderer templates = new TemplateRenderer();
    private final ExecutorService actionPool;

    public PlaybookExecutor(PlaybookRepository playbooks, ActionRegistry actions,
            ExecutionStore executions, PredicateEvaluator predicates, ExecutorSettings settings,
            SoarMetrics metrics, Clock clock) {
        this.playbooks = Objects.requireNonNull(playbooks, "playbooks must not be null");
        this.actions = Objects.requireNonNull(actions, "actions must not be null");
        this.executions = Objects.requireNonNull(executions, "executions must not be null");
        this.predicates = Objects.requireNonNull(predicates, "predicates must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        AtomicInteger threads = new AtomicInteger();
        this.actionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "playbook-action-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run a stored playbook.
     *
     * <p>
     * A missing or inactive playbook yields a failed execution record rather
     * than an exception.
     * </p>
     *
     * @return the finalised, persisted execution
     */
    public PlaybookExecution execute(long playbookId, TriggerContext context) {
        Objects.requireNonNull(context, "context must not be null");
        PlaybookExecution execution = new PlaybookExecution(executions.nextId(), playbookId,
                context.getOrganizationId(), clock.instant(), context.getSource(),
                context.getEntityId(), context.getEventId());
        executions.save(execution);

        Playbook playbook = playbooks.findById(playbookId).orElse(null);
        if (playbook == null) {
            LOG.warn("Execution {}: playbook {} not found", execution.getId(), playbookId);
            execution.fail("Playbook " + playbookId + " not found", clock.instant());
        } else if (!playbook.isActive()) {
            LOG.warn("Execution {}: playbook {} is inactive", execution.getId(), playbookId);
            execution.fail("Playbook " + playbookId + " is inactive", clock.instant());
        } else {
            LOG.info("Execution {}: running playbook {} '{}' v{} ({})", execution.getId(),
                    playbook.getId(), playbook.getName(), playbook.getVersion(), context.getSource());
            run(playbook, execution, context, actions, false);
        }

        executions.save(execution);
        metrics.recordExecution(execution.getStatus().label(), execution.getDuration().orElse(null));
        LOG.info("Execution {} finished: {}{}", execution.getId(), execution.getStatus().label(),
                execution.getError() != null ? " (" + execution.getError() + ")" : "");
        return execution;
    }

    /**
     * Run a playbook against test data without persisting the execution.
     *
     * @param playbook     playbook to run, which need not be stored
     * @param data         trigger data exposed at the namespace root
     * @param dryRunActions registry of side-effect-free stand-ins for the
     *                     real actions
     * @return the finalised execution, with id {@code 0}
     */
    public PlaybookExecution dryRun(Playbook playbook, Map<String, Object> data, ActionRegistry dryRunActions) {
        Objects.requireNonNull(playbook, "playbook must not be null");
        Objects.requireNonNull(dryRunActions, "dryRunActions must not be null");
        TriggerContext context = TriggerContext.dryRun(playbook.getOrganizationId(), data);
        PlaybookExecution execution = new PlaybookExecution(DRY_RUN_EXECUTION_ID, playbook.getId(),
                playbook.getOrganizationId(), clock.instant(), context.getSource(), 0L, null);
        run(playbook, execution, context, dryRunActions, true);
        LOG.debug("Dry run of playbook {} finished: {}", playbook.getId(), execution.getStatus().label());
        return execution;
    }

    /**
     * Request cancellation of a running execution. The action in flight, if
     * any, is not interrupted; no further step starts.
     *
     * @return {@code true} if the execution exists and was still running
     */
    public boolean cancel(long executionId) {
        boolean requested = executions.findById(executionId)
                .map(PlaybookExecution::requestCancel)
                .orElse(false);
        if (requested) {
            LOG.info("Cancellation requested for execution {}", executionId);
        }
        return requested;
    }

    @Override
    public void close() {
        actionPool.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Step loop
    // ---------------------------------------------------------------

    private void run(Playbook playbook, PlaybookExecution execution, TriggerContext context,
            ActionRegistry registry, boolean dryRun) {
        Map<String, Object> stepsNamespace = new LinkedHashMap<>();
        Map<String, Object> namespace = context.newNamespace(stepsNamespace);
        Deque<Completed> succeeded = new ArrayDeque<>();

        for (PlaybookStep step : playbook.getSteps()) {
            if (execution.isCancelRequested()) {
                LOG.info("Execution {} cancelled before step '{}'", execution.getId(), step.getStepKey());
                execution.cancel(clock.instant());
                return;
            }

            if (!conditionHolds(step, namespace, execution)) {
                execution.addResult(StepResult.skipped(step.getStepKey(), step.getActionId(), clock.instant()));
                stepsNamespace.put(step.getStepKey(), stepView("skipped", Map.of(), null));
                continue;
            }

            Action action = registry.find(step.getActionId()).orElse(null);
            Map<String, Object> inputs = templates.render(step.getInputs(), namespace);
            StepResult result = action == null
                    ? StepResult.failed(step.getStepKey(), step.getActionId(), 0,
                            "Unknown action '" + step.getActionId() + "'", clock.instant(), clock.instant())
                    : invoke(step, action, inputs, execution, dryRun);
            execution.addResult(result);

            if (result.getError() == null) {
                stepsNamespace.put(step.getStepKey(), stepView("completed", result.getOutput(), null));
                succeeded.push(new Completed(step, action, result));
                continue;
            }

            stepsNamespace.put(step.getStepKey(), stepView("failed", Map.of(), result.getError()));
            String error = "Step '" + step.getStepKey() + "' failed: " + result.getError();
            switch (step.getOnError()) {
                case CONTINUE -> LOG.warn("Execution {}: {}; continuing", execution.getId(), error);
                case ABORT -> {
                    LOG.warn("Execution {}: {}; aborting", execution.getId(), error);
                    execution.fail(error, clock.instant());
                    return;
                }
                case ROLLBACK -> {
                    LOG.warn("Execution {}: {}; rolling back {} step(s)", execution.getId(), error,
                            succeeded.size());
                    rollback(succeeded, execution, dryRun);
                    execution.fail(error + " (rolled back)", clock.instant());
                    return;
                }
                default -> throw new IllegalStateException("Unhandled error policy " + step.getOnError());
            }
        }
        execution.complete(clock.instant());
    }

    private boolean conditionHolds(PlaybookStep step, Map<String, Object> namespace, PlaybookExecution execution) {
        if (step.getCondition() == null) {
            return true;
        }
        try {
            return predicates.compile(step.getCondition()).test(namespace);
        } catch (PredicateSyntaxException | PredicateEvaluationException e) {
            LOG.debug("Execution {}: condition of step '{}' not satisfied: {}",
                    execution.getId(), step.getStepKey(), e.getMessage());
            return false;
        }
    }

    private StepResult invoke(PlaybookStep step, Action action, Map<String, Object> inputs,
            PlaybookExecution execution, boolean dryRun) {
        long timeoutMs = step.getTimeoutMs() != null
                ? step.getTimeoutMs()
                : settings.getDefaultStepTimeout().toMillis();
        int maxAttempts = step.getRetries() + 1;
        Instant startedAt = clock.instant();
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ActionContext ctx = new ActionContext(execution.getId(), execution.getPlaybookId(),
                    execution.getOrganizationId(), step.getStepKey(), attempt, dryRun);
            try {
                Map<String, Object> output = callWithDeadline(
                        () -> action.execute(inputs, ctx), action.id(), timeoutMs);
                LOG.debug("Execution {}: step '{}' completed on attempt {}",
                        execution.getId(), step.getStepKey(), attempt);
                return StepResult.completed(step.getStepKey(), action.id(), attempt,
                        output != null ? output : Map.of(), startedAt, clock.instant());
            } catch (ActionExecutionException e) {
                lastError = e.getMessage();
                LOG.debug("Execution {}: step '{}' attempt {}/{} failed: {}",
                        execution.getId(), step.getStepKey(), attempt, maxAttempts, lastError);
                if (attempt < maxAttempts && !sleep(settings.backoffAfter(attempt))) {
                    lastError = lastError + " (retry interrupted)";
                    return StepResult.failed(step.getStepKey(), action.id(), attempt, lastError,
                            startedAt, clock.instant());
                }
            }
        }
        return StepResult.failed(step.getStepKey(), action.id(), maxAttempts, lastError,
                startedAt, clock.instant());
    }

    private void rollback(Deque<Completed> succeeded, PlaybookExecution execution, boolean dryRun) {
        // the deque is LIFO, so this walks the steps in reverse order
        for (Completed done : succeeded) {
            if (!done.action.supportsCompensation()) {
                continue;
            }
            ActionContext ctx = new ActionContext(execution.getId(), execution.getPlaybookId(),
                    execution.getOrganizationId(), done.step.getStepKey(), 1, dryRun);
            long timeoutMs = done.step.getTimeoutMs() != null
                    ? done.step.getTimeoutMs()
                    : settings.getDefaultStepTimeout().toMillis();
            try {
                callWithDeadline(() -> {
                    done.action.compensate(done.result.getOutput(), ctx);
                    return null;
                }, done.action.id(), timeoutMs);
                execution.replaceResult(done.result.withCompensation(true, null));
                LOG.info("Execution {}: compensated step '{}'", execution.getId(), done.step.getStepKey());
            } catch (ActionExecutionException e) {
                execution.replaceResult(done.result.withCompensation(false, e.getMessage()));
                LOG.error("Execution {}: compensation of step '{}' failed: {}",
                        execution.getId(), done.step.getStepKey(), e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <T> T callWithDeadline(Callable<T> call, String actionId, long timeoutMs) {
        Future<T> future = actionPool.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ActionTimeoutException(actionId, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ActionExecutionException ae) {
                throw ae;
            }
            throw new ActionExecutionException("Action '" + actionId + "' failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ActionExecutionException("Interrupted while waiting for action '" + actionId + "'", e);
        }
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Map<String, Object> stepView(String status, Map<String, Object> output, String error) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("status", status);
        view.put("output", output);
        if (error != null) {
            view.put("error", error);
        }
        return view;
    }

    private static final class Completed {
        private final PlaybookStep step;
        private final Action action;
        private final StepResult result;

        private Completed(PlaybookStep step, Action action, StepResult result) {
            this.step = step;
            this.action = action;
            this.result = result;
        }
    }
}

package com.soarsentinel.core.playbook;

import java.util.Map;

/**
 * A response action that playbook steps invoke by id.
 *
 * <p>
 * Actions are registered explicitly in an {@link ActionRegistry} at startup.
 * Implementations must be thread-safe: the same instance serves concurrent
 * executions. An action is expected to honour its own per-call timeout; the
 * executor stops waiting at the step deadline but cannot force an in-flight
 * call to stop.
 * </p>
 */
public interface Action {

    /**
     * @return registry id referenced by {@code PlaybookStep.actionId}
     */
    String id();

    /**
     * Perform the action.
     *
     * @param inputs  step inputs after template rendering
     * @param context execution the call belongs to
     * @return output exposed to later steps as {@code steps.<key>.output}
     * @throws ActionExecutionException if the action fails
     */
    Map<String, Object> execute(Map<String, Object> inputs, ActionContext context);

    /**
     * @return {@code true} if {@link #compensate(Map, ActionContext)} undoes
     *         the effect of {@link #execute(Map, ActionContext)}
     */
    default boolean supportsCompensation() {
        return false;
    }

    /**
     * Undo a previous successful call. Invoked during rollback with the
     * output of that call.
     *
     * @throws ActionExecutionException if the compensation fails
     */
    default void compensate(Map<String, Object> output, ActionContext context) {
        throw new UnsupportedOperationException("Action '" + id() + "' has no compensating operation");
    }
}

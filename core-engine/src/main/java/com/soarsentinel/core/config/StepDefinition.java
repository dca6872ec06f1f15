package com.soarsentinel.core.config;

import com.soarsentinel.core.model.PlaybookStep;
import com.soarsentinel.core.model.StepErrorPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML shape of one playbook step.
 *
 * <pre>
 * - sequence: 1
 *   key: block
 *   action: block_ip
 *   condition: "severity == 'critical'"
 *   inputs:
 *     ip: "{{ sourceIp }}"
 *   onError: rollback
 *   timeoutMs: 5000
 *   retries: 2
 * </pre>
 *
 * @since 1.0.0
 */
public class StepDefinition {

    private int sequence;
    private String key;
    private String action;
    private String condition;
    private Map<String, Object> inputs = new LinkedHashMap<>();
    private String onError;
    private Long timeoutMs;
    private int retries;

    /**
     * Check required fields.
     *
     * @param owner name of the enclosing playbook, used in messages
     * @throws IllegalStateException listing every problem found
     */
    public void validate(String owner) {
        List<String> errors = new ArrayList<>();
        String label = key != null ? key : "#" + sequence;
        if (key == null || key.isBlank()) {
            errors.add("Step " + label + " of playbook '" + owner + "' requires 'key'");
        }
        if (action == null || action.isBlank()) {
            errors.add("Step '" + label + "' of playbook '" + owner + "' requires 'action'");
        }
        try {
            StepErrorPolicy.parse(onError);
        } catch (IllegalArgumentException e) {
            errors.add("Step '" + label + "' of playbook '" + owner + "': " + e.getMessage());
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            errors.add("Step '" + label + "' of playbook '" + owner + "' requires 'timeoutMs' > 0");
        }
        if (retries < 0) {
            errors.add("Step '" + label + "' of playbook '" + owner + "' requires 'retries' >= 0");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    PlaybookStep toStep() {
        return PlaybookStep.builder()
                .sequence(sequence)
                .stepKey(key)
                .actionId(action)
                .condition(condition)
                .inputs(inputs)
                .onError(StepErrorPolicy.parse(onError))
                .timeoutMs(timeoutMs)
                .retries(retries)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public int getSequence() {
        return sequence;
    }

    public void setSequence(int sequence) {
        this.sequence = sequence;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public void setInputs(Map<String, Object> inputs) {
        this.inputs = inputs != null ? new LinkedHashMap<>(inputs) : new LinkedHashMap<>();
    }

    public String getOnError() {
        return onError;
    }

    public void setOnError(String onError) {
        this.onError = onError;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = retries;
    }

    @Override
    public String toString() {
        return "StepDefinition{sequence=" + sequence + ", key='" + key + "', action='" + action + "'}";
    }
}

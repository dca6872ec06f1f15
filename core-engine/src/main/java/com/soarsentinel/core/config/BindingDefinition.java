package com.soarsentinel.core.config;

import com.soarsentinel.core.model.PlaybookBinding;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import com.soarsentinel.core.predicate.PredicateSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of a binding in the catalog.
 *
 * <pre>
 * - eventType: alert.created
 *   playbookId: 1
 *   predicate: "severity == 'critical' &amp;&amp; sourceIp != null"
 *   priority: 10
 * </pre>
 *
 * @since 1.0.0
 */
public class BindingDefinition {

    private String eventType;
    private String predicate;
    private long playbookId;
    private int priority;
    private boolean active = true;
    private long organizationId;
    private String description;

    /**
     * @param predicates used to compile the predicate
     * @throws IllegalStateException listing every problem found
     */
    public void validate(PredicateEvaluator predicates) {
        List<String> errors = new ArrayList<>();
        String label = "binding(" + eventType + " -> playbook " + playbookId + ")";
        if (eventType == null || eventType.isBlank()) {
            errors.add("Binding " + label + " requires 'eventType'");
        }
        if (playbookId <= 0) {
            errors.add("Binding " + label + " requires 'playbookId' > 0");
        }
        if (predicate != null && !predicate.isBlank()) {
            try {
                predicates.validate(predicate);
            } catch (PredicateSyntaxException e) {
                errors.add("Binding " + label + " has an invalid predicate: " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    PlaybookBinding toBinding() {
        return PlaybookBinding.builder()
                .eventType(eventType)
                .predicate(predicate)
                .playbookId(playbookId)
                .priority(priority)
                .active(active)
                .organizationId(organizationId)
                .description(description)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getPredicate() {
        return predicate;
    }

    public void setPredicate(String predicate) {
        this.predicate = predicate;
    }

    public long getPlaybookId() {
        return playbookId;
    }

    public void setPlaybookId(long playbookId) {
        this.playbookId = playbookId;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(long organizationId) {
        this.organizationId = organizationId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @Override
    public String toString() {
        return "BindingDefinition{eventType='" + eventType + "', playbookId=" + playbookId
                + ", priority=" + priority + ", predicate='" + predicate + "'}";
    }
}

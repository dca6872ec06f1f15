package com.soarsentinel.core.config;

import com.soarsentinel.core.model.Playbook;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * YAML shape of a playbook in the catalog.
 *
 * @since 1.0.0
 */
public class PlaybookDefinition {

    private long id;
    private long organizationId;
    private String name;
    private String description;
    private int version = 1;
    private boolean active = true;
    private List<StepDefinition> steps = new ArrayList<>();

    /**
     * @throws IllegalStateException listing every problem found, steps
     *                               included
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = name != null ? name : "#" + id;
        if (id <= 0) {
            errors.add("Playbook '" + label + "' requires 'id' > 0");
        }
        if (name == null || name.isBlank()) {
            errors.add("Playbook " + label + " requires 'name'");
        }
        if (version <= 0) {
            errors.add("Playbook '" + label + "' requires 'version' > 0");
        }
        Set<String> keys = new HashSet<>();
        Set<Integer> sequences = new HashSet<>();
        for (StepDefinition step : steps) {
            if (step == null) {
                errors.add("Playbook '" + label + "' contains an empty step");
                continue;
            }
            try {
                step.validate(label);
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (step.getKey() != null && !keys.add(step.getKey())) {
                errors.add("Playbook '" + label + "' has duplicate step key '" + step.getKey() + "'");
            }
            if (!sequences.add(step.getSequence())) {
                errors.add("Playbook '" + label + "' has duplicate step sequence " + step.getSequence());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    Playbook toPlaybook() {
        return new Playbook(id, organizationId, name, description, version, active,
                steps.stream().map(StepDefinition::toStep).toList());
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(long organizationId) {
        this.organizationId = organizationId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public List<StepDefinition> getSteps() {
        return steps;
    }

    public void setSteps(List<StepDefinition> steps) {
        this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PlaybookDefinition{id=" + id + ", name='" + name + "', steps=" + steps.size() + '}';
    }
}

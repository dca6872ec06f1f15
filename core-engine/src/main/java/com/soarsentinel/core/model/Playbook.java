package com.soarsentinel.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered, versioned sequence of automated response steps.
 *
 * <p>
 * Steps are stored sorted by {@link PlaybookStep#getSequence()}. Step keys
 * and sequence numbers must be unique within a playbook, because step outputs
 * are addressed as {@code steps.<key>.output}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Playbook {

    private final long id;
    private final long organizationId;
    private final String name;
    private final String description;
    private final int version;
    private final boolean active;
    private final List<PlaybookStep> steps;

    /**
     * @throws IllegalArgumentException if step keys or sequences collide
     */
    public Playbook(long id, long organizationId, String name, String description,
            int version, boolean active, List<PlaybookStep> steps) {
        this.id = id;
        this.organizationId = organizationId;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = description;
        this.version = version;
        this.active = active;

        List<PlaybookStep> sorted = new ArrayList<>(Objects.requireNonNull(steps, "steps must not be null"));
        sorted.sort(Comparator.comparingInt(PlaybookStep::getSequence));
        Set<String> keys = new HashSet<>();
        Set<Integer> sequences = new HashSet<>();
        for (PlaybookStep step : sorted) {
            if (!keys.add(step.getStepKey())) {
                throw new IllegalArgumentException(
                        "Duplicate step key '" + step.getStepKey() + "' in playbook '" + name + "'");
            }
            if (!sequences.add(step.getSequence())) {
                throw new IllegalArgumentException(
                        "Duplicate step sequence " + step.getSequence() + " in playbook '" + name + "'");
            }
        }
        this.steps = List.copyOf(sorted);
    }

    public long getId() {
        return id;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public int getVersion() {
        return version;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * @return steps in execution order
     */
    public List<PlaybookStep> getSteps() {
        return steps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Playbook that))
            return false;
        return id == that.id && version == that.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Playbook{id=" + id + ", name='" + name + "', version=" + version
                + ", active=" + active + ", steps=" + steps.size() + '}';
    }
}

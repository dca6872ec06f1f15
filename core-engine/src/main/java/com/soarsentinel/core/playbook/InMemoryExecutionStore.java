package com.soarsentinel.core.playbook;

import com.soarsentinel.core.model.PlaybookExecution;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ExecutionStore} held in a concurrent map.
 */
public final class InMemoryExecutionStore implements ExecutionStore {

    private final Map<Long, PlaybookExecution> executions = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public long nextId() {
        return sequence.incrementAndGet();
    }

    @Override
    public void save(PlaybookExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        executions.put(execution.getId(), execution);
    }

    @Override
    public Optional<PlaybookExecution> findById(long executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<PlaybookExecution> findByPlaybook(long playbookId) {
        return executions.values().stream()
                .filter(e -> e.getPlaybookId() == playbookId)
                .sorted(Comparator.comparingLong(PlaybookExecution::getId))
                .toList();
    }

    public List<PlaybookExecution> findAll() {
        return executions.values().stream()
                .sorted(Comparator.comparingLong(PlaybookExecution::getId))
                .toList();
    }
}

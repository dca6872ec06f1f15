package com.soarsentinel.core.playbook;

import com.soarsentinel.core.model.PlaybookExecution;

import java.util.List;
import java.util.Optional;

/**
 * Storage of execution records. Writes are keyed by execution id, so
 * concurrent workers never contend on the same record.
 */
public interface ExecutionStore {

    /**
     * @return a new unique execution id
     */
    long nextId();

    void save(PlaybookExecution execution);

    Optional<PlaybookExecution> findById(long executionId);

    List<PlaybookExecution> findByPlaybook(long playbookId);
}

package com.soarsentinel.core.playbook;

import com.soarsentinel.core.model.Playbook;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link PlaybookRepository} held in a concurrent map; saving a playbook with
 * an existing id replaces it.
 */
public final class InMemoryPlaybookRepository implements PlaybookRepository {

    private final Map<Long, Playbook> playbooks = new ConcurrentHashMap<>();

    @Override
    public Optional<Playbook> findById(long playbookId) {
        return Optional.ofNullable(playbooks.get(playbookId));
    }

    @Override
    public List<Playbook> findByOrganization(long organizationId) {
        return playbooks.values().stream()
                .filter(p -> p.getOrganizationId() == organizationId)
                .sorted(Comparator.comparingLong(Playbook::getId))
                .toList();
    }

    @Override
    public void save(Playbook playbook) {
        Objects.requireNonNull(playbook, "playbook must not be null");
        playbooks.put(playbook.getId(), playbook);
    }
}

package com.soarsentinel.core.playbook;

import com.soarsentinel.core.model.Playbook;

import java.util.List;
import java.util.Optional;

/**
 * Read access to versioned playbooks. Playbook authoring lives outside this
 * engine; {@link #save(Playbook)} exists for catalog seeding.
 */
public interface PlaybookRepository {

    Optional<Playbook> findById(long playbookId);

    List<Playbook> findByOrganization(long organizationId);

    void save(Playbook playbook);
}

package com.soarsentinel.core.binding;

import com.soarsentinel.core.model.PlaybookBinding;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of playbook bindings. Implementations perform no
 * validation; that is the job of {@link BindingRegistry}.
 */
public interface BindingStore {

    /**
     * Insert a binding, assigning a new id.
     *
     * @param binding binding whose id is ignored
     * @return the stored binding carrying its assigned id
     */
    PlaybookBinding insert(PlaybookBinding binding);

    /**
     * Replace an existing binding with the same id.
     *
     * @return {@code false} if no binding with that id exists
     */
    boolean replace(PlaybookBinding binding);

    Optional<PlaybookBinding> findById(long id);

    List<PlaybookBinding> findByOrganization(long organizationId);

    /**
     * @return bindings of the given type and organization, in no particular
     *         order and regardless of their active flag
     */
    List<PlaybookBinding> findByEventType(String eventType, long organizationId);

    boolean delete(long id);
}

package com.soarsentinel.core.binding;

import com.soarsentinel.core.model.Playbook;
import com.soarsentinel.core.model.PlaybookBinding;
import com.soarsentinel.core.playbook.PlaybookRepository;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import com.soarsentinel.core.predicate.PredicateSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tenant-scoped collection of playbook bindings.
 *
 * <h3>Validation</h3>
 * <p>
 * {@link #create(PlaybookBinding)} and {@link #update(long, long, BindingUpdate)}
 * validate the complete resulting binding before anything is stored: a
 * non-blank event type, an existing playbook of the same organization and a
 * predicate that compiles. Every rejected field is reported together in a
 * {@link BindingValidationException}, so a stored predicate can never fail to
 * parse when events are matched.
 * </p>
 *
 * <h3>Lookup</h3>
 * <p>
 * {@link #findMatches(String, long)} returns the active bindings of an event
 * type in dispatch order ({@link PlaybookBinding#DISPATCH_ORDER}).
 * </p>
 *
 * @since 1.0.0
 */
public final class BindingRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(BindingRegistry.class);

    private final BindingStore store;
    private final PlaybookRepository playbooks;
    private final PredicateEvaluator predicates;
    private final Clock clock;

    public BindingRegistry(BindingStore store, PlaybookRepository playbooks,
            PredicateEvaluator predicates, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.playbooks = Objects.requireNonNull(playbooks, "playbooks must not be null");
        this.predicates = Objects.requireNonNull(predicates, "predicates must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    /**
     * @return active bindings for the event type, highest priority first and
     *         ties broken by ascending id
     */
    public List<PlaybookBinding> findMatches(String eventType, long organizationId) {
        Objects.requireNonNull(eventType, "eventType must not be null");
        return store.findByEventType(eventType, organizationId).stream()
                .filter(PlaybookBinding::isActive)
                .sorted(PlaybookBinding.DISPATCH_ORDER)
                .toList();
    }

    public List<PlaybookBinding> list(long organizationId) {
        return store.findByOrganization(organizationId);
    }

    public Optional<PlaybookBinding> find(long id, long organizationId) {
        return store.findById(id).filter(b -> b.getOrganizationId() == organizationId);
    }

    /**
     * @throws BindingNotFoundException if the binding does not exist in the
     *                                  organization
     */
    public PlaybookBinding get(long id, long organizationId) {
        return find(id, organizationId).orElseThrow(() -> new BindingNotFoundException(id));
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    /**
     * Validate and store a new binding. The supplied id and timestamps are
     * ignored.
     *
     * @return the stored binding
     * @throws BindingValidationException if any field is invalid
     */
    public PlaybookBinding create(PlaybookBinding binding) {
        Objects.requireNonNull(binding, "binding must not be null");
        validate(binding);
        Instant now = clock.instant();
        PlaybookBinding stored = store.insert(binding.toBuilder()
                .eventType(binding.getEventType().trim())
                .createdAt(now)
                .updatedAt(now)
                .build());
        LOG.info("Created binding {} ({} -> playbook {}, priority {}) for organization {}",
                stored.getId(), stored.getEventType(), stored.getPlaybookId(),
                stored.getPriority(), stored.getOrganizationId());
        return stored;
    }

    /**
     * Apply a partial update.
     *
     * @return the updated binding
     * @throws BindingNotFoundException   if the binding does not exist in the
     *                                    organization
     * @throws BindingValidationException if the resulting binding is invalid
     */
    public PlaybookBinding update(long id, long organizationId, BindingUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        PlaybookBinding current = get(id, organizationId);

        PlaybookBinding.Builder builder = current.toBuilder();
        update.eventType().ifPresent(v -> builder.eventType(v.trim()));
        update.predicate().ifPresent(builder::predicate);
        update.playbookId().ifPresent(builder::playbookId);
        update.priority().ifPresent(builder::priority);
        update.active().ifPresent(builder::active);
        update.description().ifPresent(builder::description);
        PlaybookBinding candidate = builder.updatedAt(clock.instant()).build();

        validate(candidate);
        if (!store.replace(candidate)) {
            // deleted concurrently
            throw new BindingNotFoundException(id);
        }
        LOG.info("Updated binding {} for organization {}", id, organizationId);
        return candidate;
    }

    /**
     * @throws BindingNotFoundException if the binding does not exist in the
     *                                  organization
     */
    public void delete(long id, long organizationId) {
        get(id, organizationId);
        if (!store.delete(id)) {
            throw new BindingNotFoundException(id);
        }
        LOG.info("Deleted binding {} for organization {}", id, organizationId);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void validate(PlaybookBinding binding) {
        List<BindingValidationException.FieldError> errors = new ArrayList<>();

        if (binding.getEventType() == null || binding.getEventType().isBlank()) {
            errors.add(new BindingValidationException.FieldError("eventType", "must not be blank"));
        }

        if (binding.getPlaybookId() <= 0) {
            errors.add(new BindingValidationException.FieldError("playbookId", "must be positive"));
        } else {
            Optional<Playbook> playbook = playbooks.findById(binding.getPlaybookId());
            if (playbook.isEmpty() || playbook.get().getOrganizationId() != binding.getOrganizationId()) {
                errors.add(new BindingValidationException.FieldError("playbookId",
                        "playbook " + binding.getPlaybookId() + " does not exist"));
            }
        }

        if (binding.hasPredicate()) {
            try {
                predicates.validate(binding.getPredicate());
            } catch (PredicateSyntaxException e) {
                errors.add(new BindingValidationException.FieldError("predicate", e.getMessage()));
            }
        }

        if (!errors.isEmpty()) {
            LOG.debug("Rejected binding for organization {}: {}", binding.getOrganizationId(), errors);
            throw new BindingValidationException(errors);
        }
    }
}

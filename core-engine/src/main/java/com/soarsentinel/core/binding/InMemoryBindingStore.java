package com.soarsentinel.core.binding;

import com.soarsentinel.core.model.PlaybookBinding;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link BindingStore} backed by a concurrent map with a sequence for ids.
 */
public final class InMemoryBindingStore implements BindingStore {

    private final Map<Long, PlaybookBinding> bindings = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public PlaybookBinding insert(PlaybookBinding binding) {
        Objects.requireNonNull(binding, "binding must not be null");
        PlaybookBinding stored = binding.toBuilder().id(sequence.incrementAndGet()).build();
        bindings.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public boolean replace(PlaybookBinding binding) {
        Objects.requireNonNull(binding, "binding must not be null");
        return bindings.replace(binding.getId(), binding) != null;
    }

    @Override
    public Optional<PlaybookBinding> findById(long id) {
        return Optional.ofNullable(bindings.get(id));
    }

    @Override
    public List<PlaybookBinding> findByOrganization(long organizationId) {
        return bindings.values().stream()
                .filter(b -> b.getOrganizationId() == organizationId)
                .sorted(Comparator.comparingLong(PlaybookBinding::getId))
                .toList();
    }

    @Override
    public List<PlaybookBinding> findByEventType(String eventType, long organizationId) {
        return bindings.values().stream()
                .filter(b -> b.getOrganizationId() == organizationId)
                .filter(b -> b.getEventType().equals(eventType))
                .toList();
    }

    @Override
    public boolean delete(long id) {
        return bindings.remove(id) != null;
    }
}

package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link AlertRepository} held in memory. {@link #save(Alert)} stands in for
 * the ingestion pipeline and notifies creation listeners.
 */
public final class InMemoryAlertRepository implements AlertRepository {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAlertRepository.class);

    private final Map<Long, Alert> alerts = new ConcurrentHashMap<>();
    private final List<Consumer<Alert>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Store an alert. Listeners are notified only for alerts not seen before.
     */
    public void save(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (alerts.putIfAbsent(alert.getId(), alert) != null) {
            alerts.put(alert.getId(), alert);
            return;
        }
        for (Consumer<Alert> listener : listeners) {
            try {
                listener.accept(alert);
            } catch (RuntimeException e) {
                LOG.warn("Alert-created listener failed for alert {}: {}", alert.getId(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void onAlertCreated(Consumer<Alert> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public List<Alert> listAlerts(AlertFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return alerts.values().stream()
                .filter(a -> a.getOrganizationId() == filter.getOrganizationId())
                .filter(a -> filter.getSince() == null || !a.getTimestamp().isBefore(filter.getSince()))
                .filter(a -> !filter.isUnresolvedOnly() || !a.getStatus().isResolved())
                .sorted(Comparator.comparing(Alert::getTimestamp).reversed())
                .limit(filter.getLimit())
                .toList();
    }

    @Override
    public Set<Long> organizationIds() {
        return alerts.values().stream().map(Alert::getOrganizationId).collect(Collectors.toSet());
    }
}

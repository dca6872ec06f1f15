package com.soarsentinel.core.event;

import com.soarsentinel.core.model.Alert;

import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Alert persistence as seen by this engine. Alerts are written by the
 * ingestion pipeline; the engine subscribes to creations and queries recent
 * alerts for correlation.
 */
public interface AlertRepository {

    /**
     * Register a listener invoked after each alert is persisted.
     */
    void onAlertCreated(Consumer<Alert> listener);

    /**
     * @return matching alerts ordered by timestamp, newest first
     */
    List<Alert> listAlerts(AlertFilter filter);

    /**
     * @return ids of the organizations that currently own alerts
     */
    Set<Long> organizationIds();
}

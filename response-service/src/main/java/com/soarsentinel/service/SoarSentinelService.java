package com.soarsentinel.service;

import com.soarsentinel.core.binding.BindingRegistry;
import com.soarsentinel.core.binding.InMemoryBindingStore;
import com.soarsentinel.core.config.CatalogConfig;
import com.soarsentinel.core.config.CatalogLoader;
import com.soarsentinel.core.correlation.CorrelationCoordinator;
import com.soarsentinel.core.correlation.CorrelationOptions;
import com.soarsentinel.core.correlation.EventTypeClassifier;
import com.soarsentinel.core.correlation.GraphCorrelator;
import com.soarsentinel.core.correlation.InMemoryIncidentSink;
import com.soarsentinel.core.correlation.InMemoryThreatIntelSource;
import com.soarsentinel.core.correlation.TemporalCorrelator;
import com.soarsentinel.core.event.EventLog;
import com.soarsentinel.core.event.EventPublisher;
import com.soarsentinel.core.event.InMemoryAlertRepository;
import com.soarsentinel.core.event.InMemoryEventLog;
import com.soarsentinel.core.event.NotificationBus;
import com.soarsentinel.core.metrics.SoarMetrics;
import com.soarsentinel.core.playbook.ActionRegistry;
import com.soarsentinel.core.playbook.InMemoryExecutionStore;
import com.soarsentinel.core.playbook.InMemoryPlaybookRepository;
import com.soarsentinel.core.playbook.PlaybookExecutor;
import com.soarsentinel.core.playbook.actions.InMemoryEndpointClient;
import com.soarsentinel.core.playbook.actions.InMemoryFirewallClient;
import com.soarsentinel.core.predicate.PredicateEvaluator;
import com.soarsentinel.core.trigger.InMemoryDedupStore;
import com.soarsentinel.core.trigger.InMemoryJobQueue;
import com.soarsentinel.core.trigger.TriggerEngine;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the response service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   alert saved
 *     → EventPublisher (alert.created → event log, then notification bus)
 *     → TriggerEngine (match bindings → dedup → job queue → workers)
 *     → PlaybookExecutor (steps → actions → execution record)
 *
 *   every CORRELATION_INTERVAL_MINUTES
 *     → CorrelationCoordinator (temporal + graph) → IncidentSink
 * </pre>
 *
 * <p>
 * All collaborators are constructed here and passed in through
 * constructors. Storage and remediation clients are the in-memory
 * implementations; the event log is Kafka unless {@code EVENT_LOG_BACKEND}
 * is {@code memory}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SoarSentinelService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SoarSentinelService.class);

    private final PrometheusMeterRegistry registry;
    private final InMemoryAlertRepository alerts;
    private final InMemoryFirewallClient firewall;
    private final InMemoryEndpointClient endpoints;
    private final InMemoryIncidentSink incidents;
    private final InMemoryThreatIntelSource threatIntel;
    private final NotificationBus bus;
    private final EventLog eventLog;
    private final InMemoryJobQueue jobs;
    private final PlaybookExecutor executor;
    private final TriggerEngine triggerEngine;
    private final CorrelationScheduler correlationScheduler;

    SoarSentinelService(ServiceConfig config, EventLog eventLog, Clock clock) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.eventLog = eventLog;
        SoarMetrics metrics = new SoarMetrics(registry);
        PredicateEvaluator predicates = new PredicateEvaluator();

        // Catalog
        InMemoryPlaybookRepository playbooks = new InMemoryPlaybookRepository();
        BindingRegistry bindings = new BindingRegistry(new InMemoryBindingStore(), playbooks, predicates, clock);
        CatalogConfig catalog = CatalogLoader.load(config.getCatalogPath(), predicates);
        CatalogLoader.install(catalog, playbooks, bindings);

        // Playbook execution
        this.firewall = new InMemoryFirewallClient();
        this.endpoints = new InMemoryEndpointClient();
        this.executor = new PlaybookExecutor(playbooks, ActionRegistry.builtIns(firewall, endpoints),
                new InMemoryExecutionStore(), predicates, config.executorSettings(), metrics, clock);

        // Trigger path
        this.jobs = new InMemoryJobQueue(config.getJobMaxAttempts(), Duration.ofMillis(config.getJobBackoffMs()), clock);
        this.triggerEngine = new TriggerEngine(eventLog, bindings, playbooks, predicates, new InMemoryDedupStore(),
                jobs, executor, config.triggerEngineSettings(), metrics, clock);

        // Alert → event
        this.bus = new NotificationBus();
        this.alerts = new InMemoryAlertRepository();
        EventPublisher publisher = new EventPublisher(eventLog, bus, clock);
        alerts.onAlertCreated(publisher::publishAlertCreated);

        // Correlation
        CorrelationOptions options = config.correlationOptions();
        this.incidents = new InMemoryIncidentSink();
        this.threatIntel = new InMemoryThreatIntelSource();
        CorrelationCoordinator coordinator = new CorrelationCoordinator(alerts, threatIntel, incidents,
                new TemporalCorrelator(options, new EventTypeClassifier()), new GraphCorrelator(options),
                options, metrics, clock);
        this.correlationScheduler = new CorrelationScheduler(coordinator,
                Duration.ofMinutes(config.getCorrelationIntervalMinutes()));
    }

    /**
     * Assemble the service with the event log backend named in the config.
     */
    public static SoarSentinelService create(ServiceConfig config) {
        Clock clock = Clock.systemUTC();
        EventLog eventLog = switch (config.getEventLogBackend()) {
            case KAFKA -> new KafkaEventLog(config, new EventJsonCodec());
            case MEMORY -> new InMemoryEventLog(config.getEventMaxDeliveries(), clock);
        };
        LOG.info("Using {} event log", config.getEventLogBackend());
        return new SoarSentinelService(config, eventLog, clock);
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting SOAR Sentinel with config: {}", config);

        // 2. Assemble and start
        SoarSentinelService service = create(config);
        HealthServer healthServer = new HealthServer(service.registry, service::isReady);
        healthServer.start(config.getHealthPort());
        service.start();

        // 3. Block until shutdown; engine threads are daemons
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            healthServer.stop();
            service.close();
            stopped.countDown();
        }, "soar-shutdown"));
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public void start() {
        triggerEngine.start();
        correlationScheduler.start();
        LOG.info("SOAR Sentinel started");
    }

    /**
     * Stop in reverse dependency order: no new work, drain workers, then
     * release the event log.
     */
    @Override
    public void close() {
        correlationScheduler.close();
        triggerEngine.close();
        jobs.close();
        executor.close();
        eventLog.close();
        LOG.info("SOAR Sentinel stopped");
    }

    public boolean isReady() {
        return triggerEngine.isRunning();
    }

    // ---------------------------------------------------------------
    // Accessors for embedding and tests
    // ---------------------------------------------------------------

    PrometheusMeterRegistry registry() {
        return registry;
    }

    InMemoryAlertRepository alerts() {
        return alerts;
    }

    InMemoryFirewallClient firewall() {
        return firewall;
    }

    InMemoryEndpointClient endpoints() {
        return endpoints;
    }

    InMemoryIncidentSink incidents() {
        return incidents;
    }

    InMemoryThreatIntelSource threatIntel() {
        return threatIntel;
    }

    NotificationBus bus() {
        return bus;
    }

    CorrelationScheduler correlationScheduler() {
        return correlationScheduler;
    }
}

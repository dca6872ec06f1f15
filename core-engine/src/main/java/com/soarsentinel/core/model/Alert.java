package com.soarsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A security alert as persisted by the ingestion pipeline.
 *
 * <p>
 * Alerts are read-only to this engine: correlators and the trigger path
 * consume them but never mutate them. Instances are immutable.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code title}, {@code severity}, {@code source}
 * and {@code timestamp} are required; {@code status} defaults to
 * {@link AlertStatus#NEW}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert {

    private final long id;
    private final long organizationId;
    private final String title;
    private final String description;
    private final Severity severity;
    private final String source;
    private final String sourceIp;
    private final String destinationIp;
    private final Instant timestamp;
    private final AlertStatus status;
    private final String category;
    private final String hostId;
    private final String hostname;
    private final List<String> tags;
    private final IocSet iocs;
    private final Map<String, Object> metadata;

    private Alert(Builder b) {
        this.id = b.id;
        this.organizationId = b.organizationId;
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.description = b.description;
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.source = Objects.requireNonNull(b.source, "source must not be null");
        this.sourceIp = b.sourceIp;
        this.destinationIp = b.destinationIp;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.status = b.status != null ? b.status : AlertStatus.NEW;
        this.category = b.category;
        this.hostId = b.hostId;
        this.hostname = b.hostname;
        this.tags = b.tags != null ? List.copyOf(b.tags) : List.of();
        this.iocs = b.iocs != null ? b.iocs : IocSet.empty();
        this.metadata = b.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata))
                : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return description, or {@code null} if the source provided none
     */
    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getSource() {
        return source;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public String getDestinationIp() {
        return destinationIp;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public String getCategory() {
        return category;
    }

    public String getHostId() {
        return hostId;
    }

    public String getHostname() {
        return hostname;
    }

    public List<String> getTags() {
        return tags;
    }

    public IocSet getIocs() {
        return iocs;
    }

    /**
     * @return unmodifiable metadata attached by enrichment stages
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private long id;
        private long organizationId;
        private String title;
        private String description;
        private Severity severity;
        private String source;
        private String sourceIp;
        private String destinationIp;
        private Instant timestamp;
        private AlertStatus status;
        private String category;
        private String hostId;
        private String hostname;
        private List<String> tags;
        private IocSet iocs;
        private Map<String, Object> metadata;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder organizationId(long organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder destinationIp(String destinationIp) {
            this.destinationIp = destinationIp;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder hostId(String hostId) {
            this.hostId = hostId;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder iocs(IocSet iocs) {
            this.iocs = iocs;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id == alert.id && organizationId == alert.organizationId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, organizationId);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id=" + id +
                ", organizationId=" + organizationId +
                ", title='" + title + '\'' +
                ", severity=" + severity +
                ", source='" + source + '\'' +
                ", timestamp=" + timestamp +
                ", status=" + status +
                '}';
    }
}

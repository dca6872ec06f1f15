package com.soarsentinel.core.model;

import java.util.Objects;

/**
 * A threat-intelligence entry (feed item, report, campaign) with the
 * indicators it references. Immutable.
 */
public final class ThreatIntel {

    private final long id;
    private final String title;
    private final IocSet iocs;

    public ThreatIntel(long id, String title, IocSet iocs) {
        this.id = id;
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.iocs = iocs != null ? iocs : IocSet.empty();
    }

    public long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public IocSet getIocs() {
        return iocs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThreatIntel that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "ThreatIntel{id=" + id + ", title='" + title + "', iocs=" + iocs + '}';
    }
}

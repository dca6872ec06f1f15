package com.soarsentinel.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Typed set of indicators of compromise attached to an alert or a
 * threat-intel entry.
 *
 * <p>
 * Instances are immutable. Values are trimmed and blank values are dropped;
 * domains and hashes are lowercased so that lookups in the correlation
 * indices are case-insensitive.
 * </p>
 *
 * @since 1.0.0
 */
public final class IocSet {

    private static final IocSet EMPTY = new IocSet(Set.of(), Set.of(), Set.of());

    private final Set<String> ips;
    private final Set<String> domains;
    private final Set<String> hashes;

    private IocSet(Set<String> ips, Set<String> domains, Set<String> hashes) {
        this.ips = ips;
        this.domains = domains;
        this.hashes = hashes;
    }

    public static IocSet empty() {
        return EMPTY;
    }

    /**
     * @param ips     IP addresses, may be {@code null}
     * @param domains domain names, may be {@code null}
     * @param hashes  file hashes, may be {@code null}
     * @return a normalised, immutable set
     */
    public static IocSet of(Collection<String> ips, Collection<String> domains, Collection<String> hashes) {
        return new IocSet(normalise(ips, false), normalise(domains, true), normalise(hashes, true));
    }

    public static IocSet ofIps(String... ips) {
        return of(Set.of(ips), null, null);
    }

    public Set<String> getIps() {
        return ips;
    }

    public Set<String> getDomains() {
        return domains;
    }

    public Set<String> getHashes() {
        return hashes;
    }

    public boolean isEmpty() {
        return ips.isEmpty() && domains.isEmpty() && hashes.isEmpty();
    }

    private static Set<String> normalise(Collection<String> values, boolean lowercase) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v == null || v.isBlank()) {
                continue;
            }
            String trimmed = v.trim();
            out.add(lowercase ? trimmed.toLowerCase(Locale.ROOT) : trimmed);
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IocSet that))
            return false;
        return ips.equals(that.ips) && domains.equals(that.domains) && hashes.equals(that.hashes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ips, domains, hashes);
    }

    @Override
    public String toString() {
        return "IocSet{ips=" + ips + ", domains=" + domains + ", hashes=" + hashes + '}';
    }
}

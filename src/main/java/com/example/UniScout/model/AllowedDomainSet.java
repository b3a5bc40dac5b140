package com.example.UniScout.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable, ordered set of allowed domain suffixes. Entries may be written as
 * {@code example.edu} or {@code *.example.edu}; both mean "this host or any subdomain".
 * The first entry is the primary domain used for site-restricted queries.
 */
public final class AllowedDomainSet {

    private final Set<String> domains;

    private AllowedDomainSet(Set<String> domains) {
        this.domains = Collections.unmodifiableSet(domains);
    }

    public static AllowedDomainSet of(Collection<String> rawDomains) {
        Set<String> normalized = new LinkedHashSet<>();
        if (rawDomains != null) {
            for (String raw : rawDomains) {
                String domain = normalize(raw);
                if (!domain.isEmpty()) {
                    normalized.add(domain);
                }
            }
        }
        return new AllowedDomainSet(normalized);
    }

    public static AllowedDomainSet of(String... rawDomains) {
        return of(java.util.Arrays.asList(rawDomains));
    }

    private static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String domain = raw.trim().toLowerCase(Locale.ROOT);
        if (domain.startsWith("*.")) {
            domain = domain.substring(2);
        }
        while (domain.startsWith(".")) {
            domain = domain.substring(1);
        }
        while (domain.endsWith(".")) {
            domain = domain.substring(0, domain.length() - 1);
        }
        return domain;
    }

    public Set<String> domains() {
        return domains;
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    /**
     * @return the first configured domain, or null when the set is empty
     */
    public String primary() {
        return domains.isEmpty() ? null : domains.iterator().next();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AllowedDomainSet other && domains.equals(other.domains);
    }

    @Override
    public int hashCode() {
        return domains.hashCode();
    }

    @Override
    public String toString() {
        return "AllowedDomainSet" + domains;
    }
}

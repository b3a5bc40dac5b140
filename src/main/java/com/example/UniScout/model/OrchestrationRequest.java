package com.example.UniScout.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inbound request for one orchestration call.
 *
 * @param query           user question
 * @param hints           optional origin hints
 * @param allowedDomains  optional override of the configured allowed domains
 * @param enabledBackends optional override of the configured backends
 * @param limits          optional per-backend result limits
 * @param depth           optional search depth ("basic" / "advanced")
 * @param mode            optional composition mode
 */
public record OrchestrationRequest(
        @NotBlank String query,
        QueryHints hints,
        List<String> allowedDomains,
        Set<BackendId> enabledBackends,
        Map<BackendId, Integer> limits,
        SearchDepth depth,
        CompositionMode mode
) {

    public static OrchestrationRequest of(String query) {
        return new OrchestrationRequest(query, null, null, null, null, null, null);
    }

    public AllowedDomainSet resolveAllowedDomains(Collection<String> defaultDomains) {
        return allowedDomains == null || allowedDomains.isEmpty()
                ? AllowedDomainSet.of(defaultDomains)
                : AllowedDomainSet.of(allowedDomains);
    }

    public Set<BackendId> resolveEnabledBackends(Collection<BackendId> defaultBackends) {
        Collection<BackendId> source = enabledBackends == null || enabledBackends.isEmpty()
                ? defaultBackends
                : enabledBackends;
        return source == null || source.isEmpty()
                ? EnumSet.noneOf(BackendId.class)
                : EnumSet.copyOf(source);
    }

    public int resolveLimit(BackendId backend, int defaultValue) {
        if (limits == null) {
            return defaultValue;
        }
        Integer limit = limits.get(backend);
        return limit == null || limit <= 0 ? defaultValue : limit;
    }

    public SearchDepth resolveDepth(SearchDepth defaultValue) {
        return depth == null ? defaultValue : depth;
    }

    public CompositionMode resolveMode(CompositionMode defaultValue) {
        return mode == null ? defaultValue : mode;
    }
}

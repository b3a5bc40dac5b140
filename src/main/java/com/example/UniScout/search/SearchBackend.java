package com.example.UniScout.search;

import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.SearchDepth;
import com.example.UniScout.model.SearchResult;

import java.util.List;

/**
 * A single external ranked-result provider. Implementations normalize the
 * provider's payload into {@link SearchResult} and never return null.
 */
public interface SearchBackend {

    BackendId id();

    /**
     * Whether the backend has everything it needs (credential, model, datasource).
     * Decided once at startup; an unconfigured backend is skipped, not failed.
     */
    boolean isConfigured();

    /**
     * Domain-scoped backends search the open web: the orchestrator runs a
     * site-restricted query plus an unrestricted one whose results are domain-filtered.
     */
    boolean domainScoped();

    /**
     * @throws BackendException when the remote call errors, times out or returns a malformed payload
     */
    List<SearchResult> search(String expression, int limit, SearchDepth depth);
}

package com.example.UniScout.search;

import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.SearchDepth;
import com.example.UniScout.model.SearchResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scriptable backend for orchestration tests; records every expression it receives.
 */
public class FakeSearchBackend implements SearchBackend {

    private final BackendId id;
    private final boolean configured;
    private final boolean domainScoped;
    private final Function<String, List<SearchResult>> responder;
    private final List<String> expressions = new CopyOnWriteArrayList<>();

    public FakeSearchBackend(BackendId id, boolean configured, boolean domainScoped,
                             Function<String, List<SearchResult>> responder) {
        this.id = id;
        this.configured = configured;
        this.domainScoped = domainScoped;
        this.responder = responder;
    }

    public static FakeSearchBackend returning(BackendId id, boolean domainScoped, List<SearchResult> results) {
        return new FakeSearchBackend(id, true, domainScoped, expression -> results);
    }

    public static FakeSearchBackend failing(BackendId id, boolean domainScoped) {
        return new FakeSearchBackend(id, true, domainScoped, expression -> {
            throw new BackendException(id, "HTTP 502");
        });
    }

    public static FakeSearchBackend unconfigured(BackendId id) {
        return new FakeSearchBackend(id, false, false, expression -> List.of());
    }

    @Override
    public BackendId id() {
        return id;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public boolean domainScoped() {
        return domainScoped;
    }

    @Override
    public List<SearchResult> search(String expression, int limit, SearchDepth depth) {
        expressions.add(expression);
        return responder.apply(expression);
    }

    public List<String> expressions() {
        return expressions;
    }

    public int calls() {
        return expressions.size();
    }
}

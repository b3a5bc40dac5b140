package com.example.UniScout.search;

import com.example.UniScout.model.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index of all known backends, built once at startup.
 * Availability never changes for the lifetime of the process.
 */
@Component
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<BackendId, SearchBackend> backends;

    public BackendRegistry(List<SearchBackend> definitions) {
        Map<BackendId, SearchBackend> tmp = new EnumMap<>(BackendId.class);
        for (SearchBackend backend : definitions) {
            if (tmp.putIfAbsent(backend.id(), backend) != null) {
                throw new IllegalStateException("Duplicate search backend for " + backend.id());
            }
            log.info("Search backend {} registered (configured={}, domainScoped={})",
                    backend.id(), backend.isConfigured(), backend.domainScoped());
        }
        this.backends = Collections.unmodifiableMap(tmp);
    }

    public Optional<SearchBackend> find(BackendId id) {
        return Optional.ofNullable(backends.get(id));
    }

    public boolean isAvailable(BackendId id) {
        SearchBackend backend = backends.get(id);
        return backend != null && backend.isConfigured();
    }
}

package com.example.UniScout.search;

import com.example.UniScout.model.BackendId;

public class BackendException extends RuntimeException {

    private final BackendId backend;

    public BackendException(BackendId backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendException(BackendId backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public BackendId getBackend() {
        return backend;
    }
}

package com.shiv.pdfredact.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class CancellationRegistry {

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(String runId) {
        CancellationToken token = new CancellationToken();
        if (tokens.putIfAbsent(runId, token) != null) {
            throw new IllegalStateException("Run already registered: " + runId);
        }
        return token;
    }

    public Optional<CancellationToken> find(String runId) {
        return Optional.ofNullable(tokens.get(runId));
    }

    public boolean cancel(String runId) {
        CancellationToken token = tokens.get(runId);
        if (token == null) return false;
        token.cancel();
        return true;
    }

    public void remove(String runId) {
        tokens.remove(runId);
    }
}

package com.demo.eligibility.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Read-only {@code application id -> record} table, loaded once per batch. */
public final class GroundTruthLookup {

    private static final GroundTruthLookup EMPTY = new GroundTruthLookup(Map.of());

    private final Map<String, GroundTruthRecord> byId;

    public GroundTruthLookup(Map<String, GroundTruthRecord> byId) {
        this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(byId));
    }

    public static GroundTruthLookup empty() {
        return EMPTY;
    }

    public Optional<GroundTruthRecord> find(String applicationId) {
        return Optional.ofNullable(applicationId == null ? null : byId.get(applicationId));
    }

    public int size() {
        return byId.size();
    }
}

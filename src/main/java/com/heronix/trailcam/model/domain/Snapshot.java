package com.heronix.trailcam.model.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of all known cameras as of one cycle.
 */
public record Snapshot(long cycleId, Instant publishedAt, Map<String, DeviceEntry> entries) {

    private static final Snapshot EMPTY = new Snapshot(0, null, Map.of());

    public Snapshot {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public Optional<DeviceEntry> get(String deviceId) {
        return Optional.ofNullable(entries.get(deviceId));
    }

    public int size() {
        return entries.size();
    }
}

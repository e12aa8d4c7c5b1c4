package com.devicesim.core.snapshot;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable projection of a device instance at one point of a simulation. Attributes are kept
 * sorted by path so the content hash does not depend on insertion order.
 */
public final class WorldSnapshot implements Serializable {

    private static final int HASH_LENGTH = 16;

    private final String deviceType;
    private final SortedMap<String, AttributeState> attributes;
    private final String stateHash;

    public WorldSnapshot(String deviceType, Map<String, AttributeState> attributes) {
        this.deviceType = Objects.requireNonNull(deviceType, "deviceType");
        this.attributes = Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
        this.stateHash = computeHash();
    }

    public String deviceType() {
        return deviceType;
    }

    public SortedMap<String, AttributeState> attributes() {
        return attributes;
    }

    public AttributeState state(String path) {
        var state = attributes.get(path);
        if (state == null) {
            throw new IllegalArgumentException("Snapshot of " + deviceType + " has no attribute " + path);
        }
        return state;
    }

    public boolean has(String path) {
        return attributes.containsKey(path);
    }

    public SnapshotValue value(String path) {
        return state(path).value();
    }

    /**
     * Copy with one attribute replaced.
     */
    public WorldSnapshot with(String path, AttributeState state) {
        var copy = new TreeMap<>(attributes);
        copy.put(path, state);
        return new WorldSnapshot(deviceType, copy);
    }

    /**
     * First 16 hex characters of a SHA-256 over the type and every sorted
     * {@code path:value:trend} entry.
     */
    public String stateHash() {
        return stateHash;
    }

    private String computeHash() {
        var canonical = new StringBuilder("type:").append(deviceType);
        attributes.forEach((path, state) -> canonical.append('|')
                .append(path).append(':')
                .append(token(state.value())).append(':')
                .append(state.trend().wireName()));
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String token(SnapshotValue value) {
        if (value instanceof SnapshotValue.ValueSet set) {
            return "[\"" + String.join("\",\"", set.values().stream().sorted().toList()) + "\"]";
        }
        return value.render();
    }

    /**
     * Whether any attribute is unknown or a value-set.
     */
    public boolean hasUncertainty() {
        return attributes.values().stream().anyMatch(s -> s.value().isUncertain());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorldSnapshot other)) return false;
        return deviceType.equals(other.deviceType) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceType, attributes);
    }

    @Override
    public String toString() {
        return "WorldSnapshot{" + deviceType + " " + stateHash + "}";
    }
}

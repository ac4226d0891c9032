package com.example.music2db;

import java.util.Locale;

/**
 * Decides whether a walk that finished with failed batch deliveries may still
 * advance the scan checkpoint.
 */
public enum CheckpointPolicy {
    /** Commit after every uninterrupted walk, even if some batches were rejected. */
    ALWAYS("always"),
    /** Commit only when every batch of the walk was accepted by the catalog. */
    ALL_BATCHES_DELIVERED("all-batches-delivered");

    private final String configValue;

    CheckpointPolicy(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public boolean allowsCommit(int failedBatches) {
        return this == ALWAYS || failedBatches == 0;
    }

    public static CheckpointPolicy fromConfig(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (CheckpointPolicy policy : values()) {
            if (policy.configValue.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown checkpointPolicy '" + raw
                + "', expected 'always' or 'all-batches-delivered'.");
    }
}

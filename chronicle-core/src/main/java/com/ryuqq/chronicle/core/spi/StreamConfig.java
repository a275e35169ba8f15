package com.ryuqq.chronicle.core.spi;

import java.util.List;

/**
 * Broker-level stream definition.
 *
 * <p>Event stores always create streams with {@code denyDelete} and {@code denyPurge} set,
 * making the log append-only at the stream-policy level.</p>
 *
 * @param name stream name
 * @param description free text (nullable)
 * @param subjects subject filters bound to the stream (may contain wildcards, at least one)
 * @param storage storage backend
 * @param replicas replica count (at least 1)
 * @param placementCluster cluster the replicas must be placed in (nullable)
 * @param denyDelete reject deletion of individual messages
 * @param denyPurge reject purging of the stream
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public record StreamConfig(
    String name,
    String description,
    List<String> subjects,
    StorageType storage,
    int replicas,
    String placementCluster,
    boolean denyDelete,
    boolean denyPurge
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if name is invalid, subjects are empty or replicas is not positive
     */
    public StreamConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (name.contains(".") || name.contains("*") || name.contains(">") || name.contains(" ")) {
            throw new IllegalArgumentException("name cannot contain '.', '*', '>' or spaces: " + name);
        }
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("subjects cannot be null or empty");
        }
        subjects = List.copyOf(subjects);
        if (storage == null) {
            storage = StorageType.FILE;
        }
        if (replicas <= 0) {
            throw new IllegalArgumentException("replicas must be positive (current: " + replicas + ")");
        }
    }
}

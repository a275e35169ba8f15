package com.ryuqq.chronicle.core.spi;

/**
 * Storage backend of a stream.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public enum StorageType {
    FILE,
    MEMORY
}

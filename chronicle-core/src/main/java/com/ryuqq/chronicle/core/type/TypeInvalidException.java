package com.ryuqq.chronicle.core.type;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised while building a {@link TypeRegistry} when a descriptor cannot be registered.
 * No registry is created when this is thrown.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class TypeInvalidException extends ChronicleException {

    private final String typeName;

    public TypeInvalidException(String typeName, String reason) {
        super("type not valid: " + describe(typeName) + ": " + reason);
        this.typeName = typeName;
    }

    public TypeInvalidException(String typeName, String reason, Throwable cause) {
        super("type not valid: " + describe(typeName) + ": " + reason, cause);
        this.typeName = typeName;
    }

    /**
     * @return the offending name as supplied (may be null or blank)
     */
    public String typeName() {
        return typeName;
    }

    private static String describe(String typeName) {
        return typeName == null ? "<null>" : '"' + typeName + '"';
    }
}

package com.ryuqq.chronicle.core.type;

import com.ryuqq.chronicle.core.ChronicleException;

/**
 * Raised when a type name has no descriptor in the registry.
 *
 * @author Chronicle Team
 * @since 1.0.0
 */
public class TypeNotRegisteredException extends ChronicleException {

    private final String typeName;

    public TypeNotRegisteredException(String typeName) {
        super("type not registered: " + typeName);
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}

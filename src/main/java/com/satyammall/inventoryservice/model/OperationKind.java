package com.satyammall.inventoryservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a stock movement. The display name is also the value stored in the log.
 */
public enum OperationKind {
    ISSUE("Issue"),
    RECEIVE("Receive");

    private final String displayName;

    OperationKind(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static OperationKind fromDisplayName(String value) {
        for (OperationKind kind : values()) {
            if (kind.displayName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation kind: " + value);
    }
}

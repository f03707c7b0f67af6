package com.ptl.domain.model;

/**
 * Claim class on pool assets. Senior is paid first and capped in yield;
 * junior absorbs first loss and residual profit.
 */
public enum TrancheType {
    SENIOR("SENIOR"),
    JUNIOR("JUNIOR");

    private final String value;

    TrancheType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TrancheType fromValue(String value) {
        for (TrancheType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tranche: " + value);
    }

    public static boolean isValid(String value) {
        for (TrancheType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}

package com.ptl.domain.policy;

/**
 * Profit-split variant chosen when the pool is configured.
 */
public enum TranchesPolicyType {
    RISK_ADJUSTED("RISK_ADJUSTED"),
    FIXED_SENIOR_YIELD("FIXED_SENIOR_YIELD");

    private final String value;

    TranchesPolicyType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TranchesPolicyType fromValue(String value) {
        for (TranchesPolicyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tranches policy: " + value);
    }
}

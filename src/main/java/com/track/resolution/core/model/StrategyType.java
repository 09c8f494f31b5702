package com.track.resolution.core.model;

/**
 * Retrieval strategies, in escalation order.
 */
public enum StrategyType {
    DIRECT_SEARCH("direct"),
    ENGINE_FALLBACK("engine"),
    BROWSER_AUTOMATION("browser");

    private final String tag;

    StrategyType(String tag) {
        this.tag = tag;
    }

    /**
     * Short stable tag used in cache keys and audit records.
     */
    public String tag() {
        return tag;
    }

    public static StrategyType fromTag(String tag) {
        for (StrategyType type : values()) {
            if (type.tag.equalsIgnoreCase(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy tag: " + tag);
    }
}

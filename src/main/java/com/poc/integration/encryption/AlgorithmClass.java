package com.poc.integration.encryption;

/**
 * Encryption algorithm classes a search store field can be registered under.
 * Each class enables at most one query operator.
 */
public enum AlgorithmClass {
    EQUALITY("equality", true),
    PREFIX_PREVIEW("prefixPreview", true),
    SUFFIX_PREVIEW("suffixPreview", true),
    SUBSTRING_PREVIEW("substringPreview", true),
    UNINDEXED(null, false);

    private final String queryType;
    private final boolean queryable;

    AlgorithmClass(String queryType, boolean queryable) {
        this.queryType = queryType;
        this.queryable = queryable;
    }

    /**
     * The queryType name used in the store's encrypted fields map, or null for UNINDEXED.
     */
    public String getQueryType() {
        return queryType;
    }

    public boolean isQueryable() {
        return queryable;
    }

    public boolean isPreview() {
        return this == PREFIX_PREVIEW || this == SUFFIX_PREVIEW || this == SUBSTRING_PREVIEW;
    }
}

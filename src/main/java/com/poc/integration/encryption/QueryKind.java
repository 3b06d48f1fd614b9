package com.poc.integration.encryption;

/**
 * Query operators a caller can request against an encrypted field.
 */
public enum QueryKind {
    EQUALITY(AlgorithmClass.EQUALITY),
    PREFIX(AlgorithmClass.PREFIX_PREVIEW),
    SUFFIX(AlgorithmClass.SUFFIX_PREVIEW),
    SUBSTRING(AlgorithmClass.SUBSTRING_PREVIEW);

    private final AlgorithmClass requiredAlgorithm;

    QueryKind(AlgorithmClass requiredAlgorithm) {
        this.requiredAlgorithm = requiredAlgorithm;
    }

    /**
     * The algorithm class a field must be registered under to accept this operator.
     */
    public AlgorithmClass getRequiredAlgorithm() {
        return requiredAlgorithm;
    }

    public static QueryKind forAlgorithm(AlgorithmClass algorithm) {
        for (QueryKind kind : values()) {
            if (kind.requiredAlgorithm == algorithm) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Algorithm " + algorithm + " does not support queries");
    }
}

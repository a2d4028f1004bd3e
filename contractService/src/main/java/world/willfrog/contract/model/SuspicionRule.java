package world.willfrog.contract.model;

public enum SuspicionRule {
    /** Most recent memory was high confidence and the tracked value changed. */
    CONFIDENCE_CONSISTENCY,
    /** The context suggested the prior value, the response went elsewhere. */
    CONTEXT_CONTRADICTION,
    /** The last pattern history entries all agreed with the prior value. */
    PATTERN_BREAK
}

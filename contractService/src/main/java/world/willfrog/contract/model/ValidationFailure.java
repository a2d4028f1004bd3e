package world.willfrog.contract.model;

public enum ValidationFailure {
    NONE,
    UNPARSEABLE_RESPONSE,
    MISSING_REQUIRED_FIELDS,
    PII_DETECTED,
    MISSING_COMPLIANCE_TAGS,
    UNAUTHORIZED_TOOL,
    DECISION_CHANGED,
    TEMPERATURE_OUT_OF_RANGE,
    RESPONSE_TIME_EXCEEDED,
    INVALID_CONFIDENCE_LEVEL,
    INVALID_BEHAVIOR_VALUE
}

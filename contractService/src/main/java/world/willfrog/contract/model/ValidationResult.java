package world.willfrog.contract.model;

/**
 * Outcome of validating one response. A rejected result always carries a non-blank reason.
 */
public record ValidationResult(boolean accepted, ValidationFailure failure, String reason) {

    private static final ValidationResult ACCEPTED = new ValidationResult(true, ValidationFailure.NONE, "");

    public static ValidationResult ok() {
        return ACCEPTED;
    }

    public static ValidationResult rejected(ValidationFailure failure, String reason) {
        return new ValidationResult(false, failure, reason == null || reason.isBlank() ? failure.name().toLowerCase() : reason);
    }
}

package world.willfrog.contract.model;

/**
 * Names the response field whose value is tracked for drift.
 */
public record BehaviorSignature(String key) {

    public static final String DEFAULT_KEY = "decision";

    public static BehaviorSignature defaults() {
        return new BehaviorSignature(DEFAULT_KEY);
    }

    public String keyOrDefault() {
        return key == null || key.isBlank() ? DEFAULT_KEY : key.trim();
    }
}

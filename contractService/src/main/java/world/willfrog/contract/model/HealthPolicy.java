package world.willfrog.contract.model;

public record HealthPolicy(int maxStrikes, long strikeWindowSeconds) {

    public static final int DEFAULT_MAX_STRIKES = 3;
    public static final long DEFAULT_STRIKE_WINDOW_SECONDS = 3600L;

    public static HealthPolicy defaults() {
        return new HealthPolicy(DEFAULT_MAX_STRIKES, DEFAULT_STRIKE_WINDOW_SECONDS);
    }

    public void validate() {
        if (maxStrikes <= 0) {
            throw new ContractSpecException("health.max_strikes must be positive: " + maxStrikes);
        }
        if (strikeWindowSeconds <= 0) {
            throw new ContractSpecException("health.strike_window_seconds must be positive: " + strikeWindowSeconds);
        }
    }
}

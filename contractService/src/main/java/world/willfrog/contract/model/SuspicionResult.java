package world.willfrog.contract.model;

public record SuspicionResult(boolean suspicious, SuspicionRule rule, String reason) {

    private static final SuspicionResult CLEAR = new SuspicionResult(false, null, "");

    public static SuspicionResult clear() {
        return CLEAR;
    }

    public static SuspicionResult flagged(SuspicionRule rule, String reason) {
        return new SuspicionResult(true, rule, reason);
    }
}

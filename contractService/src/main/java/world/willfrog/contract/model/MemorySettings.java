package world.willfrog.contract.model;

/**
 * Describes how the agent consumes prior analyses. Informational only; the enforcer reads
 * memory from the call request regardless of these settings.
 */
public record MemorySettings(boolean enabled, String format, String usage, boolean required, String description) {

    public static MemorySettings defaults() {
        return new MemorySettings(false, "string", "prompt-append", false, "");
    }
}

package world.willfrog.contract.model;

import java.util.Locale;
import java.util.Optional;

public enum EscalationReason {
    UNEXPECTED_OUTPUT,
    INVALID_RESPONSE,
    CONTEXT_MISMATCH;

    /**
     * Wire name as used in contract documents, e.g. {@code unexpected_output}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EscalationReason> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("ON_")) {
            normalized = normalized.substring(3);
        }
        for (EscalationReason reason : values()) {
            if (reason.name().equals(normalized)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}

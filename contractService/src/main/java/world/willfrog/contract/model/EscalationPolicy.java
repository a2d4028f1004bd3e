package world.willfrog.contract.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record EscalationPolicy(Map<EscalationReason, String> actions, String fallbackRole) {

    public static final String DEFAULT_ACTION = "fallback";

    public EscalationPolicy {
        EnumMap<EscalationReason, String> copy = new EnumMap<>(EscalationReason.class);
        if (actions != null) {
            copy.putAll(actions);
        }
        actions = Collections.unmodifiableMap(copy);
    }

    public static EscalationPolicy defaults() {
        return new EscalationPolicy(Map.of(), null);
    }

    public String actionFor(EscalationReason reason) {
        String action = reason == null ? null : actions.get(reason);
        return action == null || action.isBlank() ? DEFAULT_ACTION : action;
    }
}

package world.willfrog.contract.model;

import lombok.Builder;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments of one wrapped agent invocation. The enforcer reads {@code context}, or the
 * top-level {@code memory} / {@code indicators} keyword arguments, to build the drift-check context.
 */
@Builder(toBuilder = true)
public record AgentCallRequest(@Singular("arg") List<Object> args,
                               @Singular("kwarg") Map<String, Object> kwargs,
                               Map<String, Object> context) {

    public static final String KEY_CONTEXT = "context";
    public static final String KEY_MEMORY = "memory";
    public static final String KEY_INDICATORS = "indicators";
    public static final String KEY_PATTERN_HISTORY = "pattern_history";
    public static final String KEY_CONTEXT_SUGGESTION = "context_suggestion";

    public AgentCallRequest {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    /**
     * Context used by the drift check: the explicit context (or a {@code context} kwarg) with
     * top-level {@code memory} and {@code indicators} kwargs filled in where it lacks them.
     * {@code indicators} is not read by the enforcer; it is carried so agent adapters receive the
     * same context the checks saw.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> resolveContext() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (context != null) {
            resolved.putAll(context);
        } else if (kwargs.get(KEY_CONTEXT) instanceof Map<?, ?> fromKwargs) {
            resolved.putAll((Map<String, Object>) fromKwargs);
        }
        if (!resolved.containsKey(KEY_MEMORY) && kwargs.containsKey(KEY_MEMORY)) {
            resolved.put(KEY_MEMORY, kwargs.get(KEY_MEMORY));
        }
        if (!resolved.containsKey(KEY_INDICATORS) && kwargs.containsKey(KEY_INDICATORS)) {
            resolved.put(KEY_INDICATORS, kwargs.get(KEY_INDICATORS));
        }
        return resolved;
    }
}

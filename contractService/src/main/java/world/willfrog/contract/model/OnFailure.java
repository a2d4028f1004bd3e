package world.willfrog.contract.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record OnFailure(int maxRetries, Map<String, Object> fallback) {

    public OnFailure {
        fallback = fallback == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fallback));
    }
}

package world.willfrog.contract.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ContractEvent(OffsetDateTime timestamp,
                            @JsonProperty("event_type") String eventType,
                            @JsonProperty("contract_version") String contractVersion,
                            String role,
                            Map<String, Object> data) {

    public static final String TYPE_ESCALATION = "escalation";
    public static final String TYPE_HEALTH_CHECK = "health_check";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_PERFORMANCE_WARNING = "performance_warning";
    public static final String TYPE_VALIDATION_FAILED = "validation_failed";

    public ContractEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}

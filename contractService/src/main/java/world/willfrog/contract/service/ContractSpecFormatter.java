package world.willfrog.contract.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.contract.model.ContractSpecException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders loose contract data as a normalized contract JSON document with typed values and
 * defaults filled in. Only the header, memory, policy and behavioral flag sections are emitted.
 */
@Component
@RequiredArgsConstructor
public class ContractSpecFormatter {

    private final ObjectMapper objectMapper;

    public String generate(Map<String, ?> specData) {
        Map<String, ?> data = specData == null ? Map.of() : specData;
        Map<String, Object> formatted = new LinkedHashMap<>();
        formatted.put("version", String.valueOf(valueOr(data, "version", "1.1")));
        formatted.put("description", valueOr(data, "description", ""));
        formatted.put("role", valueOr(data, "role", ""));

        Map<String, ?> memory = section(data, "memory");
        Map<String, Object> memoryOut = new LinkedHashMap<>();
        memoryOut.put("enabled", valueOr(memory, "enabled", false));
        memoryOut.put("format", valueOr(memory, "format", "string"));
        memoryOut.put("usage", valueOr(memory, "usage", "prompt-append"));
        memoryOut.put("required", valueOr(memory, "required", false));
        memoryOut.put("description", valueOr(memory, "description", ""));
        formatted.put("memory", memoryOut);

        if (data.containsKey("policy")) {
            Map<String, ?> policy = section(data, "policy");
            Map<String, Object> policyOut = new LinkedHashMap<>();
            policyOut.put("pii", valueOr(policy, "pii", false));
            policyOut.put("compliance_tags", valueOr(policy, "compliance_tags", List.of()));
            policyOut.put("allowed_tools", valueOr(policy, "allowed_tools", List.of()));
            formatted.put("policy", policyOut);
        }

        String flagsKey = data.containsKey("behavioral_flags") ? "behavioral_flags"
                : data.containsKey("behavioural_flags") ? "behavioural_flags" : null;
        if (flagsKey != null) {
            Map<String, ?> flags = section(data, flagsKey);
            Map<String, ?> temperature = section(flags, "temperature_control");
            Map<String, Object> temperatureOut = new LinkedHashMap<>();
            temperatureOut.put("mode", valueOr(temperature, "mode", "adaptive"));
            temperatureOut.put("range", valueOr(temperature, "range", List.of(0.2D, 0.6D)));
            Map<String, Object> flagsOut = new LinkedHashMap<>();
            flagsOut.put("conservatism", valueOr(flags, "conservatism", "moderate"));
            flagsOut.put("verbosity", valueOr(flags, "verbosity", "compact"));
            flagsOut.put("temperature_control", temperatureOut);
            formatted.put("behavioral_flags", flagsOut);
        }

        try {
            return objectMapper.writeValueAsString(formatted);
        } catch (JsonProcessingException e) {
            throw new ContractSpecException("Failed to render contract: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Re-renders an existing contract so that every value has its expected type.
     */
    public String format(Map<String, ?> contract) {
        return generate(contract);
    }

    @SuppressWarnings("unchecked")
    private Map<String, ?> section(Map<String, ?> data, String key) {
        Object value = data.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, ?>) map : Map.of();
    }

    private Object valueOr(Map<String, ?> data, String key, Object defaultValue) {
        Object value = data.get(key);
        return value == null ? defaultValue : value;
    }
}

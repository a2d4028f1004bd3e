package world.willfrog.contract.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw agent output into a canonical response map. Accepts maps as they are, and text
 * holding a JSON object, optionally wrapped in a markdown code fence.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseNormalizer {

    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> normalize(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return Optional.of(copy);
        }
        if (raw instanceof JsonNode node) {
            return node.isObject()
                    ? Optional.of(objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {}))
                    : Optional.empty();
        }
        if (!(raw instanceof CharSequence sequence)) {
            log.debug("Unsupported agent output type: {}", raw == null ? "null" : raw.getClass().getName());
            return Optional.empty();
        }
        return parseText(sequence.toString());
    }

    private Optional<Map<String, Object>> parseText(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (trimmed.startsWith(FENCE) && trimmed.endsWith(FENCE)) {
            String[] lines = trimmed.split("\n");
            if (lines.length > 2) {
                StringBuilder body = new StringBuilder();
                for (int i = 1; i < lines.length - 1; i++) {
                    body.append(lines[i]).append('\n');
                }
                return readObject(body.toString().replace(FENCE, "").trim());
            }
        }
        return readObject(trimmed);
    }

    private Optional<Map<String, Object>> readObject(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {}));
        } catch (Exception e) {
            log.debug("Agent output is not a JSON object: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

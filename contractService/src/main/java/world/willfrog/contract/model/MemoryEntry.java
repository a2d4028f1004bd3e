package world.willfrog.contract.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One prior analysis of the agent, shaped as {@code {analysis: {<behavior_key>: value, confidence: value}}}.
 */
public record MemoryEntry(Map<String, Object> analysis) {

    public MemoryEntry {
        analysis = analysis == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(analysis));
    }

    public static MemoryEntry of(String behaviorKey, Object value, String confidence) {
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put(behaviorKey, value);
        analysis.put("confidence", confidence);
        return new MemoryEntry(analysis);
    }

    /**
     * Converts a raw memory list (maps carrying an {@code analysis} object, or {@link MemoryEntry}
     * instances) into entries, most recent first. Items of any other shape become empty entries so
     * that positions are preserved.
     */
    @SuppressWarnings("unchecked")
    public static List<MemoryEntry> fromRaw(Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            return List.of();
        }
        List<MemoryEntry> entries = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof MemoryEntry entry) {
                entries.add(entry);
            } else if (item instanceof Map<?, ?> map && map.get("analysis") instanceof Map<?, ?> analysis) {
                entries.add(new MemoryEntry((Map<String, Object>) analysis));
            } else {
                entries.add(new MemoryEntry(Map.of()));
            }
        }
        return entries;
    }
}

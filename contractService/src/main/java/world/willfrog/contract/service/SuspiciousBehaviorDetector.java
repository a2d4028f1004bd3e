package world.willfrog.contract.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.contract.model.AgentCallRequest;
import world.willfrog.contract.model.MemoryEntry;
import world.willfrog.contract.model.ResponseContract;
import world.willfrog.contract.model.SuspicionResult;
import world.willfrog.contract.model.SuspicionRule;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags high-confidence responses whose tracked value drifts from the most recent memory entry.
 * Only the current response and the supplied context are read; nothing is mutated.
 */
@Component
@Slf4j
public class SuspiciousBehaviorDetector {

    private static final String HIGH = "high";
    private static final int PATTERN_WINDOW = 3;

    public SuspicionResult isSuspicious(Map<String, Object> response,
                                        Map<String, Object> context,
                                        ResponseContract responseContract) {
        String behaviorKey = responseContract == null ? "decision" : responseContract.behaviorKey();
        if (response == null || context == null) {
            return SuspicionResult.clear();
        }
        List<MemoryEntry> memory = MemoryEntry.fromRaw(context.get(AgentCallRequest.KEY_MEMORY));
        if (memory.isEmpty()) {
            log.debug("No memory provided, skip drift check");
            return SuspicionResult.clear();
        }
        String current = text(response.get(behaviorKey));
        String currentConfidence = text(response.get(ResponseValidator.FIELD_CONFIDENCE));
        if (current.isEmpty() || !HIGH.equals(currentConfidence)) {
            log.debug("No high confidence {} in current response, skip drift check", behaviorKey);
            return SuspicionResult.clear();
        }

        Map<String, Object> latest = memory.get(0).analysis();
        String prior = text(latest.get(behaviorKey));
        String shownCurrent = String.valueOf(response.get(behaviorKey));
        String shownPrior = String.valueOf(latest.get(behaviorKey));
        String priorConfidence = text(latest.get(ResponseValidator.FIELD_CONFIDENCE));
        if (prior.isEmpty() || prior.equals(current)) {
            return SuspicionResult.clear();
        }

        if (HIGH.equals(priorConfidence)) {
            log.warn("Suspicious behavior: high confidence {} changed from {} to {}", behaviorKey, shownPrior, shownCurrent);
            return SuspicionResult.flagged(SuspicionRule.CONFIDENCE_CONSISTENCY,
                    "High confidence " + behaviorKey + " changed from " + shownPrior + " to " + shownCurrent);
        }

        String suggestion = text(context.get(AgentCallRequest.KEY_CONTEXT_SUGGESTION));
        if (!suggestion.isEmpty() && suggestion.equals(prior)) {
            log.warn("Suspicious behavior: {} {} contradicts context suggestion {}", behaviorKey, current, suggestion);
            return SuspicionResult.flagged(SuspicionRule.CONTEXT_CONTRADICTION,
                    "Response " + shownCurrent + " contradicts context suggestion " + context.get(AgentCallRequest.KEY_CONTEXT_SUGGESTION));
        }

        if (context.get(AgentCallRequest.KEY_PATTERN_HISTORY) instanceof List<?> history && !history.isEmpty()) {
            List<?> recent = history.subList(Math.max(0, history.size() - PATTERN_WINDOW), history.size());
            boolean unbroken = true;
            for (Object item : recent) {
                if (!prior.equals(text(item))) {
                    unbroken = false;
                    break;
                }
            }
            if (unbroken) {
                log.warn("Suspicious behavior: {} {} breaks established pattern {}", behaviorKey, current, recent);
                return SuspicionResult.flagged(SuspicionRule.PATTERN_BREAK,
                        "Response " + shownCurrent + " breaks from established pattern " + recent);
            }
        }

        log.info("{} changed from {} to {}, but not definitively suspicious", behaviorKey, shownPrior, shownCurrent);
        return SuspicionResult.clear();
    }

    private String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
    }
}

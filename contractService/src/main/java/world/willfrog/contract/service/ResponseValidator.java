package world.willfrog.contract.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.contract.model.ContractSpec;
import world.willfrog.contract.model.Policy;
import world.willfrog.contract.model.ResponseContract;
import world.willfrog.contract.model.TemperatureControl;
import world.willfrog.contract.model.ValidationFailure;
import world.willfrog.contract.model.ValidationResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural, policy and timing checks over one agent response.
 *
 * <p>Checks run in a fixed order and the first failure wins: required fields, PII, compliance
 * tags, allowed tools, inline decision regression, temperature range, response time, then the
 * optional confidence-level and allowed-value lists. The validator keeps no per-call state.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseValidator {

    public static final String FIELD_CONFIDENCE = "confidence";
    public static final String FIELD_COMPLIANCE_TAGS = "compliance_tags";
    public static final String FIELD_TOOLS = "tools";
    public static final String FIELD_TEMPERATURE_USED = "temperature_used";
    public static final String FIELD_REASONING = "reasoning";
    public static final String FIELD_SUMMARY = "summary";
    public static final String FIELD_FLAGGED_FOR_REVIEW = "flagged_for_review";
    public static final String FIELD_STRIKE_REASON = "strike_reason";
    public static final String PREVIOUS_PREFIX = "previous_";

    public static final String REASON_DECISION_CHANGED = "high confidence decision changed";

    private static final List<Pattern> PII_PATTERNS = List.of(
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
            Pattern.compile("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b"),
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b")
    );

    private final Clock clock;

    /**
     * @param response        normalized agent response
     * @param spec            contract the response is held to
     * @param startedAtMillis epoch millis when the agent call started; {@code <= 0} skips the time budget
     */
    public ValidationResult validate(Map<String, Object> response, ContractSpec spec, long startedAtMillis) {
        if (response == null) {
            return ValidationResult.rejected(ValidationFailure.UNPARSEABLE_RESPONSE, "unparseable response");
        }
        ResponseContract contract = spec.responseContract();
        Policy policy = spec.policy();
        String behaviorKey = contract.behaviorKey();

        List<String> missing = new ArrayList<>();
        for (String field : contract.requiredFields()) {
            if (!response.containsKey(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            return reject(ValidationFailure.MISSING_REQUIRED_FIELDS, "missing required fields: " + String.join(", ", missing));
        }

        if (!policy.piiAllowed() && containsPii(response)) {
            return reject(ValidationFailure.PII_DETECTED, "pii detected in response");
        }

        if (!policy.complianceTags().isEmpty()) {
            Set<String> present = asStrings(response.get(FIELD_COMPLIANCE_TAGS));
            if (!response.containsKey(FIELD_COMPLIANCE_TAGS) || !present.containsAll(policy.complianceTags())) {
                List<String> absent = new ArrayList<>();
                for (String tag : policy.complianceTags()) {
                    if (!present.contains(tag)) {
                        absent.add(tag);
                    }
                }
                return reject(ValidationFailure.MISSING_COMPLIANCE_TAGS, "missing compliance tags: " + String.join(", ", absent));
            }
        }

        if (response.containsKey(FIELD_TOOLS)) {
            List<String> unauthorized = new ArrayList<>();
            for (String tool : asStrings(response.get(FIELD_TOOLS))) {
                if (!policy.allowedTools().contains(tool)) {
                    unauthorized.add(tool);
                }
            }
            if (!unauthorized.isEmpty()) {
                return reject(ValidationFailure.UNAUTHORIZED_TOOL, "unauthorized tool used: " + String.join(", ", unauthorized));
            }
        }

        String previousKey = PREVIOUS_PREFIX + behaviorKey;
        if (response.containsKey(previousKey)
                && !Objects.equals(normalize(response.get(previousKey)), normalize(response.get(behaviorKey)))) {
            return reject(ValidationFailure.DECISION_CHANGED, REASON_DECISION_CHANGED);
        }

        if (response.containsKey(FIELD_TEMPERATURE_USED)) {
            TemperatureControl range = spec.temperatureControl();
            Object used = response.get(FIELD_TEMPERATURE_USED);
            if (!(used instanceof Number number) || !range.contains(number.doubleValue())) {
                return reject(ValidationFailure.TEMPERATURE_OUT_OF_RANGE,
                        "temperature out of range: " + used + " not in [" + range.min() + ", " + range.max() + "]");
            }
        }

        if (startedAtMillis > 0) {
            long elapsedMs = clock.millis() - startedAtMillis;
            if (elapsedMs > contract.maxResponseTimeMs()) {
                return reject(ValidationFailure.RESPONSE_TIME_EXCEEDED,
                        "response time exceeded (timeout after " + elapsedMs + "ms, budget " + contract.maxResponseTimeMs() + "ms)");
            }
        }

        if (!contract.confidenceLevels().isEmpty() && response.containsKey(FIELD_CONFIDENCE)
                && !containsIgnoreCase(contract.confidenceLevels(), response.get(FIELD_CONFIDENCE))) {
            return reject(ValidationFailure.INVALID_CONFIDENCE_LEVEL,
                    "invalid confidence level: " + response.get(FIELD_CONFIDENCE));
        }

        if (!contract.allowedValues().isEmpty() && response.containsKey(behaviorKey)
                && !containsIgnoreCase(contract.allowedValues(), response.get(behaviorKey))) {
            return reject(ValidationFailure.INVALID_BEHAVIOR_VALUE,
                    "invalid " + behaviorKey + " value: " + response.get(behaviorKey));
        }

        return ValidationResult.ok();
    }

    /**
     * Canonical substitute response. Callers merge it over the contract's configured fallback.
     */
    public Map<String, Object> fallbackResponse(String behaviorKey, String reason) {
        String detail = reason == null || reason.isBlank() ? "unknown error" : reason;
        Map<String, Object> fallback = new LinkedHashMap<>();
        fallback.put(behaviorKey == null || behaviorKey.isBlank() ? "decision" : behaviorKey, "unknown");
        fallback.put(FIELD_CONFIDENCE, "low");
        fallback.put(FIELD_SUMMARY, "Fallback due to error");
        fallback.put(FIELD_REASONING, "Fallback due to: " + detail);
        if (detail.contains("decision changed")) {
            fallback.put(FIELD_FLAGGED_FOR_REVIEW, true);
        }
        return fallback;
    }

    boolean containsPii(Map<String, Object> response) {
        String text = String.valueOf(response);
        for (Pattern pattern : PII_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private ValidationResult reject(ValidationFailure failure, String reason) {
        log.warn("Response validation failed: failure={}, reason={}", failure, reason);
        return ValidationResult.rejected(failure, reason);
    }

    private Set<String> asStrings(Object value) {
        Set<String> out = new LinkedHashSet<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null) {
                    out.add(String.valueOf(item));
                }
            }
        } else if (value instanceof Object[] array) {
            for (Object item : array) {
                if (item != null) {
                    out.add(String.valueOf(item));
                }
            }
        } else if (value != null) {
            out.add(String.valueOf(value));
        }
        return out;
    }

    private boolean containsIgnoreCase(List<String> allowed, Object value) {
        String candidate = normalize(value);
        for (String item : allowed) {
            if (normalize(item).equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    private String normalize(Object value) {
        return value == null ? "" : String.valueOf(value).trim().toLowerCase(Locale.ROOT);
    }
}

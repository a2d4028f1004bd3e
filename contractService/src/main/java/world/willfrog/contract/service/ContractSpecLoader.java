package world.willfrog.contract.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.contract.config.ContractProperties;
import world.willfrog.contract.model.BehaviorSignature;
import world.willfrog.contract.model.BehavioralFlags;
import world.willfrog.contract.model.ContractSpec;
import world.willfrog.contract.model.ContractSpecException;
import world.willfrog.contract.model.EscalationPolicy;
import world.willfrog.contract.model.EscalationReason;
import world.willfrog.contract.model.HealthPolicy;
import world.willfrog.contract.model.MemorySettings;
import world.willfrog.contract.model.OnFailure;
import world.willfrog.contract.model.Policy;
import world.willfrog.contract.model.ResponseContract;
import world.willfrog.contract.model.TemperatureControl;
import world.willfrog.contract.model.TemperatureMode;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads contract documents (snake_case JSON) into validated {@link ContractSpec} values.
 *
 * <p>Both the flat {@code response_contract} layout and the nested {@code output_format} layout
 * are accepted, as are the {@code behavioral_flags} and {@code behavioural_flags} spellings.
 * Unknown top-level fields and malformed values are rejected with a {@link ContractSpecException}
 * naming the offending field.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContractSpecLoader {

    private static final Set<String> TOP_LEVEL_FIELDS = Set.of(
            "version", "description", "role", "policy",
            "behavioral_flags", "behavioural_flags",
            "response_contract", "health", "escalation", "memory"
    );
    private static final Set<String> POLICY_FIELDS = Set.of("pii_allowed", "pii", "PII", "compliance_tags", "allowed_tools");
    private static final Set<String> FLAG_FIELDS = Set.of("conservatism", "verbosity", "temperature_control");
    private static final Set<String> TEMPERATURE_FIELDS = Set.of("mode", "range");
    private static final Set<String> OUTPUT_FORMAT_FIELDS = Set.of(
            "required_fields", "max_response_time_ms", "max_retries", "on_failure",
            "confidence_levels", "allowed_values", "allowed_decisions"
    );
    private static final Set<String> RESPONSE_CONTRACT_FIELDS = union(OUTPUT_FORMAT_FIELDS,
            Set.of("output_format", "behavior_signature", "behaviour_signature"));
    // action is the legacy per-contract failure action, superseded by escalation
    private static final Set<String> ON_FAILURE_FIELDS = Set.of("action", "max_retries", "fallback");
    private static final Set<String> SIGNATURE_FIELDS = Set.of("key", "expected_type");
    // strikes and status are runtime state some documents carry; they are ignored
    private static final Set<String> HEALTH_FIELDS = Set.of("max_strikes", "strike_window_seconds", "strikes", "status");
    private static final Set<String> MEMORY_FIELDS = Set.of("enabled", "format", "usage", "required", "description");

    private final ObjectMapper objectMapper;
    private final ContractProperties properties;

    private volatile ContractSpec preloaded;

    @PostConstruct
    public void load() {
        String file = properties.getSpecFile() == null ? "" : properties.getSpecFile().trim();
        if (file.isEmpty()) {
            log.info("contract.spec-file is empty, skip contract preloading");
            return;
        }
        Path path = Paths.get(file).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            log.info("Contract spec file not found, skip: {}", path);
            return;
        }
        this.preloaded = read(path);
        log.info("Loaded contract spec from {} (version={}, role={})", path, preloaded.version(), preloaded.role());
    }

    public Optional<ContractSpec> current() {
        return Optional.ofNullable(preloaded);
    }

    public ContractSpec read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (ContractSpecException e) {
            throw e;
        } catch (Exception e) {
            throw new ContractSpecException("Failed to read contract spec from " + path + ": " + e.getMessage(), e);
        }
    }

    public ContractSpec read(InputStream in) {
        try {
            return fromNode(objectMapper.readTree(in));
        } catch (ContractSpecException e) {
            throw e;
        } catch (Exception e) {
            throw new ContractSpecException("Contract spec is not valid JSON: " + e.getMessage(), e);
        }
    }

    public ContractSpec parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ContractSpecException("Contract spec document is empty");
        }
        try {
            return fromNode(objectMapper.readTree(json));
        } catch (ContractSpecException e) {
            throw e;
        } catch (Exception e) {
            throw new ContractSpecException("Contract spec is not valid JSON: " + e.getMessage(), e);
        }
    }

    public ContractSpec fromMap(Map<String, ?> raw) {
        if (raw == null) {
            throw new ContractSpecException("Contract spec is required");
        }
        return fromNode(objectMapper.valueToTree(raw));
    }

    public ContractSpec fromNode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ContractSpecException("Contract spec must be a JSON object");
        }
        rejectUnknown(root, TOP_LEVEL_FIELDS, "");
        JsonNode flags = root.has("behavioral_flags") ? root.get("behavioral_flags") : root.get("behavioural_flags");
        return ContractSpec.builder()
                .version(requiredText(root, "version", "version"))
                .description(root.path("description").asText(""))
                .role(requiredText(root, "role", "role"))
                .policy(readPolicy(requiredObject(root, "policy", "policy")))
                .behavioralFlags(readFlags(requireObject(flags, "behavioral_flags")))
                .responseContract(readResponseContract(requiredObject(root, "response_contract", "response_contract")))
                .health(readHealth(root.get("health")))
                .escalation(readEscalation(root.get("escalation")))
                .memory(readMemory(root.get("memory")))
                .build()
                .validate();
    }

    private Policy readPolicy(JsonNode node) {
        rejectUnknown(node, POLICY_FIELDS, "policy.");
        JsonNode pii = firstPresent(node, "pii_allowed", "pii", "PII");
        if (pii != null && !pii.isBoolean()) {
            throw new ContractSpecException("policy.pii_allowed must be a boolean");
        }
        return new Policy(
                pii != null && pii.asBoolean(),
                new LinkedHashSet<>(stringList(node.get("compliance_tags"), "policy.compliance_tags")),
                new LinkedHashSet<>(stringList(node.get("allowed_tools"), "policy.allowed_tools"))
        );
    }

    private BehavioralFlags readFlags(JsonNode node) {
        rejectUnknown(node, FLAG_FIELDS, "behavioral_flags.");
        JsonNode temperature = requiredObject(node, "temperature_control", "behavioral_flags.temperature_control");
        rejectUnknown(temperature, TEMPERATURE_FIELDS, "behavioral_flags.temperature_control.");
        JsonNode range = temperature.get("range");
        if (range == null || !range.isArray() || range.size() != 2
                || !range.get(0).isNumber() || !range.get(1).isNumber()) {
            throw new ContractSpecException("behavioral_flags.temperature_control.range must be [min, max]");
        }
        return new BehavioralFlags(
                node.path("conservatism").asText(null),
                node.path("verbosity").asText(null),
                new TemperatureControl(
                        TemperatureMode.parse(temperature.path("mode").asText(null)),
                        range.get(0).asDouble(),
                        range.get(1).asDouble()
                )
        );
    }

    private ResponseContract readResponseContract(JsonNode node) {
        rejectUnknown(node, RESPONSE_CONTRACT_FIELDS, "response_contract.");
        JsonNode format = node.has("output_format") ? requireObject(node.get("output_format"), "response_contract.output_format") : node;
        if (format != node) {
            rejectUnknown(format, OUTPUT_FORMAT_FIELDS, "response_contract.output_format.");
        }
        JsonNode onFailure = requiredObject(format, "on_failure", "response_contract.on_failure");
        rejectUnknown(onFailure, ON_FAILURE_FIELDS, "response_contract.on_failure.");

        JsonNode maxTime = firstPresent(format, "max_response_time_ms");
        if (maxTime == null) {
            maxTime = node.get("max_response_time_ms");
        }
        if (maxTime == null || !maxTime.isIntegralNumber()) {
            throw new ContractSpecException("response_contract.max_response_time_ms must be an integer");
        }

        JsonNode retries = firstPresent(onFailure, "max_retries");
        if (retries == null) {
            retries = format.get("max_retries");
        }
        if (retries != null && !retries.isIntegralNumber()) {
            throw new ContractSpecException("response_contract.on_failure.max_retries must be an integer");
        }

        JsonNode fallback = onFailure.get("fallback");
        if (fallback == null || !fallback.isObject()) {
            throw new ContractSpecException("response_contract.on_failure.fallback must be an object");
        }
        Map<String, Object> fallbackValues = new LinkedHashMap<>();
        fallback.fields().forEachRemaining(entry ->
                fallbackValues.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class)));

        JsonNode signature = firstPresent(node, "behavior_signature", "behaviour_signature");
        if (signature != null && signature.isObject()) {
            rejectUnknown(signature, SIGNATURE_FIELDS, "response_contract.behavior_signature.");
        }
        BehaviorSignature behaviorSignature = signature != null && signature.isObject()
                ? new BehaviorSignature(signature.path("key").asText(BehaviorSignature.DEFAULT_KEY))
                : BehaviorSignature.defaults();

        JsonNode allowedValues = firstPresent(format, "allowed_values", "allowed_decisions");
        return ResponseContract.builder()
                .requiredFields(stringList(format.get("required_fields"), "response_contract.required_fields"))
                .maxResponseTimeMs(maxTime.asLong())
                .onFailure(new OnFailure(retries == null ? 1 : retries.asInt(), fallbackValues))
                .behaviorSignature(behaviorSignature)
                .confidenceLevels(stringList(format.get("confidence_levels"), "response_contract.confidence_levels"))
                .allowedValues(stringList(allowedValues, "response_contract.allowed_values"))
                .build();
    }

    private HealthPolicy readHealth(JsonNode node) {
        if (node == null || node.isNull()) {
            return HealthPolicy.defaults();
        }
        requireObject(node, "health");
        rejectUnknown(node, HEALTH_FIELDS, "health.");
        JsonNode maxStrikes = node.get("max_strikes");
        JsonNode window = node.get("strike_window_seconds");
        if (maxStrikes != null && !maxStrikes.isIntegralNumber()) {
            throw new ContractSpecException("health.max_strikes must be an integer");
        }
        if (window != null && !window.isIntegralNumber()) {
            throw new ContractSpecException("health.strike_window_seconds must be an integer");
        }
        return new HealthPolicy(
                maxStrikes == null ? HealthPolicy.DEFAULT_MAX_STRIKES : maxStrikes.asInt(),
                window == null ? HealthPolicy.DEFAULT_STRIKE_WINDOW_SECONDS : window.asLong()
        );
    }

    private EscalationPolicy readEscalation(JsonNode node) {
        if (node == null || node.isNull()) {
            return EscalationPolicy.defaults();
        }
        requireObject(node, "escalation");
        Map<EscalationReason, String> actions = new EnumMap<>(EscalationReason.class);
        node.fields().forEachRemaining(entry -> {
            if ("fallback_role".equals(entry.getKey())) {
                return;
            }
            Optional<EscalationReason> reason = entry.getKey().startsWith("on_")
                    ? EscalationReason.fromKey(entry.getKey())
                    : Optional.empty();
            if (reason.isEmpty()) {
                throw new ContractSpecException("Unknown contract field: escalation." + entry.getKey());
            }
            actions.put(reason.get(), entry.getValue().asText());
        });
        JsonNode fallbackRole = node.get("fallback_role");
        return new EscalationPolicy(actions, fallbackRole == null || fallbackRole.isNull() ? null : fallbackRole.asText());
    }

    private MemorySettings readMemory(JsonNode node) {
        if (node == null || !node.isObject()) {
            return MemorySettings.defaults();
        }
        rejectUnknown(node, MEMORY_FIELDS, "memory.");
        MemorySettings defaults = MemorySettings.defaults();
        return new MemorySettings(
                node.path("enabled").asBoolean(defaults.enabled()),
                node.path("format").asText(defaults.format()),
                node.path("usage").asText(defaults.usage()),
                node.path("required").asBoolean(defaults.required()),
                node.path("description").asText(defaults.description())
        );
    }

    private void rejectUnknown(JsonNode node, Set<String> allowed, String prefix) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw new ContractSpecException("Unknown contract field: " + prefix + name);
            }
        }
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> all = new LinkedHashSet<>(first);
        all.addAll(second);
        return Set.copyOf(all);
    }

    private List<String> stringList(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ContractSpecException(field + " must be a list of strings");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ContractSpecException(field + " must be a list of strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    private String requiredText(JsonNode node, String name, String field) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new ContractSpecException("Contract " + field + " is required");
        }
        return value.asText();
    }

    private JsonNode requiredObject(JsonNode node, String name, String field) {
        return requireObject(node.get(name), field);
    }

    private JsonNode requireObject(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            throw new ContractSpecException("Contract " + field + " is required and must be an object");
        }
        return node;
    }

    private JsonNode firstPresent(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }
}

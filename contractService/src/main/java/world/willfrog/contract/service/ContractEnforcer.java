package world.willfrog.contract.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import world.willfrog.contract.agent.AgentCall;
import world.willfrog.contract.model.AgentCallRequest;
import world.willfrog.contract.model.ContractEvent;
import world.willfrog.contract.model.ContractSpec;
import world.willfrog.contract.model.EscalationReason;
import world.willfrog.contract.model.SuspicionResult;
import world.willfrog.contract.model.ValidationFailure;
import world.willfrog.contract.model.ValidationResult;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Enforces one behavioral contract around calls to a wrapped agent.
 *
 * <p>The enforcer owns the contract's {@link HealthMonitor} and {@link TemperatureController};
 * both persist across calls and are shared by concurrent callers. Every call returns exactly one
 * response map holding all required fields, either the validated agent output or a fallback.
 * Nothing thrown by the agent, the validators or the event sink escapes {@link #enforce}, errors
 * included; only {@link OutOfMemoryError} is rethrown.</p>
 */
@Slf4j
public class ContractEnforcer {

    public static final String REASON_UNHEALTHY = "agent unhealthy";
    public static final String REASON_UNPARSEABLE = "unparseable response";
    public static final String STRIKE_SUSPICIOUS = "suspicious_behavior";

    private final ContractSpec spec;
    private final HealthMonitor healthMonitor;
    private final TemperatureController temperatureController;
    private final ResponseNormalizer normalizer;
    private final ResponseValidator validator;
    private final SuspiciousBehaviorDetector detector;
    private final EscalationHandler escalationHandler;
    private final Clock clock;
    private final boolean suspiciousCountsAsStrike;
    private final boolean performanceWarningEnabled;

    private final Timer enforceTimer;
    private final Counter fallbackCounter;
    private final Counter flaggedCounter;

    public ContractEnforcer(ContractSpec spec,
                            HealthMonitor healthMonitor,
                            TemperatureController temperatureController,
                            ResponseNormalizer normalizer,
                            ResponseValidator validator,
                            SuspiciousBehaviorDetector detector,
                            EscalationHandler escalationHandler,
                            Clock clock,
                            MeterRegistry meterRegistry,
                            boolean suspiciousCountsAsStrike,
                            boolean performanceWarningEnabled) {
        this.spec = spec;
        this.healthMonitor = healthMonitor;
        this.temperatureController = temperatureController;
        this.normalizer = normalizer;
        this.validator = validator;
        this.detector = detector;
        this.escalationHandler = escalationHandler;
        this.clock = clock;
        this.suspiciousCountsAsStrike = suspiciousCountsAsStrike;
        this.performanceWarningEnabled = performanceWarningEnabled;
        this.enforceTimer = Timer.builder("contract.enforce.duration")
                .description("Contract enforcement duration, agent calls included")
                .tag("role", spec.role())
                .register(meterRegistry);
        this.fallbackCounter = Counter.builder("contract.enforce.fallback")
                .description("Calls answered with a fallback response")
                .tag("role", spec.role())
                .register(meterRegistry);
        this.flaggedCounter = Counter.builder("contract.enforce.flagged")
                .description("Responses flagged for review")
                .tag("role", spec.role())
                .register(meterRegistry);
        log.info("ContractEnforcer initialized: version={}, role={}, maxRetries={}, temperatureMode={}",
                spec.version(), spec.role(), spec.responseContract().onFailure().maxRetries(), temperatureController.mode());
    }

    /**
     * Binds this enforcer to an agent, yielding the wrapped callable.
     */
    public Function<AgentCallRequest, Map<String, Object>> wrap(AgentCall agentCall) {
        return request -> enforce(agentCall, request);
    }

    public Map<String, Object> enforce(AgentCall agentCall, AgentCallRequest request) {
        long startedAt = clock.millis();
        try {
            return doEnforce(agentCall, request == null ? AgentCallRequest.builder().build() : request, startedAt);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Unexpected error while enforcing contract: role={}", spec.role(), e);
            return fallback("unexpected error: " + errorText(e));
        } finally {
            enforceTimer.record(clock.millis() - startedAt, TimeUnit.MILLISECONDS);
        }
    }

    private Map<String, Object> doEnforce(AgentCall agentCall, AgentCallRequest request, long startedAt) {
        if (!healthMonitor.isHealthy()) {
            log.warn("Agent is unhealthy, using fallback response: role={}, strikes={}", spec.role(), healthMonitor.strikeCount());
            escalationHandler.emit(ContractEvent.TYPE_HEALTH_CHECK, mapOf(
                    "status", healthMonitor.status().name().toLowerCase(),
                    "action", "fallback"
            ));
            return fallback(REASON_UNHEALTHY);
        }

        int maxRetries = spec.responseContract().onFailure().maxRetries();
        String lastFailure = "no attempt made";
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            double temperature = temperatureController.getTemperature();
            log.info("Attempt {} of {}: role={}, temperature={}", attempt + 1, maxRetries + 1, spec.role(), temperature);

            long attemptStartedAt = clock.millis();
            Object raw;
            try {
                raw = agentCall.call(request, agentCall.acceptsTemperature() ? temperature : null);
            } catch (OutOfMemoryError e) {
                throw e;
            } catch (Throwable e) {
                String err = errorText(e);
                log.warn("Agent call failed: role={}, attempt={}, err={}", spec.role(), attempt + 1, err);
                escalationHandler.emit(ContractEvent.TYPE_ERROR, mapOf("error", err, "attempt", attempt + 1));
                temperatureController.adjust(false);
                healthMonitor.addStrike(err);
                lastFailure = "agent call error: " + err;
                continue;
            }

            Optional<Map<String, Object>> normalized = normalizer.normalize(raw);
            ValidationResult result = normalized
                    .map(response -> validator.validate(response, spec, attemptStartedAt))
                    .orElseGet(() -> ValidationResult.rejected(ValidationFailure.UNPARSEABLE_RESPONSE, REASON_UNPARSEABLE));
            if (!result.accepted()) {
                temperatureController.adjust(false);
                healthMonitor.addStrike(result.reason());
                escalationHandler.emit(ContractEvent.TYPE_VALIDATION_FAILED, mapOf(
                        "failure", result.failure().name().toLowerCase(),
                        "reason", result.reason(),
                        "attempt", attempt + 1
                ));
                lastFailure = result.reason();
                if (attempt < maxRetries) {
                    continue;
                }
                escalationHandler.escalate(EscalationReason.UNEXPECTED_OUTPUT, result.reason());
                return fallback(result.reason());
            }

            Map<String, Object> response = normalized.get();
            SuspicionResult suspicion = detector.isSuspicious(response, request.resolveContext(), spec.responseContract());
            if (suspicion.suspicious()) {
                response.put(ResponseValidator.FIELD_FLAGGED_FOR_REVIEW, true);
                response.put(ResponseValidator.FIELD_STRIKE_REASON, suspicion.reason());
                flaggedCounter.increment();
                if (suspiciousCountsAsStrike) {
                    healthMonitor.addStrike(STRIKE_SUSPICIOUS);
                }
                escalationHandler.escalate(EscalationReason.UNEXPECTED_OUTPUT, suspicion.reason());
            }

            temperatureController.adjust(true);
            long totalMs = clock.millis() - startedAt;
            if (performanceWarningEnabled && totalMs > spec.responseContract().maxResponseTimeMs()) {
                log.warn("Enforced call exceeded response budget across attempts: {}ms > {}ms",
                        totalMs, spec.responseContract().maxResponseTimeMs());
                escalationHandler.emit(ContractEvent.TYPE_PERFORMANCE_WARNING, mapOf(
                        "response_time_ms", totalMs,
                        "threshold_ms", spec.responseContract().maxResponseTimeMs()
                ));
            }
            return response;
        }

        log.warn("All {} attempts failed, escalating to fallback: role={}", maxRetries + 1, spec.role());
        escalationHandler.escalate(EscalationReason.UNEXPECTED_OUTPUT, lastFailure);
        return fallback(lastFailure);
    }

    /**
     * Configured fallback defaults overlaid with the canonical fallback fields; every required
     * field is present in the result.
     */
    Map<String, Object> fallback(String reason) {
        fallbackCounter.increment();
        Map<String, Object> response = new LinkedHashMap<>(spec.responseContract().onFailure().fallback());
        Map<String, Object> canonical = validator.fallbackResponse(spec.behaviorKey(), reason);
        canonical.forEach((key, value) -> {
            if (ResponseValidator.FIELD_SUMMARY.equals(key)) {
                response.putIfAbsent(key, value);
            } else {
                response.put(key, value);
            }
        });
        response.putIfAbsent(ResponseValidator.FIELD_FLAGGED_FOR_REVIEW, false);
        response.putIfAbsent(ResponseValidator.FIELD_STRIKE_REASON, null);
        for (String field : spec.responseContract().requiredFields()) {
            response.putIfAbsent(field, null);
        }
        return response;
    }

    public ContractSpec spec() {
        return spec;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public TemperatureController temperatureController() {
        return temperatureController;
    }

    private String errorText(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private Map<String, Object> mapOf(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            map.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return map;
    }
}

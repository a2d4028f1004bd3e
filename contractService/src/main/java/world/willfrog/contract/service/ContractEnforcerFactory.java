package world.willfrog.contract.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.contract.config.ContractProperties;
import world.willfrog.contract.model.ContractSpec;

import java.time.Clock;

/**
 * Creates one {@link ContractEnforcer} per contract. Each enforcer gets its own health monitor and
 * temperature controller; validation and drift detection are shared.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContractEnforcerFactory {

    private final ResponseNormalizer normalizer;
    private final ResponseValidator validator;
    private final SuspiciousBehaviorDetector detector;
    private final ContractEventSink eventSink;
    private final ContractProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @throws world.willfrog.contract.model.ContractSpecException if the spec is malformed
     */
    public ContractEnforcer create(ContractSpec spec) {
        ContractSpec validated = spec.validate();
        ContractProperties.Enforcer enforcer = properties.getEnforcer();
        return new ContractEnforcer(
                validated,
                new HealthMonitor(validated.health(), clock),
                new TemperatureController(validated.temperatureControl(), properties.getTemperature().getStep()),
                normalizer,
                validator,
                detector,
                new EscalationHandler(validated, eventSink, clock),
                clock,
                meterRegistry,
                enforcer.isSuspiciousCountsAsStrike(),
                enforcer.isPerformanceWarningEnabled()
        );
    }
}

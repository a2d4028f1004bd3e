package world.willfrog.contract.model;

import lombok.Builder;

/**
 * Declarative behavioral contract for one wrapped agent. Instances are immutable; call
 * {@link #validate()} before handing a spec to an enforcer.
 */
@Builder(toBuilder = true)
public record ContractSpec(String version,
                           String description,
                           String role,
                           Policy policy,
                           BehavioralFlags behavioralFlags,
                           ResponseContract responseContract,
                           HealthPolicy health,
                           EscalationPolicy escalation,
                           MemorySettings memory) {

    public ContractSpec {
        description = description == null ? "" : description;
        health = health == null ? HealthPolicy.defaults() : health;
        escalation = escalation == null ? EscalationPolicy.defaults() : escalation;
        memory = memory == null ? MemorySettings.defaults() : memory;
    }

    public ContractSpec validate() {
        if (version == null || version.isBlank()) {
            throw new ContractSpecException("Contract version is required");
        }
        if (role == null || role.isBlank()) {
            throw new ContractSpecException("Contract role is required");
        }
        if (policy == null) {
            throw new ContractSpecException("Contract policy is required");
        }
        if (behavioralFlags == null) {
            throw new ContractSpecException("Contract behavioral_flags is required");
        }
        behavioralFlags.validate();
        if (responseContract == null) {
            throw new ContractSpecException("Contract response_contract is required");
        }
        responseContract.validate();
        health.validate();
        return this;
    }

    public String behaviorKey() {
        return responseContract == null ? BehaviorSignature.DEFAULT_KEY : responseContract.behaviorKey();
    }

    public TemperatureControl temperatureControl() {
        return behavioralFlags == null ? null : behavioralFlags.temperatureControl();
    }
}

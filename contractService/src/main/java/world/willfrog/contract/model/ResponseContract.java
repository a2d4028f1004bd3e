package world.willfrog.contract.model;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record ResponseContract(List<String> requiredFields,
                               long maxResponseTimeMs,
                               OnFailure onFailure,
                               BehaviorSignature behaviorSignature,
                               List<String> confidenceLevels,
                               List<String> allowedValues) {

    public ResponseContract {
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        confidenceLevels = confidenceLevels == null ? List.of() : List.copyOf(confidenceLevels);
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public String behaviorKey() {
        return behaviorSignature == null ? BehaviorSignature.DEFAULT_KEY : behaviorSignature.keyOrDefault();
    }

    public void validate() {
        if (requiredFields.isEmpty()) {
            throw new ContractSpecException("response_contract.required_fields must not be empty");
        }
        for (String field : requiredFields) {
            if (field == null || field.isBlank()) {
                throw new ContractSpecException("response_contract.required_fields contains a blank entry");
            }
        }
        if (maxResponseTimeMs <= 0) {
            throw new ContractSpecException("response_contract.max_response_time_ms must be positive: " + maxResponseTimeMs);
        }
        if (onFailure == null) {
            throw new ContractSpecException("response_contract.on_failure is required");
        }
        if (onFailure.maxRetries() < 0) {
            throw new ContractSpecException("response_contract.on_failure.max_retries must not be negative: " + onFailure.maxRetries());
        }
    }
}

package world.willfrog.contract.model;

public record BehavioralFlags(String conservatism, String verbosity, TemperatureControl temperatureControl) {

    public void validate() {
        if (isBlank(conservatism)) {
            throw new ContractSpecException("behavioral_flags.conservatism is required");
        }
        if (isBlank(verbosity)) {
            throw new ContractSpecException("behavioral_flags.verbosity is required");
        }
        if (temperatureControl == null) {
            throw new ContractSpecException("behavioral_flags.temperature_control is required");
        }
        temperatureControl.validate();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}

package world.willfrog.contract.model;

/**
 * Sampling temperature policy. The range is inclusive and must satisfy {@code 0 <= min < max <= 1}.
 */
public record TemperatureControl(TemperatureMode mode, double min, double max) {

    public void validate() {
        if (mode == null) {
            throw new ContractSpecException("behavioral_flags.temperature_control.mode is required");
        }
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new ContractSpecException("behavioral_flags.temperature_control.range must be numeric");
        }
        if (min < 0.0D || max > 1.0D) {
            throw new ContractSpecException("Temperature range must lie within [0, 1]: [" + min + ", " + max + "]");
        }
        if (min >= max) {
            throw new ContractSpecException("Temperature range min must be less than max: [" + min + ", " + max + "]");
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    public double midpoint() {
        return (min + max) / 2.0D;
    }
}

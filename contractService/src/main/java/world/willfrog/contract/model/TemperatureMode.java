package world.willfrog.contract.model;

import java.util.Locale;

public enum TemperatureMode {
    FIXED,
    ADAPTIVE;

    public static TemperatureMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ContractSpecException("behavioral_flags.temperature_control.mode is required");
        }
        try {
            return TemperatureMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ContractSpecException("Unsupported temperature mode: " + value, e);
        }
    }
}

package world.willfrog.contract.service;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.contract.model.TemperatureControl;
import world.willfrog.contract.model.TemperatureMode;

/**
 * Tracks the sampling temperature handed to the agent. Successful calls cool the value toward the
 * range minimum, failures heat it toward the maximum; the value never leaves {@code [min, max]}.
 */
@Slf4j
public class TemperatureController {

    public static final double DEFAULT_STEP = 0.1D;

    private final TemperatureMode mode;
    private final double min;
    private final double max;
    private final double step;
    private final Object lock = new Object();

    private double current;

    public TemperatureController(TemperatureControl control) {
        this(control, DEFAULT_STEP);
    }

    public TemperatureController(TemperatureControl control, double step) {
        if (control == null) {
            throw new IllegalArgumentException("temperature control is required");
        }
        control.validate();
        if (!(step > 0.0D)) {
            throw new IllegalArgumentException("temperature step must be positive: " + step);
        }
        this.mode = control.mode();
        this.min = control.min();
        this.max = control.max();
        this.step = step;
        this.current = control.midpoint();
    }

    public double getTemperature() {
        synchronized (lock) {
            return current;
        }
    }

    public void adjust(boolean success) {
        if (mode == TemperatureMode.FIXED) {
            return;
        }
        synchronized (lock) {
            double previous = current;
            double next = success ? current - step : current + step;
            current = Math.max(min, Math.min(max, next));
            log.debug("Temperature adjusted: success={}, {} -> {}", success, previous, current);
        }
    }

    public TemperatureMode mode() {
        return mode;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }
}

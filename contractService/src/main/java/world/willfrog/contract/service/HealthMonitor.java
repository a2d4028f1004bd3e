package world.willfrog.contract.service;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.contract.model.HealthPolicy;
import world.willfrog.contract.model.HealthStatus;
import world.willfrog.contract.model.Strike;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Strike-based health tracking for one wrapped agent.
 *
 * <p>Status is re-evaluated only when a strike is added or the monitor is reset; strikes that
 * fall out of the window are pruned lazily on the next {@link #addStrike(String)}.</p>
 */
@Slf4j
public class HealthMonitor {

    private final int maxStrikes;
    private final Duration strikeWindow;
    private final Clock clock;
    private final Deque<Strike> strikes = new ArrayDeque<>();
    private final Object lock = new Object();

    private volatile HealthStatus status = HealthStatus.HEALTHY;

    public HealthMonitor(HealthPolicy policy, Clock clock) {
        HealthPolicy effective = policy == null ? HealthPolicy.defaults() : policy;
        effective.validate();
        this.maxStrikes = effective.maxStrikes();
        this.strikeWindow = Duration.ofSeconds(effective.strikeWindowSeconds());
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public HealthStatus addStrike(String reason) {
        synchronized (lock) {
            Instant now = clock.instant();
            strikes.addLast(new Strike(now, reason == null ? "" : reason));
            Instant cutoff = now.minus(strikeWindow);
            while (!strikes.isEmpty() && strikes.peekFirst().at().isBefore(cutoff)) {
                strikes.removeFirst();
            }
            HealthStatus previous = status;
            status = strikes.size() >= maxStrikes ? HealthStatus.UNHEALTHY : HealthStatus.HEALTHY;
            if (previous != status) {
                log.warn("Agent health changed: {} -> {} (strikes={}, maxStrikes={}, lastReason={})",
                        previous, status, strikes.size(), maxStrikes, reason);
            } else {
                log.info("Strike recorded: reason={}, strikes={}/{}", reason, strikes.size(), maxStrikes);
            }
            return status;
        }
    }

    public void reset() {
        synchronized (lock) {
            strikes.clear();
            if (status != HealthStatus.HEALTHY) {
                log.info("Agent health reset: {} -> {}", status, HealthStatus.HEALTHY);
            }
            status = HealthStatus.HEALTHY;
        }
    }

    public HealthStatus status() {
        return status;
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    public int strikeCount() {
        synchronized (lock) {
            return strikes.size();
        }
    }

    public List<Strike> strikes() {
        synchronized (lock) {
            return List.copyOf(strikes);
        }
    }
}

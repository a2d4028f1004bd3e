package world.willfrog.contract.model;

import java.time.Instant;

public record Strike(Instant at, String reason) {
}

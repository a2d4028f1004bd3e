package world.willfrog.contract.model;

public enum HealthStatus {
    HEALTHY,
    UNHEALTHY
}

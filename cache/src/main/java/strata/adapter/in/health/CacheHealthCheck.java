package strata.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import strata.core.service.CacheCoordinator;

/**
 * Health check for the two-tier cache.
 *
 * <p>Reports whether the remote tier is in use and how full the local tier is.
 *
 * <p>This health check always reports UP: while the remote tier is down, every
 * cache operation is served by the local tier, so the service stays usable.
 * Remote outages are visible through {@code remote.available} and the
 * {@code strata.cache.remote.available} gauge.
 */
@Readiness
@ApplicationScoped
public class CacheHealthCheck implements HealthCheck {

    private final CacheCoordinator coordinator;

    @Inject
    public CacheHealthCheck(CacheCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public HealthCheckResponse call() {
        final var status = coordinator.status();
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("cache");
        builder.withData("remote.available", status.remoteAvailable());
        builder.withData("local.size", status.localSize());
        builder.withData("local.capacity", status.localCapacity());
        return builder.up().build();
    }
}

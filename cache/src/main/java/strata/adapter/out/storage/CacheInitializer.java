package strata.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import strata.core.service.CacheCoordinator;

/**
 * Creates the cache on application startup so the remote connection is opened
 * before the first request.
 */
@ApplicationScoped
public class CacheInitializer {

    private static final Logger LOG = Logger.getLogger(CacheInitializer.class);

    private final CacheCoordinator coordinator;

    @Inject
    public CacheInitializer(CacheCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    void onStart(@Observes StartupEvent event) {
        final var status = coordinator.status();
        LOG.infof(
                "Cache initialized: localCapacity=%d, defaultTtl=%s",
                status.localCapacity(), coordinator.defaultTtl());
    }
}

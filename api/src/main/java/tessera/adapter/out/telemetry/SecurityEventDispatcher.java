package tessera.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import tessera.core.config.TelemetryConfig;
import tessera.core.port.out.SecurityEventPublisher;
import tessera.spi.SecurityEvent;
import tessera.spi.SecurityEventHandler;

/**
 * Publishes security events to the handlers registered under
 * {@code META-INF/services/tessera.spi.SecurityEventHandler}.
 *
 * <p>Handlers run in priority order (highest first) on a single background
 * thread, so publishing never blocks a login or refresh. A failing handler is
 * logged and does not stop the others.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityEventPublisher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final MeterRegistry meterRegistry;
    private final boolean enabled;

    private List<SecurityEventHandler> handlers;
    private ExecutorService executor;

    @Inject
    public SecurityEventDispatcher(TelemetryConfig config, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.enabled = config != null && config.security().enabled();
    }

    SecurityEventDispatcher(List<SecurityEventHandler> handlers, ExecutorService executor) {
        this.meterRegistry = null;
        this.enabled = true;
        this.handlers = sorted(handlers);
        this.executor = executor;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Security event publishing is disabled");
            return;
        }

        final var loaded = ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        for (var handler : loaded) {
            if (handler instanceof MetricsSecurityEventHandler metricsHandler) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }
        handlers = sorted(loaded);

        if (handlers.isEmpty()) {
            LOG.warn("No security event handlers found - events will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d security event handler(s): %s",
                    handlers.size(),
                    handlers.stream().map(SecurityEventHandler::name).toList());
        }

        executor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "security-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        if (handlers != null) {
            for (var handler : handlers) {
                try {
                    handler.close();
                } catch (RuntimeException e) {
                    LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
                }
            }
        }
    }

    @Override
    public void publish(SecurityEvent event) {
        if (!enabled || handlers == null || handlers.isEmpty()) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Dropped security event %s: dispatcher is shut down", event.getClass().getSimpleName());
        }
    }

    public List<SecurityEventHandler> getHandlers() {
        return handlers != null ? handlers : List.of();
    }

    private void deliver(SecurityEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf("Handler %s failed to process event: %s", handler.name(), e.getMessage());
            }
        }
    }

    private static List<SecurityEventHandler> sorted(List<SecurityEventHandler> handlers) {
        return handlers.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
    }
}

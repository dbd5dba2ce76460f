package com.agilab.goes_convert;

import com.agilab.goes_convert.worker.WorkerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Cancels in-flight workers when the application shuts down.
 * <p>
 * SIGINT and SIGTERM reach this through the JVM shutdown hook Spring Boot registers, which closes the context.
 * The watcher stop flag is owned by {@link MonitorService} and is set after this listener has run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShutdownCoordinator implements ApplicationListener<ContextClosedEvent> {

    private final WorkerRegistry registry;

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        onShutdownSignal();
    }

    public int onShutdownSignal() {
        log.info("Shutdown requested, stopping {} workers", registry.count());
        return registry.stopAll();
    }
}

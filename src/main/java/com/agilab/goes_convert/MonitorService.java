package com.agilab.goes_convert;

import com.agilab.goes_convert.config.SatelliteProperties;
import com.agilab.goes_convert.destination.Region;
import com.agilab.goes_convert.exception.PipelineExceptionHandler;
import com.agilab.goes_convert.exception.WatcherSetupException;
import com.agilab.goes_convert.gateway.CropGeometry;
import com.agilab.goes_convert.watch.FileWatcher;
import com.agilab.goes_convert.worker.WorkerRegistry;
import com.agilab.goes_convert.worker.WorkerTask;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Schedules the watcher's polls on a single {@code file-watcher} thread and turns every new file into a
 * registered {@link WorkerTask}.
 */
@Service
@Slf4j
public class MonitorService implements SmartLifecycle {

    static final Set<String> SUPPORTED_SATELLITES = Set.of("goeseast", "goeswest");

    private final SatelliteProperties properties;
    private final FileProcessingPipeline pipeline;
    private final WorkerRegistry registry;
    private final PipelineExceptionHandler exceptionHandler;
    private final TaskExecutor workerExecutor;

    private volatile FileWatcher watcher;
    private volatile ThreadPoolTaskScheduler watcherScheduler;
    private volatile ScheduledFuture<?> watchFuture;

    public MonitorService(SatelliteProperties properties,
                          FileProcessingPipeline pipeline,
                          WorkerRegistry registry,
                          PipelineExceptionHandler exceptionHandler,
                          TaskExecutor workerExecutor) {
        this.properties = properties;
        this.pipeline = pipeline;
        this.registry = registry;
        this.exceptionHandler = exceptionHandler;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void start() {
        log.debug("Configuration: {}", properties);
        FileWatcher fileWatcher;
        try {
            validateConfiguration();
            fileWatcher = new FileWatcher(Path.of(properties.getWatchDir()), properties.getPollingInterval(),
                    this::dispatch, properties.isReplayExisting());
            fileWatcher.open();
        } catch (WatcherSetupException e) {
            log.error("Can't run as not properly configured: {}", e.getMessage());
            throw e;
        }

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("file-watcher-");
        // a poll in flight finishes its dispatch before the scheduler goes away
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(properties.getPollingInterval().multipliedBy(2).toMillis() + 1000);
        scheduler.initialize();

        watcher = fileWatcher;
        watcherScheduler = scheduler;
        watchFuture = scheduler.scheduleWithFixedDelay(fileWatcher::pollAndDispatch, properties.getPollingInterval());
        log.info("Monitoring {} in '{}'", properties.getSatellite(), properties.getWatchDir());
    }

    @Override
    public void stop() {
        var currentWatcher = watcher;
        if (currentWatcher == null) {
            return;
        }
        currentWatcher.requestStop();
        watchFuture.cancel(false);
        watcherScheduler.shutdown();
        watchFuture = null;
        watcherScheduler = null;
        watcher = null;
        log.info("Watcher: BYE");
    }

    @Override
    public boolean isRunning() {
        return watcher != null;
    }

    /**
     * Registers a worker for {@code source} and hands it to the worker pool.
     */
    public WorkerTask dispatch(Path source) {
        log.debug("Start worker to process {}", source);
        var task = new WorkerTask(source, pipeline, registry, exceptionHandler);
        registry.add(task);
        try {
            workerExecutor.execute(task);
        } catch (TaskRejectedException e) {
            registry.remove(task);
            log.error("Worker pool rejected {}", source, e);
        }
        return task;
    }

    void validateConfiguration() {
        if (StringUtils.isBlank(properties.getSatellite())) {
            throw new WatcherSetupException("You must specify a satellite to watch");
        }
        if (!SUPPORTED_SATELLITES.contains(properties.getSatellite())) {
            throw new WatcherSetupException("Unsupported satellite '" + properties.getSatellite()
                    + "', expected one of " + SUPPORTED_SATELLITES);
        }
        if (StringUtils.isBlank(properties.getWatchDir())) {
            throw new WatcherSetupException("No watch directory configured");
        }
        if (StringUtils.isBlank(properties.getProcessDir())) {
            throw new WatcherSetupException("No process directory configured");
        }
        for (var region : Region.values()) {
            try {
                CropGeometry.parse(properties.getCrop().get(region.getCode()));
            } catch (IllegalArgumentException e) {
                throw new WatcherSetupException("Invalid crop geometry for " + region.getCode(), e);
            }
        }
    }
}

package com.agilab.goes_convert.worker;

import com.agilab.goes_convert.exception.PipelineException;
import com.agilab.goes_convert.exception.PipelineExceptionHandler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.nio.file.Path;

/**
 * Processes one detected file. The task owns its lifecycle and removes itself from the
 * {@link WorkerRegistry} on every terminal state; the registry only signals cancellation.
 */
@Slf4j
public class WorkerTask implements Runnable {

    static final String MDC_FILE_KEY = "file";

    private final Path sourcePath;
    private final SourceFileProcessor processor;
    private final WorkerRegistry registry;
    private final PipelineExceptionHandler exceptionHandler;
    private final CancellationToken token = new CancellationToken();

    private volatile TaskState state = TaskState.CREATED;

    public WorkerTask(Path sourcePath, SourceFileProcessor processor, WorkerRegistry registry,
                      PipelineExceptionHandler exceptionHandler) {
        this.sourcePath = sourcePath;
        this.processor = processor;
        this.registry = registry;
        this.exceptionHandler = exceptionHandler;
    }

    @Override
    public void run() {
        MDC.put(MDC_FILE_KEY, sourcePath.getFileName().toString());
        try {
            if (token.isCancellationRequested()) {
                log.info("Cancelled before start: {}", sourcePath);
                state = TaskState.CANCELLED;
                return;
            }
            state = TaskState.RUNNING;
            state = processor.process(sourcePath, token);
        } catch (RuntimeException e) {
            if (e instanceof PipelineException pipelineException) {
                exceptionHandler.logException(pipelineException);
            } else {
                log.error("Unexpected failure processing {}", sourcePath, e);
            }
            state = TaskState.FAILED;
        } finally {
            registry.remove(this);
            log.debug("Exiting with {}", state);
            MDC.remove(MDC_FILE_KEY);
        }
    }

    public void cancel() {
        token.cancel();
    }

    public boolean isCancellationRequested() {
        return token.isCancellationRequested();
    }

    public TaskState getState() {
        return state;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    @Override
    public String toString() {
        return "WorkerTask[" + sourcePath + ", " + state + "]";
    }
}

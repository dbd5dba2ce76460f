package com.agilab.goes_convert.worker;

import java.nio.file.Path;

/**
 * Work done for one source file on behalf of a {@link WorkerTask}.
 */
@FunctionalInterface
public interface SourceFileProcessor {

    /**
     * Processes {@code source}, checking {@code token} between steps.
     *
     * @return {@link TaskState#COMPLETED} or {@link TaskState#CANCELLED}; failures are thrown
     */
    TaskState process(Path source, CancellationToken token);
}

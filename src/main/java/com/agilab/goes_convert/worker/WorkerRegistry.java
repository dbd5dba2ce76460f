package com.agilab.goes_convert.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Live set of in-flight {@link WorkerTask}s, shared by the watcher, the workers and the shutdown path.
 * Holds non-owning references used for cancellation and accounting only.
 */
@Slf4j
@Component
public class WorkerRegistry {

    private final Object lock = new Object();
    private final Set<WorkerTask> tasks = new LinkedHashSet<>();

    public void add(WorkerTask task) {
        synchronized (lock) {
            tasks.add(task);
        }
    }

    /**
     * No-op when the task is not registered.
     */
    public void remove(WorkerTask task) {
        synchronized (lock) {
            tasks.remove(task);
        }
    }

    /**
     * Flags every registered task for cancellation and returns without waiting for them to finish.
     *
     * @return the number of tasks signalled
     */
    public int stopAll() {
        var snapshot = new ArrayList<WorkerTask>();
        synchronized (lock) {
            snapshot.addAll(tasks);
        }
        snapshot.forEach(WorkerTask::cancel);
        log.debug("Signalled {} workers to stop", snapshot.size());
        return snapshot.size();
    }

    public int count() {
        synchronized (lock) {
            return tasks.size();
        }
    }
}

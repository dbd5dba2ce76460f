package com.agilab.goes_convert.watch;

import com.agilab.goes_convert.exception.WatcherSetupException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Recursive polling watcher.
 * <p>
 * Each poll walks the whole tree and diffs it against the previous snapshot, so it works on file systems
 * without change notification and sees directories created after the watch started.
 * New regular files are handed to the dispatch callback on the polling thread. The watcher does not own a
 * thread: whoever schedules {@link #pollAndDispatch()} decides the cadence.
 */
@Slf4j
public class FileWatcher {

    private final Path root;
    private final Duration pollingInterval;
    private final Consumer<Path> dispatch;
    private final boolean emitExisting;

    private volatile boolean stopRequested;
    private SortedMap<Path, EntryState> snapshot;

    private record EntryState(boolean directory, long lastModified, long size) {
    }

    public FileWatcher(Path root, Duration pollingInterval, Consumer<Path> dispatch, boolean emitExisting) {
        this.root = root;
        this.pollingInterval = pollingInterval;
        this.dispatch = dispatch;
        this.emitExisting = emitExisting;
    }

    /**
     * Validates the root and takes the initial snapshot. Files already present are only reported when
     * {@code emitExisting} is set, and then on the first poll.
     */
    public void open() {
        if (!Files.isDirectory(root)) {
            throw new WatcherSetupException("Watch directory does not exist or is not a directory: " + root);
        }
        try {
            snapshot = emitExisting ? new TreeMap<>() : scan();
        } catch (IOException e) {
            throw new WatcherSetupException("Cannot read watch directory " + root, e);
        }
        log.info("Watching '{}' every {}", root, pollingInterval);
    }

    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Runs one poll: diffs the tree and dispatches every newly created regular file.
     * Does nothing once a stop was requested.
     *
     * @return the number of files dispatched
     */
    public int pollAndDispatch() {
        if (stopRequested) {
            log.debug("Stop requested, skipping poll of '{}'", root);
            return 0;
        }
        var dispatched = 0;
        for (var event : poll()) {
            if (!event.isFileCreation()) {
                continue;
            }
            log.debug("Got create event for '{}'", event.path());
            try {
                dispatch.accept(event.path());
                dispatched++;
            } catch (Exception e) {
                log.error("Failed to dispatch {}", event.path(), e);
            }
        }
        return dispatched;
    }

    /**
     * Diffs the current tree against the previous snapshot. A failed walk keeps the previous snapshot.
     */
    public List<SourceEvent> poll() {
        if (snapshot == null) {
            throw new IllegalStateException("Watcher has not been opened");
        }
        SortedMap<Path, EntryState> current;
        try {
            current = scan();
        } catch (IOException e) {
            log.error("Error during watch directory poll: {}", root, e);
            return List.of();
        }

        var events = new ArrayList<SourceEvent>();
        for (Map.Entry<Path, EntryState> entry : current.entrySet()) {
            var previous = snapshot.get(entry.getKey());
            var state = entry.getValue();
            if (previous == null) {
                events.add(new SourceEvent(entry.getKey(), SourceEvent.Kind.CREATED, state.directory()));
            } else if (previous.lastModified() != state.lastModified() || previous.size() != state.size()) {
                events.add(new SourceEvent(entry.getKey(), SourceEvent.Kind.MODIFIED, state.directory()));
            }
        }
        snapshot.forEach((path, state) -> {
            if (!current.containsKey(path)) {
                events.add(new SourceEvent(path, SourceEvent.Kind.DELETED, state.directory()));
            }
        });
        snapshot = current;
        return events;
    }

    private SortedMap<Path, EntryState> scan() throws IOException {
        var entries = new TreeMap<Path, EntryState>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root)) {
                    entries.put(dir, new EntryState(true, attrs.lastModifiedTime().toMillis(), 0));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    entries.put(file, new EntryState(false, attrs.lastModifiedTime().toMillis(), attrs.size()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                // entries can vanish between listing and stat
                log.debug("Skipping unreadable entry {}", file, e);
                return FileVisitResult.CONTINUE;
            }
        });
        return entries;
    }
}

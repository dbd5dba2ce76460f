package com.agilab.goes_convert.watch;

import com.agilab.goes_convert.exception.WatcherSetupException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileWatcherTest {

    @TempDir
    Path tempDir;

    private final List<Path> dispatched = new CopyOnWriteArrayList<>();

    @Test
    void open_shouldFailWhenRootIsMissing() {
        var watcher = new FileWatcher(tempDir.resolve("missing"), Duration.ofMillis(50), dispatched::add, false);

        assertThatThrownBy(watcher::open).isInstanceOf(WatcherSetupException.class);
    }

    @Test
    void poll_shouldIgnoreFilesPresentAtStart() throws IOException {
        Files.writeString(tempDir.resolve("old.png"), "old");
        var watcher = openWatcher(false);

        assertThat(watcher.pollAndDispatch()).isZero();
        assertThat(dispatched).isEmpty();
    }

    @Test
    void poll_shouldReplayFilesPresentAtStartWhenAsked() throws IOException {
        var existing = Files.writeString(tempDir.resolve("old.png"), "old");
        var watcher = openWatcher(true);

        watcher.pollAndDispatch();

        assertThat(dispatched).containsExactly(existing);
    }

    @Test
    void poll_shouldDispatchFilesInDirectoriesCreatedAfterStart() throws IOException {
        var watcher = openWatcher(false);
        var channelDir = Files.createDirectories(tempDir.resolve("fd/x/chan1"));
        var image = Files.writeString(channelDir.resolve("2023-06-01T-12-00-00Z.png"), "png");

        var dispatchedCount = watcher.pollAndDispatch();

        assertThat(dispatchedCount).isEqualTo(1);
        assertThat(dispatched).containsExactly(image);
    }

    @Test
    void poll_shouldReportDirectoriesButNotDispatchThem() throws IOException {
        var watcher = openWatcher(false);
        var dir = Files.createDirectories(tempDir.resolve("m1"));

        var events = watcher.poll();

        assertThat(events).containsExactly(new SourceEvent(dir, SourceEvent.Kind.CREATED, true));
        assertThat(events.get(0).isFileCreation()).isFalse();
    }

    @Test
    void poll_shouldReportModificationsAndDeletions() throws IOException {
        var image = Files.writeString(tempDir.resolve("a.png"), "a");
        var watcher = openWatcher(false);

        Files.writeString(image, "a much longer body");
        assertThat(watcher.poll()).containsExactly(new SourceEvent(image, SourceEvent.Kind.MODIFIED, false));

        Files.delete(image);
        assertThat(watcher.poll()).containsExactly(new SourceEvent(image, SourceEvent.Kind.DELETED, false));
    }

    @Test
    void poll_shouldReportEachFileOnce() throws IOException {
        var watcher = openWatcher(false);
        Files.writeString(tempDir.resolve("a.png"), "a");

        watcher.pollAndDispatch();
        watcher.pollAndDispatch();

        assertThat(dispatched).hasSize(1);
    }

    @Test
    void pollAndDispatch_shouldSurviveCallbackFailures() throws IOException {
        var first = tempDir.resolve("a.png");
        var second = tempDir.resolve("b.png");
        var watcher = new FileWatcher(tempDir, Duration.ofMillis(50), path -> {
            if (path.equals(first)) {
                throw new IllegalStateException("Test exception");
            }
            dispatched.add(path);
        }, false);
        watcher.open();
        Files.writeString(first, "a");
        Files.writeString(second, "b");

        var dispatchedCount = watcher.pollAndDispatch();

        assertThat(dispatchedCount).isEqualTo(1);
        assertThat(dispatched).containsExactly(second);
    }

    @Test
    void pollAndDispatch_shouldDispatchNothingOnceStopRequested() throws IOException {
        var watcher = openWatcher(false);
        watcher.requestStop();
        Files.writeString(tempDir.resolve("late.png"), "png");

        var dispatchedCount = watcher.pollAndDispatch();

        assertThat(dispatchedCount).isZero();
        assertThat(dispatched).isEmpty();
        assertThat(watcher.isStopRequested()).isTrue();
    }

    private FileWatcher openWatcher(boolean emitExisting) {
        var watcher = new FileWatcher(tempDir, Duration.ofMillis(50), dispatched::add, emitExisting);
        watcher.open();
        return watcher;
    }
}

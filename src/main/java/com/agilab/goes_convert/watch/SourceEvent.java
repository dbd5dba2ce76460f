package com.agilab.goes_convert.watch;

import java.nio.file.Path;

/**
 * A change observed between two polls of the watch tree.
 */
public record SourceEvent(Path path, Kind kind, boolean directory) {

    public enum Kind {
        CREATED,
        MODIFIED,
        DELETED
    }

    public boolean isFileCreation() {
        return kind == Kind.CREATED && !directory;
    }
}

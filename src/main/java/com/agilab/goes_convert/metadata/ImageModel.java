package com.agilab.goes_convert.metadata;

import java.util.Arrays;
import java.util.Optional;

/**
 * Scan modes written by goestools, keyed by the directory name they are written under.
 */
public enum ImageModel {
    FULL_DISC("fd"),
    MESOSCALE_1("m1"),
    MESOSCALE_2("m2");

    private final String directoryName;

    ImageModel(String directoryName) {
        this.directoryName = directoryName;
    }

    public String getDirectoryName() {
        return directoryName;
    }

    public boolean isFullDisc() {
        return this == FULL_DISC;
    }

    public static Optional<ImageModel> fromDirectoryName(String name) {
        return Arrays.stream(values())
                .filter(model -> model.directoryName.equals(name))
                .findFirst();
    }
}

package com.agilab.goes_convert.gateway;

import com.agilab.goes_convert.exception.ExternalToolException;

import java.nio.file.Path;
import java.util.List;

/**
 * Pixel operations delegated to an external image tool.
 * <p>
 * Every call is synchronous and blocks the calling worker until the tool finishes.
 * Failures surface as {@link ExternalToolException}.
 */
public interface ImageTransformGateway {

    /**
     * Writes the {@code geometry} rectangle of {@code source} to {@code target}.
     */
    Path crop(Path source, CropGeometry geometry, Path target);

    /**
     * Scales {@code file} in place to {@code percentage} of its size.
     */
    Path resize(Path file, int percentage);

    /**
     * Burns {@code caption} into {@code file} in place.
     */
    Path annotate(Path file, Caption caption, int fontSizePt, Path fontFile);

    /**
     * Encodes {@code frames} in order into a looping animation at {@code output}.
     */
    Path buildAnimatedSequence(List<Path> frames, Path output, int frameDelayTicks, boolean loopForever);
}

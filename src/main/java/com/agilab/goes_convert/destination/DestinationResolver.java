package com.agilab.goes_convert.destination;

import com.agilab.goes_convert.exception.FileWriteException;
import com.agilab.goes_convert.metadata.FileMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Computes where derivatives of a source image go.
 * <p>
 * Layout: {@code <processDir>/<model>/<yyyy-MM-dd>/<channel>[/<region>][/<subdest>]/<HH-mm-ss>.png}.
 * Dates and times are taken in the region's clock, or UTC for whole-scene output.
 * Path computation is pure; {@link #ensureDirectory(Path)} is the only method that touches the disk for writing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DestinationResolver {

    public static final String ANIMATE_SUBDEST = "animate";
    public static final String ANIMATION_FILE_NAME = "animate.gif";
    public static final String FRAME_EXTENSION = ".png";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH-mm-ss");

    private final RegionClock regionClock;

    public Path resolveDir(Path processRoot, FileMetadata metadata, Optional<Region> region, Optional<String> subdest) {
        var date = regionClock.localDate(metadata.captureTime(), region).format(DATE_FORMAT);
        var dir = processRoot
                .resolve(metadata.model().getDirectoryName())
                .resolve(date)
                .resolve(metadata.channel());
        if (region.isPresent()) {
            dir = dir.resolve(region.get().getCode());
        }
        if (subdest.isPresent()) {
            dir = dir.resolve(subdest.get());
        }
        return dir;
    }

    public String resolveFileName(Instant captureTime, Optional<Region> region) {
        return regionClock.localDateTime(captureTime, region).format(TIME_FORMAT) + FRAME_EXTENSION;
    }

    public Path animationFile(Path directory) {
        return directory.resolve(ANIMATION_FILE_NAME);
    }

    public Path ensureDirectory(Path directory) {
        log.debug("make sure '{}' exists", directory);
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new FileWriteException(directory.toString(), "Cannot create output directory", e);
        }
    }

    /**
     * Frames currently present in a directory, in name order (which is capture order within a day).
     */
    public List<Path> listFrames(Path directory) {
        var frames = new ArrayList<Path>();
        if (!Files.isDirectory(directory)) {
            return frames;
        }
        try (var stream = Files.newDirectoryStream(directory, "*" + FRAME_EXTENSION)) {
            stream.forEach(frames::add);
        } catch (IOException e) {
            log.warn("Cannot list frames in {}", directory, e);
        }
        frames.sort(Comparator.comparing(Path::getFileName));
        return frames;
    }
}

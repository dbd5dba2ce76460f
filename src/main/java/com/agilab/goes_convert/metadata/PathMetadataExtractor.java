package com.agilab.goes_convert.metadata;

import com.agilab.goes_convert.exception.MalformedPathException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

import static org.apache.commons.io.FilenameUtils.getBaseName;

/**
 * Parses {@code <watchDir>/<model>/<x>/<channel>/<yyyy-MM-ddT-HH-mm-ssZ>.png} into {@link FileMetadata}.
 */
@Component
public class PathMetadataExtractor {

    // STRICT rejects dates such as Feb 30 or hour 24 instead of rolling them onto a real frame's slot
    static final DateTimeFormatter CAPTURE_TIME_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'-HH-mm-ss'Z'")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final int MODEL_SEGMENT = 0;
    private static final int CHANNEL_SEGMENT = 2;

    public FileMetadata parse(Path source, Path watchDir) {
        var normalizedSource = source.toAbsolutePath().normalize();
        var normalizedRoot = watchDir.toAbsolutePath().normalize();
        if (!normalizedSource.startsWith(normalizedRoot)) {
            throw new MalformedPathException(source.toString(), "Path is not under watch directory " + watchDir);
        }

        var relative = normalizedRoot.relativize(normalizedSource);
        // the last name is the file itself
        var directorySegments = relative.getNameCount() - 1;
        if (directorySegments <= CHANNEL_SEGMENT) {
            throw new MalformedPathException(source.toString(),
                    "Expected at least " + (CHANNEL_SEGMENT + 1) + " directories below the watch root, found " + directorySegments);
        }

        var modelName = relative.getName(MODEL_SEGMENT).toString();
        var model = ImageModel.fromDirectoryName(modelName)
                .orElseThrow(() -> new MalformedPathException(source.toString(), "Unknown image model: " + modelName));
        var channel = relative.getName(CHANNEL_SEGMENT).toString();

        var timeText = getBaseName(relative.getFileName().toString());
        try {
            var captureTime = LocalDateTime.parse(timeText, CAPTURE_TIME_FORMAT).toInstant(ZoneOffset.UTC);
            return new FileMetadata(model, channel, captureTime);
        } catch (DateTimeParseException e) {
            throw new MalformedPathException(source.toString(), "File name is not a capture timestamp: " + timeText, e);
        }
    }
}

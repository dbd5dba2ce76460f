package com.agilab.goes_convert.gateway;

import com.agilab.goes_convert.config.SatelliteProperties;
import com.agilab.goes_convert.exception.ExternalToolException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.time.StopWatch;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ImageTransformGateway} backed by ImageMagick's {@code convert}.
 * Arguments are passed as a list, never through a shell.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageMagickGateway implements ImageTransformGateway {

    private static final String ANNOTATION_QUALITY = "90";
    private static final String CAPTION_BAND_FILL = "#0004";
    private static final String CAPTION_BAND = "rectangle 0,2000,2560,1820";
    private static final String CAPTION_OFFSET = "+2+10";

    private final SatelliteProperties properties;

    @Override
    public Path crop(Path source, CropGeometry geometry, Path target) {
        execute(cropCommand(source, geometry, target), target);
        return target;
    }

    @Override
    public Path resize(Path file, int percentage) {
        execute(resizeCommand(file, percentage), file);
        return file;
    }

    @Override
    public Path annotate(Path file, Caption caption, int fontSizePt, Path fontFile) {
        execute(annotateCommand(file, caption, fontSizePt, fontFile), file);
        return file;
    }

    @Override
    public Path buildAnimatedSequence(List<Path> frames, Path output, int frameDelayTicks, boolean loopForever) {
        if (frames.isEmpty()) {
            throw new ExternalToolException(output.toString(), "No frames to animate");
        }
        execute(animateCommand(frames, output, frameDelayTicks, loopForever), output);
        return output;
    }

    List<String> cropCommand(Path source, CropGeometry geometry, Path target) {
        return List.of(properties.getConvertCommand(),
                source.toString(),
                "-crop", geometry.toString(),
                "+repage",
                target.toString());
    }

    List<String> resizeCommand(Path file, int percentage) {
        return List.of(properties.getConvertCommand(),
                file.toString(),
                "-resize", percentage + "%",
                file.toString());
    }

    List<String> annotateCommand(Path file, Caption caption, int fontSizePt, Path fontFile) {
        return List.of(properties.getConvertCommand(),
                file.toString(),
                "-quality", ANNOTATION_QUALITY,
                "-font", fontFile.toString(),
                "-fill", CAPTION_BAND_FILL, "-draw", CAPTION_BAND,
                "-pointsize", String.valueOf(fontSizePt),
                "-fill", "white", "-gravity", "southwest", "-annotate", CAPTION_OFFSET, caption.timestamp(),
                "-fill", "white", "-gravity", "southeast", "-annotate", CAPTION_OFFSET, caption.watermark(),
                file.toString());
    }

    List<String> animateCommand(List<Path> frames, Path output, int frameDelayTicks, boolean loopForever) {
        var command = new ArrayList<String>();
        command.add(properties.getConvertCommand());
        if (loopForever) {
            command.add("-loop");
            command.add("0");
        }
        command.add("-delay");
        command.add(String.valueOf(frameDelayTicks));
        frames.forEach(frame -> command.add(frame.toString()));
        command.add(output.toString());
        return command;
    }

    private void execute(List<String> command, Path file) {
        var stopWatch = StopWatch.createStarted();
        Path outputLog = null;
        try {
            outputLog = Files.createTempFile("convert-", ".log");
            var process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputLog.toFile())
                    .start();

            var completed = process.waitFor(properties.getToolTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new ExternalToolException(file.toString(),
                        "convert did not finish within " + properties.getToolTimeout());
            }

            var output = Files.readString(outputLog);
            if (process.exitValue() != 0) {
                throw new ExternalToolException(file.toString(),
                        "convert exited with " + process.exitValue() + ": " + StringUtils.abbreviate(output.trim(), 500));
            }
            if (StringUtils.isNotBlank(output)) {
                log.debug("convert output for {}: {}", file, output.trim());
            }
        } catch (IOException e) {
            throw new ExternalToolException(file.toString(), "Cannot run " + properties.getConvertCommand(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(file.toString(), "Interrupted while waiting for convert", e);
        } finally {
            if (outputLog != null) {
                FileUtils.deleteQuietly(outputLog.toFile());
            }
            log.debug("convert for {} took {} ms", file, stopWatch.getTime());
        }
    }
}

package com.agilab.goes_convert;

import com.agilab.goes_convert.config.SatelliteProperties;
import com.agilab.goes_convert.destination.DestinationResolver;
import com.agilab.goes_convert.destination.Region;
import com.agilab.goes_convert.destination.RegionClock;
import com.agilab.goes_convert.exception.ExternalToolException;
import com.agilab.goes_convert.exception.FileWriteException;
import com.agilab.goes_convert.exception.PipelineExceptionHandler;
import com.agilab.goes_convert.exception.SourceNotReadyException;
import com.agilab.goes_convert.gateway.Caption;
import com.agilab.goes_convert.gateway.CropGeometry;
import com.agilab.goes_convert.gateway.ImageTransformGateway;
import com.agilab.goes_convert.metadata.FileMetadata;
import com.agilab.goes_convert.metadata.PathMetadataExtractor;
import com.agilab.goes_convert.worker.CancellationToken;
import com.agilab.goes_convert.worker.SourceFileProcessor;
import com.agilab.goes_convert.worker.TaskState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns one goestools image into its derivatives.
 * <p>
 * Full disc images are cropped per region, copied at reduced size into the {@code animate} folder and
 * every region plus the full disc folder gets its animation rebuilt. Mesoscale images are copied with a
 * caption and their folder animation rebuilt. Crops and copies are skipped when the target already exists,
 * animations are always rebuilt so they pick up the newest frame.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileProcessingPipeline implements SourceFileProcessor {

    private static final DateTimeFormatter CAPTION_FORMAT =
            DateTimeFormatter.ofPattern("EEEE MMM ppd, uuuu  HH:mm:ss", Locale.US);

    private final SatelliteProperties properties;
    private final PathMetadataExtractor metadataExtractor;
    private final DestinationResolver destinationResolver;
    private final RegionClock regionClock;
    private final ImageTransformGateway gateway;
    private final PipelineExceptionHandler exceptionHandler;
    private final RetryTemplate sourceReadinessRetryTemplate;

    record Stage(String name, Runnable action) {
    }

    private record Job(Path source, FileMetadata metadata, Path processRoot) {
    }

    @Override
    public TaskState process(Path source, CancellationToken token) {
        var metadata = metadataExtractor.parse(source, Path.of(properties.getWatchDir()));
        log.info("Processing {} {} captured {}", metadata.model(), metadata.channel(), metadata.captureTime());

        awaitSource(source, token);

        var job = new Job(source, metadata, Path.of(properties.getProcessDir()));
        for (var stage : stagesFor(job)) {
            if (token.isCancellationRequested()) {
                log.info("Cancelled before stage {} of {}", stage.name(), source);
                return TaskState.CANCELLED;
            }
            log.debug("Stage {} for {}", stage.name(), source);
            stage.action().run();
        }
        return TaskState.COMPLETED;
    }

    List<Stage> stagesFor(FileMetadata metadata, Path source) {
        return stagesFor(new Job(source, metadata, Path.of(properties.getProcessDir())));
    }

    private List<Stage> stagesFor(Job job) {
        if (job.metadata().model().isFullDisc()) {
            return List.of(
                    new Stage("crop-va", () -> crop(job, Region.VA)),
                    new Stage("crop-ca", () -> crop(job, Region.CA)),
                    new Stage("crop-usa", () -> crop(job, Region.USA)),
                    new Stage("copy-animate", () -> copy(job, Optional.of(DestinationResolver.ANIMATE_SUBDEST), false, true)),
                    new Stage("animate-va", () -> animate(job, Optional.of(Region.VA))),
                    new Stage("animate-ca", () -> animate(job, Optional.of(Region.CA))),
                    new Stage("animate-usa", () -> animate(job, Optional.of(Region.USA))),
                    new Stage("animate-fd", () -> animateFullDisc(job)));
        }
        return List.of(
                new Stage("copy", () -> copy(job, Optional.empty(), true, false)),
                new Stage("animate", () -> animate(job, Optional.empty())));
    }

    private void awaitSource(Path source, CancellationToken token) {
        try {
            sourceReadinessRetryTemplate.execute(context -> {
                if (token.isCancellationRequested() || Files.isReadable(source)) {
                    return null;
                }
                log.debug("'{}' isn't ready yet (attempt {})", source, context.getRetryCount() + 1);
                throw new SourceNotReadyException(source.toString(), "Source file is not readable yet");
            });
        } catch (SourceNotReadyException e) {
            throw new SourceNotReadyException(source.toString(), "Source file never became readable", e);
        }
    }

    private void crop(Job job, Region region) {
        log.info("Crop fd image for '{}'", region.getCode());
        var captureTime = job.metadata().captureTime();
        var dest = destinationResolver.resolveDir(job.processRoot(), job.metadata(), Optional.of(region), Optional.empty());
        destinationResolver.ensureDirectory(dest);
        var target = dest.resolve(destinationResolver.resolveFileName(captureTime, Optional.of(region)));
        if (Files.exists(target)) {
            log.debug("Crop {} already exists", target);
            return;
        }

        var geometry = CropGeometry.parse(properties.getCrop().get(region.getCode()));
        try {
            gateway.crop(job.source(), geometry, target);
        } catch (ExternalToolException e) {
            exceptionHandler.logException(e);
            return;
        }
        tolerateToolFailure(() -> overlay(job, target, Optional.of(region)));
    }

    private void copy(Job job, Optional<String> subdest, boolean overlay, boolean resize) {
        var dest = destinationResolver.resolveDir(job.processRoot(), job.metadata(), Optional.empty(), subdest);
        var target = dest.resolve(destinationResolver.resolveFileName(job.metadata().captureTime(), Optional.empty()));
        log.debug("copy image to destination '{}'", target);

        destinationResolver.ensureDirectory(dest);
        if (Files.exists(target)) {
            log.debug("Copy {} already exists", target);
            return;
        }
        try {
            Files.copy(job.source(), target);
        } catch (FileAlreadyExistsException e) {
            log.debug("Copy {} was written concurrently", target);
            return;
        } catch (IOException e) {
            throw new FileWriteException(target.toString(), "Cannot copy " + job.source(), e);
        }

        if (resize) {
            tolerateToolFailure(() -> gateway.resize(target, properties.getResizePercentage()));
        }
        if (overlay) {
            tolerateToolFailure(() -> overlay(job, target, Optional.empty()));
        }
    }

    private void animate(Job job, Optional<Region> region) {
        var dest = destinationResolver.resolveDir(job.processRoot(), job.metadata(), region, Optional.empty());
        log.info("animate directory '{}'", dest);
        buildAnimation(dest);
    }

    private void animateFullDisc(Job job) {
        var dest = destinationResolver.resolveDir(job.processRoot(), job.metadata(), Optional.empty(),
                Optional.of(DestinationResolver.ANIMATE_SUBDEST));
        log.info("animate full disc directory '{}'", dest);
        buildAnimation(dest);
    }

    private void buildAnimation(Path dest) {
        var frames = destinationResolver.listFrames(dest);
        if (frames.isEmpty()) {
            log.debug("No frames in {}, skipping animation", dest);
            return;
        }
        tolerateToolFailure(() -> gateway.buildAnimatedSequence(frames, destinationResolver.animationFile(dest),
                properties.getFrameDelayTicks(), true));
    }

    private void overlay(Job job, Path imageFile, Optional<Region> region) {
        var localTime = regionClock.localDateTime(job.metadata().captureTime(), region);
        var timestamp = localTime.format(CAPTION_FORMAT) + "  " + regionClock.zoneLabel(region);
        var fontSize = region.isPresent() ? properties.getRegionFontSize() : properties.getSceneFontSize();
        gateway.annotate(imageFile, new Caption(timestamp, properties.getWatermark()), fontSize,
                Path.of(properties.getFontPath()));
    }

    private void tolerateToolFailure(Runnable toolCall) {
        try {
            toolCall.run();
        } catch (ExternalToolException e) {
            exceptionHandler.logException(e);
        }
    }
}

package com.agilab.goes_convert.gateway;

import com.agilab.goes_convert.config.SatelliteProperties;
import com.agilab.goes_convert.exception.ExternalToolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageMagickGatewayTest {

    private SatelliteProperties properties;
    private ImageMagickGateway gateway;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        properties = new SatelliteProperties();
        properties.setConvertCommand("convert");
        gateway = new ImageMagickGateway(properties);
    }

    @Test
    void cropCommand_shouldPassGeometryAsSingleArgument() {
        var command = gateway.cropCommand(Path.of("/in/a.png"), CropGeometry.parse("1024x768+600+600"), Path.of("/out/b.png"));

        assertThat(command).containsExactly("convert", "/in/a.png", "-crop", "1024x768+600+600", "+repage", "/out/b.png");
    }

    @Test
    void resizeCommand_shouldResizeInPlace() {
        var command = gateway.resizeCommand(Path.of("/out/b.png"), 25);

        assertThat(command).containsExactly("convert", "/out/b.png", "-resize", "25%", "/out/b.png");
    }

    @Test
    void annotateCommand_shouldPlaceTimestampAndWatermark() {
        var caption = new Caption("Thursday Jun  1, 2023  07:00:00  EST", "wx.hemna.com");

        var command = gateway.annotateCommand(Path.of("/out/b.png"), caption, 24, Path.of("/fonts/Verdana_Bold.ttf"));

        assertThat(command).first().isEqualTo("convert");
        assertThat(command).last().isEqualTo("/out/b.png");
        assertThat(command).containsSubsequence("-font", "/fonts/Verdana_Bold.ttf");
        assertThat(command).containsSubsequence("-pointsize", "24");
        assertThat(command).containsSubsequence("southwest", "-annotate", "+2+10", "Thursday Jun  1, 2023  07:00:00  EST");
        assertThat(command).containsSubsequence("southeast", "-annotate", "+2+10", "wx.hemna.com");
    }

    @Test
    void animateCommand_shouldListFramesBeforeOutput() {
        var frames = List.of(Path.of("/d/12-00-00.png"), Path.of("/d/12-10-00.png"));

        var command = gateway.animateCommand(frames, Path.of("/d/animate.gif"), 15, true);

        assertThat(command).containsExactly("convert", "-loop", "0", "-delay", "15",
                "/d/12-00-00.png", "/d/12-10-00.png", "/d/animate.gif");
        assertThat(gateway.animateCommand(frames, Path.of("/d/animate.gif"), 15, false)).doesNotContain("-loop");
    }

    @Test
    void crop_shouldRaiseExternalToolExceptionWhenToolCannotStart() {
        properties.setConvertCommand(tempDir.resolve("no-such-convert").toString());
        var target = tempDir.resolve("crop.png");

        assertThatThrownBy(() -> gateway.crop(tempDir.resolve("in.png"), CropGeometry.parse("10x10+0+0"), target))
                .isInstanceOf(ExternalToolException.class)
                .satisfies(e -> assertThat(((ExternalToolException) e).getFilePath()).isEqualTo(target.toString()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void resize_shouldRaiseExternalToolExceptionOnNonZeroExit() {
        properties.setConvertCommand("false");
        var file = tempDir.resolve("frame.png");

        assertThatThrownBy(() -> gateway.resize(file, 25))
                .isInstanceOf(ExternalToolException.class)
                .hasMessageContaining("exited with 1")
                .satisfies(e -> assertThat(((ExternalToolException) e).getFilePath()).isEqualTo(file.toString()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void resize_shouldRaiseExternalToolExceptionWhenToolOutlivesTimeout() throws IOException {
        var slowConvert = Files.writeString(tempDir.resolve("slow-convert.sh"), "#!/bin/sh\nsleep 10\n");
        Files.setPosixFilePermissions(slowConvert, PosixFilePermissions.fromString("rwxr-xr-x"));
        properties.setConvertCommand(slowConvert.toString());
        properties.setToolTimeout(Duration.ofMillis(200));

        assertThatThrownBy(() -> gateway.resize(tempDir.resolve("frame.png"), 25))
                .isInstanceOf(ExternalToolException.class)
                .hasMessageContaining("did not finish within");
    }

    @Test
    void buildAnimatedSequence_shouldRejectEmptyFrameList() {
        assertThatThrownBy(() -> gateway.buildAnimatedSequence(List.of(), tempDir.resolve("animate.gif"), 15, true))
                .isInstanceOf(ExternalToolException.class)
                .hasMessageContaining("No frames");
    }
}

package com.agilab.goes_convert.gateway;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CropGeometryTest {

    @Test
    void parse_shouldReadImageMagickGeometry() {
        var geometry = CropGeometry.parse("2424x1424+720+280");

        assertThat(geometry).isEqualTo(new CropGeometry(2424, 1424, 720, 280));
        assertThat(geometry.toString()).isEqualTo("2424x1424+720+280");
    }

    @Test
    void parse_shouldRejectMalformedGeometry() {
        assertThatThrownBy(() -> CropGeometry.parse("1024x768")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CropGeometry.parse("1024x768+0+0; rm -rf /")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CropGeometry.parse(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CropGeometry.parse("0x768+0+0")).isInstanceOf(IllegalArgumentException.class);
    }
}

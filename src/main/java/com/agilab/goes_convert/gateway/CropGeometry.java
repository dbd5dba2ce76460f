package com.agilab.goes_convert.gateway;

import java.util.regex.Pattern;

/**
 * Crop rectangle in ImageMagick geometry notation, {@code WxH+X+Y}.
 */
public record CropGeometry(int width, int height, int xOffset, int yOffset) {

    private static final Pattern GEOMETRY = Pattern.compile("(\\d+)x(\\d+)\\+(\\d+)\\+(\\d+)");

    public CropGeometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Crop size must be positive: " + width + "x" + height);
        }
    }

    public static CropGeometry parse(String text) {
        var matcher = GEOMETRY.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a crop geometry: " + text);
        }
        return new CropGeometry(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                Integer.parseInt(matcher.group(4)));
    }

    @Override
    public String toString() {
        return width + "x" + height + "+" + xOffset + "+" + yOffset;
    }
}

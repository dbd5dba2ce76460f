package com.agilab.goes_convert.destination;

import java.time.ZoneOffset;

/**
 * Geographic viewports cropped out of the full disc. USA shares the Virginia clock.
 */
public enum Region {
    VA("va", ZoneOffset.ofHours(-5), "EST"),
    CA("ca", ZoneOffset.ofHours(-8), "PST"),
    USA("usa", ZoneOffset.ofHours(-5), "EST");

    private final String code;
    private final ZoneOffset offset;
    private final String zoneLabel;

    Region(String code, ZoneOffset offset, String zoneLabel) {
        this.code = code;
        this.offset = offset;
        this.zoneLabel = zoneLabel;
    }

    public String getCode() {
        return code;
    }

    ZoneOffset getOffset() {
        return offset;
    }

    String getZoneLabel() {
        return zoneLabel;
    }
}

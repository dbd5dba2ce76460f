package com.agilab.goes_convert.destination;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Buckets capture instants into region-local wall clock time. Offsets are fixed; no daylight saving is applied.
 */
@Component
public class RegionClock {

    public ZoneOffset zoneFor(Optional<Region> region) {
        return region.map(Region::getOffset).orElse(ZoneOffset.UTC);
    }

    public String zoneLabel(Optional<Region> region) {
        return region.map(Region::getZoneLabel).orElse("GMT");
    }

    public LocalDateTime localDateTime(Instant captureTime, Optional<Region> region) {
        return LocalDateTime.ofInstant(captureTime, zoneFor(region));
    }

    public LocalDate localDate(Instant captureTime, Optional<Region> region) {
        return localDateTime(captureTime, region).toLocalDate();
    }
}

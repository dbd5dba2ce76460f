package com.agilab.goes_convert.metadata;

import java.time.Instant;

/**
 * What a source path says about its image: scan mode, channel and the UTC capture time.
 */
public record FileMetadata(ImageModel model,
                           String channel,
                           Instant captureTime) {
}

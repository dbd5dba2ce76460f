package com.agilab.goes_convert.gateway;

/**
 * Text burned into a frame: the local capture time bottom left, the watermark bottom right.
 */
public record Caption(String timestamp, String watermark) {
}

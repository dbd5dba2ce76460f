package com.agilab.goes_convert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "goes-convert")
@Data
@Component
public class SatelliteProperties {
    private String satellite;
    private String watchDir;
    private String processDir;
    private String fontPath = "./Verdana_Bold.ttf";
    // region code -> WxH+X+Y
    private Map<String, String> crop = new HashMap<>(Map.of(
            "va", "1024x768+2100+600",
            "ca", "1024x768+600+600",
            "usa", "2424x1424+720+280"));
    private String watermark = "wx.hemna.com";
    private String convertCommand = "convert";
    private Duration pollingInterval = Duration.ofSeconds(1);
    private boolean replayExisting = false;
    private int workerPoolSize = 4;
    private Duration shutdownAwait = Duration.ofSeconds(30);
    private int sourceReadyAttempts = 10;
    private Duration sourceReadyInitialDelay = Duration.ofSeconds(1);
    private Duration sourceReadyMaxDelay = Duration.ofSeconds(10);
    private Duration toolTimeout = Duration.ofMinutes(5);
    private int resizePercentage = 25;
    private int frameDelayTicks = 15;
    private int regionFontSize = 24;
    private int sceneFontSize = 12;
}

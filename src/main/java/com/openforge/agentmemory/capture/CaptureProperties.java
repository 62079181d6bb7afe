package com.openforge.agentmemory.capture;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Thresholds of the capture pipeline.
 *
 * application.yml:
 *
 * memory:
 *   capture:
 *     min-length: 10               # shorter is noise
 *     max-length: 500              # longer is rarely one discrete fact
 *     max-pictographs: 3
 *     duplicate-check: true
 *     duplicate-threshold: 0.95
 *     max-stored-text-length: 1000
 *     source: auto-capture
 */
@ConfigurationProperties(prefix = "memory.capture")
public record CaptureProperties(
        @DefaultValue("10")           int     minLength,
        @DefaultValue("500")          int     maxLength,
        @DefaultValue("3")            int     maxPictographs,
        @DefaultValue("true")         boolean duplicateCheck,
        @DefaultValue("0.95")         double  duplicateThreshold,
        @DefaultValue("1000")         int     maxStoredTextLength,
        @DefaultValue("auto-capture") String  source
) {

    public static CaptureProperties defaults() {
        return new CaptureProperties(10, 500, 3, true, 0.95, 1000, "auto-capture");
    }
}

package com.project.imaging.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under {@code pipeline.*}. The centroid implementation is chosen separately through
 * {@code pipeline.centroid.method}, see the calculator beans.
 */
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
        @DefaultValue Mask mask,
        @DefaultValue Populate populate,
        @DefaultValue Scans scans
) {

    /**
     * @param pixelIndexBase base of the linear pixel indices stored with each mask (1 for masks
     *                       written by the upstream segmentation)
     */
    public record Mask(@DefaultValue("1") int pixelIndexBase) {}

    public record Populate(
            @DefaultValue("false") boolean suppressErrors,
            @DefaultValue("false") boolean onStartup
    ) {}

    /** @param root base directory for scan paths stored relative to the acquisition share */
    public record Scans(String root) {}
}

package com.project.imaging.pipeline.config;

import com.project.imaging.pipeline.DTOs.PopulateReport;
import com.project.imaging.pipeline.service.MaskCoordinateExtractor;
import com.project.imaging.pipeline.service.PopulateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Populates the mask coordinate table once after the context is up.
 * Only active with {@code pipeline.populate.on-startup=true}.
 */
@Component
@ConditionalOnProperty(name = "pipeline.populate.on-startup", havingValue = "true")
public class PopulateOnStartup implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(PopulateOnStartup.class);

    private final PopulateService populateService;
    private final MaskCoordinateExtractor maskCoordinates;

    public PopulateOnStartup(PopulateService populateService, MaskCoordinateExtractor maskCoordinates) {
        this.populateService = populateService;
        this.maskCoordinates = maskCoordinates;
    }

    @Override
    public void run(String... args) {
        PopulateReport report = populateService.populate(maskCoordinates);
        log.info("Startup populate of {} finished: {} keys populated, {} failed",
                report.table(), report.populated(), report.failures().size());
    }
}

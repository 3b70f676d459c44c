package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.DTOs.ScanImageHeader;
import com.project.imaging.pipeline.model.ScanKey;

/** Read-only access to the scanner metadata of a raw scan. */
public interface ScanReader {

    /**
     * @throws com.project.imaging.pipeline.exceptions.ScanReadException if the scan file cannot
     *         be located or decoded
     */
    ScanImageHeader read(ScanKey key);
}

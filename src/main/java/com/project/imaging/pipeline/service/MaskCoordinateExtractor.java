package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.DTOs.Centroid;
import com.project.imaging.pipeline.DTOs.FrameGeometry;
import com.project.imaging.pipeline.DTOs.WeightedMask;
import com.project.imaging.pipeline.config.PipelineProperties;
import com.project.imaging.pipeline.exceptions.CoordinateExtractionException;
import com.project.imaging.pipeline.model.MaskCoordinate;
import com.project.imaging.pipeline.model.Scan;
import com.project.imaging.pipeline.model.ScanKey;
import com.project.imaging.pipeline.model.Segmentation;
import com.project.imaging.pipeline.model.SegmentationKey;
import com.project.imaging.pipeline.model.SegmentedMask;
import com.project.imaging.pipeline.repository.MaskCoordinateRepository;
import com.project.imaging.pipeline.repository.ScanGeometryRepository;
import com.project.imaging.pipeline.repository.ScanRepository;
import com.project.imaging.pipeline.repository.SegmentationRepository;
import com.project.imaging.pipeline.repository.SegmentedMaskRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Mask center of mass of each segmented cell, in micrometers: x and y relative to the frame
 * center, z relative to the tissue surface.
 */
@Service
public class MaskCoordinateExtractor implements AutoPopulate<SegmentationKey, MaskCoordinate> {
    private static final Logger log = LoggerFactory.getLogger(MaskCoordinateExtractor.class);

    private final SegmentationRepository segmentations;
    private final SegmentedMaskRepository masks;
    private final ScanGeometryRepository geometries;
    private final ScanRepository scans;
    private final MaskCoordinateRepository coordinates;
    private final ScanReader scanReader;
    private final CentroidCalculator centroidCalculator;
    private final int pixelIndexBase;

    @PersistenceContext
    private EntityManager entityManager;

    public MaskCoordinateExtractor(SegmentationRepository segmentations,
                                   SegmentedMaskRepository masks,
                                   ScanGeometryRepository geometries,
                                   ScanRepository scans,
                                   MaskCoordinateRepository coordinates,
                                   ScanReader scanReader,
                                   CentroidCalculator centroidCalculator,
                                   PipelineProperties properties) {
        this.segmentations = segmentations;
        this.masks = masks;
        this.geometries = geometries;
        this.scans = scans;
        this.coordinates = coordinates;
        this.scanReader = scanReader;
        this.centroidCalculator = centroidCalculator;
        this.pixelIndexBase = properties.mask().pixelIndexBase();
    }

    @Override
    public String tableName() {
        return "mask_coordinate";
    }

    @Override
    public List<SegmentationKey> keySource() {
        return segmentations.findWithoutMaskCoordinates().stream()
                .map(Segmentation::key)
                .toList();
    }

    @Override
    public List<MaskCoordinate> makeTuples(SegmentationKey key) {
        List<SegmentedMask> rows = masks.findByKey(key);
        if (rows.isEmpty()) {
            throw new CoordinateExtractionException("No masks found for " + key);
        }

        ScanKey scanKey = key.scanKey();
        FrameGeometry frame = geometries.findById(scanKey)
                .orElseThrow(() -> new CoordinateExtractionException("No scan geometry for " + scanKey))
                .toFrameGeometry();
        double depth = scans.findById(scanKey)
                .map(Scan::getDepth)
                .orElseThrow(() -> new CoordinateExtractionException("No scan depth for " + scanKey));
        double zloc = depth + slicePosition(scanKey, key.getSlice());

        log.debug("Extracting {} mask coordinates for {} on a {}x{} px / {}x{} um frame",
                rows.size(), key, frame.pxWidth(), frame.pxHeight(), frame.umWidth(), frame.umHeight());

        List<MaskCoordinate> result = new ArrayList<>(rows.size());
        for (SegmentedMask row : rows) {
            WeightedMask mask = WeightedMask.of(row.getTraceId(), row.getMaskPixels(), row.getMaskWeights(),
                    pixelIndexBase, frame);
            Centroid centroid = centroidCalculator.weightedCentroid(mask);
            result.add(new MaskCoordinate(key, row.getTraceId(),
                    frame.xloc(centroid.x()), frame.yloc(centroid.y()), zloc));
        }
        return result;
    }

    @Override
    public void insert(List<MaskCoordinate> rows) {
        rows.forEach(entityManager::persist);
        entityManager.flush();
    }

    @Override
    public long deleteKey(SegmentationKey key) {
        long removed = coordinates.deleteByKey(key);
        entityManager.flush();
        return removed;
    }

    /** Offset (um) of the 1-based slice from the scanner's fast-z positions. */
    private double slicePosition(ScanKey scanKey, int slice) {
        double[] positions = scanReader.read(scanKey).slicePositions();
        if (slice < 1 || slice > positions.length) {
            throw new CoordinateExtractionException("Slice " + slice + " has no z position for " + scanKey
                    + " (scanner reports " + positions.length + " slices)");
        }
        return positions[slice - 1];
    }
}

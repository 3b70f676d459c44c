package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.DTOs.ScanImageHeader;
import com.project.imaging.pipeline.config.PipelineProperties;
import com.project.imaging.pipeline.exceptions.ScanReadException;
import com.project.imaging.pipeline.model.Scan;
import com.project.imaging.pipeline.model.ScanKey;
import com.project.imaging.pipeline.model.ScanSession;
import com.project.imaging.pipeline.repository.ScanRepository;
import com.project.imaging.pipeline.repository.ScanSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Reads the ScanImage header stored in the first image directory of a scan's TIFF file.
 * The header text sits in the ImageDescription tag (older ScanImage) or the Software tag
 * (ScanImage 2016 and later); both are parsed and merged.
 */
@Service
public class ScanImageTiffReader implements ScanReader {
    private static final Logger log = LoggerFactory.getLogger(ScanImageTiffReader.class);

    private final ScanRepository scans;
    private final ScanSessionRepository sessions;
    private final Path scanRoot;

    public ScanImageTiffReader(ScanRepository scans, ScanSessionRepository sessions, PipelineProperties properties) {
        this.scans = scans;
        this.sessions = sessions;
        String root = properties.scans().root();
        this.scanRoot = (root == null || root.isBlank()) ? null : Paths.get(root).toAbsolutePath().normalize();
    }

    @Override
    public ScanImageHeader read(ScanKey key) {
        Path file = locate(key);
        log.debug("Reading ScanImage header of {} from {}", key, file);
        return readHeader(file);
    }

    /**
     * Finds the first file of the scan: {@code <filename>_*.tif} in name order, falling back to
     * {@code <filename>.tif}.
     */
    public Path locate(ScanKey key) {
        Scan scan = scans.findById(key)
                .orElseThrow(() -> new ScanReadException("No scan registered for " + key));
        ScanSession session = sessions.findById(key.sessionKey())
                .orElseThrow(() -> new ScanReadException("No session registered for " + key.sessionKey()));

        Path dir = resolveScanPath(session.getScanPath());
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, scan.getFilename() + "_*.tif")) {
            stream.forEach(candidates::add);
        } catch (IOException e) {
            throw new ScanReadException("Cannot list scan directory " + dir, e);
        }
        if (!candidates.isEmpty()) {
            Collections.sort(candidates);
            return candidates.get(0);
        }
        Path single = dir.resolve(scan.getFilename() + ".tif");
        if (Files.isRegularFile(single)) return single;
        throw new ScanReadException("No scan file '" + scan.getFilename() + "' found in " + dir);
    }

    public static ScanImageHeader readHeader(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ScanReadException("Scan file does not exist: " + file);
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("tiff");
            if (!readers.hasNext()) {
                throw new ScanReadException("No TIFF reader available in this runtime");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, false);
                IIOMetadata metadata = reader.getImageMetadata(0);
                TIFFDirectory directory = TIFFDirectory.createFromMetadata(metadata);
                ScanImageHeader header = ScanImageHeader.parse(asciiTag(directory, BaselineTIFFTagSet.TAG_IMAGE_DESCRIPTION))
                        .merge(ScanImageHeader.parse(asciiTag(directory, BaselineTIFFTagSet.TAG_SOFTWARE)));
                if (header.fields().isEmpty()) {
                    throw new ScanReadException("No ScanImage header found in " + file);
                }
                return header;
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new ScanReadException("Failed to read TIFF metadata of " + file, e);
        }
    }

    private Path resolveScanPath(String scanPath) {
        Path path = Paths.get(scanPath);
        if (path.isAbsolute() || scanRoot == null) return path;
        return scanRoot.resolve(path);
    }

    private static String asciiTag(TIFFDirectory directory, int tag) {
        TIFFField field = directory.getTIFFField(tag);
        if (field == null || field.getCount() == 0) return null;
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < field.getCount(); i++) {
            if (i > 0) text.append('\n');
            text.append(field.getAsString(i));
        }
        return text.toString();
    }
}

package com.project.imaging.pipeline.repository;

import com.project.imaging.pipeline.model.ScanGeometry;
import com.project.imaging.pipeline.model.ScanKey;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScanGeometryRepository extends JpaRepository<ScanGeometry, ScanKey> {
}

package com.project.imaging.pipeline.repository;

import com.project.imaging.pipeline.model.Scan;
import com.project.imaging.pipeline.model.ScanKey;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScanRepository extends JpaRepository<Scan, ScanKey> {
}

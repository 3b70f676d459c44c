package com.project.imaging.pipeline.repository;

import com.project.imaging.pipeline.model.ScanSession;
import com.project.imaging.pipeline.model.SessionKey;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScanSessionRepository extends JpaRepository<ScanSession, SessionKey> {
}

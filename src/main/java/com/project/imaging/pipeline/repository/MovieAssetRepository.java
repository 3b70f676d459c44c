package com.project.imaging.pipeline.repository;

import com.project.imaging.pipeline.model.MovieAsset;
import com.project.imaging.pipeline.model.MovieClass;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MovieAssetRepository extends JpaRepository<MovieAsset, String> {

    List<MovieAsset> findByMovieClassOrderByMovieName(MovieClass movieClass);
}

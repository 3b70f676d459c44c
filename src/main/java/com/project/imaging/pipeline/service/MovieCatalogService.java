package com.project.imaging.pipeline.service;

import com.project.imaging.pipeline.exceptions.MovieCatalogException;
import com.project.imaging.pipeline.model.MovieAsset;
import com.project.imaging.pipeline.model.MovieClass;
import com.project.imaging.pipeline.repository.MovieAssetRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.IllegalFormatException;
import java.util.List;
import java.util.Optional;

/**
 * Manual maintenance of the movie lookup table. Rows are validated before they reach the
 * store; unknown movie classes never get past {@link MovieClass#fromValue(String)}.
 */
@Service
@Validated
public class MovieCatalogService {
    private static final Logger log = LoggerFactory.getLogger(MovieCatalogService.class);

    private final MovieAssetRepository movies;

    public MovieCatalogService(MovieAssetRepository movies) {
        this.movies = movies;
    }

    @Transactional
    public MovieAsset register(@Valid MovieAsset movie) {
        if (movies.existsById(movie.getMovieName())) {
            throw new MovieCatalogException("Movie '" + movie.getMovieName() + "' is already registered");
        }
        MovieAsset saved = movies.save(movie);
        log.info("Registered movie {} ({})", saved.getMovieName(), saved.getMovieClass());
        return saved;
    }

    @Transactional
    public MovieAsset update(@Valid MovieAsset movie) {
        if (!movies.existsById(movie.getMovieName())) {
            throw new MovieCatalogException("Movie '" + movie.getMovieName() + "' is not registered");
        }
        log.info("Updating movie {}", movie.getMovieName());
        return movies.save(movie);
    }

    @Transactional(readOnly = true)
    public Optional<MovieAsset> find(String movieName) {
        return movies.findById(movieName);
    }

    @Transactional(readOnly = true)
    public List<MovieAsset> listByClass(MovieClass movieClass) {
        return movies.findByMovieClassOrderByMovieName(movieClass);
    }

    /** Full path of clip file {@code fileIndex}, from the movie's file template. */
    @Transactional(readOnly = true)
    public String clipFile(String movieName, @PositiveOrZero int fileIndex) {
        MovieAsset movie = require(movieName);
        try {
            return String.format(movie.getFileTemplate(), fileIndex);
        } catch (IllegalFormatException e) {
            throw new MovieCatalogException("File template of movie '" + movieName + "' is not a valid pattern: "
                    + movie.getFileTemplate(), e);
        }
    }

    /** (s) offset of clip file {@code fileIndex} into the original movie. */
    @Transactional(readOnly = true)
    public double clipStart(String movieName, @PositiveOrZero int fileIndex) {
        return (double) fileIndex * require(movieName).getFileDuration();
    }

    private MovieAsset require(String movieName) {
        return movies.findById(movieName)
                .orElseThrow(() -> new MovieCatalogException("Movie '" + movieName + "' is not registered"));
    }
}

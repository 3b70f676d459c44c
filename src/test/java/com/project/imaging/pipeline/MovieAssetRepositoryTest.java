package com.project.imaging.pipeline;

import com.project.imaging.pipeline.model.MovieAsset;
import com.project.imaging.pipeline.model.MovieClass;
import com.project.imaging.pipeline.repository.MovieAssetRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
class MovieAssetRepositoryTest {

    @Autowired MovieAssetRepository movies;
    @Autowired TestEntityManager entityManager;
    @Autowired JdbcTemplate jdbc;

    private static final String INSERT = "insert into movie (movie_name, path, movie_class, original_file, "
            + "file_template, file_duration, movie_description) values (?, ?, ?, ?, ?, ?, ?)";

    @Test
    void insertWithUnknownMovieClass_isRejected() {
        assertThatThrownBy(() -> jdbc.update(INSERT,
                "vrtour", "/movies/vr", "vr", "tour.mp4", "/movies/vr/tour_%03d.mp4", 10f, "VR tour"))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void unknownMovieClass_cannotBeParsed() {
        assertThatThrownBy(() -> MovieClass.fromValue("vr"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vr");
        assertThat(MovieClass.fromValue("madmax")).isEqualTo(MovieClass.MADMAX);
    }

    @Test
    void omittedColumns_takeTableDefaults() {
        jdbc.update(INSERT, "MadMax", "/movies/madmax", "madmax", "fury_road.mkv",
                "/movies/madmax/clip_%03d.mp4", 10f, "Mad Max: Fury Road");

        MovieAsset movie = movies.findById("MadMax").orElseThrow();

        assertThat(movie.getMovieClass()).isEqualTo(MovieClass.MADMAX);
        assertThat(movie.getCodec()).isEqualTo("-c:v libx264 -preset slow -crf 5");
        assertThat(movie.getFrameRate()).isEqualTo(30f);
        assertThat(movie.getFrameWidth()).isEqualTo(256);
        assertThat(movie.getFrameHeight()).isEqualTo(144);
        assertThat(movie.getParams()).isNull();
    }

    @Test
    void newEntity_carriesSameDefaultsAsTable() {
        MovieAsset movie = new MovieAsset("obj1", MovieClass.OBJECT3D);

        assertThat(movie.getCodec()).isEqualTo(MovieAsset.DEFAULT_CODEC);
        assertThat(movie.getFrameRate()).isEqualTo(30f);
        assertThat(movie.getFrameWidth()).isEqualTo(256);
        assertThat(movie.getFrameHeight()).isEqualTo(144);
        assertThat(movie.getParams()).isNull();
    }

    @Test
    void movieClass_isStoredAsLowerCaseValue() {
        MovieAsset movie = new MovieAsset("obj1", MovieClass.OBJECT3D)
                .setPath("/movies/objects")
                .setOriginalFile("objects.blend")
                .setFileTemplate("/movies/objects/obj1_%03d.mp4")
                .setFileDuration(5f)
                .setMovieDescription("rendered 3d objects")
                .setParams(new byte[]{1, 2, 3});
        movies.save(movie);
        entityManager.flush();
        entityManager.clear();

        assertThat(jdbc.queryForObject("select movie_class from movie where movie_name = ?", String.class, "obj1"))
                .isEqualTo("object3d");
        assertThat(movies.findByMovieClassOrderByMovieName(MovieClass.OBJECT3D))
                .extracting(MovieAsset::getMovieName).containsExactly("obj1");
        assertThat(movies.findById("obj1").orElseThrow().getParams()).containsExactly(1, 2, 3);
        assertThat(movies.findByMovieClassOrderByMovieName(MovieClass.MOUSECAM)).isEmpty();
    }
}

package com.project.imaging.pipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Movies used for generating clips and stills. Lookup table: rows are entered by hand,
 * no populate logic touches it.
 */
@Entity
@Table(name = "movie")
public class MovieAsset {
    public static final String DEFAULT_CODEC = "-c:v libx264 -preset slow -crf 5";
    public static final float DEFAULT_FRAME_RATE = 30;
    public static final int DEFAULT_FRAME_WIDTH = 256;
    public static final int DEFAULT_FRAME_HEIGHT = 144;

    /** short movie title */
    @Id
    @NotBlank
    @Size(max = 8)
    @Column(name = "movie_name", length = 8)
    private String movieName;

    @NotNull
    @Size(max = 255)
    @Column(name = "path", nullable = false)
    private String path;

    @NotNull
    @Column(name = "movie_class", nullable = false)
    private MovieClass movieClass;

    @NotNull
    @Size(max = 255)
    @Column(name = "original_file", nullable = false)
    private String originalFile;

    /** filename template with full path */
    @NotNull
    @Size(max = 255)
    @Column(name = "file_template", nullable = false)
    private String fileTemplate;

    /** (s) duration of each file (must be equal) */
    @Positive
    @Column(name = "file_duration", nullable = false)
    private float fileDuration;

    @NotNull
    @Size(max = 255)
    @Column(name = "codec", nullable = false)
    private String codec = DEFAULT_CODEC;

    /** full movie title */
    @NotNull
    @Size(max = 255)
    @Column(name = "movie_description", nullable = false)
    private String movieDescription;

    /** frames per second */
    @Positive
    @Column(name = "frame_rate", nullable = false)
    private float frameRate = DEFAULT_FRAME_RATE;

    @Positive
    @Column(name = "frame_width", nullable = false)
    private int frameWidth = DEFAULT_FRAME_WIDTH;

    @Positive
    @Column(name = "frame_height", nullable = false)
    private int frameHeight = DEFAULT_FRAME_HEIGHT;

    /** movie parameters for parametric models */
    @Lob
    @Column(name = "params")
    private byte[] params;

    protected MovieAsset() {}

    public MovieAsset(String movieName, MovieClass movieClass) {
        this.movieName = movieName;
        this.movieClass = movieClass;
    }

    public String getMovieName() { return movieName; }
    public String getPath() { return path; }
    public MovieClass getMovieClass() { return movieClass; }
    public String getOriginalFile() { return originalFile; }
    public String getFileTemplate() { return fileTemplate; }
    public float getFileDuration() { return fileDuration; }
    public String getCodec() { return codec; }
    public String getMovieDescription() { return movieDescription; }
    public float getFrameRate() { return frameRate; }
    public int getFrameWidth() { return frameWidth; }
    public int getFrameHeight() { return frameHeight; }
    public byte[] getParams() { return params; }

    public MovieAsset setPath(String path) { this.path = path; return this; }
    public MovieAsset setMovieClass(MovieClass movieClass) { this.movieClass = movieClass; return this; }
    public MovieAsset setOriginalFile(String originalFile) { this.originalFile = originalFile; return this; }
    public MovieAsset setFileTemplate(String fileTemplate) { this.fileTemplate = fileTemplate; return this; }
    public MovieAsset setFileDuration(float fileDuration) { this.fileDuration = fileDuration; return this; }
    public MovieAsset setCodec(String codec) { this.codec = codec; return this; }
    public MovieAsset setMovieDescription(String movieDescription) { this.movieDescription = movieDescription; return this; }
    public MovieAsset setFrameRate(float frameRate) { this.frameRate = frameRate; return this; }
    public MovieAsset setFrameWidth(int frameWidth) { this.frameWidth = frameWidth; return this; }
    public MovieAsset setFrameHeight(int frameHeight) { this.frameHeight = frameHeight; return this; }
    public MovieAsset setParams(byte[] params) { this.params = params; return this; }
}

package com.project.imaging.pipeline.exceptions;

/** Unknown or duplicate movie, or an unusable file template. */
public class MovieCatalogException extends RuntimeException {
    public MovieCatalogException(String message) { super(message); }
    public MovieCatalogException(String message, Throwable cause) { super(message, cause); }
}

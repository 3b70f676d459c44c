package com.project.imaging.pipeline.exceptions;

/** Bad or missing upstream data for a key; the whole key is abandoned. */
public class CoordinateExtractionException extends RuntimeException {
    public CoordinateExtractionException(String message) { super(message); }
    public CoordinateExtractionException(String message, Throwable cause) { super(message, cause); }
}

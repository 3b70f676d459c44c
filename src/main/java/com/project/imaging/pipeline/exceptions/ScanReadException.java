package com.project.imaging.pipeline.exceptions;

/** Failure locating or decoding a raw scan file's metadata. */
public class ScanReadException extends RuntimeException {
    public ScanReadException(String message) { super(message); }
    public ScanReadException(String message, Throwable cause) { super(message, cause); }
}

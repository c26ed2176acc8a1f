package com.featuredetect.SIFT;

/**
 * Thrown when a detector is configured with parameters the pipeline cannot run with.
 */
public class InvalidSiftParametersException extends IllegalArgumentException {

    public InvalidSiftParametersException(String message) {
        super(message);
    }
}

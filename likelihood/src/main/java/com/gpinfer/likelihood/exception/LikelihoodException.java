package com.gpinfer.likelihood.exception;

/**
 * Base type for input-validation failures raised by likelihood components.
 */
public class LikelihoodException extends IllegalArgumentException {

    public LikelihoodException(String message) {
        super(message);
    }
}

package com.gpinfer.likelihood.exception;

/**
 * Thrown when two vectors that are consumed element by element differ in length.
 */
public class ShapeMismatchException extends LikelihoodException {

    public ShapeMismatchException(String firstName, int firstLength, String secondName, int secondLength) {
        super(firstName + " and " + secondName + " must have the same length (" + firstLength + " != "
                + secondLength + ")");
    }
}

package com.gpinfer.likelihood.exception;

/**
 * Thrown when a label vector holds a value other than -1 or +1.
 */
public class LabelDomainException extends LikelihoodException {

    private final int index;
    private final double value;

    public LabelDomainException(String likelihoodType, int index, double value) {
        super(likelihoodType + ": the class labels have to be {-1,1}, found " + value + " at index " + index);
        this.index = index;
        this.value = value;
    }

    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }
}

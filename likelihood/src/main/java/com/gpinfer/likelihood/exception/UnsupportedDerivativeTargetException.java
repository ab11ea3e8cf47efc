package com.gpinfer.likelihood.exception;

public class UnsupportedDerivativeTargetException extends LikelihoodException {

    private final String target;

    public UnsupportedDerivativeTargetException(String likelihoodType, String target) {
        super(likelihoodType + ": derivatives are only available with respect to 'latent', got '" + target + "'");
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}

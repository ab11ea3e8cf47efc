package com.gpinfer.likelihood.record;

import java.util.ArrayList;
import java.util.List;

/**
 * History of likelihood hyperparameters, one packed vector per recorded
 * sample. Used by chain recorders that keep the state of every iteration.
 */
public class LikelihoodRecord {
    private String type;
    private final List<double[]> parameters = new ArrayList<>();

    public LikelihoodRecord() {
    }

    public LikelihoodRecord(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public List<double[]> getParameters() {
        List<double[]> copy = new ArrayList<>(parameters.size());
        for (double[] p : parameters) {
            copy.add(p.clone());
        }
        return copy;
    }

    public void setParameters(List<double[]> parameters) {
        this.parameters.clear();
        if (parameters != null) {
            for (double[] p : parameters) {
                this.parameters.add(p != null ? p.clone() : new double[0]);
            }
        }
    }

    /**
     * Stores {@code packed} at {@code index}, padding any skipped indices
     * with empty vectors.
     */
    public void put(int index, double[] packed) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Record index must be non-negative, got " + index);
        }
        while (parameters.size() <= index) {
            parameters.add(new double[0]);
        }
        parameters.set(index, packed.clone());
    }

    public double[] get(int index) {
        return parameters.get(index).clone();
    }

    public int size() {
        return parameters.size();
    }
}

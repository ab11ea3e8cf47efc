package com.gpinfer.likelihood;

import com.gpinfer.math.NormalMath;

public class LikelihoodConfig {
    public String type = ProbitLikelihood.TYPE;
    // reject y/f (and Ef/Varf) of different length instead of using the common prefix
    public boolean strictShapes = true;
    // arguments at or below this use the asymptotic normal tail expansion
    public double tailThreshold = NormalMath.DEFAULT_TAIL_THRESHOLD;

    public LikelihoodConfig() {
    }

    public LikelihoodConfig(String type, boolean strictShapes, double tailThreshold) {
        this.type = type;
        this.strictShapes = strictShapes;
        this.tailThreshold = tailThreshold;
    }

    public static LikelihoodConfig defaults() {
        return new LikelihoodConfig(ProbitLikelihood.TYPE, true, NormalMath.DEFAULT_TAIL_THRESHOLD);
    }

    public LikelihoodConfig copy() {
        return new LikelihoodConfig(
                this.type,
                this.strictShapes,
                this.tailThreshold);
    }

    @Override
    public String toString() {
        return "LikelihoodConfig{" +
                "type='" + type + '\'' +
                ", strictShapes=" + strictShapes +
                ", tailThreshold=" + tailThreshold +
                '}';
    }
}

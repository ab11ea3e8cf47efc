package com.gpinfer.likelihood;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public class LikelihoodFactory {

    private static final Logger logger = LoggerFactory.getLogger(LikelihoodFactory.class);

    public static Likelihood create(LikelihoodConfig config) {
        LikelihoodConfig cfg = config != null ? config.copy() : LikelihoodConfig.defaults();
        String type = cfg.type;

        if (type == null || type.trim().isEmpty()) {
            logger.warn("Likelihood type not specified, defaulting to '{}'", ProbitLikelihood.TYPE);
            type = ProbitLikelihood.TYPE;
        }

        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case ProbitLikelihood.TYPE:
                return new ProbitLikelihood(cfg);
            default:
                logger.warn("Unknown likelihood type '{}', defaulting to '{}'", type, ProbitLikelihood.TYPE);
                return new ProbitLikelihood(cfg);
        }
    }

    public static Likelihood create(String type) {
        LikelihoodConfig cfg = LikelihoodConfig.defaults();
        cfg.type = type;
        return create(cfg);
    }

    // Uses likelihood_config.json and any system property overrides.
    public static Likelihood createFromClasspath() {
        return create(LikelihoodConfigLoader.load());
    }
}

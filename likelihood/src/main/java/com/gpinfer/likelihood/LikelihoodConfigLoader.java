package com.gpinfer.likelihood;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Resolves the {@link LikelihoodConfig}: system properties first, then the
 * JSON file on the classpath, then built-in defaults.
 */
public class LikelihoodConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(LikelihoodConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/likelihood_config.json";
    public static final String TYPE_PROPERTY = "gpinfer.likelihood.type";
    public static final String STRICT_SHAPES_PROPERTY = "gpinfer.likelihood.strictShapes";

    public static LikelihoodConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static LikelihoodConfig load(String resource) {
        LikelihoodConfig config;
        try (InputStream is = LikelihoodConfigLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                logger.info("{} not found on classpath, using default likelihood configuration", resource);
                config = LikelihoodConfig.defaults();
            } else {
                config = read(is);
                logger.debug("Loaded likelihood configuration from {}", resource);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read likelihood configuration " + resource, e);
        }

        applySystemOverrides(config);
        logger.debug("Resolved {}", config);
        return config;
    }

    public static LikelihoodConfig read(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        LikelihoodConfig config = mapper.readValue(jsonStream, LikelihoodConfig.class);
        return config != null ? config : LikelihoodConfig.defaults();
    }

    private static void applySystemOverrides(LikelihoodConfig config) {
        String type = System.getProperty(TYPE_PROPERTY);
        if (type != null && !type.isEmpty()) {
            logger.debug("Likelihood type overridden by {}={}", TYPE_PROPERTY, type);
            config.type = type;
        }

        String strict = System.getProperty(STRICT_SHAPES_PROPERTY);
        if (strict != null && !strict.isEmpty()) {
            logger.debug("Shape checking overridden by {}={}", STRICT_SHAPES_PROPERTY, strict);
            config.strictShapes = Boolean.parseBoolean(strict);
        }
    }
}

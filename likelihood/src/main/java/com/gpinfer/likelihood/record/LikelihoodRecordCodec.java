package com.gpinfer.likelihood.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;

public class LikelihoodRecordCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String toJson(LikelihoodRecord record) {
        if (record == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize likelihood record", e);
        }
    }

    public static LikelihoodRecord fromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readValue(json, LikelihoodRecord.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse likelihood record", e);
        }
    }
}

package com.ctlchecker.loader.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Settings for loading structures and reporting verdicts. Callers construct it directly or
 * start from {@link #defaults()}.
 *
 * @param failOnUnknownProperties reject documents with fields other than atoms/states/starts/trans
 * @param maxListedStates         cap on state names printed per set in a text verdict
 */
public record LoaderConfig(boolean failOnUnknownProperties, int maxListedStates) {

    public static final boolean DEFAULT_FAIL_ON_UNKNOWN = true;
    public static final int DEFAULT_MAX_LISTED = 20;

    public LoaderConfig {
        if (maxListedStates < 1) {
            throw new IllegalArgumentException("maxListedStates must be positive, got " + maxListedStates);
        }
    }

    public static LoaderConfig defaults() {
        return new LoaderConfig(DEFAULT_FAIL_ON_UNKNOWN, DEFAULT_MAX_LISTED);
    }

    public LoaderConfig withFailOnUnknownProperties(boolean fail) {
        return new LoaderConfig(fail, maxListedStates);
    }

    public LoaderConfig withMaxListedStates(int max) {
        return new LoaderConfig(failOnUnknownProperties, max);
    }

    /** The mapper shared by the loader, the writer and the reporter. */
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, failOnUnknownProperties);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}

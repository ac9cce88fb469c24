package com.caserunner.util;

import com.caserunner.executor.CaseConfigException;
import com.caserunner.model.CaseDefinition;
import com.caserunner.model.CaseResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON binding for case definitions and case results.
 *
 * Timestamps are written as ISO-8601 strings. A problem is written with its
 * category and formatted message only.
 */
public final class CaseResults {

    private static final Logger log = LoggerFactory.getLogger(CaseResults.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private CaseResults() {}

    public static String toJson(CaseResult result) {
        return write(result);
    }

    public static String toJson(List<CaseResult> results) {
        return write(results);
    }

    /**
     * Binds one case definition from JSON, e.g. one a suite loader produced
     * from its own source format.
     *
     * @throws CaseConfigException if the JSON does not describe a case
     */
    public static CaseDefinition readDefinition(String json) {
        try {
            return MAPPER.readValue(json, CaseDefinition.class);
        } catch (JsonProcessingException e) {
            log.error("CaseResults: could not read case definition: {}", e.getOriginalMessage());
            throw new CaseConfigException("could not read case definition: " + e.getOriginalMessage(), e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("CaseResults: could not serialise {}: {}", value, e.getMessage());
            throw new UncheckedIOException(e);
        }
    }
}

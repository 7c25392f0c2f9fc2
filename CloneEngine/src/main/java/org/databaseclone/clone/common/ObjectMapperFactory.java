package org.databaseclone.clone.common;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public class ObjectMapperFactory {
    private static final int MAX_STRING_LENGTH = 100 * 1024 * 1024; // ~100 MB

    /**
     * Returns a default ObjectMapper with fail-on-unknown-properties disabled.  Floating point
     * values are read as BigDecimal, trailing zeros included, so document numbers survive a copy
     * unchanged.
     */
    public static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .build();
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        mapper.getFactory()
            .setStreamReadConstraints(StreamReadConstraints.builder()
                .maxStringLength(MAX_STRING_LENGTH)
                .build());
        return mapper;
    }

    private ObjectMapperFactory() {
        // Prevent instantiation
    }
}

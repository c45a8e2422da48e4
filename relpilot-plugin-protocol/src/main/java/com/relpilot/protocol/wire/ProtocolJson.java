package com.relpilot.protocol.wire;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Jackson mapper for the JSON carried inside wire messages (config, outputs, log data) and for
 * audit records. Unknown properties are ignored and unknown enum constants fall back to the
 * enum's declared default so newer peers stay readable.
 */
public final class ProtocolJson {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true);

    public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ProtocolJson() {
    }
}

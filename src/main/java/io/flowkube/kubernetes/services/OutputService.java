package io.flowkube.kubernetes.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * "Maybe JSON" formatting applied to all captured output.
 */
@Slf4j
public abstract class OutputService {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * @return the parsed value (maps, lists, numbers, booleans, strings) when the whole text is one JSON value,
     *     the text unchanged otherwise, including when it is blank
     */
    public static Object format(String output) {
        if (output == null || output.isBlank()) {
            return output;
        }

        try {
            JsonNode node = MAPPER.readTree(output);
            return MAPPER.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            log.trace("Output is not valid JSON, returning raw string");
            return output;
        }
    }
}

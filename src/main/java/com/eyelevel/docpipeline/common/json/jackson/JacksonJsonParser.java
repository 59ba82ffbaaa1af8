package com.eyelevel.docpipeline.common.json.jackson;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link JsonParser} backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(final String json, final Class<T> valueType) {
        if (json == null) {
            throw new JsonParsingException("Cannot parse null JSON into " + valueType.getSimpleName(), null);
        }
        return parseObject(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(final byte[] jsonBytes, final Class<T> valueType) {
        log.debug("Parsing JSON ({} bytes) to object of type: {}", jsonBytes.length, valueType.getName());
        try {
            final T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}

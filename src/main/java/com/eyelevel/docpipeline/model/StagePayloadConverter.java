package com.eyelevel.docpipeline.model;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.common.json.JsonSerializer;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a {@link StagePayload} as a JSON text column.
 * <p>
 * Hibernate obtains converters through Spring's bean container, so the application's JSON components are
 * injected here like in any other bean.
 */
@Converter
@RequiredArgsConstructor
public class StagePayloadConverter implements AttributeConverter<StagePayload, String> {

    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;

    @Override
    public String convertToDatabaseColumn(final StagePayload payload) {
        if (payload == null) {
            return null;
        }
        return jsonSerializer.serialize(payload.asMap());
    }

    @Override
    @SuppressWarnings("unchecked")
    public StagePayload convertToEntityAttribute(final String json) {
        if (json == null || json.isBlank()) {
            return new StagePayload();
        }
        // untyped JSON objects come back as LinkedHashMap<String, Object>, keeping the stored key order
        return new StagePayload((Map<String, ?>) jsonParser.parseObject(json, LinkedHashMap.class));
    }
}

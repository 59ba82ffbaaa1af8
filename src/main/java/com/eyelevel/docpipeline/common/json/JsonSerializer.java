package com.eyelevel.docpipeline.common.json;

/**
 * Serializes Java objects into JSON text.
 */
public interface JsonSerializer {

    /**
     * Compact serialization.
     *
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the object cannot be serialized.
     */
    <T> String serialize(T object);

    /**
     * @param prettyPrint whether to indent the output (two spaces per level).
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the object cannot be serialized.
     */
    <T> String serialize(T object, boolean prettyPrint);
}

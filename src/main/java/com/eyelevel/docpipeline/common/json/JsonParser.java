package com.eyelevel.docpipeline.common.json;

/**
 * Parses JSON documents (queue message bodies, stored payloads) into Java objects.
 *
 * <p>Callers depend on this interface rather than on a concrete JSON library.
 */
public interface JsonParser {

    /**
     * Parses JSON text into an object of the given type.
     *
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the text is not valid JSON
     *                                                                      for the type.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses UTF-8 encoded JSON bytes into an object of the given type.
     *
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the bytes are not valid JSON
     *                                                                      for the type.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}

package com.barte.sdk.decode;

/** Decodes one JSON object, typically an element of an array or page. */
@FunctionalInterface
public interface ElementDecoder<T> {
    T decode(JsonFields fields) throws DecodingException;
}

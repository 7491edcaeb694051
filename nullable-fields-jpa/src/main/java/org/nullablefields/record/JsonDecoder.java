package org.nullablefields.record;

/**
 * Decode capability a record can expose for its structured (JSON-encoded) attributes.
 * Implementations return {@code null} for input they cannot decode.
 */
@FunctionalInterface
public interface JsonDecoder {
    Object fromJson(String json);
}

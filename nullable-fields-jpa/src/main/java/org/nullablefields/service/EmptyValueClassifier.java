package org.nullablefields.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nullablefields.model.enums.FieldKind;
import org.nullablefields.record.JsonDecoder;
import org.nullablefields.record.NullableAttributes;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Decides whether an attribute value is empty and, if so, replaces it with {@code null}.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *     <li>Structured attribute: the value is decoded (unless the record has a set mutator for it, in which
 *     case the value is taken as stored) and is empty when the result is {@code null}, an empty
 *     collection, map or array, or blank text. A non-empty result is returned decoded.</li>
 *     <li>Collection, map or array: empty when it has no elements.</li>
 *     <li>Text: empty when it trims to {@code ""}. Other scalars are never empty.</li>
 * </ol>
 * Non-empty values are returned untouched, text is never trimmed.
 */
@Slf4j
@RequiredArgsConstructor
public class EmptyValueClassifier {

    private final ObjectMapper objectMapper;

    public Object nullIfEmpty(Object value) {
        return FieldKind.ofValue(value).isEmpty(value) ? null : value;
    }

    public Object nullIfEmpty(NullableAttributes record, Object value, String key) {
        if (key == null) {
            return nullIfEmpty(value);
        }
        FieldKind kind = record.kindOf(key, value);
        if (kind == FieldKind.STRUCTURED) {
            Object candidate = record.hasSetMutator(key) ? value : decode(record, value);
            return kind.isEmpty(candidate) ? null : candidate;
        }
        return kind.isEmpty(value) ? null : value;
    }

    private Object decode(NullableAttributes record, Object value) {
        if (!(value instanceof CharSequence text)) {
            return value;
        }
        Optional<JsonDecoder> decoder = record.jsonDecoder();
        return decoder.isPresent() ? decoder.get().fromJson(text.toString()) : readJson(text.toString());
    }

    private Object readJson(String json) {
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JacksonException e) {
            log.warn("Could not decode JSON attribute value, treating it as empty: {}", e.getMessage());
            return null;
        }
    }
}

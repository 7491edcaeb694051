package org.nullablefields.record;

import org.nullablefields.model.enums.FieldKind;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * What a record has to expose so that its empty nullable attributes can be turned into {@code null}
 * before it is saved.
 *
 * <p>The attribute map is a snapshot keyed by attribute name; values may be {@code null}.
 * {@link #setRawAttribute(String, Object)} writes straight into the record's storage and must not go
 * through any custom setter logic.</p>
 */
public interface NullableAttributes {

    Map<String, Object> getAttributes();

    /**
     * Names of the attributes eligible for normalization. {@code null} or empty means none.
     */
    Collection<String> getNullableFields();

    /** Whether the attribute is persisted as JSON-encoded text. */
    boolean isJsonCastable(String key);

    /** Whether the record carries its own assignment logic for the attribute. */
    boolean hasSetMutator(String key);

    void setRawAttribute(String key, Object value);

    /**
     * Kind used to judge emptiness of the attribute. Hosts with static field types should override this
     * so the kind comes from the declaration rather than from the current value.
     */
    default FieldKind kindOf(String key, Object value) {
        return isJsonCastable(key) ? FieldKind.STRUCTURED : FieldKind.ofValue(value);
    }

    /**
     * The record's own decoder for structured text. When empty, a generic JSON decode is used.
     */
    default Optional<JsonDecoder> jsonDecoder() {
        return Optional.empty();
    }
}

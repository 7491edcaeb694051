package org.nullablefields.service;

import lombok.extern.slf4j.Slf4j;
import org.nullablefields.entity.EntityAttributes;
import org.nullablefields.record.NullableAttributes;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class NullableFieldsNormalizer {

    private final EmptyValueClassifier classifier;
    private final boolean enabled;

    public NullableFieldsNormalizer(EmptyValueClassifier classifier, boolean enabled) {
        this.classifier = classifier;
        this.enabled = enabled;
    }

    public static NullableFieldsNormalizer withDefaults() {
        return new NullableFieldsNormalizer(new EmptyValueClassifier(new ObjectMapper()), true);
    }

    /**
     * Normalizes a mapped entity in place. Call this right before handing the entity to a repository
     * when the entity type is not registered with {@code NullableFieldsListener}.
     */
    public void normalize(Object entity) {
        setNullableFields(EntityAttributes.of(entity));
    }

    /**
     * Sets every empty nullable attribute of the record to {@code null}.
     */
    public void setNullableFields(NullableAttributes record) {
        if (!enabled) {
            log.debug("Nullable field normalization is disabled, leaving {} as is", record);
            return;
        }
        List<String> nulled = new ArrayList<>();
        nullableFromAttributes(record).forEach((key, value) -> {
            Object normalized = classifier.nullIfEmpty(record, value, key);
            if (normalized != value) {
                record.setRawAttribute(key, normalized);
                if (normalized == null) {
                    nulled.add(key);
                }
            }
        });
        if (!nulled.isEmpty()) {
            log.debug("Set empty attributes {} to null on {}", nulled, record);
        }
    }

    Map<String, Object> nullableFromAttributes(NullableAttributes record) {
        Collection<String> declared = record.getNullableFields();
        if (declared == null || declared.isEmpty()) {
            return Map.of();
        }
        Set<String> nullable = new HashSet<>(declared);
        Map<String, Object> result = new LinkedHashMap<>();
        record.getAttributes().forEach((key, value) -> {
            if (nullable.contains(key)) {
                result.put(key, value);
            }
        });
        return result;
    }
}

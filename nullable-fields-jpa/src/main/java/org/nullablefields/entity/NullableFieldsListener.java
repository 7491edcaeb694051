package org.nullablefields.entity;

import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import org.nullablefields.service.NullableFieldsNormalizer;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * JPA entity listener that normalizes {@link NullableFields} right before every insert and update.
 * Register it on the entity type with {@code @EntityListeners(NullableFieldsListener.class)}.
 */
public class NullableFieldsListener {

    private final NullableFieldsNormalizer normalizer;

    public NullableFieldsListener() {
        this(NullableFieldsNormalizer.withDefaults());
    }

    @Autowired
    public NullableFieldsListener(NullableFieldsNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @PrePersist
    @PreUpdate
    public void beforeSave(Object entity) {
        normalizer.normalize(entity);
    }
}

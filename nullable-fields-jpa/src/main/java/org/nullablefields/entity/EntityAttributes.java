package org.nullablefields.entity;

import org.hibernate.Hibernate;
import org.nullablefields.entity.EntityAttributeMetadata.AttributeDescriptor;
import org.nullablefields.model.enums.FieldKind;
import org.nullablefields.record.JsonDecoder;
import org.nullablefields.record.NullableAttributes;
import org.springframework.util.ReflectionUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link NullableAttributes} over a mapped entity. Attributes are read from and written to the entity's
 * fields directly, so setters never run for a normalized value.
 */
public final class EntityAttributes implements NullableAttributes {

    private final Object entity;
    private final EntityAttributeMetadata metadata;

    private EntityAttributes(Object entity, EntityAttributeMetadata metadata) {
        this.entity = entity;
        this.metadata = metadata;
    }

    public static EntityAttributes of(Object entity) {
        Object target = Hibernate.unproxy(entity);
        return new EntityAttributes(target, EntityAttributeMetadata.forType(target.getClass()));
    }

    @Override
    public Map<String, Object> getAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        metadata.getAttributes().forEach((name, descriptor) ->
                attributes.put(name, ReflectionUtils.getField(descriptor.field(), entity)));
        return attributes;
    }

    @Override
    public Collection<String> getNullableFields() {
        return metadata.getNullableFields();
    }

    @Override
    public boolean isJsonCastable(String key) {
        AttributeDescriptor descriptor = metadata.attribute(key);
        return descriptor != null && descriptor.structured();
    }

    @Override
    public boolean hasSetMutator(String key) {
        AttributeDescriptor descriptor = metadata.attribute(key);
        return descriptor != null && descriptor.setMutator();
    }

    @Override
    public FieldKind kindOf(String key, Object value) {
        AttributeDescriptor descriptor = metadata.attribute(key);
        return descriptor != null ? descriptor.kindOf(value) : FieldKind.ofValue(value);
    }

    @Override
    public Optional<JsonDecoder> jsonDecoder() {
        return entity instanceof JsonDecoder decoder ? Optional.of(decoder) : Optional.empty();
    }

    @Override
    public void setRawAttribute(String key, Object value) {
        AttributeDescriptor descriptor = metadata.attribute(key);
        if (descriptor == null) {
            throw new IllegalArgumentException("No persistent field '" + key + "' on " + metadata.getEntityType().getName());
        }
        if (value != null && isJsonText(descriptor)) {
            // the column's text already encodes the decoded value
            return;
        }
        ReflectionUtils.setField(descriptor.field(), entity, value);
    }

    private static boolean isJsonText(AttributeDescriptor descriptor) {
        return descriptor.structured() && descriptor.field().getType() == String.class;
    }

    @Override
    public String toString() {
        return metadata.getEntityType().getSimpleName();
    }
}

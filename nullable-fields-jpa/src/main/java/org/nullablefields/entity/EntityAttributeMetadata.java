package org.nullablefields.entity;

import jakarta.persistence.Convert;
import jakarta.persistence.Transient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.nullablefields.convertor.JsonAttributeConverter;
import org.nullablefields.model.enums.FieldKind;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ReflectionUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-type view of an entity's persistent fields, resolved once and cached.
 */
@Slf4j
@Getter
public final class EntityAttributeMetadata {

    private static final Map<Class<?>, EntityAttributeMetadata> CACHE = new ConcurrentHashMap<>();

    private final Class<?> entityType;
    private final Map<String, AttributeDescriptor> attributes;
    private final Set<String> nullableFields;

    private EntityAttributeMetadata(Class<?> entityType, Map<String, AttributeDescriptor> attributes, Set<String> nullableFields) {
        this.entityType = entityType;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.nullableFields = Collections.unmodifiableSet(nullableFields);
    }

    public static EntityAttributeMetadata forType(Class<?> entityType) {
        return CACHE.computeIfAbsent(entityType, EntityAttributeMetadata::inspect);
    }

    public AttributeDescriptor attribute(String name) {
        return attributes.get(name);
    }

    /**
     * @param declaredKind kind taken from the field type, {@code null} for fields declared as {@code Object}
     */
    public record AttributeDescriptor(Field field, FieldKind declaredKind, boolean structured, boolean setMutator) {

        public FieldKind kindOf(Object value) {
            return declaredKind != null ? declaredKind : FieldKind.ofValue(value);
        }
    }

    private static EntityAttributeMetadata inspect(Class<?> entityType) {
        Map<String, Field> fields = new LinkedHashMap<>();
        ReflectionUtils.doWithFields(entityType,
                field -> fields.putIfAbsent(field.getName(), field),
                EntityAttributeMetadata::isPersistent);

        Set<String> mutated = findSetMutators(entityType, fields.keySet());

        Map<String, AttributeDescriptor> attributes = new LinkedHashMap<>();
        fields.forEach((name, field) -> {
            ReflectionUtils.makeAccessible(field);
            boolean structured = isStructured(field);
            FieldKind declaredKind = structured ? FieldKind.STRUCTURED
                    : field.getType() == Object.class ? null : FieldKind.ofType(field.getType());
            attributes.put(name, new AttributeDescriptor(field, declaredKind, structured, mutated.contains(name)));
        });

        Set<String> nullable = new LinkedHashSet<>();
        NullableFields declaration = AnnotatedElementUtils.findMergedAnnotation(entityType, NullableFields.class);
        if (declaration != null) {
            for (String name : declaration.value()) {
                if (!attributes.containsKey(name)) {
                    throw new IllegalStateException("@NullableFields on " + entityType.getName()
                            + " names '" + name + "', which is not a persistent field");
                }
                nullable.add(name);
            }
        }
        log.debug("Resolved {} attributes for {}, nullable: {}", attributes.size(), entityType.getSimpleName(), nullable);
        return new EntityAttributeMetadata(entityType, attributes, nullable);
    }

    private static boolean isPersistent(Field field) {
        int modifiers = field.getModifiers();
        return !Modifier.isStatic(modifiers)
                && !Modifier.isTransient(modifiers)
                && !field.isSynthetic()
                && !field.getName().startsWith("$$_")
                && !field.isAnnotationPresent(Transient.class);
    }

    private static boolean isStructured(Field field) {
        Convert convert = field.getAnnotation(Convert.class);
        if (convert != null && !convert.disableConversion() && JsonAttributeConverter.class.isAssignableFrom(convert.converter())) {
            return true;
        }
        JdbcTypeCode typeCode = field.getAnnotation(JdbcTypeCode.class);
        return typeCode != null && typeCode.value() == SqlTypes.JSON;
    }

    private static Set<String> findSetMutators(Class<?> entityType, Set<String> fieldNames) {
        Set<String> mutated = new HashSet<>();
        for (Method method : ReflectionUtils.getUniqueDeclaredMethods(entityType)) {
            SetMutator mutator = method.getAnnotation(SetMutator.class);
            if (mutator == null) {
                continue;
            }
            String name = StringUtils.hasText(mutator.value()) ? mutator.value() : propertyName(method);
            if (name == null || !fieldNames.contains(name)) {
                throw new IllegalStateException("@SetMutator on " + entityType.getName() + "." + method.getName()
                        + " does not match a persistent field");
            }
            mutated.add(name);
        }
        return mutated;
    }

    private static String propertyName(Method method) {
        String name = method.getName();
        if (name.length() > 3 && name.startsWith("set")) {
            return StringUtils.uncapitalize(name.substring(3));
        }
        return null;
    }
}

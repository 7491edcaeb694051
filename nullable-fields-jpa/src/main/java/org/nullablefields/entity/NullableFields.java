package org.nullablefields.entity;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares which attributes of an entity are saved as {@code null} when they are empty.
 *
 * <pre>
 * &#64;Entity
 * &#64;EntityListeners(NullableFieldsListener.class)
 * &#64;NullableFields({"middleName", "tags"})
 * public class ContactEntity { ... }
 * </pre>
 *
 * Names are Java field names and must refer to persistent fields of the annotated type.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface NullableFields {
    String[] value();
}

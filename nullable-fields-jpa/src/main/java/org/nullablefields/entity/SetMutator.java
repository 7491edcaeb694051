package org.nullablefields.entity;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a setter that carries its own assignment logic. For structured attributes the stored value is
 * then judged as it is, without decoding it first.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface SetMutator {

    /** Attribute name. Derived from the method name ({@code setFooBar} -> {@code fooBar}) when empty. */
    String value() default "";
}

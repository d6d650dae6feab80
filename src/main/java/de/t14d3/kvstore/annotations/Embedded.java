package de.t14d3.kvstore.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Stores the referenced {@link Embeddable} inline, as a nested map inside the owner's record.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Embedded {
    /**
     * The embeddable class. Defaults to the declared type of the field.
     */
    Class<?> target() default void.class;
}

package de.t14d3.kvstore.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as an entity that can be stored in a key-value storage.
 * <p>
 * Every entity needs at least one field annotated with {@link Id}. All other
 * non-static fields are persisted unless they are {@link Transient}; fields
 * annotated with {@link Embedded} are stored inline in the owning record.
 *
 * @see Id
 * @see Embedded
 * @see Transient
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Entity {
    /**
     * The name of the storage (table, collection, bucket) holding records of this type.
     * Defaults to the lower-cased simple class name.
     */
    String storageName() default "";
}

package com.a2a.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as an A2A plugin. The plugin locator reads it from builtin classes to derive the
 * registry id without instantiating the class, and uses {@link #displayName()} for listings.
 * Extension classes named in a {@code META-INF/a2a/<slot>.properties} manifest get their id from the
 * manifest; the annotation is optional there.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface A2aPlugin {

    /** Short registry id (e.g. "echo", "azure_openai", "native"). */
    String id();

    /** Plugin slot the class belongs to: "providers" or "frameworks". */
    String slot();

    /** Human-friendly name. */
    String displayName() default "";

    /** Optional description. */
    String description() default "";
}

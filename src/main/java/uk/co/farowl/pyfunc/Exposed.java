// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Annotations that may be placed on elements of a Java class intended
 * as the implementation of a Python type, and that the {@link Exposer}
 * will look for during the definition of a {@link PyType}.
 */
interface Exposed {

    /**
     * Specify the documentation string ({@code __doc__}) for an
     * attribute defined in Java and exposed to Python.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface DocString { String value(); }

    /**
     * Identify a method as that to be called during a Python call to
     * {@code __getattribute__} naming an exposed attribute.
     * <p>
     * The signature must be {@code ()T} for some reference type
     * {@code T}.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Getter {
        /**
         * Exposed name of the attribute, if different from the Java
         * method name. This name will relate the {@link Setter} and
         * {@link Deleter} in a single descriptor.
         *
         * @return name of the attribute
         */
        String value() default "";
    }

    /**
     * Identify a method as that to be called during a Python call to
     * {@code __setattr__} naming an exposed attribute.
     * <p>
     * The signature must be {@code (Object)void}. The method is
     * responsible for checking the type of the value.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Setter {
        /**
         * Exposed name of the attribute, if different from the Java
         * method name. This name will relate the {@link Getter} and
         * {@link Deleter} in a single descriptor.
         *
         * @return name of the attribute
         */
        String value() default "";
    }

    /**
     * Identify a method as that to be called during a Python call to
     * {@code __delattr__} naming an exposed attribute.
     * <p>
     * The signature must be {@code ()void}.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Deleter {
        /**
         * Exposed name of the attribute, if different from the Java
         * method name. This name will relate the {@link Getter} and
         * {@link Setter} in a single descriptor.
         *
         * @return name of the attribute
         */
        String value() default "";
    }
}

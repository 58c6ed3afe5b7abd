// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/**
 * Python object implementations that know their Python type implement
 * this interface. Java objects adopted as Python objects (such as
 * {@code String} for {@code str}) do not, and their type is found by
 * {@link PyType#of(Object)}.
 */
public interface PyObject {

    /**
     * The Python {@code type} of this object.
     *
     * @return {@code type} of this object
     */
    PyType getType();
}

// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/**
 * Python objects that implement {@code __get__}, and so act as
 * (non-data) descriptors when found in the dictionary of a type.
 */
public interface WithDescrGet {

    /**
     * The {@code __get__} special method of the Python descriptor
     * protocol. A call with {@code obj == null} signifies the attribute
     * was sought on the {@code type} itself.
     *
     * @param obj object on which the attribute is sought or
     *     {@code null}
     * @param type on which this descriptor was found (may be ignored)
     * @return attribute value, bound object or this attribute
     * @throws Throwable from the implementation of the getter
     */
    Object __get__(Object obj, PyType type) throws Throwable;
}

// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/**
 * A descriptor that defines {@code __set__} and {@code __delete__} as
 * well as {@code __get__}. Found in the dictionary of a type, a data
 * descriptor takes precedence over the instance dictionary.
 */
abstract class DataDescriptor extends Descriptor {

    DataDescriptor(PyType objclass, String name) {
        super(objclass, name);
    }

    /**
     * The {@code __set__} special method of the Python descriptor
     * protocol, implementing {@code obj.name = value}.
     *
     * @param obj object on which the attribute is sought
     * @param value to assign ({@code null} means delete)
     * @throws TypeError if the value is of the wrong type
     * @throws Throwable from the implementation of the setter
     */
    abstract void __set__(Object obj, Object value)
            throws TypeError, Throwable;

    /**
     * The {@code __delete__} special method of the Python descriptor
     * protocol, implementing {@code del obj.name}.
     *
     * @param obj object on which the attribute is sought
     * @throws TypeError if the attribute may not be deleted
     * @throws Throwable from the implementation of the deleter
     */
    abstract void __delete__(Object obj) throws TypeError, Throwable;

    /**
     * {@code descr.__set__(obj, value)} has been called on this
     * descriptor. We must check that the descriptor applies to the type
     * of object supplied as the {@code obj} argument.
     *
     * @param obj target object (argument to {@code __set__})
     * @throws TypeError if descriptor doesn't apply to {@code obj}
     */
    // Compare CPython descr_setcheck in descrobject.c
    protected void checkSet(Object obj) throws TypeError { check(obj); }

    /**
     * {@code descr.__delete__(obj)} has been called on this descriptor.
     * We must check that the descriptor applies to the type of object
     * supplied as the {@code obj} argument.
     *
     * @param obj target object (argument to {@code __delete__})
     * @throws TypeError if descriptor doesn't apply to {@code obj}
     */
    // Compare CPython descr_setcheck in descrobject.c
    protected void checkDelete(Object obj) throws TypeError {
        check(obj);
    }

    /**
     * Create an {@link AttributeError} with a message along the lines
     * "attribute N of 'T' objects is not readable" involving the name N
     * of this attribute and the type T which is
     * {@link Descriptor#objclass}.
     *
     * @return exception to throw
     */
    protected AttributeError cannotReadAttr() {
        return new AttributeError(ATTRIBUTE_IS_NOT, name,
                objclass.getName(), "readable");
    }

    /**
     * Create an {@link AttributeError} with a message along the lines
     * "attribute N of 'T' objects is not writable" involving the name N
     * of this attribute and the type T which is
     * {@link Descriptor#objclass}.
     *
     * @return exception to throw
     */
    protected AttributeError cannotWriteAttr() {
        return new AttributeError(ATTRIBUTE_IS_NOT, name,
                objclass.getName(), "writable");
    }

    /**
     * Create a {@link TypeError} with a message along the lines "cannot
     * delete attribute N from 'T' objects" involving the name N of this
     * attribute and the type T which is {@link Descriptor#objclass},
     * e.g. "cannot delete attribute <u>__name__</u> from
     * '<u>function</u>' objects".
     *
     * @return exception to throw
     */
    protected TypeError cannotDeleteAttr() {
        String msg =
                "cannot delete attribute %.50s from '%.50s' objects";
        return new TypeError(msg, name, objclass.getName());
    }

    private static final String ATTRIBUTE_IS_NOT =
            "attribute '%s' of '%.100s' objects is not %s";
}

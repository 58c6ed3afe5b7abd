// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/**
 * The base class of built-in descriptors. Descriptors populate the
 * dictionary of every type, and mediate access to the attributes of
 * instances.
 */
abstract class Descriptor implements PyObject, WithDescrGet {

    protected static final String DESCRIPTOR_DOESNT_APPLY =
            "descriptor '%s' for '%.100s' objects doesn't apply to a '%.100s' object";

    /**
     * Python {@code type} that defines the attribute being described.
     * This is exposed to Python as {@code __objclass__}.
     */
    // In CPython, called d_type
    protected final PyType objclass;

    /**
     * Name of the object described, e.g. "__code__". This is exposed to
     * Python as {@code __name__}.
     */
    // In CPython, called d_name
    protected final String name;

    /**
     * Create the common part of {@code Descriptor} sub-classes. The
     * Python type of the descriptor is supplied by the sub-class
     * through {@link #getType()}, since descriptors are created while
     * types (even their own) are still being built.
     *
     * @param objclass that defines the attribute being described
     * @param name of the object described as {@code __name__}
     */
    Descriptor(PyType objclass, String name) {
        assert objclass != null;
        this.objclass = objclass;
        assert name != null;
        this.name = name;
    }

    /**
     * Helper for {@code __repr__} implementation. It formats together
     * the {@code kind} argument ("attribute", "method", etc.),
     * {@code this.name} and {@code this.objclass.name}.
     *
     * @param kind description of type (first word in the repr)
     * @return repr as a {@code str}
     */
    String descrRepr(String kind) {
        return String.format("<%s '%.50s' of '%.100s' objects>", kind,
                name, objclass.getName());
    }

    /**
     * {@code descr.__get__(obj, type)} has been called on this
     * descriptor. We must check that the descriptor applies to the type
     * of object supplied as the {@code obj} argument. From Python,
     * anything could be presented, but when we operate on it, we'll be
     * assuming the particular {@link #objclass} type.
     *
     * @param obj target object (non-null argument to {@code __get__})
     * @throws TypeError if descriptor doesn't apply to {@code obj}
     */
    // Compare CPython descr_check in descrobject.c
    protected void check(Object obj) throws TypeError {
        PyType objType = PyType.of(obj);
        if (!objType.isSubTypeOf(objclass)) {
            throw new TypeError(DESCRIPTOR_DOESNT_APPLY, this.name,
                    objclass.getName(), objType.getName());
        }
    }
}

// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/**
 * The "abstract interface" to operations on Python objects. Methods
 * here execute the slot functions of the type definition of the
 * objects passed in. A primary application is to the interpreter
 * (and to tests) which needs to get and set attributes by name
 * without knowing the concrete class of the target.
 */
public class Abstract {

    private Abstract() {} // only static methods here

    /**
     * {@code o.name} with Python semantics.
     *
     * @param o object to operate on
     * @param name of attribute
     * @return {@code o.name}
     * @throws AttributeError if non-existent etc.
     * @throws Throwable on other errors
     */
    // Compare CPython PyObject_GetAttr in object.c
    public static Object getAttr(Object o, String name)
            throws AttributeError, Throwable {
        if (o instanceof PyType) {
            return ((PyType)o).__getattribute__(name);
        } else {
            return PyBaseObject.__getattribute__(o, name);
        }
    }

    /**
     * Python {@code o.name} returning {@code null} when not found (in
     * place of {@code AttributeError} as would
     * {@link #getAttr(Object, String)}). Other exceptions that may be
     * raised in the process propagate.
     *
     * @param o the object in which to look for the attribute
     * @param name of the attribute sought
     * @return the attribute or {@code null}
     * @throws Throwable on other errors than {@code AttributeError}
     */
    // Compare CPython _PyObject_LookupAttr in object.c
    public static Object lookupAttr(Object o, String name)
            throws Throwable {
        try {
            return getAttr(o, name);
        } catch (AttributeError e) {
            return null;
        }
    }

    /**
     * {@code o.name = value} with Python semantics.
     *
     * @param o object to operate on
     * @param name of attribute
     * @param value to set
     * @throws AttributeError if non-existent etc.
     * @throws Throwable on other errors
     */
    // Compare CPython PyObject_SetAttr in object.c
    public static void setAttr(Object o, String name, Object value)
            throws AttributeError, Throwable {
        if (o instanceof PyType) {
            ((PyType)o).__setattr__(name, value);
        } else {
            PyBaseObject.__setattr__(o, name, value);
        }
    }

    /**
     * {@code del o.name} with Python semantics.
     *
     * @param o object to operate on
     * @param name of attribute
     * @throws AttributeError if non-existent etc.
     * @throws Throwable on other errors
     */
    // Compare CPython PyObject_DelAttr in abstract.h
    public static void delAttr(Object o, String name)
            throws AttributeError, Throwable {
        if (o instanceof PyType) {
            ((PyType)o).__delattr__(name);
        } else {
            PyBaseObject.__delattr__(o, name);
        }
    }

    /**
     * Call an object with the classic CPython call arguments.
     *
     * @param callable target
     * @param args positional arguments (or {@code null})
     * @param kwargs keyword arguments (or {@code null})
     * @return the return from the call
     * @throws TypeError if target is not callable
     * @throws Throwable for errors raised in the callable
     */
    // Compare CPython PyObject_Call in call.c
    public static Object call(Object callable, PyTuple args,
            PyDict kwargs) throws TypeError, Throwable {
        if (callable instanceof WithCall) {
            return ((WithCall)callable).__call__(args, kwargs);
        }
        throw typeError("'%.200s' object is not callable", callable);
    }

    /**
     * Call an object with positional arguments only.
     *
     * @param callable target
     * @param args positional arguments
     * @return the return from the call
     * @throws TypeError if target is not callable
     * @throws Throwable for errors raised in the callable
     */
    public static Object call(Object callable, Object... args)
            throws TypeError, Throwable {
        return call(callable, PyTuple.from(args), null);
    }

    // Plumbing -------------------------------------------------------

    /**
     * Create a {@link TypeError} with a message involving the type of
     * {@code o} and optionally other arguments.
     *
     * @param fmt format for message with a {@code %s} first
     * @param o object whose type name will fill the first {@code %s}
     * @param args extra arguments to the formatted message
     * @return exception to throw
     */
    static TypeError typeError(String fmt, Object o, Object... args) {
        Object[] a = new Object[args.length + 1];
        a[0] = PyType.of(o).getName();
        System.arraycopy(args, 0, a, 1, args.length);
        return new TypeError(fmt, a);
    }

    /**
     * Create a {@link AttributeError} with a message along the lines
     * "'T' object has no attribute N", where T is the type of the
     * object accessed.
     *
     * @param v object accessed
     * @param name of attribute
     * @return exception to throw
     */
    static AttributeError noAttributeError(Object v, Object name) {
        String fmt = "'%.50s' object has no attribute '%.50s'";
        return new AttributeError(fmt, PyType.of(v).getName(), name);
    }

    /**
     * Create a {@link AttributeError} with a message along the lines
     * "'T' object attribute N is read-only", where T is the type of the
     * object accessed.
     *
     * @param v object accessed
     * @param name of attribute
     * @return exception to throw
     */
    static AttributeError readonlyAttributeError(Object v,
            Object name) {
        String fmt = "'%.50s' object attribute '%s' is read-only";
        return new AttributeError(fmt, PyType.of(v).getName(), name);
    }

    /**
     * Create a {@link TypeError} with a message along the lines "N must
     * be set to T, not a X object" involving the name N of the
     * attribute, any descriptive phrase T and the type X of
     * {@code value}, e.g. "<u>__dict__</u> must be set to <u>a
     * dictionary</u>, not a '<u>list</u>' object".
     *
     * @param name of the attribute
     * @param kind expected kind of thing
     * @param value provided to set this attribute in some object
     * @return exception to throw
     */
    static TypeError attrMustBe(String name, String kind,
            Object value) {
        String msg = "%.50s must be set to %.50s, not a '%.50s' object";
        return new TypeError(msg, name, kind,
                PyType.of(value).getName());
    }

    /**
     * Create a {@link TypeError} with a message along the lines "N must
     * be set to a string, not a X object".
     *
     * @param name of the attribute
     * @param value provided to set this attribute in some object
     * @return exception to throw
     */
    static TypeError attrMustBeString(String name, Object value) {
        return attrMustBe(name, "a string", value);
    }
}

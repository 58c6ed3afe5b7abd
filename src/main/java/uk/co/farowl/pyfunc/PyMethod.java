// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;

import uk.co.farowl.pyfunc.Exposed.Getter;

/**
 * A Python {@code method} object: a function bound to the instance
 * through which it was found. Calling it calls the function with that
 * instance prepended to the positional arguments.
 */
// Compare CPython PyMethodObject in classobject.c
public class PyMethod implements PyObject, WithCall {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("method", MethodHandles.lookup())
                    .flagNot(PyType.Flag.BASETYPE));

    /** The function that will be called, exposed as {@code __func__}. */
    private final PyFunction func;

    /** The instance bound as first argument, {@code __self__}. */
    private final Object self;

    /**
     * Bind a function to an instance.
     *
     * @param func to be called
     * @param self to be the first argument of every call
     */
    PyMethod(PyFunction func, Object self) {
        assert func != null && self != null;
        this.func = func;
        this.self = self;
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the function called by this method */
    public PyFunction getFunction() { return func; }

    /** @return the object bound as the first argument */
    public Object getSelf() { return self; }

    @Getter
    private Object __func__() { return func; }

    @Getter
    private Object __self__() { return self; }

    @Getter
    private Object __name__() { return func.getName(); }

    @Getter
    private Object __qualname__() { return func.getQualname(); }

    @Getter
    private Object __doc__() { return func.getDoc(); }

    @Override
    public Object __call__(PyTuple args, PyDict kwargs) throws Throwable {
        args = args == null ? Py.tuple(self) : args.prepend(self);
        return func.__call__(args, kwargs);
    }

    // Compare CPython method_richcompare in classobject.c
    @Override
    public boolean equals(Object other) {
        if (other instanceof PyMethod) {
            PyMethod m = (PyMethod)other;
            return self == m.self && func.equals(m.func);
        }
        return false;
    }

    // Compare CPython method_hash in classobject.c
    @Override
    public int hashCode() {
        return System.identityHashCode(self) ^ func.hashCode();
    }

    // Compare CPython method_repr in classobject.c
    @Override
    public String toString() {
        return String.format("<bound method %.100s of %s>",
                func.getQualname(), Py.repr(self));
    }
}

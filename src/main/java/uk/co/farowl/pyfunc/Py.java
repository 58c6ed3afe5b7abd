// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/** Common run-time constants and constructors. */
public class Py {

    private Py() {} // No instances

    /** Python {@code None} object. */
    public static final PyNone None = PyNone.INSTANCE;

    /**
     * Return Python {@code tuple} for array of {@code Object}.
     *
     * @param values to contain
     * @return equivalent {@code tuple} object
     */
    public static PyTuple tuple(Object... values) {
        return PyTuple.from(values);
    }

    /**
     * Return empty Python {@code dict}.
     *
     * @return {@code dict()}
     */
    public static PyDict dict() { return new PyDict(); }

    /**
     * Return the unique numerical identity of a given Python object.
     * Objects with the same id() are identical as long as both exist.
     *
     * @param o the object
     * @return the Python {@code id(o)}
     */
    static int id(Object o) {
        // For the time being identity means:
        return System.identityHashCode(o);
    }

    /**
     * A simplified {@code repr()}: a {@code str} is quoted and anything
     * else is represented by its {@code toString()}.
     *
     * @param o object to represent
     * @return a string representation
     */
    static String repr(Object o) {
        if (o instanceof String) {
            return "'" + o + "'";
        } else {
            return String.valueOf(o);
        }
    }
}

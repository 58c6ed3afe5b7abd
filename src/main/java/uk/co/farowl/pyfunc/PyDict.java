// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * The Python {@code dict} object. The Java API is provided directly by
 * the base class implementing {@code Map}.
 */
public class PyDict extends LinkedHashMap<Object, Object>
        implements PyObject {
    private static final long serialVersionUID = 1L;

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("dict", MethodHandles.lookup()));

    /** Construct an empty {@code dict}. */
    public PyDict() {}

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (Map.Entry<Object, Object> e : entrySet()) {
            sj.add(Py.repr(e.getKey()) + ": " + Py.repr(e.getValue()));
        }
        return sj.toString();
    }
}

// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;

/** The Python {@code None} object. */
public final class PyNone implements PyObject {

    /** The Python type of {@code None}. */
    static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("NoneType", MethodHandles.lookup())
                    .flagNot(PyType.Flag.BASETYPE));

    /** Only one instance. */
    static final PyNone INSTANCE = new PyNone();

    private PyNone() {}

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public String toString() { return "None"; }
}

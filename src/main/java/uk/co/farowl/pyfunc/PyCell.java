// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;
import java.util.function.Supplier;

import uk.co.farowl.pyfunc.Exposed.Deleter;
import uk.co.farowl.pyfunc.Exposed.Getter;
import uk.co.farowl.pyfunc.Exposed.Setter;

/**
 * Holder for objects appearing in the closure of a function. Cells are
 * shared by reference: every function holding the same cell sees the
 * same slot.
 */
public class PyCell implements Supplier<Object>, PyObject {

    /** The Python type {@code cell}. */
    public static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("cell", MethodHandles.lookup())
                    // Type admits no Python subclasses.
                    .flagNot(PyType.Flag.BASETYPE));

    /** The object currently held, or {@code null} when empty. */
    Object obj;

    /** Create an empty cell. */
    public PyCell() {}

    /**
     * Create a cell holding the given value.
     *
     * @param obj initial contents ({@code null} means empty)
     */
    public PyCell(Object obj) { this.obj = obj; }

    @Override
    public PyType getType() { return TYPE; }

    @Getter
    private Object cell_contents() {
        if (obj == null) { throw new ValueError("Cell is empty"); }
        return obj;
    }

    @Override
    public Object get() { return obj; }

    @Setter("cell_contents")
    public void set(Object v) { obj = v; }

    @Deleter("cell_contents")
    public void del() { obj = null; }

    // Compare CPython cell_repr in cellobject.c
    @Override
    public String toString() {
        if (obj == null) {
            return String.format("<cell at %#x: empty>", Py.id(this));
        } else {
            return String.format("<cell at %#x: [%.100s]>", Py.id(this),
                    obj);
        }
    }
}

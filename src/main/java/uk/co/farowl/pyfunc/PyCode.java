// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;

import uk.co.farowl.pyfunc.Exposed.Getter;

/**
 * The Python {@code code} object: the compiled, immutable form of a
 * function body, shared by every function created from it. Only the
 * parts a function needs are represented here. The instructions belong
 * to the {@link Evaluator}.
 */
public class PyCode implements PyObject {

    /** The Python type {@code code}. */
    public static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("code", MethodHandles.lookup())
                    .flagNot(PyType.Flag.BASETYPE));

    /** Name of the function or other unit of code. */
    final String name;

    /** Fully qualified name of the unit of code. */
    final String qualname;

    /** Constant objects needed by the code. */
    final Object[] consts;

    /** Names of variables referenced but defined in an outer scope. */
    final String[] freevars;

    /**
     * Create a code object.
     *
     * @param name of the function
     * @param qualname qualified name ({@code null} means {@code name})
     * @param consts constants used by the code (copied)
     * @param freevars names of free variables (copied)
     */
    public PyCode(String name, String qualname, Object[] consts,
            String[] freevars) {
        assert name != null;
        this.name = name;
        this.qualname = qualname != null ? qualname : name;
        this.consts = consts == null ? new Object[0] : consts.clone();
        this.freevars =
                freevars == null ? new String[0] : freevars.clone();
    }

    /**
     * Create a code object with its simple name as qualified name.
     *
     * @param name of the function
     * @param consts constants used by the code (copied)
     * @param freevars names of free variables (copied)
     */
    public PyCode(String name, Object[] consts, String[] freevars) {
        this(name, null, consts, freevars);
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the number of free variables the closure must supply */
    public int nfreevars() { return freevars.length; }

    /**
     * The constant at the given index.
     *
     * @param i index
     * @return the constant
     */
    public Object getConst(int i) { return consts[i]; }

    /** @return number of constants */
    public int nconsts() { return consts.length; }

    // Exposed attributes ---------------------------------------------

    @Getter
    private Object co_name() { return name; }

    @Getter
    private Object co_qualname() { return qualname; }

    @Getter
    private Object co_consts() { return PyTuple.from(consts); }

    @Getter
    private Object co_freevars() { return PyTuple.from(freevars); }

    // Compare CPython code_repr in codeobject.c
    @Override
    public String toString() {
        return String.format("<code object %.100s at %#x>", name,
                Py.id(this));
    }
}

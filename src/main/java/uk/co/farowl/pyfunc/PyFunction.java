// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;
import java.util.Collection;
import java.util.Map;

import uk.co.farowl.pyfunc.Exposed.Deleter;
import uk.co.farowl.pyfunc.Exposed.Getter;
import uk.co.farowl.pyfunc.Exposed.Setter;
import uk.co.farowl.pyfunc.PyType.Flag;

/**
 * Python {@code function} object as created by a function definition
 * and subsequently called. The body of the function is executed by the
 * {@link Evaluator} of the {@link Interpreter} in which it was defined.
 * <p>
 * The attributes a Python program may read and write are exposed
 * through get-set descriptors in the dictionary of the type
 * {@code function}, built from the annotated methods of this class.
 * Each setter checks the type of the value it is given, and leaves the
 * function unchanged if it is not acceptable.
 */
public class PyFunction implements PyObject, WithCall, WithDescrGet,
        WithDict {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("function", MethodHandles.lookup())
                    .flagNot(Flag.BASETYPE));

    /**
     * The interpreter that defines the context of execution. Not
     * {@code null}.
     */
    final Interpreter interpreter;

    /**
     * The {@code __code__} attribute: a code object, which is writable,
     * but only with a number of free variables matching the closure.
     * Not {@code null}.
     */
    private PyCode code;

    /**
     * The read-only {@code __globals__} attribute is a {@code dict}:
     * other mappings won't do. Not {@code null}.
     */
    final PyDict globals;

    /** The (positional) {@code __defaults__} or {@code null}. */
    private PyTuple defaults;

    /** The {@code __kwdefaults__} or {@code null}. */
    private PyDict kwdefaults;

    /**
     * The read-only {@code __closure__} attribute, or {@code null}. See
     * {@link #setClosure(Collection)}.
     */
    private PyCell[] closure;

    /**
     * The {@code __doc__} attribute, can be set to anything.
     */
    // (but only a str prints in help)
    private Object doc;

    /** The function name ({@code __name__} attribute). */
    private String name;

    /** The function qualified name ({@code __qualname__} attribute). */
    private String qualname;

    /** The {@code __module__} attribute, can be anything. */
    private Object module;

    /** The {@code __dict__} attribute, a {@code dict} or {@code null}. */
    private PyDict dict;

    /**
     * The {@code __annotations__} attribute, a {@code dict} or
     * {@code null}.
     */
    private PyDict annotations;

    /**
     * Create a {@code PyFunction} from a code object, the global name
     * space of its definition and a qualified name. The positional and
     * keyword defaults, closure, annotations and instance dictionary
     * are all initially absent.
     *
     * @param interpreter providing the evaluator, not {@code null}
     * @param code to execute, not {@code null}
     * @param globals name space to treat as global variables, not
     *     {@code null}
     * @param qualname qualified name (if {@code null} or empty the
     *     name of the code is used)
     */
    // Compare CPython PyFunction_NewWithQualName in funcobject.c
    PyFunction(Interpreter interpreter, PyCode code, PyDict globals,
            String qualname) {
        assert interpreter != null;
        this.interpreter = interpreter;
        assert code != null;
        this.code = code;
        assert globals != null;
        this.globals = globals;

        this.name = code.name;
        this.qualname = qualname == null || qualname.isEmpty()
                ? code.name : qualname;

        // Get __doc__ from first constant in code (if str)
        Object d = code.nconsts() >= 1 ? code.getConst(0) : null;
        this.doc = d instanceof String ? d : Py.None;

        // __module__ = globals['__name__'] or None.
        Object m = globals.get("__name__");
        this.module = m != null ? m : Py.None;
    }

    // Java API -------------------------------------------------------

    /** @return the code object of this function. */
    public PyCode getCode() { return code; }

    /** @return the global name space of this function. */
    public PyDict getGlobals() { return globals; }

    /** @return the function name */
    public String getName() { return name; }

    /** @return the qualified name */
    public String getQualname() { return qualname; }

    /** @return the {@code __doc__} (may be {@code None}) */
    public Object getDoc() { return doc; }

    /** @return the {@code __module__} (may be {@code None}) */
    public Object getModule() { return module; }

    /** @return the positional defaults or {@code null} */
    public PyTuple getDefaults() { return defaults; }

    /**
     * Set the positional defaults.
     *
     * @param defaults to set or {@code null} meaning none
     */
    public void setDefaults(PyTuple defaults) { this.defaults = defaults; }

    /** @return the keyword defaults or {@code null} */
    public PyDict getKwdefaults() { return kwdefaults; }

    /**
     * Set the keyword defaults.
     *
     * @param kwdefaults to set or {@code null} meaning none
     */
    public void setKwdefaults(PyDict kwdefaults) {
        this.kwdefaults = kwdefaults;
    }

    /** @return the annotations or {@code null} */
    public PyDict getAnnotations() { return annotations; }

    /**
     * Set the annotations.
     *
     * @param annotations to set or {@code null} meaning none
     */
    public void setAnnotations(PyDict annotations) {
        this.annotations = annotations;
    }

    /** @return the closure as a tuple of cells or {@code null} */
    public PyTuple getClosure() {
        return closure == null ? null : PyTuple.from(closure);
    }

    /**
     * Set the closure of this function. This is <b>not</b> exposed as a
     * setter method to Python. An interpreter uses it after
     * construction, when the code has free variables.
     *
     * @param <E> element type
     * @param closure elements with which to populate the closure
     * @throws TypeError if the code has no free variables but the
     *     closure is not empty, or if an element is not a cell
     * @throws ValueError if the closure is the wrong length
     */
    // Compare CPython PyFunction_SetClosure in funcobject.c
    public <E> void setClosure(Collection<E> closure)
            throws TypeError, ValueError {

        int n = closure == null ? 0 : closure.size();
        int nfree = code.nfreevars();

        if (nfree == 0) {
            if (n == 0)
                this.closure = null;
            else
                throw new TypeError("%s closure must be empty/None",
                        code.name);
        } else if (n != nfree) {
            throw new ValueError(
                    "%s requires closure of length %d, not %d",
                    code.name, nfree, n);
        } else {
            PyCell[] cells = new PyCell[n];
            int i = 0;
            for (Object o : closure) {
                if (!(o instanceof PyCell)) {
                    throw Abstract.typeError(
                            "closure: expected cell, found %s",
                            o == null ? Py.None : o);
                }
                cells[i++] = (PyCell)o;
            }
            this.closure = cells;
        }
    }

    /** @return the interpreter in which this function was defined */
    public Interpreter getInterpreter() { return interpreter; }

    // Exposed attributes ---------------------------------------------

    @Getter
    private Object __code__() { return code; }

    @Setter
    private void __code__(Object c) { this.code = checkFreevars(c); }

    @Getter
    private Object __globals__() { return globals; }

    @Getter
    private Object __name__() { return name; }

    @Setter
    private void __name__(Object v) {
        if (!(v instanceof String)) {
            throw Abstract.attrMustBeString("__name__", v);
        }
        this.name = (String)v;
    }

    @Getter
    private Object __qualname__() { return qualname; }

    @Setter
    private void __qualname__(Object v) {
        if (!(v instanceof String)) {
            throw Abstract.attrMustBeString("__qualname__", v);
        }
        this.qualname = (String)v;
    }

    @Getter
    private Object __defaults__() { return orNone(defaults); }

    @Setter
    private void __defaults__(Object v) {
        if (!(v instanceof PyTuple)) {
            throw Abstract.attrMustBe("__defaults__", "a tuple", v);
        }
        this.defaults = (PyTuple)v;
    }

    @Deleter("__defaults__")
    private void deleteDefaults() { this.defaults = null; }

    @Getter
    private Object __kwdefaults__() { return orNone(kwdefaults); }

    @Setter
    private void __kwdefaults__(Object v) {
        this.kwdefaults = asDict("__kwdefaults__", v);
    }

    @Deleter("__kwdefaults__")
    private void deleteKwdefaults() { this.kwdefaults = null; }

    @Getter
    private Object __closure__() {
        return closure == null ? Py.None : PyTuple.from(closure);
    }

    @Getter
    private Object __annotations__() { return orNone(annotations); }

    @Setter
    private void __annotations__(Object v) {
        this.annotations = asDict("__annotations__", v);
    }

    @Deleter("__annotations__")
    private void deleteAnnotations() { this.annotations = null; }

    @Getter
    private Object __dict__() { return orNone(dict); }

    @Setter
    private void __dict__(Object v) {
        if (!(v instanceof PyDict)) {
            throw Abstract.attrMustBe("__dict__", "a dictionary", v);
        }
        this.dict = (PyDict)v;
    }

    @Deleter("__dict__")
    private void deleteDict() { this.dict = null; }

    @Getter
    private Object __doc__() { return doc; }

    @Setter
    private void __doc__(Object v) { this.doc = v; }

    @Deleter("__doc__")
    private void deleteDoc() { this.doc = Py.None; }

    @Getter
    private Object __module__() { return module; }

    @Setter
    private void __module__(Object v) { this.module = v; }

    @Deleter("__module__")
    private void deleteModule() { this.module = Py.None; }

    // slot methods ---------------------------------------------------

    /**
     * {@inheritDoc}
     * <p>
     * The call is handed to the {@link Evaluator} of the defining
     * interpreter, with a fresh dictionary for local variables.
     */
    @Override
    public Object __call__(PyTuple args, PyDict kwargs) throws Throwable {
        return interpreter.getEvaluator().evaluate(code, globals,
                new PyDict(), args == null ? PyTuple.EMPTY : args, kwargs,
                defaults, kwdefaults, PyTuple.wrap(closure));
    }

    /**
     * {@inheritDoc}
     * <p>
     * Found on the type of {@code obj}, a function becomes a method
     * bound to {@code obj}. Found on the type itself (or with
     * {@code obj} {@code None}), the function is returned unbound.
     */
    // Compare CPython func_descr_get in funcobject.c
    @Override
    public Object __get__(Object obj, PyType type) {
        if (obj == null || obj == Py.None) {
            return this;
        } else {
            return new PyMethod(this, obj);
        }
    }

    // plumbing -------------------------------------------------------

    @Override
    public Map<Object, Object> getDict(boolean create) {
        if (dict == null && create) { dict = new PyDict(); }
        return dict;
    }

    @Override
    public PyType getType() { return TYPE; }

    // Compare CPython func_repr in funcobject.c
    @Override
    public String toString() {
        return String.format("<function %.100s at %#x>", qualname,
                Py.id(this));
    }

    /**
     * Check that the number of free variables expected by the given
     * code object matches the length of the existing {@link #closure}
     * (or is zero if {@code closure==null}).
     *
     * @param c object to test (not {@code null}).
     * @return {@code c} as a code object
     * @throws TypeError if {@code c} is not a code object
     * @throws ValueError if the number of free variables is wrong
     */
    private PyCode checkFreevars(Object c) throws TypeError, ValueError {
        if (!(c instanceof PyCode)) {
            throw Abstract.attrMustBe("__code__", "a code object", c);
        }
        PyCode newCode = (PyCode)c;
        int nfree = newCode.nfreevars();
        int nclosure = closure == null ? 0 : closure.length;
        if (nclosure != nfree) {
            throw new ValueError(FREE_VARS, name, nclosure, nfree);
        }
        return newCode;
    }

    private static final String FREE_VARS =
            "%s() requires a code object with %d free vars, not %d";

    /**
     * Check that a value to be set is a {@code dict}.
     *
     * @param attr name of the attribute being set
     * @param v the value
     * @return {@code v} as a {@code dict}
     * @throws TypeError if {@code v} is not a {@code dict}
     */
    private static PyDict asDict(String attr, Object v) throws TypeError {
        if (v instanceof PyDict) { return (PyDict)v; }
        throw Abstract.attrMustBe(attr, "a dict", v);
    }

    /**
     * Present a value, or if it is {@code null}, a Python
     * {@code None}.
     *
     * @param v value or {@code null}
     * @return {@code v} or {@code None}
     */
    private static Object orNone(Object v) {
        return v == null ? Py.None : v;
    }
}

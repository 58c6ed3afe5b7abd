// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.lang.invoke.WrongMethodTypeException;
import java.lang.reflect.Method;

import uk.co.farowl.pyfunc.Exposed.Deleter;
import uk.co.farowl.pyfunc.Exposed.Getter;
import uk.co.farowl.pyfunc.Exposed.Setter;

/**
 * Descriptor for an attribute that has been defined by a series of
 * {@link Getter}, {@link Setter} and {@link Deleter} that annotate
 * access methods defined in the object implementation to get, set or
 * delete the value. The author of an implementation class has the power
 * (and responsibility) entirely to define the behaviour corresponding
 * to these actions, in particular, to check the type of a value to be
 * set.
 */
// Compare CPython struct PyGetSetDef in descrobject.h,
// and PyGetSetDescrObject also in descrobject.h
class PyGetSetDescr extends DataDescriptor implements ClassShorthand {

    static final Lookup LOOKUP = MethodHandles.lookup();

    // CPython: PyObject *(*getter)(PyObject *, void *)
    static final MethodType GETTER = MethodType.methodType(O, O);
    // CPython: int (*setter)(PyObject *, PyObject *, void *)
    static final MethodType SETTER = MethodType.methodType(V, O, O);
    static final MethodType DELETER = MethodType.methodType(V, O);

    /** The exception thrown by the empty access methods. */
    private static final EmptyException EMPTY = new EmptyException();

    /** A handle on {@link #emptyGetter(Object)} */
    private static final MethodHandle EMPTY_GETTER;
    /** A handle on {@link #emptySetter(Object, Object)} */
    private static final MethodHandle EMPTY_SETTER;
    /** A handle on {@link #emptyDeleter(Object)} */
    private static final MethodHandle EMPTY_DELETER;

    static {
        /*
         * Initialise the empty method handles in a block since it can
         * fail (in theory). This must precede the creation of TYPE,
         * which creates instances of this class.
         */
        try {
            EMPTY_GETTER = LOOKUP.findStatic(PyGetSetDescr.class,
                    "emptyGetter", GETTER);
            EMPTY_SETTER = LOOKUP.findStatic(PyGetSetDescr.class,
                    "emptySetter", SETTER);
            EMPTY_DELETER = LOOKUP.findStatic(PyGetSetDescr.class,
                    "emptyDeleter", DELETER);
        } catch (NoSuchMethodException | IllegalAccessException e) {
            // This should never happen.
            throw new InterpreterError(e,
                    "cannot find get-set empty* functions");
        }
    }

    /** The type of Python object this class implements. */
    static final PyType TYPE =
            PyType.fromSpec(new PyType.Spec("getset_descriptor", LOOKUP)
                    .flagNot(PyType.Flag.BASETYPE));

    /**
     * A handle on the getter defined by the implementation of
     * {@link Descriptor#objclass} for this attribute. The method type is
     * {@link #GETTER} {@code (O)O}.
     */
    // Compare CPython PyGetSetDef::get
    final MethodHandle get;  // MT = GETTER

    /**
     * A handle on the setter defined by the implementation of
     * {@link Descriptor#objclass} for this attribute. The method type is
     * {@link #SETTER} {@code (O,O)V}.
     */
    // Compare CPython PyGetSetDef::set
    final MethodHandle set;  // MT = SETTER

    /**
     * A handle on the deleter defined by the implementation of
     * {@link Descriptor#objclass} for this attribute. The method type is
     * {@link #DELETER} {@code (O)V}.
     */
    // Compare CPython PyGetSetDef::set with null
    final MethodHandle delete;  // MT = DELETER

    /** Documentation string for this attribute (or {@code null}). */
    final String doc;

    /**
     * Construct a descriptor that calls the access methods for get, set
     * and delete operations specified as method handles. These methods
     * will be identified in an implementation by annotations
     * {@link Getter}, {@link Setter}, {@link Deleter}.
     *
     * @param objclass to which descriptor applies
     * @param name of attribute
     * @param get handle on getter method (or {@code null})
     * @param set handle on setter method (or {@code null})
     * @param delete handle on deleter method (or {@code null})
     * @param doc documentation string
     */
    // Compare CPython PyDescr_NewGetSet
    PyGetSetDescr(PyType objclass, String name, MethodHandle get,
            MethodHandle set, MethodHandle delete, String doc) {
        super(objclass, name);
        this.get = get != null ? get : EMPTY_GETTER;
        this.set = set != null ? set : EMPTY_SETTER;
        this.delete = delete != null ? delete : EMPTY_DELETER;
        this.doc = doc;
    }

    @Override
    public PyType getType() { return TYPE; }

    /**
     * The attribute may not be set or deleted.
     *
     * @return true if the attribute may not be set or deleted
     */
    boolean readonly() { return set == EMPTY_SETTER; }

    /**
     * The attribute may be deleted.
     *
     * @return true if the attribute may be deleted.
     */
    boolean optional() { return delete != EMPTY_DELETER; }

    // Compare CPython getset_repr in descrobject.c
    @Override
    public String toString() { return descrRepr("attribute"); }

    // Exposed attributes ---------------------------------------------

    // Compare CPython getset_get_doc in descrobject.c
    @Getter("__doc__")
    private Object getDoc() { return doc == null ? Py.None : doc; }

    @Getter("__name__")
    private Object getName() { return name; }

    @Getter("__objclass__")
    private Object getObjclass() { return objclass; }

    // Descriptor protocol --------------------------------------------

    /**
     * {@inheritDoc}
     *
     * If {@code obj != null} invoke {@link #get} on it to return a
     * value. {@code obj} must be of type {@link #objclass}. A call made
     * with {@code obj == null} returns {@code this} descriptor.
     *
     * @param type is ignored
     */
    // Compare CPython getset_get in descrobject.c
    @Override
    public Object __get__(Object obj, PyType type) throws Throwable {
        if (obj == null) {
            /*
             * obj==null indicates the descriptor was found on the
             * target object itself (or a base), see CPython
             * type_getattro in typeobject.c
             */
            return this;
        } else {
            try {
                check(obj);
                return (Object)get.invokeExact(obj);
            } catch (EmptyException e) {
                throw cannotReadAttr();
            }
        }
    }

    // Compare CPython getset_set in descrobject.c
    @Override
    void __set__(Object obj, Object value) throws TypeError, Throwable {
        if (value == null) {
            // This ought to be an error, but allow for CPython idiom.
            __delete__(obj);
        } else {
            try {
                checkSet(obj);
                set.invokeExact(obj, value);
            } catch (EmptyException e) {
                throw cannotWriteAttr();
            }
        }
    }

    // Compare CPython getset_set in descrobject.c with NULL
    @Override
    void __delete__(Object obj) throws TypeError, Throwable {
        try {
            checkDelete(obj);
            delete.invokeExact(obj);
        } catch (EmptyException e) {
            throw readonly() ? cannotWriteAttr() : cannotDeleteAttr();
        }
    }

    /**
     * This method fills {@link #get} when the implementation leaves it
     * blank.
     *
     * @param ignored object to operate on
     * @return never
     * @throws EmptyException always
     */
    @SuppressWarnings("unused") // used reflectively
    private static Object emptyGetter(Object ignored)
            throws EmptyException {
        throw EMPTY;
    }

    /**
     * This method fills {@link #set} when the implementation leaves it
     * blank.
     *
     * @param ignored object to operate on
     * @param v ignored too
     * @throws EmptyException always
     */
    @SuppressWarnings("unused") // used reflectively
    private static void emptySetter(Object ignored, Object v)
            throws EmptyException {
        throw EMPTY;
    }

    /**
     * This method fills {@link #delete} when the implementation leaves
     * it blank.
     *
     * @param ignored object to operate on
     * @throws EmptyException always
     */
    @SuppressWarnings("unused") // used reflectively
    private static void emptyDeleter(Object ignored)
            throws EmptyException {
        throw EMPTY;
    }

    /** The type of exception thrown by invoking an empty accessor. */
    static class EmptyException extends Exception {
        private static final long serialVersionUID = 1L;

        // Suppression and stack trace disabled since singleton.
        EmptyException() { super(null, null, false, false); }
    }

    /**
     * {@code GetSetDef} ({@code PyGetSetDef} in CPython) represents a
     * field or computable property of a Java class that is exposed to
     * Python as an attribute of an object. The exporting class is
     * required to define getter and setter functions that appear here
     * as {@code MethodHandle}s. The attribute may be made read-only by
     * not supplying a setter.
     */
    static class GetSetDef {

        final String name;
        Method get;
        Method set;
        Method delete;
        String doc;

        GetSetDef(String name) { this.name = name; }

        /**
         * Set the {@link #get} method.
         *
         * @param get to hold as {@link #get}
         * @return previous value
         */
        Method setGet(Method get) {
            Method previous = this.get;
            this.get = get;
            return previous;
        }

        /**
         * Set the {@link #set} method.
         *
         * @param set to hold as {@link #set}
         * @return previous value
         */
        Method setSet(Method set) {
            Method previous = this.set;
            this.set = set;
            return previous;
        }

        /**
         * Set the {@link #delete} method.
         *
         * @param delete to hold as {@link #delete}
         * @return previous value
         */
        Method setDelete(Method delete) {
            Method previous = this.delete;
            this.delete = delete;
            return previous;
        }

        /**
         * Set the {@link #doc} string.
         *
         * @param doc to hold as {@link #doc}
         * @return previous value
         */
        String setDoc(String doc) {
            String previous = this.doc;
            this.doc = doc;
            return previous;
        }

        /**
         * Create a {@code PyGetSetDescr} with behaviour determined by
         * the settings on this definition.
         *
         * @param objclass Python type that owns the descriptor
         * @param lookup authorisation to access methods
         * @return descriptor for access to the attribute
         * @throws InterpreterError if the method type is not supported
         */
        PyGetSetDescr create(PyType objclass, Lookup lookup)
                throws InterpreterError {
            if (get == null) {
                throw new InterpreterError(NO_GETTER, name,
                        objclass.getName());
            }
            if (set != null && set.getParameterCount() == 1
                    && set.getParameterTypes()[0] != O) {
                // Accepting only a narrower type would hide the check
                throw new InterpreterError(SETTER_NOT_OBJECT,
                        set.getName(), set.getParameterTypes()[0]
                                .getSimpleName());
            }

            MethodHandle g = unreflect(lookup, GETTER, get);
            MethodHandle s = unreflect(lookup, SETTER, set);
            MethodHandle d = unreflect(lookup, DELETER, delete);

            return new PyGetSetDescr(objclass, name, g, s, d, doc);
        }

        /**
         * Create a method handle on the implementation method,
         * verifying that the method type produced is compatible with
         * the method type provided. The method may be {@code null},
         * signifying a method was not defined, in which case the
         * returned handle is {@code null}.
         *
         * @param lookup authorisation to access methods
         * @param mt expected to match returned handle
         * @param m implementing method (or {@code null})
         * @return method handle on {@code m} (or {@code null})
         */
        private MethodHandle unreflect(Lookup lookup, MethodType mt,
                Method m) {
            if (m == null) { return null; }
            try {
                MethodHandle mh = lookup.unreflect(m);
                try {
                    /*
                     * The call site that invokes the handle (for
                     * example in PyGetSetDescr.__get__) will have a
                     * signature involving only Object. We must
                     * therefore add a cast to the method handle
                     * obtained from the method.
                     */
                    return mh.asType(mt);
                } catch (WrongMethodTypeException wmte) {
                    throw methodSignatureError(m, mt, mh);
                }
            } catch (IllegalAccessException e) {
                throw new InterpreterError(e,
                        "cannot get method handle for '%s'", m);
            }
        }

        /** Convenience function to compose error in unreflect(). */
        private InterpreterError methodSignatureError(Method m,
                MethodType mt, MethodHandle mh) {
            String anno = "@Deleter";
            if (mt == GETTER) {
                anno = "@Getter";
            } else if (mt == SETTER) { anno = "@Setter"; }
            return new InterpreterError(UNSUPPORTED_SIG, m.getName(),
                    anno, mh.type());
        }

        private static final String UNSUPPORTED_SIG =
                "target %.50s of %s has wrong signature %.50s";
        private static final String NO_GETTER =
                "attribute '%s' of type '%s' has no @Getter";
        private static final String SETTER_NOT_OBJECT =
                "@Setter %.50s must accept Object, not %.50s";

        @Override
        public String toString() {
            return String.format(
                    "GetSetDef(%s, get=%s, set=%s, delete=%s, %.20s)",
                    name, mn(get), mn(set), mn(delete), doc);
        }

        /** Method name or null (for toString()). */
        private static String mn(Method m) {
            return m == null ? "" : m.getName();
        }
    }
}

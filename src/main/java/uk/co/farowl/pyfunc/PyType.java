// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles.Lookup;
import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Python {@code type} object. Type objects are normally created
 * (when created from Java) by a call to {@link PyType#fromSpec(Spec)},
 * which also populates the dictionary of the type with descriptors for
 * the attributes exposed by the implementation class.
 * <p>
 * This is only as much of a type system as the {@code function} object
 * and its companions need: single inheritance, a dictionary per type,
 * and a handful of Java classes adopted as the implementations of
 * built-in types.
 */
public class PyType implements PyObject {

    /** Logger for type creation. */
    static final Logger logger = LoggerFactory.getLogger(PyType.class);

    /**
     * Characteristics of the type, to determine behaviours (such as
     * mutability) of instances or the type itself.
     */
    public enum Flag {
        /** The type may be used as a base in a class definition. */
        BASETYPE,
        /** The type dictionary may be changed after creation. */
        MUTABLE
    }

    // *** The order of these initialisations is critical

    /** Types of Java classes adopted as built-in Python types. */
    private static final Map<Class<?>, PyType> adopted =
            new HashMap<>();

    /** The type object of {@code object} objects. */
    public static final PyType OBJECT_TYPE =
            new PyType("object", null, EnumSet.of(Flag.BASETYPE));

    /** The type object of {@code type} objects. */
    public static final PyType TYPE =
            new PyType("type", OBJECT_TYPE, EnumSet.of(Flag.BASETYPE));

    static {
        EnumSet<Flag> base = EnumSet.of(Flag.BASETYPE);
        adopt(new PyType("str", OBJECT_TYPE, base), String.class);
        PyType intType = new PyType("int", OBJECT_TYPE, base);
        adopt(intType, Integer.class, Long.class, BigInteger.class);
        adopt(new PyType("bool", intType, EnumSet.noneOf(Flag.class)),
                Boolean.class);
        adopt(new PyType("float", OBJECT_TYPE, base), Double.class);
    }

    // *** End critically ordered section

    /** Name of the type. */
    final String name;

    /** The base of this type (only {@code object} has none). */
    private final PyType base;

    /** Characteristics of the type. */
    private final EnumSet<Flag> flags;

    /** The dictionary of the type is always an ordered {@code Map}. */
    private final Map<String, Object> dict = new LinkedHashMap<>();

    /**
     * Construct a {@code type} object with given name and base, but an
     * empty dictionary.
     *
     * @param name of the type
     * @param base of the new type ({@code null} only for
     *     {@code object})
     * @param flags characteristics of the type being defined
     */
    private PyType(String name, PyType base, EnumSet<Flag> flags) {
        this.name = name;
        this.base = base;
        this.flags = EnumSet.copyOf(flags); // in case original changes
    }

    /**
     * Register a type as that of instances of some Java classes not
     * themselves crafted as Python objects.
     *
     * @param type to register
     * @param classes the type adopts
     */
    private static void adopt(PyType type, Class<?>... classes) {
        for (Class<?> c : classes) { adopted.put(c, type); }
    }

    /**
     * Create (and publish) a Python type object from the specification
     * given. The lookup object in the specification grants access to
     * the methods of the defining class, which is scanned for exposed
     * attributes to enter in the dictionary of the new type.
     *
     * @param spec specifying the new type
     * @return the new type
     * @throws InterpreterError if the defining class is inconsistent
     *     or the base does not admit subclasses
     */
    public static PyType fromSpec(Spec spec) throws InterpreterError {
        if (!spec.base.flags.contains(Flag.BASETYPE)) {
            throw new InterpreterError(
                    "type '%.100s' is not an acceptable base type",
                    spec.base.name);
        }
        Class<?> definingClass = spec.lookup.lookupClass();
        PyType type = new PyType(spec.name, spec.base, spec.flags);
        type.dict.putAll(
                Exposer.getsetDescrs(spec.lookup, definingClass, type));
        logger.atDebug().setMessage("Type '{}' created from {}")
                .addArgument(spec.name)
                .addArgument(definingClass::getName).log();
        return type;
    }

    /**
     * Return the Python type of an object: the type recorded in a
     * {@link PyObject}, or the type that adopted its Java class, or
     * {@code object} if all else fails.
     *
     * @param o to interrogate (not {@code null})
     * @return the type of {@code o}
     */
    public static PyType of(Object o) {
        if (o instanceof PyObject) {
            return ((PyObject)o).getType();
        } else {
            PyType type = adopted.get(o.getClass());
            return type != null ? type : OBJECT_TYPE;
        }
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the name of the type */
    public String getName() { return name; }

    /**
     * A read-only view of the dictionary of this type.
     *
     * @return the dictionary of this type
     */
    public Map<String, Object> getDict() {
        return Collections.unmodifiableMap(dict);
    }

    /**
     * Determine if this type is a Python sub-type of {@code b} (if
     * {@code b} is on the chain of bases of this type).
     *
     * @param b to seek along the bases
     * @return {@code true} if {@code b} is a base of this type
     */
    public boolean isSubTypeOf(PyType b) {
        for (PyType t = this; t != null; t = t.base) {
            if (t == b) { return true; }
        }
        return false;
    }

    /**
     * Look for a name, returning the entry directly from the first
     * dictionary along the chain of bases that contains it.
     *
     * @param name to look up
     * @return dictionary entry or {@code null} if not found
     */
    public Object lookup(String name) {
        for (PyType t = this; t != null; t = t.base) {
            Object v = t.dict.get(name);
            if (v != null) { return v; }
        }
        return null;
    }

    @Override
    public String toString() { return "<class '" + name + "'>"; }

    // slot functions -------------------------------------------------

    /**
     * Attribute access on a type object. An entry found along the bases
     * that is a descriptor is asked for its value with a {@code null}
     * instance, so a function is returned unbound and a get-set
     * descriptor returns itself.
     *
     * @param name of the attribute
     * @return attribute value
     * @throws AttributeError if no such attribute
     * @throws Throwable on other errors, typically from the descriptor
     */
    // Compare CPython type_getattro in typeobject.c
    Object __getattribute__(String name)
            throws AttributeError, Throwable {
        // Attributes of every type (data descriptors on type)
        if ("__name__".equals(name) || "__qualname__".equals(name)) {
            return this.name;
        }
        Object attr = lookup(name);
        if (attr instanceof WithDescrGet) {
            return ((WithDescrGet)attr).__get__(null, this);
        } else if (attr != null) {
            return attr;
        }
        throw new AttributeError(NO_TYPE_ATTRIBUTE, this.name, name);
    }

    /**
     * Attribute assignment on a type object, which is only possible if
     * it is {@link Flag#MUTABLE}.
     *
     * @param name of the attribute
     * @param value to assign ({@code null} means delete)
     * @throws TypeError if the type is immutable
     * @throws AttributeError on deleting a missing attribute
     */
    // Compare CPython type_setattro in typeobject.c
    void __setattr__(String name, Object value)
            throws TypeError, AttributeError {
        if (value == null) {
            __delattr__(name);
        } else {
            checkMutable(name);
            dict.put(name, value);
        }
    }

    /**
     * Attribute deletion on a type object, which is only possible if it
     * is {@link Flag#MUTABLE}.
     *
     * @param name of the attribute
     * @throws TypeError if the type is immutable
     * @throws AttributeError if the attribute is not in the dictionary
     */
    void __delattr__(String name) throws TypeError, AttributeError {
        checkMutable(name);
        if (dict.remove(name) == null) {
            throw new AttributeError(NO_TYPE_ATTRIBUTE, this.name, name);
        }
    }

    private void checkMutable(String attr) throws TypeError {
        if (!flags.contains(Flag.MUTABLE)) {
            throw new TypeError(
                    "cannot set '%.50s' attribute of immutable type '%s'",
                    attr, name);
        }
    }

    private static final String NO_TYPE_ATTRIBUTE =
            "type object '%.50s' has no attribute '%.400s'";

    /**
     * A specification for a Python type. A Java class intended as the
     * implementation of a Python type creates one of these to pass to
     * {@link PyType#fromSpec(Spec)}.
     */
    public static class Spec {

        /** Name of the type being specified. */
        final String name;

        /** Authorisation to access the defining class. */
        final Lookup lookup;

        /** Base of the type being specified. */
        private PyType base = OBJECT_TYPE;

        /** Characteristics of the type being specified. */
        private final EnumSet<Flag> flags = EnumSet.of(Flag.BASETYPE);

        /**
         * Create (begin) a specification for a {@link PyType} based on
         * the class that holds the {@code lookup}.
         *
         * @param name of the type
         * @param lookup authorisation to access the defining class
         */
        public Spec(String name, Lookup lookup) {
            this.name = name;
            this.lookup = lookup;
        }

        /**
         * Specify the base of the type.
         *
         * @param base to use
         * @return {@code this}
         */
        public Spec base(PyType base) {
            this.base = base;
            return this;
        }

        /**
         * Add a characteristic to the type.
         *
         * @param f to add
         * @return {@code this}
         */
        public Spec flag(Flag f) {
            flags.add(f);
            return this;
        }

        /**
         * Remove a characteristic from the type.
         *
         * @param f to remove
         * @return {@code this}
         */
        public Spec flagNot(Flag f) {
            flags.remove(f);
            return this;
        }

        @Override
        public String toString() {
            return String.format("'%s' %s %s", name,
                    lookup.lookupClass().getSimpleName(), flags);
        }
    }
}

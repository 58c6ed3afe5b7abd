// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.util.Map;

/**
 * The Python {@code object} type is implemented by
 * {@code java.lang.Object} but gets its behaviour from this class or
 * its superclass. The methods here implement the generic attribute
 * access that every object not a {@code type} inherits.
 */
final class PyBaseObject {

    /** The type object {@code object}. */
    static final PyType TYPE = PyType.OBJECT_TYPE;

    private PyBaseObject() {} // No instances

    /**
     * The generic attribute access implements dictionary look-up on the
     * type and the instance. It is the starting point for activating
     * the descriptor protocol. The following order of precedence
     * applies when looking for the value of an attribute:
     * <ol>
     * <li>a data descriptor from the dictionary of the type</li>
     * <li>a value in the instance dictionary of {@code obj}</li>
     * <li>a non-data descriptor from dictionary of the type</li>
     * <li>a value from the dictionary of the type</li>
     * </ol>
     * An {@link AttributeError} from a data descriptor is definitive.
     *
     * @param obj the target of the get
     * @param name of the attribute
     * @return attribute value
     * @throws AttributeError if no such attribute
     * @throws Throwable on other errors, typically from the descriptor
     */
    // Compare CPython PyObject_GenericGetAttr in object.c
    static Object __getattribute__(Object obj, String name)
            throws AttributeError, Throwable {

        PyType objType = PyType.of(obj);

        // Look up the name in the type (null if not found).
        Object typeAttr = objType.lookup(name);
        if (typeAttr instanceof DataDescriptor) {
            // typeAttr is a data descriptor so call its __get__.
            return ((DataDescriptor)typeAttr).__get__(obj, objType);
        }

        /*
         * At this stage: typeAttr is the value from the type, or a
         * non-data descriptor, or null if the attribute was not found.
         * It's time to give the object instance dictionary a chance.
         */
        Map<Object, Object> dict = instanceDict(obj, false);
        if (dict != null) {
            Object instanceAttr = dict.get(name);
            if (instanceAttr != null) { return instanceAttr; }
        }

        // Only the results of look-up on the type remain.
        if (typeAttr instanceof WithDescrGet) {
            // typeAttr is a non-data descriptor (a function, say)
            return ((WithDescrGet)typeAttr).__get__(obj, objType);
        } else if (typeAttr != null) {
            return typeAttr;
        }

        throw Abstract.noAttributeError(obj, name);
    }

    /**
     * The generic attribute assignment calls a data descriptor from the
     * dictionary of the type, if there is one, or else places the value
     * in the instance dictionary of {@code obj}. An
     * {@link AttributeError} from the descriptor is definitive.
     *
     * @param obj the target of the set
     * @param name of the attribute
     * @param value to give the attribute ({@code null} means delete)
     * @throws AttributeError if no such attribute or it is read-only
     * @throws Throwable on other errors, typically from the descriptor
     */
    // Compare CPython PyObject_GenericSetAttr in object.c
    static void __setattr__(Object obj, String name, Object value)
            throws AttributeError, Throwable {

        // Accommodate CPython idiom that set null means delete.
        if (value == null) {
            __delattr__(obj, name);
            return;
        }

        Object typeAttr = PyType.of(obj).lookup(name);
        if (typeAttr instanceof DataDescriptor) {
            ((DataDescriptor)typeAttr).__set__(obj, value);
            return;
        }

        Map<Object, Object> dict = instanceDict(obj, true);
        if (dict == null) {
            // Object has no dictionary (and won't support one).
            if (typeAttr == null) {
                throw Abstract.noAttributeError(obj, name);
            } else {
                // Values found on the type are read-only via instances
                throw Abstract.readonlyAttributeError(obj, name);
            }
        }
        dict.put(name, value);
    }

    /**
     * The generic attribute deletion calls a data descriptor from the
     * dictionary of the type, if there is one, or else removes the
     * entry from the instance dictionary of {@code obj}.
     *
     * @param obj the target of the delete
     * @param name of the attribute
     * @throws AttributeError if no such attribute or it is read-only
     * @throws Throwable on other errors, typically from the descriptor
     */
    // Compare CPython PyObject_GenericSetAttr in object.c with NULL
    static void __delattr__(Object obj, String name)
            throws AttributeError, Throwable {

        Object typeAttr = PyType.of(obj).lookup(name);
        if (typeAttr instanceof DataDescriptor) {
            ((DataDescriptor)typeAttr).__delete__(obj);
            return;
        }

        Map<Object, Object> dict = instanceDict(obj, false);
        if (dict == null || !dict.containsKey(name)) {
            if (typeAttr == null) {
                throw Abstract.noAttributeError(obj, name);
            } else {
                throw Abstract.readonlyAttributeError(obj, name);
            }
        }
        dict.remove(name);
    }

    private static Map<Object, Object> instanceDict(Object obj,
            boolean create) {
        return obj instanceof WithDict ? ((WithDict)obj).getDict(create)
                : null;
    }
}

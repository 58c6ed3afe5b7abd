// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.lang.invoke.MethodHandles;

/** The Python {@code BaseException} exception. */
public class BaseException extends RuntimeException implements PyObject {
    private static final long serialVersionUID = 1L;

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec(
            new PyType.Spec("BaseException", MethodHandles.lookup()));

    private final PyType type;

    /** The {@code args} of the exception: the message, if any. */
    final PyTuple args;

    /**
     * Constructor for sub-class use specifying {@link #type}.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected BaseException(PyType type, String msg, Object... args) {
        super(String.format(msg, args));
        this.type = type;
        msg = this.getMessage();
        this.args = msg.length() > 0 ? Py.tuple(msg) : PyTuple.EMPTY;
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public BaseException(String msg, Object... args) {
        this(TYPE, msg, args);
    }

    @Override
    public PyType getType() { return type; }

    @Override
    public String toString() {
        String msg = args.size() > 0 ? args.get(0).toString() : "";
        return String.format("%s: %s", getType().getName(), msg);
    }
}

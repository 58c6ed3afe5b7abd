// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/** Python objects that may be called. */
public interface WithCall {

    /**
     * Canonical {@code __call__} special method in the "classic"
     * arrangement of positional and keyword arguments.
     *
     * @param args positional arguments (or {@code null} meaning none)
     * @param kwargs keyword arguments (or {@code null} meaning none)
     * @return the return from the call
     * @throws Throwable for errors raised in the callable
     */
    Object __call__(PyTuple args, PyDict kwargs) throws Throwable;
}

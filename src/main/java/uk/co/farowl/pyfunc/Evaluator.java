// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/**
 * The engine that executes the body of a function. A
 * {@link PyFunction} hands over its code, its name spaces and the
 * arguments of a call, and returns whatever the evaluator returns.
 * <p>
 * Binding the arguments to parameters (using the defaults), checking
 * arity and creating the frame are all the business of the evaluator.
 * Whatever it throws reaches the caller of the function unchanged.
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * Execute the code of a function.
     *
     * @param code to execute
     * @param globals global name space of the function
     * @param locals fresh local name space for this call
     * @param args positional arguments (never {@code null})
     * @param kwargs keyword arguments (or {@code null})
     * @param defaults positional defaults (or {@code null})
     * @param kwdefaults keyword defaults (or {@code null})
     * @param closure cells of free variables (never {@code null})
     * @return the result of the call
     * @throws Throwable any error raised by the code
     */
    Object evaluate(PyCode code, PyDict globals, PyDict locals,
            PyTuple args, PyDict kwargs, PyTuple defaults,
            PyDict kwdefaults, PyTuple closure) throws Throwable;
}

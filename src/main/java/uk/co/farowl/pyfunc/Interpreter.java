// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.util.Collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An interpreter is the context in which functions are defined, and
 * holds the {@link Evaluator} that every function defined here uses to
 * execute its code.
 */
public class Interpreter {

    /** Logger for the interpreter and the functions it defines. */
    static final Logger logger =
            LoggerFactory.getLogger(Interpreter.class);

    /** Executes the code of functions defined here. */
    private final Evaluator evaluator;

    /**
     * Create an interpreter with the given means of executing code.
     *
     * @param evaluator to execute the code of functions
     */
    public Interpreter(Evaluator evaluator) {
        assert evaluator != null;
        this.evaluator = evaluator;
        logger.atInfo().setMessage("Interpreter created with {}")
                .addArgument(evaluator).log();
    }

    /** @return the evaluator of functions defined here */
    public Evaluator getEvaluator() { return evaluator; }

    /**
     * Define a function from code and global name space, that is,
     * execute a {@code def} statement. The function has no defaults or
     * closure.
     *
     * @param code of the function body
     * @param globals of the module defining it (never written)
     * @param qualname qualified name ({@code null} for the code name)
     * @return the new function
     */
    public PyFunction defineFunction(PyCode code, PyDict globals,
            String qualname) {
        PyFunction f = new PyFunction(this, code, globals, qualname);
        logger.atTrace().setMessage("defined {}").addArgument(f).log();
        return f;
    }

    /**
     * Define a function from code, global name space and the other
     * values a {@code def} statement may supply. The closure is checked
     * against the free variables of the code.
     *
     * @param code of the function body
     * @param globals of the module defining it (never written)
     * @param qualname qualified name ({@code null} for the code name)
     * @param defaults positional defaults (or {@code null})
     * @param kwdefaults keyword defaults (or {@code null})
     * @param closure cells for the free variables (or {@code null})
     * @return the new function
     * @throws TypeError if the closure contains other than cells or is
     *     not empty for code without free variables
     * @throws ValueError if the closure is the wrong length
     */
    // Compare CPython MAKE_FUNCTION in ceval.c
    public PyFunction defineFunction(PyCode code, PyDict globals,
            String qualname, PyTuple defaults, PyDict kwdefaults,
            Collection<?> closure) throws TypeError, ValueError {
        PyFunction f = new PyFunction(this, code, globals, qualname);
        f.setClosure(closure);
        f.setDefaults(defaults);
        f.setKwdefaults(kwdefaults);
        logger.atTrace().setMessage("defined {} with closure {}")
                .addArgument(f).addArgument(f::getClosure).log();
        return f;
    }
}

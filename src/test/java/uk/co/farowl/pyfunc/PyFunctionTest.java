// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Test the construction of {@link PyFunction} objects, and that a call
 * is handed to the {@link Evaluator} exactly as made.
 */
@DisplayName("A function object")
class PyFunctionTest extends UnitTestSupport {

    /** {@code def add(a, b): "adds two numbers"; return a + b} */
    static final PyCode ADD = new PyCode("add",
            new Object[] {"adds two numbers", Py.None}, null);

    /** A code object referring to one variable of an outer scope. */
    static final PyCode INNER = new PyCode("inner", "outer.<locals>.inner",
            new Object[] {42}, new String[] {"x"});

    RecordingEvaluator evaluator;
    Interpreter interp;
    PyDict globals;

    @BeforeEach
    void setup() {
        evaluator = new RecordingEvaluator();
        interp = new Interpreter(evaluator);
        globals = Py.dict();
        globals.put("__name__", "mathmod");
    }

    @Nested
    @DisplayName("when constructed")
    class Construction {

        @Test
        @DisplayName("takes name, doc and module from code and globals")
        void fromCodeAndGlobals() {
            PyFunction f = interp.defineFunction(ADD, globals, "");
            assertSame(ADD, f.getCode());
            assertSame(globals, f.getGlobals());
            assertEquals("add", f.getName());
            assertEquals("add", f.getQualname());
            assertEquals("adds two numbers", f.getDoc());
            assertEquals("mathmod", f.getModule());
            assertNull(f.getClosure());
            assertNull(f.getDefaults());
            assertNull(f.getKwdefaults());
            assertNull(f.getAnnotations());
            assertNull(f.getDict(false));
            assertSame(PyFunction.TYPE, f.getType());
        }

        @Test
        @DisplayName("uses a qualified name when given one")
        void withQualname() {
            PyFunction f = interp.defineFunction(ADD, globals, "Calc.add");
            assertEquals("add", f.getName());
            assertEquals("Calc.add", f.getQualname());
        }

        @Test
        @DisplayName("uses the name when the qualified name is null")
        void nullQualname() {
            PyFunction f = interp.defineFunction(ADD, globals, null);
            assertEquals("add", f.getQualname());
        }

        @Test
        @DisplayName("uses the code name, not the code qualified name")
        void codeNameNotCodeQualname() {
            assertEquals("outer.<locals>.inner", INNER.qualname);
            PyFunction f = interp.defineFunction(INNER, globals, "");
            assertEquals("inner", f.getQualname());
            PyFunction g = interp.defineFunction(INNER, globals, null);
            assertEquals("inner", g.getQualname());
            assertEquals("inner", g.getName());
        }

        @Test
        @DisplayName("has doc None when the first constant is not a str")
        void docNotString() {
            PyFunction f = interp.defineFunction(INNER, globals, null);
            assertSame(Py.None, f.getDoc());
            PyCode empty = new PyCode("empty", new Object[0], null);
            f = interp.defineFunction(empty, globals, null);
            assertSame(Py.None, f.getDoc());
        }

        @Test
        @DisplayName("has module None when globals has no __name__")
        void noModuleName() {
            PyFunction f = interp.defineFunction(ADD, Py.dict(), null);
            assertSame(Py.None, f.getModule());
        }

        @Test
        @DisplayName("does not write to globals")
        void globalsUntouched() {
            interp.defineFunction(ADD, globals, "add");
            assertEquals(1, globals.size());
        }

        @Test
        @DisplayName("has a repr naming the qualified name")
        void repr() {
            PyFunction f = interp.defineFunction(ADD, globals, "Calc.add");
            assertStartsWith("<function Calc.add at 0x", f.toString());
        }
    }

    @Nested
    @DisplayName("when given a closure")
    class Closure {

        @Test
        @DisplayName("accepts cells matching the free variables")
        void matchingCells() {
            PyCell x = new PyCell(1);
            PyFunction f = interp.defineFunction(INNER, globals, null,
                    Py.tuple(2), null, List.of(x));
            assertEquals(Py.tuple(x), f.getClosure());
            assertEquals(Py.tuple(2), f.getDefaults());
            assertEquals("inner", f.getQualname());
        }

        @Test
        @DisplayName("rejects cells when the code has no free variables")
        void cellsNotWanted() {
            PyFunction f = interp.defineFunction(ADD, globals, null);
            assertRaises(TypeError.class,
                    () -> f.setClosure(List.of(new PyCell())),
                    "add closure must be empty/None");
        }

        @Test
        @DisplayName("rejects a closure of the wrong length")
        void wrongLength() {
            PyFunction f = interp.defineFunction(INNER, globals, null);
            assertRaises(ValueError.class,
                    () -> f.setClosure(
                            List.of(new PyCell(), new PyCell())),
                    "inner requires closure of length 1, not 2");
            assertRaises(ValueError.class, () -> f.setClosure(null),
                    "inner requires closure of length 1, not 0");
        }

        @Test
        @DisplayName("rejects a closure containing a non-cell")
        void notCell() {
            PyFunction f = interp.defineFunction(INNER, globals, null);
            assertRaises(TypeError.class,
                    () -> f.setClosure(Arrays.asList(42)),
                    "closure: expected cell, found int");
            assertNull(f.getClosure());
        }

        @Test
        @DisplayName("rejects a closure containing null")
        void nullInClosure() {
            PyFunction f = interp.defineFunction(INNER, globals, null);
            assertRaises(TypeError.class,
                    () -> f.setClosure(Arrays.asList((Object)null)),
                    "closure: expected cell, found NoneType");
            assertNull(f.getClosure());
        }

        @Test
        @DisplayName("accepts an empty closure for code without free variables")
        void emptyOk() {
            PyFunction f = interp.defineFunction(ADD, globals, null,
                    null, null, List.of());
            assertNull(f.getClosure());
        }

        @Test
        @DisplayName("shares cells with other functions")
        void sharedCells() throws Throwable {
            PyCell x = new PyCell(1);
            PyFunction f = interp.defineFunction(INNER, globals, null,
                    null, null, List.of(x));
            PyFunction g = interp.defineFunction(INNER, globals, null,
                    null, null, List.of(x));
            x.set(2);
            f.__call__(null, null);
            assertSame(x, evaluator.closure.get(0));
            g.__call__(null, null);
            assertEquals(2, ((PyCell)evaluator.closure.get(0)).get());
        }

        @Test
        @DisplayName("gives the evaluator a closure whose array takes any object")
        void closureArrayOfObject() throws Throwable {
            PyCell x = new PyCell(1);
            PyFunction f = interp.defineFunction(INNER, globals, null,
                    null, null, List.of(x));
            f.__call__(null, null);
            Object[] a = evaluator.closure.toArray();
            assertSame(Object[].class, a.getClass());
            a[0] = "not a cell";
            assertSame(x, evaluator.closure.get(0));
        }
    }

    @Nested
    @DisplayName("when called")
    class Call {

        @Test
        @DisplayName("forwards everything to the evaluator")
        void forwards() throws Throwable {
            PyFunction f = interp.defineFunction(ADD, globals, "");
            evaluator.result = 5;
            PyDict kwargs = Py.dict();
            Object r = f.__call__(Py.tuple(2, 3), kwargs);

            assertEquals(5, r);
            assertEquals(1, evaluator.calls);
            assertSame(ADD, evaluator.code);
            assertSame(globals, evaluator.globals);
            assertTrue(evaluator.locals.isEmpty());
            assertEquals(Py.tuple(2, 3), evaluator.args);
            assertSame(kwargs, evaluator.kwargs);
            assertNull(evaluator.defaults);
            assertNull(evaluator.kwdefaults);
            assertSame(PyTuple.EMPTY, evaluator.closure);
        }

        @Test
        @DisplayName("returns the result unmodified")
        void resultUnmodified() throws Throwable {
            PyFunction f = interp.defineFunction(ADD, globals, "");
            Object result = new Object();
            evaluator.result = result;
            assertSame(result, Abstract.call(f, 1, 2));
        }

        @Test
        @DisplayName("gets fresh locals each time")
        void freshLocals() throws Throwable {
            PyFunction f = interp.defineFunction(ADD, globals, "");
            f.__call__(Py.tuple(), null);
            PyDict first = evaluator.locals;
            first.put("a", 1);
            f.__call__(Py.tuple(), null);
            assertNotSame(first, evaluator.locals);
            assertTrue(evaluator.locals.isEmpty());
        }

        @Test
        @DisplayName("passes current defaults and keyword defaults")
        void passesDefaults() throws Throwable {
            PyFunction f = interp.defineFunction(ADD, globals, "");
            PyDict kwd = Py.dict();
            kwd.put("b", 10);
            f.setDefaults(Py.tuple(1));
            f.setKwdefaults(kwd);
            f.__call__(null, null);
            assertSame(PyTuple.EMPTY, evaluator.args);
            assertEquals(Py.tuple(1), evaluator.defaults);
            assertSame(kwd, evaluator.kwdefaults);
        }

        @Test
        @DisplayName("lets evaluator errors propagate unchanged")
        void errorPropagates() {
            PyFunction f = interp.defineFunction(ADD, globals, "");
            TypeError error = new TypeError("unsupported operand");
            evaluator.toThrow = error;
            TypeError e = assertThrows(TypeError.class,
                    () -> f.__call__(Py.tuple(1, "a"), null));
            assertSame(error, e);
        }

        @Test
        @DisplayName("computes with a real evaluator")
        void addsNumbers() throws Throwable {
            Interpreter adder = new Interpreter((code, g, l, args, kw, d,
                    kwd, c) -> (Integer)args.get(0) + (Integer)args.get(1));
            PyFunction f = adder.defineFunction(ADD, globals, "");
            assertEquals(5, Abstract.call(f, 2, 3));
        }
    }

    @Test
    @DisplayName("refuses code with free variables its closure lacks")
    void codeFreevarMismatch() throws Throwable {
        PyFunction f = interp.defineFunction(ADD, globals, "");
        PyCode c = new PyCode("g", new Object[0], new String[] {"y"});
        assertRaises(ValueError.class,
                () -> Abstract.setAttr(f, "__code__", c),
                "add() requires a code object with 0 free vars, not 1");
        assertSame(ADD, f.getCode());
    }
}
